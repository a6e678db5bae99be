package de.bsommerfeld.crashscope.installer.process;

/**
 * Outcome of one external command.
 *
 * @param exitCode process exit code, {@code -1} when the process was killed on timeout
 * @param stdout   captured standard output
 * @param stderr   captured standard error
 * @param timedOut {@code true} if the process exceeded its deadline and was killed
 */
public record CommandResult(int exitCode, String stdout, String stderr, boolean timedOut) {

    public static CommandResult timeout(String stdout, String stderr) {
        return new CommandResult(-1, stdout, stderr, true);
    }

    public boolean succeeded() {
        return !timedOut && exitCode == 0;
    }
}
