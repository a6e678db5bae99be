package de.bsommerfeld.crashscope.installer.process;

import java.io.IOException;
import java.time.Duration;
import java.util.List;

/**
 * Runs an external program given as an argv vector. Arguments are passed to
 * the program verbatim, never through a shell.
 */
public interface CommandExecutor {

    /**
     * Runs {@code argv} and waits at most {@code timeout} for it to finish.
     * A process still running at the deadline is killed and reported through
     * {@link CommandResult#timedOut()}.
     *
     * @throws IOException          if the program cannot be started
     * @throws InterruptedException if the calling thread is interrupted while waiting
     */
    CommandResult run(List<String> argv, Duration timeout) throws IOException, InterruptedException;
}
