package de.bsommerfeld.crashscope.installer.verify;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * A trivial invocation that proves a tool responds, e.g. {@code r2 -v}
 * expected to print {@code radare2}.
 *
 * @param executable program name or absolute path
 * @param args       arguments of the probe invocation
 * @param marker     text the output must contain (case-insensitive); {@code null}
 *                   or blank accepts any output
 */
public record ToolProbe(String executable, List<String> args, String marker) {

    public ToolProbe {
        Objects.requireNonNull(executable, "executable");
        args = List.copyOf(args);
    }

    public List<String> command() {
        List<String> command = new ArrayList<>(args.size() + 1);
        command.add(executable);
        command.addAll(args);
        return command;
    }

    boolean matches(String output) {
        if (marker == null || marker.isBlank()) {
            return true;
        }
        return output != null && output.toLowerCase(Locale.ROOT).contains(marker.toLowerCase(Locale.ROOT));
    }
}
