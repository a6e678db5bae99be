package de.bsommerfeld.crashscope.installer.process;

import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Extends the {@code PATH} of spawned commands with the directories package
 * managers install into.
 *
 * <p>
 * A freshly installed {@code r2} usually lands in {@code /usr/local/bin},
 * {@code /opt/homebrew/bin} or the Linuxbrew prefix. Launchers started from a
 * desktop entry or a service manager often run with a minimal {@code PATH}
 * that misses those, so verification would report the tool as absent right
 * after a successful install.
 *
 * <p>
 * On Windows, no enrichment is needed; {@code winget} and {@code choco}
 * update the machine {@code PATH} themselves.
 */
final class PathEnricher {

    private static final List<String> EXTRA_PATHS = List.of(
            "/usr/local/bin",
            "/usr/local/sbin",
            "/usr/sbin",
            "/opt/homebrew/bin",
            "/opt/homebrew/sbin",
            "/home/linuxbrew/.linuxbrew/bin",
            "/snap/bin");

    private static final String DEFAULT_PATH = "/usr/bin:/bin";

    private PathEnricher() {
    }

    static void enrich(ProcessBuilder pb) {
        enrich(pb.environment(), System.getProperty("os.name", ""), System.getProperty("user.home"));
    }

    /**
     * Appends {@link #EXTRA_PATHS} and {@code ~/.local/bin} to {@code PATH},
     * skipping entries that are already present. No-op on Windows.
     */
    static void enrich(Map<String, String> environment, String osName, String userHome) {
        if (osName.toLowerCase(Locale.ROOT).contains("win"))
            return;

        String path = environment.getOrDefault("PATH", DEFAULT_PATH);
        Set<String> entries = new LinkedHashSet<>(Arrays.asList(path.split(":")));
        entries.addAll(EXTRA_PATHS);
        entries.add(userHome + "/.local/bin");
        entries.remove("");

        environment.put("PATH", String.join(":", entries));
    }
}
