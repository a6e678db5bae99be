package de.bsommerfeld.crashscope.core.util;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Locale;
import java.util.function.Function;

/**
 * Resolves the directory CrashScope keeps its configuration in. Paths are
 * returned absolute but are <strong>not</strong> created; the caller is
 * responsible for ensuring the directory exists.
 *
 * <p>
 * Resolution order:
 * <ol>
 * <li>{@code $CRASHSCOPE_HOME} if set and non-empty</li>
 * <li><strong>macOS</strong>: {@code ~/Library/Application Support/{appName}}</li>
 * <li><strong>Windows</strong>: {@code %APPDATA%\{appName}} (fallback:
 * {@code ~/AppData/Roaming})</li>
 * <li><strong>Linux</strong>: {@code $XDG_CONFIG_HOME/{appName}} (fallback:
 * {@code ~/.config})</li>
 * </ol>
 */
public final class StorageUtils {

    public static final String HOME_VARIABLE = "CRASHSCOPE_HOME";

    private static final String CONFIG_FILE_NAME = "config.toml";

    private StorageUtils() {
    }

    public static Path getAppDataDir(String appName) {
        return resolveAppDataDir(appName, System::getenv,
                System.getProperty("os.name", "generic"), System.getProperty("user.home"));
    }

    public static Path getConfigFile(String appName) {
        return getAppDataDir(appName).resolve(CONFIG_FILE_NAME);
    }

    /**
     * Pure resolution used by {@link #getAppDataDir(String)}; the environment
     * and platform are passed in so every branch can be exercised on any host.
     */
    static Path resolveAppDataDir(String appName, Function<String, String> env, String osName, String userHome) {
        String override = env.apply(HOME_VARIABLE);
        if (override != null && !override.isBlank()) {
            return Paths.get(override).toAbsolutePath();
        }

        String os = osName.toLowerCase(Locale.ENGLISH);
        Path path;
        if (os.contains("mac") || os.contains("darwin")) {
            path = Paths.get(userHome, "Library", "Application Support", appName);
        } else if (os.contains("win")) {
            String appData = env.apply("APPDATA");
            path = appData != null
                    ? Paths.get(appData, appName)
                    : Paths.get(userHome, "AppData", "Roaming", appName);
        } else {
            String xdgConfig = env.apply("XDG_CONFIG_HOME");
            path = xdgConfig != null && !xdgConfig.isEmpty()
                    ? Paths.get(xdgConfig, appName)
                    : Paths.get(userHome, ".config", appName);
        }
        return path.toAbsolutePath();
    }
}
