package de.bsommerfeld.crashscope.installer.env;

import java.util.Locale;

/**
 * Host operating system families the installer knows package managers for.
 */
public enum Platform {

    MACOS,
    LINUX,
    WINDOWS,
    UNSUPPORTED;

    public static Platform current() {
        return fromOsName(System.getProperty("os.name", ""));
    }

    public static Platform fromOsName(String osName) {
        String os = osName.toLowerCase(Locale.ENGLISH);
        if (os.contains("mac") || os.contains("darwin")) {
            return MACOS;
        }
        if (os.contains("win")) {
            return WINDOWS;
        }
        if (os.contains("linux")) {
            return LINUX;
        }
        return UNSUPPORTED;
    }
}
