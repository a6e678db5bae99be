package de.bsommerfeld.crashscope.core.config;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Root of {@code config.toml}.
 */
public class CrashScopeConfig {

    @JsonProperty("debug-mode")
    private boolean debugMode = false;

    @JsonProperty("installer")
    private InstallerConfig installer = new InstallerConfig();

    public boolean isDebugMode() {
        return debugMode;
    }

    public void setDebugMode(boolean debugMode) {
        this.debugMode = debugMode;
    }

    public InstallerConfig getInstaller() {
        return installer;
    }
}
