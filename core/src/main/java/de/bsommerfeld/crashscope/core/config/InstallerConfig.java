package de.bsommerfeld.crashscope.core.config;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;

/**
 * Settings for locating the disassembler and installing it when missing.
 * Defaults target radare2 with objdump as the fallback disassembler.
 */
public class InstallerConfig {

    public static final int DEFAULT_COMMAND_TIMEOUT_SECONDS = 300;
    public static final int DEFAULT_VERIFY_TIMEOUT_SECONDS = 5;

    @JsonProperty("auto-install")
    private boolean autoInstall = true;

    // Empty means "detect from the platform"
    @JsonProperty("preferred-manager")
    private String preferredManager = "";

    @JsonProperty("package-name")
    private String packageName = "radare2";

    @JsonProperty("tool-executable")
    private String toolExecutable = "r2";

    @JsonProperty("tool-probe-args")
    private List<String> toolProbeArgs = new ArrayList<>(List.of("-v"));

    @JsonProperty("tool-probe-marker")
    private String toolProbeMarker = "radare2";

    @JsonProperty("fallback-executable")
    private String fallbackExecutable = "objdump";

    @JsonProperty("fallback-probe-args")
    private List<String> fallbackProbeArgs = new ArrayList<>(List.of("--version"));

    @JsonProperty("command-timeout-seconds")
    private int commandTimeoutSeconds = DEFAULT_COMMAND_TIMEOUT_SECONDS;

    @JsonProperty("verify-timeout-seconds")
    private int verifyTimeoutSeconds = DEFAULT_VERIFY_TIMEOUT_SECONDS;

    public boolean isAutoInstall() {
        return autoInstall;
    }

    public void setAutoInstall(boolean autoInstall) {
        this.autoInstall = autoInstall;
    }

    public String getPreferredManager() {
        return preferredManager;
    }

    public void setPreferredManager(String preferredManager) {
        this.preferredManager = preferredManager;
    }

    public String getPackageName() {
        return packageName;
    }

    public void setPackageName(String packageName) {
        this.packageName = packageName;
    }

    public String getToolExecutable() {
        return toolExecutable;
    }

    public void setToolExecutable(String toolExecutable) {
        this.toolExecutable = toolExecutable;
    }

    public List<String> getToolProbeArgs() {
        return toolProbeArgs;
    }

    public String getToolProbeMarker() {
        return toolProbeMarker;
    }

    public String getFallbackExecutable() {
        return fallbackExecutable;
    }

    public void setFallbackExecutable(String fallbackExecutable) {
        this.fallbackExecutable = fallbackExecutable;
    }

    public List<String> getFallbackProbeArgs() {
        return fallbackProbeArgs;
    }

    public int getCommandTimeoutSeconds() {
        return commandTimeoutSeconds;
    }

    public void setCommandTimeoutSeconds(int commandTimeoutSeconds) {
        this.commandTimeoutSeconds = commandTimeoutSeconds;
    }

    public int getVerifyTimeoutSeconds() {
        return verifyTimeoutSeconds;
    }

    public void setVerifyTimeoutSeconds(int verifyTimeoutSeconds) {
        this.verifyTimeoutSeconds = verifyTimeoutSeconds;
    }
}
