package de.bsommerfeld.crashscope.installer.error;

/**
 * Every way an installation attempt can end without a usable tool.
 */
public enum InstallErrorKind {

    PLATFORM_UNSUPPORTED("No package manager is known for this platform"),
    PACKAGE_MANAGER_UNAVAILABLE("No supported package manager found on PATH"),
    UNKNOWN_MANAGER("Unknown package manager"),
    COMMAND_FAILED("Install command failed"),
    TIMEOUT("Install command timed out"),
    EXECUTION_ERROR("Install command could not be executed"),
    SKIPPED_CI_PRIVILEGE("Privileged install skipped in CI environment"),
    /** Advisory only; never ends an attempt on its own. */
    VERIFICATION_FAILED("Installed tool did not pass verification"),
    CANCELLED("Installation cancelled"),
    UNEXPECTED_EXCEPTION("Unexpected error during installation");

    private final String description;

    InstallErrorKind(String description) {
        this.description = description;
    }

    public String description() {
        return description;
    }
}
