package de.bsommerfeld.crashscope.installer.error;

/**
 * Thrown by the installer building blocks when an attempt cannot proceed.
 * The orchestrator turns it into a failed attempt; it never reaches callers
 * of the public API.
 */
public class InstallException extends Exception {

    private final InstallError error;

    public InstallException(InstallError error) {
        super(error.message());
        this.error = error;
    }

    public InstallException(InstallError error, Throwable cause) {
        super(error.message(), cause);
        this.error = error;
    }

    public InstallException(InstallErrorKind kind, String detail) {
        this(InstallError.of(kind, detail));
    }

    public InstallError getError() {
        return error;
    }
}
