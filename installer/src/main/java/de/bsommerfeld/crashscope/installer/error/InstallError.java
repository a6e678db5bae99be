package de.bsommerfeld.crashscope.installer.error;

import java.util.Objects;

/**
 * Tagged failure reason of an installation attempt.
 *
 * @param kind   what went wrong; callers branch on this
 * @param detail free-form context such as captured stderr, may be {@code null}
 */
public record InstallError(InstallErrorKind kind, String detail) {

    public InstallError {
        Objects.requireNonNull(kind, "kind");
    }

    public static InstallError of(InstallErrorKind kind) {
        return new InstallError(kind, null);
    }

    public static InstallError of(InstallErrorKind kind, String detail) {
        return new InstallError(kind, detail);
    }

    /**
     * Human-readable rendering, e.g. {@code "Install command failed: E: Unable to locate package"}.
     */
    public String message() {
        if (detail == null || detail.isBlank()) {
            return kind.description();
        }
        return kind.description() + ": " + detail;
    }

    @Override
    public String toString() {
        return kind + (detail == null ? "" : "(" + detail + ")");
    }
}
