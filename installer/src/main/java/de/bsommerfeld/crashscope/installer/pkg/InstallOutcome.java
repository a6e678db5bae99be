package de.bsommerfeld.crashscope.installer.pkg;

import de.bsommerfeld.crashscope.installer.error.InstallError;

/**
 * Non-exceptional result of {@link PackageManagerAdapter#installPackage}.
 * Either the package was installed, or the install was deliberately skipped
 * with a reason; real failures are raised as exceptions instead.
 *
 * @param installed  {@code true} if the install command succeeded
 * @param skipReason why nothing was executed, {@code null} when installed
 */
public record InstallOutcome(boolean installed, InstallError skipReason) {

    private static final InstallOutcome INSTALLED = new InstallOutcome(true, null);

    public static InstallOutcome success() {
        return INSTALLED;
    }

    public static InstallOutcome skipped(InstallError reason) {
        return new InstallOutcome(false, reason);
    }

    public boolean isSkipped() {
        return skipReason != null;
    }
}
