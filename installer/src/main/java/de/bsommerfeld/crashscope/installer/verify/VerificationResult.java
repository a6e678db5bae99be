package de.bsommerfeld.crashscope.installer.verify;

public enum VerificationResult {

    /** The tool ran, exited with 0 and printed the expected marker. */
    VERIFIED,
    /** The binary exists but failed, hung or printed something unexpected. */
    BROKEN,
    /** The binary could not be started at all. */
    ABSENT
}
