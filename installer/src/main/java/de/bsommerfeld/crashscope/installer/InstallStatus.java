package de.bsommerfeld.crashscope.installer;

import de.bsommerfeld.crashscope.installer.error.InstallError;

import java.time.Duration;
import java.time.Instant;

/**
 * Consistent point-in-time view of the current (or last) installation attempt.
 * All five components are read under one lock acquisition.
 *
 * @param inProgress {@code true} between the start of an attempt and its terminal transition
 * @param outcome    {@code null} if never attempted or still running, otherwise whether it succeeded
 * @param error      failure reason, non-null exactly when {@code outcome} is {@code false}
 * @param startedAt  when the attempt started, {@code null} if never attempted
 * @param duration   elapsed time while running, the fixed final duration afterwards,
 *                   {@code null} if never attempted
 */
public record InstallStatus(boolean inProgress, Boolean outcome, InstallError error, Instant startedAt,
        Duration duration) {

    static final InstallStatus NOT_STARTED = new InstallStatus(false, null, null, null, null);

    public String errorMessage() {
        return error == null ? null : error.message();
    }

    public boolean succeeded() {
        return Boolean.TRUE.equals(outcome);
    }
}
