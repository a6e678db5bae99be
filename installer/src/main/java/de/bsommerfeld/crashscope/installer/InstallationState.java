package de.bsommerfeld.crashscope.installer;

import de.bsommerfeld.crashscope.installer.error.InstallError;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.Future;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Lifecycle record of one installer's current attempt. Every read and write
 * happens under {@link #lock}, so observers see a transition either fully
 * applied or not at all.
 *
 * <p>
 * Invariants:
 * <ul>
 * <li>{@code inProgress} implies {@code outcome == null}</li>
 * <li>{@code error != null} iff {@code outcome == FALSE}</li>
 * <li>{@code duration} is written once per attempt, at the terminal transition</li>
 * <li>{@code workerHandle != null} iff the attempt runs in the background</li>
 * </ul>
 */
final class InstallationState {

    private final ReentrantLock lock = new ReentrantLock();

    private boolean inProgress;
    private Boolean outcome;
    private InstallError error;
    private Instant startedAt;
    private Duration duration;
    private boolean cancelRequested;
    private Future<?> workerHandle;

    /**
     * Resets the previous attempt and enters the in-progress state.
     *
     * @param workerHandle the background task, {@code null} for a foreground attempt
     * @return {@code false} if an attempt is already running; nothing changes then
     */
    boolean begin(Instant now, Future<?> workerHandle) {
        lock.lock();
        try {
            if (inProgress) {
                return false;
            }
            outcome = null;
            error = null;
            duration = null;
            cancelRequested = false;
            startedAt = now;
            this.workerHandle = workerHandle;
            inProgress = true;
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Terminal transition. A {@code null} error means success.
     *
     * @return the state right after the transition
     */
    InstallStatus complete(Instant now, InstallError error) {
        lock.lock();
        try {
            if (!inProgress) {
                return snapshotLocked(now);
            }
            Duration elapsed = Duration.between(startedAt, now);
            duration = elapsed.isNegative() ? Duration.ZERO : elapsed;
            outcome = error == null;
            this.error = error;
            inProgress = false;
            return snapshotLocked(now);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Signals cancellation to a running background worker.
     *
     * @return {@code false} if nothing is running or the attempt runs in the foreground
     */
    boolean requestCancel() {
        lock.lock();
        try {
            if (!inProgress || workerHandle == null) {
                return false;
            }
            cancelRequested = true;
            return true;
        } finally {
            lock.unlock();
        }
    }

    boolean isCancelRequested() {
        lock.lock();
        try {
            return cancelRequested;
        } finally {
            lock.unlock();
        }
    }

    boolean isBackground() {
        lock.lock();
        try {
            return workerHandle != null;
        } finally {
            lock.unlock();
        }
    }

    InstallStatus snapshot(Instant now) {
        lock.lock();
        try {
            return snapshotLocked(now);
        } finally {
            lock.unlock();
        }
    }

    private InstallStatus snapshotLocked(Instant now) {
        if (startedAt == null) {
            return InstallStatus.NOT_STARTED;
        }
        Duration reported = duration;
        if (inProgress) {
            Duration elapsed = Duration.between(startedAt, now);
            reported = elapsed.isNegative() ? Duration.ZERO : elapsed;
        }
        return new InstallStatus(inProgress, outcome, error, startedAt, reported);
    }
}
