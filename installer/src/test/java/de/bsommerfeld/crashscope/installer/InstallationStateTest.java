package de.bsommerfeld.crashscope.installer;

import de.bsommerfeld.crashscope.installer.error.InstallError;
import de.bsommerfeld.crashscope.installer.error.InstallErrorKind;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.FutureTask;

import static org.junit.jupiter.api.Assertions.*;

class InstallationStateTest {

    private static final Instant T1000 = Instant.ofEpochSecond(1000);

    private final InstallationState state = new InstallationState();

    private static FutureTask<Void> worker() {
        return new FutureTask<>(() -> {
        }, null);
    }

    @Test
    void snapshot_shouldReportNothingBeforeFirstAttempt() {
        InstallStatus status = state.snapshot(T1000);

        assertFalse(status.inProgress());
        assertNull(status.outcome());
        assertNull(status.error());
        assertNull(status.startedAt());
        assertNull(status.duration());
    }

    @Test
    void snapshot_shouldDeriveDurationWhileInProgress() {
        state.begin(T1000, worker());

        InstallStatus status = state.snapshot(T1000.plusSeconds(10));

        assertTrue(status.inProgress());
        assertNull(status.outcome());
        assertEquals(T1000, status.startedAt());
        assertEquals(Duration.ofSeconds(10), status.duration());
    }

    @Test
    void complete_shouldFreezeDuration() {
        state.begin(T1000, null);
        state.complete(T1000.plusSeconds(42), null);

        assertEquals(Duration.ofSeconds(42), state.snapshot(T1000.plusSeconds(50)).duration());
        assertEquals(Duration.ofSeconds(42), state.snapshot(T1000.plusSeconds(5000)).duration());
    }

    @Test
    void complete_shouldRecordSuccess() {
        state.begin(T1000, null);

        InstallStatus status = state.complete(T1000.plusSeconds(3), null);

        assertFalse(status.inProgress());
        assertEquals(Boolean.TRUE, status.outcome());
        assertNull(status.error());
    }

    @Test
    void complete_shouldRecordFailureWithError() {
        state.begin(T1000, null);
        InstallError error = InstallError.of(InstallErrorKind.COMMAND_FAILED, "exit 1");

        InstallStatus status = state.complete(T1000.plusSeconds(3), error);

        assertEquals(Boolean.FALSE, status.outcome());
        assertEquals(error, status.error());
    }

    @Test
    void complete_shouldBeIgnoredWhenNothingRuns() {
        state.begin(T1000, null);
        state.complete(T1000.plusSeconds(3), null);

        InstallStatus again = state.complete(T1000.plusSeconds(99),
                InstallError.of(InstallErrorKind.UNEXPECTED_EXCEPTION));

        assertEquals(Boolean.TRUE, again.outcome());
        assertEquals(Duration.ofSeconds(3), again.duration());
    }

    @Test
    void complete_shouldClampClockGoingBackwards() {
        state.begin(T1000, null);

        assertEquals(Duration.ZERO, state.complete(T1000.minusSeconds(5), null).duration());
    }

    @Test
    void begin_shouldRefuseSecondConcurrentAttempt() {
        assertTrue(state.begin(T1000, worker()));
        assertFalse(state.begin(T1000.plusSeconds(1), worker()));

        assertEquals(T1000, state.snapshot(T1000.plusSeconds(2)).startedAt());
    }

    @Test
    void begin_shouldResetPreviousAttempt() {
        state.begin(T1000, worker());
        state.requestCancel();
        state.complete(T1000.plusSeconds(5), InstallError.of(InstallErrorKind.CANCELLED));

        assertTrue(state.begin(T1000.plusSeconds(100), null));

        InstallStatus status = state.snapshot(T1000.plusSeconds(101));
        assertTrue(status.inProgress());
        assertNull(status.outcome());
        assertNull(status.error());
        assertEquals(Duration.ofSeconds(1), status.duration());
        assertFalse(state.isCancelRequested());
        assertFalse(state.isBackground());
    }

    @Test
    void requestCancel_shouldBeIdempotentForBackgroundAttempt() {
        state.begin(T1000, worker());

        for (int i = 0; i < 5; i++) {
            assertTrue(state.requestCancel());
        }
        assertTrue(state.isCancelRequested());
    }

    @Test
    void requestCancel_shouldRefuseForegroundAttempt() {
        state.begin(T1000, null);

        assertFalse(state.requestCancel());
        assertFalse(state.isCancelRequested());
        assertTrue(state.snapshot(T1000).inProgress());
    }

    @Test
    void requestCancel_shouldRefuseWhenNothingRuns() {
        assertFalse(state.requestCancel());

        state.begin(T1000, worker());
        state.complete(T1000.plusSeconds(1), null);

        assertFalse(state.requestCancel());
        assertFalse(state.requestCancel());
    }

    @Test
    void isBackground_shouldFollowWorkerHandle() {
        state.begin(T1000, worker());
        assertTrue(state.isBackground());
    }
}
