package de.bsommerfeld.crashscope.installer.verify;

import de.bsommerfeld.crashscope.installer.process.CommandExecutor;
import de.bsommerfeld.crashscope.installer.process.CommandResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.*;

class InstallVerifierTest {

    private static final ToolProbe R2 = new ToolProbe("r2", List.of("-v"), "radare2");

    private CommandExecutor executor;
    private InstallVerifier verifier;

    @BeforeEach
    void setUp() {
        executor = mock(CommandExecutor.class);
        verifier = new InstallVerifier(executor, Duration.ofSeconds(5));
    }

    @Test
    void check_shouldVerifyToolPrintingMarker() throws Exception {
        when(executor.run(anyList(), any()))
                .thenReturn(new CommandResult(0, "radare2 5.9.8 0 @ linux-x86-64\n", "", false));

        assertEquals(VerificationResult.VERIFIED, verifier.check(R2));
        verify(executor).run(List.of("r2", "-v"), Duration.ofSeconds(5));
    }

    @Test
    void verify_shouldRunProbeOncePerCall() throws Exception {
        when(executor.run(anyList(), any()))
                .thenReturn(new CommandResult(0, "radare2 5.9.8 0 @ linux-x86-64\n", "", false));

        assertTrue(verifier.verify(R2));
        assertTrue(verifier.verify(R2));
        verify(executor, times(2)).run(List.of("r2", "-v"), Duration.ofSeconds(5));
    }

    @Test
    void check_shouldMatchMarkerCaseInsensitivelyOnStderr() throws Exception {
        when(executor.run(anyList(), any())).thenReturn(new CommandResult(0, "", "RADARE2 5.9", false));

        assertEquals(VerificationResult.VERIFIED, verifier.check(R2));
    }

    @Test
    void check_shouldReportBrokenOnNonZeroExit() throws Exception {
        when(executor.run(anyList(), any())).thenReturn(new CommandResult(1, "radare2", "libr missing", false));

        assertEquals(VerificationResult.BROKEN, verifier.check(R2));
        assertFalse(verifier.verify(R2));
    }

    @Test
    void check_shouldReportBrokenWhenMarkerIsMissing() throws Exception {
        when(executor.run(anyList(), any())).thenReturn(new CommandResult(0, "something else", "", false));

        assertEquals(VerificationResult.BROKEN, verifier.check(R2));
    }

    @Test
    void check_shouldReportBrokenOnTimeout() throws Exception {
        when(executor.run(anyList(), any())).thenReturn(CommandResult.timeout("", ""));

        assertEquals(VerificationResult.BROKEN, verifier.check(R2));
    }

    @Test
    void check_shouldReportAbsentWhenBinaryCannotStart() throws Exception {
        when(executor.run(anyList(), any())).thenThrow(new IOException("error=2, No such file or directory"));

        assertEquals(VerificationResult.ABSENT, verifier.check(R2));
        assertFalse(verifier.verify(R2));
    }

    @Test
    void check_shouldNeverPropagateRuntimeExceptions() throws Exception {
        when(executor.run(anyList(), any())).thenThrow(new IllegalStateException("unexpected"));

        assertEquals(VerificationResult.BROKEN, assertDoesNotThrow(() -> verifier.check(R2)));
    }

    @Test
    void check_shouldAcceptAnyOutputWithoutMarker() throws Exception {
        when(executor.run(anyList(), any())).thenReturn(new CommandResult(0, "GNU objdump 2.42", "", false));

        assertTrue(verifier.verify(new ToolProbe("objdump", List.of("--version"), null)));
    }

    @Test
    void check_shouldRestoreInterruptFlag() throws Exception {
        when(executor.run(anyList(), any())).thenThrow(new InterruptedException());

        try {
            assertEquals(VerificationResult.BROKEN, verifier.check(R2));
            assertTrue(Thread.currentThread().isInterrupted());
        } finally {
            Thread.interrupted();
        }
    }
}
