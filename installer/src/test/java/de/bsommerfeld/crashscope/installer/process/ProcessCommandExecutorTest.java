package de.bsommerfeld.crashscope.installer.process;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.DisabledOnOs;
import org.junit.jupiter.api.condition.OS;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Runs real processes through {@code sh}; skipped on Windows.
 */
@DisabledOnOs(OS.WINDOWS)
class ProcessCommandExecutorTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(10);

    private final ProcessCommandExecutor executor = new ProcessCommandExecutor();

    @Test
    void run_shouldCaptureStdoutAndExitCode() throws Exception {
        CommandResult result = executor.run(List.of("sh", "-c", "echo radare2 5.9"), TIMEOUT);

        assertTrue(result.succeeded());
        assertEquals(0, result.exitCode());
        assertEquals("radare2 5.9", result.stdout().strip());
        assertFalse(result.timedOut());
    }

    @Test
    void run_shouldCaptureStderrSeparately() throws Exception {
        CommandResult result = executor.run(List.of("sh", "-c", "echo oops >&2; exit 3"), TIMEOUT);

        assertFalse(result.succeeded());
        assertEquals(3, result.exitCode());
        assertEquals("oops", result.stderr().strip());
        assertEquals("", result.stdout());
    }

    @Test
    void run_shouldPassArgumentsVerbatim() throws Exception {
        CommandResult result = executor.run(List.of("sh", "-c", "printf '%s' \"$1\"", "sh", "a b; echo injected"),
                TIMEOUT);

        assertEquals("a b; echo injected", result.stdout());
    }

    @Test
    void run_shouldKillProcessOnTimeout() throws Exception {
        long start = System.nanoTime();

        CommandResult result = executor.run(List.of("sleep", "30"), Duration.ofMillis(200));

        assertTrue(result.timedOut());
        assertFalse(result.succeeded());
        assertTrue(Duration.ofNanos(System.nanoTime() - start).toSeconds() < 10);
    }

    @Test
    void run_shouldKillGrandchildrenOnTimeout() throws Exception {
        String sleep = "sleep " + uniqueSeconds();

        CommandResult result = executor.run(List.of("sh", "-c", sleep + "; echo done"), Duration.ofSeconds(1));

        assertTrue(result.timedOut());
        assertEquals(0, awaitSurvivors(sleep));
    }

    @Test
    void run_shouldKillProcessTreeWhenInterrupted() throws Exception {
        String sleep = "sleep " + uniqueSeconds();
        AtomicReference<Throwable> thrown = new AtomicReference<>();
        Thread caller = new Thread(() -> {
            try {
                executor.run(List.of("sh", "-c", sleep + "; echo done"), Duration.ofSeconds(60));
            } catch (Exception e) {
                thrown.set(e);
            }
        });
        caller.start();

        long deadline = System.nanoTime() + Duration.ofSeconds(10).toNanos();
        while (survivors(sleep) == 0 && System.nanoTime() < deadline) {
            Thread.sleep(50);
        }
        assertTrue(survivors(sleep) > 0, "command did not start");

        caller.interrupt();
        caller.join(10_000);

        assertInstanceOf(InterruptedException.class, thrown.get());
        assertEquals(0, awaitSurvivors(sleep));
    }

    @Test
    void run_shouldNotBlockOnStdin() throws Exception {
        CommandResult result = executor.run(List.of("sh", "-c", "read answer; echo \"got:$answer\""), TIMEOUT);

        assertFalse(result.timedOut());
        assertEquals("got:", result.stdout().strip());
    }

    @Test
    void run_shouldThrowWhenProgramDoesNotExist() {
        assertThrows(IOException.class,
                () -> executor.run(List.of("crashscope-definitely-missing-binary"), TIMEOUT));
    }

    // Unlikely to collide with another sleep running on the machine
    private static long uniqueSeconds() {
        return 100_000 + ThreadLocalRandom.current().nextInt(900_000);
    }

    private static long survivors(String commandLine) {
        return ProcessHandle.allProcesses()
                .filter(ProcessHandle::isAlive)
                .filter(p -> p.info().commandLine().orElse("").contains(commandLine))
                .count();
    }

    private static long awaitSurvivors(String commandLine) throws InterruptedException {
        long deadline = System.nanoTime() + Duration.ofSeconds(5).toNanos();
        long count = survivors(commandLine);
        while (count > 0 && System.nanoTime() < deadline) {
            Thread.sleep(50);
            count = survivors(commandLine);
        }
        return count;
    }
}
