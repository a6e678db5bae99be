package de.bsommerfeld.crashscope.installer.process;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.google.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * {@link CommandExecutor} backed by {@link ProcessBuilder}.
 *
 * <p>
 * Standard output and standard error are drained on separate daemon threads
 * so a chatty package manager cannot fill a pipe buffer and stall. Standard
 * input is closed right after start; a command waiting for a password or a
 * confirmation sees EOF instead of hanging until the deadline.
 */
@Singleton
public class ProcessCommandExecutor implements CommandExecutor {

    private static final Logger LOG = LoggerFactory.getLogger(ProcessCommandExecutor.class);

    /** How long to wait for the output pipes after the process has exited or was killed. */
    private static final long DRAIN_GRACE_SECONDS = 2;

    private static final ExecutorService DRAIN_POOL = Executors.newCachedThreadPool(
            new ThreadFactoryBuilder().setNameFormat("crashscope-io-%d").setDaemon(true).build());

    @Override
    public CommandResult run(List<String> argv, Duration timeout) throws IOException, InterruptedException {
        ProcessBuilder pb = new ProcessBuilder(argv);
        PathEnricher.enrich(pb);

        LOG.debug("Running {} (timeout {}s)", argv, timeout.toSeconds());
        Process process = pb.start();
        process.getOutputStream().close();

        CompletableFuture<String> stdout = drain(process.getInputStream());
        CompletableFuture<String> stderr = drain(process.getErrorStream());

        boolean finished;
        try {
            finished = process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            LOG.warn("Interrupted while waiting for {}, killing it", argv.get(0));
            destroyTree(process);
            throw e;
        }
        if (!finished) {
            LOG.warn("{} exceeded {}s, killing it", argv.get(0), timeout.toSeconds());
            destroyTree(process);
            process.waitFor(DRAIN_GRACE_SECONDS, TimeUnit.SECONDS);
            return CommandResult.timeout(collect(stdout), collect(stderr));
        }

        return new CommandResult(process.exitValue(), collect(stdout), collect(stderr), false);
    }

    /**
     * Kills the process and everything it spawned. {@code sudo} and shell
     * wrappers leave the real package manager as a grandchild, which would
     * otherwise keep running and hold the package database lock.
     */
    static void destroyTree(Process process) {
        process.descendants().forEach(ProcessHandle::destroyForcibly);
        process.destroyForcibly();
    }

    private static CompletableFuture<String> drain(InputStream stream) {
        return CompletableFuture.supplyAsync(() -> {
            try (InputStream in = stream) {
                return new String(in.readAllBytes(), StandardCharsets.UTF_8);
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
        }, DRAIN_POOL);
    }

    /**
     * Returns what the drain thread read, or an empty string when the pipe
     * broke or a grandchild process still holds it open.
     */
    private static String collect(CompletableFuture<String> output) throws InterruptedException {
        try {
            return output.get(DRAIN_GRACE_SECONDS, TimeUnit.SECONDS);
        } catch (ExecutionException | TimeoutException e) {
            LOG.debug("Could not collect command output", e);
            return "";
        }
    }
}
