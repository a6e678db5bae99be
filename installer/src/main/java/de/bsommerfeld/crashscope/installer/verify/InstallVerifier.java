package de.bsommerfeld.crashscope.installer.verify;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.crashscope.core.config.InstallerConfig;
import de.bsommerfeld.crashscope.installer.process.CommandExecutor;
import de.bsommerfeld.crashscope.installer.process.CommandResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;

/**
 * Confirms that a tool is usable by running its {@link ToolProbe}.
 *
 * <p>
 * Never throws: every failure maps to {@link VerificationResult#BROKEN} or
 * {@link VerificationResult#ABSENT}. A probe that cannot be spawned means the
 * binary is missing; anything that gets as far as running but misbehaves means
 * the binary is present but broken.
 */
@Singleton
public class InstallVerifier {

    private static final Logger LOG = LoggerFactory.getLogger(InstallVerifier.class);

    private final CommandExecutor executor;
    private final Duration timeout;

    @Inject
    public InstallVerifier(CommandExecutor executor, InstallerConfig config) {
        this(executor, Duration.ofSeconds(config.getVerifyTimeoutSeconds()));
    }

    public InstallVerifier(CommandExecutor executor, Duration timeout) {
        this.executor = executor;
        this.timeout = timeout;
    }

    public boolean verify(ToolProbe probe) {
        return check(probe) == VerificationResult.VERIFIED;
    }

    public VerificationResult check(ToolProbe probe) {
        try {
            CommandResult result = executor.run(probe.command(), timeout);
            if (result.timedOut()) {
                LOG.debug("{} did not answer within {}s", probe.executable(), timeout.toSeconds());
                return VerificationResult.BROKEN;
            }
            if (result.exitCode() != 0) {
                LOG.debug("{} exited with code {}", probe.executable(), result.exitCode());
                return VerificationResult.BROKEN;
            }
            if (!probe.matches(result.stdout()) && !probe.matches(result.stderr())) {
                LOG.debug("{} output lacks marker '{}'", probe.executable(), probe.marker());
                return VerificationResult.BROKEN;
            }
            return VerificationResult.VERIFIED;
        } catch (IOException e) {
            LOG.debug("{} could not be started: {}", probe.executable(), e.getMessage());
            return VerificationResult.ABSENT;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return VerificationResult.BROKEN;
        } catch (RuntimeException e) {
            LOG.debug("Probing {} failed", probe.executable(), e);
            return VerificationResult.BROKEN;
        }
    }
}
