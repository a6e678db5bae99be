package de.bsommerfeld.crashscope.installer.pkg;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.crashscope.core.config.InstallerConfig;
import de.bsommerfeld.crashscope.installer.env.EnvironmentProbe;
import de.bsommerfeld.crashscope.installer.error.InstallError;
import de.bsommerfeld.crashscope.installer.error.InstallErrorKind;
import de.bsommerfeld.crashscope.installer.error.InstallException;
import de.bsommerfeld.crashscope.installer.process.CommandExecutor;
import de.bsommerfeld.crashscope.installer.process.CommandResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.List;

/**
 * Turns a (manager, package, privilege) request into one bounded install
 * command and classifies its result. A single attempt, no retries.
 *
 * <p>
 * Privileged commands are never run inside CI: there is nobody to answer a
 * password prompt, and mutating a shared build host is not ours to do.
 */
@Singleton
public class PackageManagerAdapter {

    private static final Logger LOG = LoggerFactory.getLogger(PackageManagerAdapter.class);

    private static final int STDERR_TAIL_LINES = 5;

    private final CommandExecutor executor;
    private final EnvironmentProbe probe;
    private final Duration timeout;

    @Inject
    public PackageManagerAdapter(CommandExecutor executor, EnvironmentProbe probe, InstallerConfig config) {
        this(executor, probe, Duration.ofSeconds(config.getCommandTimeoutSeconds()));
    }

    public PackageManagerAdapter(CommandExecutor executor, EnvironmentProbe probe, Duration timeout) {
        this.executor = executor;
        this.probe = probe;
        this.timeout = timeout;
    }

    /**
     * @param managerId         id of a {@link PackageManager}, see {@link PackageManager#byId}
     * @param packageName       package to install
     * @param requiresPrivilege whether to run the command through {@code sudo}
     * @return {@link InstallOutcome#success()} on exit code 0, or a skipped
     *         outcome when a privileged install was requested inside CI
     * @throws InstallException {@code UNKNOWN_MANAGER}, {@code COMMAND_FAILED},
     *                          {@code TIMEOUT} or {@code EXECUTION_ERROR}
     */
    public InstallOutcome installPackage(String managerId, String packageName, boolean requiresPrivilege)
            throws InstallException {
        PackageManager manager = PackageManager.byId(managerId)
                .orElseThrow(() -> new InstallException(InstallErrorKind.UNKNOWN_MANAGER, managerId));

        List<String> command = manager.installCommand(packageName, requiresPrivilege);

        if (requiresPrivilege && probe.isCiEnvironment()) {
            LOG.warn("CI environment detected, not running privileged command: {}", String.join(" ", command));
            return InstallOutcome.skipped(
                    InstallError.of(InstallErrorKind.SKIPPED_CI_PRIVILEGE, String.join(" ", command)));
        }

        LOG.info("Installing {} via {}", packageName, manager.id());
        CommandResult result;
        try {
            result = executor.run(command, timeout);
        } catch (IOException e) {
            throw new InstallException(InstallError.of(InstallErrorKind.EXECUTION_ERROR, e.getMessage()), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new InstallException(InstallError.of(InstallErrorKind.EXECUTION_ERROR, "interrupted"), e);
        }

        if (result.timedOut()) {
            throw new InstallException(InstallErrorKind.TIMEOUT, "after " + timeout.toSeconds() + "s");
        }
        if (result.exitCode() != 0) {
            throw new InstallException(InstallErrorKind.COMMAND_FAILED, describeFailure(result));
        }

        LOG.info("{} installed {}", manager.id(), packageName);
        return InstallOutcome.success();
    }

    private static String describeFailure(CommandResult result) {
        String stderr = result.stderr() == null ? "" : result.stderr().strip();
        if (stderr.isEmpty()) {
            return "exit " + result.exitCode();
        }
        List<String> lines = stderr.lines().toList();
        List<String> tail = lines.subList(Math.max(0, lines.size() - STDERR_TAIL_LINES), lines.size());
        return "exit " + result.exitCode() + ": " + String.join("\n", tail);
    }
}
