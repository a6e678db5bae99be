package de.bsommerfeld.crashscope.installer;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import com.google.inject.name.Named;
import de.bsommerfeld.crashscope.core.config.InstallerConfig;
import de.bsommerfeld.crashscope.core.event.ApplicationEventBus;
import de.bsommerfeld.crashscope.installer.InstallerEvents.InstallFinishedEvent;
import de.bsommerfeld.crashscope.installer.InstallerEvents.InstallStartedEvent;
import de.bsommerfeld.crashscope.installer.env.EnvironmentProbe;
import de.bsommerfeld.crashscope.installer.error.InstallError;
import de.bsommerfeld.crashscope.installer.error.InstallErrorKind;
import de.bsommerfeld.crashscope.installer.error.InstallException;
import de.bsommerfeld.crashscope.installer.pkg.InstallOutcome;
import de.bsommerfeld.crashscope.installer.pkg.PackageManager;
import de.bsommerfeld.crashscope.installer.pkg.PackageManagerAdapter;
import de.bsommerfeld.crashscope.installer.pkg.PackageManagerResolver;
import de.bsommerfeld.crashscope.installer.verify.InstallVerifier;
import de.bsommerfeld.crashscope.installer.verify.ToolProbe;
import de.bsommerfeld.crashscope.installer.verify.VerificationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.concurrent.Executor;
import java.util.concurrent.FutureTask;
import java.util.concurrent.RejectedExecutionException;

/**
 * Drives installation attempts through
 * {@code NotStarted -> InProgress -> Succeeded | Failed | Cancelled}.
 *
 * <h3>Mode</h3>
 * With a fallback tool at hand the attempt runs on the injected
 * {@link Executor} and the caller continues with the fallback. Without one the
 * caller has nothing to work with, so the attempt runs inline and blocks;
 * such an attempt has no worker handle and cannot be cancelled.
 *
 * <h3>Cancellation</h3>
 * Cooperative. The worker checks the flag before resolving the package
 * manager, before running the install command and after the command returned.
 * A running package manager process is never interrupted.
 *
 * <h3>Failure</h3>
 * Nothing escapes the worker. Every failure, including unexpected runtime
 * exceptions, ends the attempt as failed with its {@link InstallError}; the
 * terminal transition runs in a {@code finally} block so an attempt can never
 * stay in progress.
 *
 * <h3>Verification</h3>
 * Advisory: a successful install command marks the attempt as succeeded even
 * when the verification probe fails; the failure is logged as a warning.
 */
@Singleton
public class InstallOrchestrator {

    private static final Logger LOG = LoggerFactory.getLogger(InstallOrchestrator.class);

    private final EnvironmentProbe environment;
    private final InstallerConfig config;
    private final PackageManagerResolver resolver;
    private final PackageManagerAdapter adapter;
    private final InstallVerifier verifier;
    private final ApplicationEventBus eventBus;
    private final Executor workerExecutor;
    private final Clock clock;

    private final InstallationState state = new InstallationState();

    @Inject
    public InstallOrchestrator(EnvironmentProbe environment, InstallerConfig config,
            PackageManagerResolver resolver, PackageManagerAdapter adapter, InstallVerifier verifier,
            ApplicationEventBus eventBus, @Named("installer") Executor workerExecutor, Clock clock) {
        this.environment = environment;
        this.config = config;
        this.resolver = resolver;
        this.adapter = adapter;
        this.verifier = verifier;
        this.eventBus = eventBus;
        this.workerExecutor = workerExecutor;
        this.clock = clock;
    }

    /**
     * Starts an attempt to install the configured package.
     *
     * @param toolProbe         verification probe for the installed tool
     * @param fallbackAvailable whether the caller can work with a fallback
     *                          tool meanwhile; selects background mode
     * @return the mode chosen; for {@link InstallMode#FOREGROUND} the attempt
     *         has already finished when this returns
     */
    public InstallMode start(ToolProbe toolProbe, boolean fallbackAvailable) {
        if (isAutoInstallDisabled()) {
            LOG.info("Automatic installation of {} is disabled", config.getPackageName());
            return InstallMode.DISABLED;
        }

        InstallRequest request = new InstallRequest(toolProbe, config.getPackageName());
        return fallbackAvailable ? startBackground(request) : startForeground(request);
    }

    public boolean isAutoInstallDisabled() {
        return environment.isAutoInstallDisabled() || !config.isAutoInstall();
    }

    /**
     * Never blocks on the worker and never throws.
     */
    public InstallStatus getInstallStatus() {
        return state.snapshot(clock.instant());
    }

    /**
     * Asks a running background attempt to stop at its next checkpoint.
     * Safe to call any number of times.
     *
     * @return {@code true} if a cancellable attempt is running; {@code false}
     *         when nothing runs, the last attempt finished, or the attempt runs
     *         in the foreground
     */
    public boolean cancelInstall() {
        boolean requested = state.requestCancel();
        if (requested) {
            LOG.info("Cancellation of {} requested", config.getPackageName());
        }
        return requested;
    }

    // -- Modes --

    private InstallMode startBackground(InstallRequest request) {
        FutureTask<Void> worker = new FutureTask<>(() -> runAttempt(request), null);
        if (!state.begin(clock.instant(), worker)) {
            LOG.debug("Installation of {} already running", request.packageName());
            return InstallMode.ALREADY_RUNNING;
        }
        eventBus.post(new InstallStartedEvent(InstallMode.BACKGROUND, request.packageName()));
        LOG.info("Installing {} in the background", request.packageName());

        try {
            workerExecutor.execute(worker);
        } catch (RejectedExecutionException e) {
            LOG.error("Installer executor rejected the worker", e);
            finish(request, InstallError.of(InstallErrorKind.UNEXPECTED_EXCEPTION, describe(e)));
        }
        return InstallMode.BACKGROUND;
    }

    private InstallMode startForeground(InstallRequest request) {
        if (!state.begin(clock.instant(), null)) {
            LOG.debug("Installation of {} already running", request.packageName());
            return InstallMode.ALREADY_RUNNING;
        }
        eventBus.post(new InstallStartedEvent(InstallMode.FOREGROUND, request.packageName()));
        LOG.info("No fallback available, installing {} before continuing", request.packageName());

        runAttempt(request);
        return InstallMode.FOREGROUND;
    }

    // -- Worker --

    void runAttempt(InstallRequest request) {
        InstallError error = InstallError.of(InstallErrorKind.UNEXPECTED_EXCEPTION, "worker terminated abnormally");
        try {
            install(request);
            error = null;
        } catch (InstallException e) {
            error = e.getError();
        } catch (RuntimeException e) {
            LOG.error("Unexpected error while installing {}", request.packageName(), e);
            error = InstallError.of(InstallErrorKind.UNEXPECTED_EXCEPTION, describe(e));
        } finally {
            finish(request, error);
        }
    }

    private void install(InstallRequest request) throws InstallException {
        checkpoint("resolving the package manager");
        String managerId = resolver.resolve();
        boolean privileged = PackageManager.byId(managerId)
                .map(PackageManager::requiresPrivilege)
                .orElse(false);

        checkpoint("running " + managerId);
        InstallOutcome outcome = adapter.installPackage(managerId, request.packageName(), privileged);
        if (outcome.isSkipped()) {
            throw new InstallException(outcome.skipReason());
        }

        checkpoint("verification");
        VerificationResult verification = verifier.check(request.toolProbe());
        if (verification != VerificationResult.VERIFIED) {
            InstallError advisory = InstallError.of(InstallErrorKind.VERIFICATION_FAILED,
                    "'" + String.join(" ", request.toolProbe().command()) + "' reports " + verification);
            LOG.warn("{} was installed, continuing anyway. {}", request.packageName(), advisory.message());
        }
    }

    private void checkpoint(String nextStep) throws InstallException {
        if (state.isCancelRequested()) {
            throw new InstallException(InstallErrorKind.CANCELLED, "before " + nextStep);
        }
    }

    private void finish(InstallRequest request, InstallError error) {
        InstallStatus status = state.complete(clock.instant(), error);
        if (error == null) {
            LOG.info("Installed {} in {}s", request.packageName(), status.duration().toSeconds());
        } else if (error.kind() == InstallErrorKind.CANCELLED) {
            LOG.info("Installation of {} cancelled ({})", request.packageName(), error.detail());
        } else {
            LOG.warn("Installation of {} failed: {}", request.packageName(), error.message());
        }
        eventBus.post(new InstallFinishedEvent(status));
    }

    private static String describe(Throwable t) {
        return t.getMessage() != null ? t.getMessage() : t.getClass().getSimpleName();
    }

    boolean isBackgroundAttempt() {
        return state.isBackground();
    }

    boolean isCancelRequested() {
        return state.isCancelRequested();
    }
}
