package de.bsommerfeld.crashscope.installer;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.crashscope.core.config.InstallerConfig;
import de.bsommerfeld.crashscope.installer.env.EnvironmentProbe;
import de.bsommerfeld.crashscope.installer.env.Platform;
import de.bsommerfeld.crashscope.installer.pkg.PackageManager;
import de.bsommerfeld.crashscope.installer.verify.InstallVerifier;
import de.bsommerfeld.crashscope.installer.verify.ToolProbe;
import de.bsommerfeld.crashscope.installer.verify.VerificationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;
import java.util.Optional;

/**
 * Public entry point for everything that needs the disassembler.
 *
 * <p>
 * {@link #initialize()} locates the tool and, when it is missing, hands off to
 * the {@link InstallOrchestrator}. If the fallback disassembler answers, the
 * install runs in the background and callers keep working with the fallback
 * until {@link #reloadTool()} picks up the freshly installed tool.
 */
@Singleton
public class ManagedTool {

    private static final Logger LOG = LoggerFactory.getLogger(ManagedTool.class);

    private final InstallOrchestrator orchestrator;
    private final InstallVerifier verifier;
    private final InstallerConfig config;
    private final Clock clock;
    private final ToolProbe toolProbe;
    private final ToolProbe fallbackProbe;

    private volatile ToolHandle handle;
    private volatile boolean fallbackAvailable;

    @Inject
    public ManagedTool(InstallOrchestrator orchestrator, InstallVerifier verifier, InstallerConfig config,
            Clock clock) {
        this.orchestrator = orchestrator;
        this.verifier = verifier;
        this.config = config;
        this.clock = clock;
        this.toolProbe = new ToolProbe(config.getToolExecutable(), config.getToolProbeArgs(),
                config.getToolProbeMarker());
        this.fallbackProbe = new ToolProbe(config.getFallbackExecutable(), config.getFallbackProbeArgs(), null);
    }

    /**
     * Locates the tool, starting an installation when it is missing.
     *
     * @return {@code true} if the tool is ready now. A background install
     *         returns {@code false}; poll {@link #getInstallStatus()} and call
     *         {@link #reloadTool()} once it succeeded.
     */
    public synchronized boolean initialize() {
        if (handle != null || locate()) {
            return true;
        }

        fallbackAvailable = verifier.verify(fallbackProbe);
        LOG.info("{} not found, fallback {} {}", config.getToolExecutable(), config.getFallbackExecutable(),
                fallbackAvailable ? "available" : "unavailable");

        InstallMode mode = orchestrator.start(toolProbe, fallbackAvailable);
        switch (mode) {
            case DISABLED:
                LOG.warn(guidance());
                break;
            case FOREGROUND:
                if (orchestrator.getInstallStatus().succeeded()) {
                    locate();
                }
                break;
            default:
                break;
        }
        return isToolReady();
    }

    public boolean isToolReady() {
        return handle != null;
    }

    /**
     * Locates the tool again after a successful install. Does nothing when
     * the tool is already initialized or the last attempt did not succeed.
     *
     * @return {@link #isToolReady()}
     */
    public synchronized boolean reloadTool() {
        if (handle != null) {
            return true;
        }
        if (orchestrator.getInstallStatus().succeeded()) {
            locate();
        }
        return isToolReady();
    }

    public InstallStatus getInstallStatus() {
        return orchestrator.getInstallStatus();
    }

    public boolean cancelInstall() {
        return orchestrator.cancelInstall();
    }

    public Optional<ToolHandle> handle() {
        return Optional.ofNullable(handle);
    }

    /**
     * @return whether the fallback disassembler answered during the last
     *         {@link #initialize()} that had to install
     */
    public boolean isFallbackAvailable() {
        return fallbackAvailable;
    }

    /**
     * Manual install hint for the current platform, e.g.
     * {@code "Install radare2 manually, e.g. 'brew install radare2', ..."}.
     */
    public String guidance() {
        List<PackageManager> candidates = PackageManager.candidatesFor(Platform.current());
        String example = "";
        if (!candidates.isEmpty()) {
            PackageManager manager = candidates.get(0);
            example = ", e.g. '" + String.join(" ",
                    manager.installCommand(config.getPackageName(), manager.requiresPrivilege())) + "'";
        }
        return "Install " + config.getPackageName() + " manually" + example
                + ", or unset " + EnvironmentProbe.DISABLE_VARIABLE
                + " and enable installer.auto-install to let CrashScope install it.";
    }

    private boolean locate() {
        VerificationResult result = verifier.check(toolProbe);
        if (result == VerificationResult.VERIFIED) {
            handle = new ToolHandle(toolProbe.executable(), clock.instant());
            LOG.info("Using {}", toolProbe.executable());
            return true;
        }
        if (result == VerificationResult.BROKEN) {
            LOG.warn("{} is present but does not respond to '{}'", toolProbe.executable(),
                    String.join(" ", toolProbe.command()));
        }
        return false;
    }
}
