package de.bsommerfeld.crashscope.installer.pkg;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.crashscope.core.config.InstallerConfig;
import de.bsommerfeld.crashscope.installer.env.Platform;
import de.bsommerfeld.crashscope.installer.error.InstallErrorKind;
import de.bsommerfeld.crashscope.installer.error.InstallException;
import de.bsommerfeld.crashscope.installer.process.CommandExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Picks the package manager an attempt will use.
 *
 * <p>
 * A manager named in the configuration wins without probing; its id is passed
 * through unchecked so that a typo surfaces as {@code UNKNOWN_MANAGER} from the
 * adapter. Otherwise the platform's candidates are probed in order with
 * {@code <executable> --version} and the first one that answers is used.
 */
@Singleton
public class PackageManagerResolver {

    private static final Logger LOG = LoggerFactory.getLogger(PackageManagerResolver.class);

    private static final Duration PROBE_TIMEOUT = Duration.ofSeconds(5);

    private final CommandExecutor executor;
    private final InstallerConfig config;
    private final Platform platform;

    @Inject
    public PackageManagerResolver(CommandExecutor executor, InstallerConfig config) {
        this(executor, config, Platform.current());
    }

    public PackageManagerResolver(CommandExecutor executor, InstallerConfig config, Platform platform) {
        this.executor = executor;
        this.config = config;
        this.platform = platform;
    }

    /**
     * @return id of the manager to use
     * @throws InstallException {@code PLATFORM_UNSUPPORTED} or {@code PACKAGE_MANAGER_UNAVAILABLE}
     */
    public String resolve() throws InstallException {
        String preferred = config.getPreferredManager();
        if (preferred != null && !preferred.isBlank()) {
            LOG.debug("Using configured package manager '{}'", preferred);
            return preferred.strip();
        }

        List<PackageManager> candidates = PackageManager.candidatesFor(platform);
        if (candidates.isEmpty()) {
            throw new InstallException(InstallErrorKind.PLATFORM_UNSUPPORTED,
                    System.getProperty("os.name", "unknown"));
        }

        for (PackageManager candidate : candidates) {
            if (isAvailable(candidate)) {
                LOG.debug("Detected package manager {}", candidate.id());
                return candidate.id();
            }
        }

        throw new InstallException(InstallErrorKind.PACKAGE_MANAGER_UNAVAILABLE,
                candidates.stream().map(PackageManager::executable).collect(Collectors.joining(", ")));
    }

    private boolean isAvailable(PackageManager manager) throws InstallException {
        try {
            return executor.run(List.of(manager.executable(), "--version"), PROBE_TIMEOUT).succeeded();
        } catch (IOException e) {
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new InstallException(InstallErrorKind.EXECUTION_ERROR, "interrupted while probing " + manager.id());
        }
    }
}
