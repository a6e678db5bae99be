package de.bsommerfeld.crashscope.app;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.google.inject.Singleton;
import com.google.inject.name.Named;
import de.bsommerfeld.crashscope.core.config.ConfigLoader;
import de.bsommerfeld.crashscope.core.config.CrashScopeConfig;
import de.bsommerfeld.crashscope.core.config.InstallerConfig;
import de.bsommerfeld.crashscope.core.util.StorageUtils;
import de.bsommerfeld.crashscope.installer.process.CommandExecutor;
import de.bsommerfeld.crashscope.installer.process.ProcessCommandExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.util.concurrent.Executor;
import java.util.concurrent.Executors;

/**
 * Guice module wiring configuration and the installer subsystem.
 */
public class AppModule extends AbstractModule {

    static final String APP_NAME = "crashscope";

    private static final Logger LOG = LoggerFactory.getLogger(AppModule.class);

    private final Path configPath;

    public AppModule() {
        this(StorageUtils.getConfigFile(APP_NAME));
    }

    public AppModule(Path configPath) {
        this.configPath = configPath;
    }

    @Override
    protected void configure() {
        try {
            LOG.info("Loading configuration from: {}", configPath.toAbsolutePath());
            CrashScopeConfig config = ConfigLoader.load(configPath);

            bind(CrashScopeConfig.class).toInstance(config);
            bind(InstallerConfig.class).toInstance(config.getInstaller());
        } catch (IOException e) {
            // Without configuration there is no package name to install; fail fast
            throw new IllegalStateException("Failed to load configuration from " + configPath, e);
        }

        bind(CommandExecutor.class).to(ProcessCommandExecutor.class);
        bind(Clock.class).toInstance(Clock.systemUTC());
    }

    /**
     * One daemon thread: at most one background install runs per installer,
     * and a pending install must not keep the JVM alive.
     */
    @Provides
    @Singleton
    @Named("installer")
    Executor installerExecutor() {
        return Executors.newSingleThreadExecutor(
                new ThreadFactoryBuilder().setNameFormat("crashscope-installer").setDaemon(true).build());
    }
}
