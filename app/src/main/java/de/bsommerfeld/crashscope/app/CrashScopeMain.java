package de.bsommerfeld.crashscope.app;

import com.google.inject.Guice;
import com.google.inject.Injector;
import de.bsommerfeld.crashscope.core.event.ApplicationEventBus;
import de.bsommerfeld.crashscope.installer.InstallStatus;
import de.bsommerfeld.crashscope.installer.ManagedTool;
import de.bsommerfeld.crashscope.installer.ToolHandle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * Makes sure the disassembler is available. Waits for a background install
 * to settle so that its outcome ends up in the log; the exit code tells
 * whether the tool is ready.
 */
public final class CrashScopeMain {

    private static final Logger LOG = LoggerFactory.getLogger(CrashScopeMain.class);

    private static final Duration POLL_INTERVAL = Duration.ofSeconds(1);

    private CrashScopeMain() {
    }

    public static void main(String[] args) {
        Injector injector = Guice.createInjector(new AppModule());

        ApplicationEventBus eventBus = injector.getInstance(ApplicationEventBus.class);
        eventBus.register(injector.getInstance(InstallCompletionListener.class));

        ManagedTool tool = injector.getInstance(ManagedTool.class);
        Runtime.getRuntime().addShutdownHook(new Thread(tool::cancelInstall, "crashscope-cancel"));

        boolean ready;
        try {
            ready = awaitTool(tool);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            ready = false;
        }

        InstallStatus status = tool.getInstallStatus();
        if (ready) {
            LOG.info("Disassembler ready: {}", tool.handle().map(ToolHandle::executable).orElse("?"));
        } else if (status.error() != null) {
            LOG.error("Disassembler unavailable: {}", status.errorMessage());
        } else {
            LOG.error("Disassembler unavailable. {}", tool.guidance());
        }
        System.exit(ready ? 0 : 1);
    }

    static boolean awaitTool(ManagedTool tool) throws InterruptedException {
        if (tool.initialize()) {
            return true;
        }
        InstallStatus status = tool.getInstallStatus();
        while (status.inProgress()) {
            LOG.info("Installing... {}s elapsed", status.duration().toSeconds());
            Thread.sleep(POLL_INTERVAL.toMillis());
            status = tool.getInstallStatus();
        }
        return tool.reloadTool();
    }
}
