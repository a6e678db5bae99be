package de.bsommerfeld.crashscope.app;

import com.google.common.eventbus.Subscribe;
import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.crashscope.installer.InstallerEvents.InstallFinishedEvent;
import de.bsommerfeld.crashscope.installer.ManagedTool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Switches from the fallback disassembler to the installed one as soon as a
 * background install succeeds.
 */
@Singleton
public class InstallCompletionListener {

    private static final Logger LOG = LoggerFactory.getLogger(InstallCompletionListener.class);

    private final ManagedTool tool;

    @Inject
    public InstallCompletionListener(ManagedTool tool) {
        this.tool = tool;
    }

    @Subscribe
    public void onInstallFinished(InstallFinishedEvent event) {
        if (!event.status().succeeded()) {
            return;
        }
        if (tool.reloadTool()) {
            LOG.info("Switched to the installed disassembler");
        } else {
            LOG.warn("Install reported success but the disassembler still cannot be located");
        }
    }
}
