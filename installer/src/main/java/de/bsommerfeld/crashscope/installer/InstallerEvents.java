package de.bsommerfeld.crashscope.installer;

/**
 * Observational events posted on the
 * {@link de.bsommerfeld.crashscope.core.event.ApplicationEventBus}.
 * {@link InstallOrchestrator#getInstallStatus()} stays the source of truth.
 */
public class InstallerEvents {

    public record InstallStartedEvent(InstallMode mode, String packageName) {
    }

    /**
     * Fired once per attempt after its terminal transition.
     */
    public record InstallFinishedEvent(InstallStatus status) {
    }
}
