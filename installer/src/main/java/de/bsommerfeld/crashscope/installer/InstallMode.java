package de.bsommerfeld.crashscope.installer;

/**
 * What {@link InstallOrchestrator#start} decided to do.
 */
public enum InstallMode {

    /** Auto-install is switched off; nothing was started. */
    DISABLED,
    /** Installed synchronously on the caller's thread; not cancellable. */
    FOREGROUND,
    /** Installing on a worker thread; cancellable. */
    BACKGROUND,
    /** Another attempt of this installer is still running. */
    ALREADY_RUNNING
}
