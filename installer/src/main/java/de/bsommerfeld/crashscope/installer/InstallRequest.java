package de.bsommerfeld.crashscope.installer;

import de.bsommerfeld.crashscope.installer.verify.ToolProbe;

/**
 * Everything a worker needs, captured when the attempt starts.
 *
 * @param toolProbe   how to verify the tool once installed
 * @param packageName package to ask the package manager for
 */
record InstallRequest(ToolProbe toolProbe, String packageName) {
}
