package de.bsommerfeld.crashscope.installer;

import java.time.Instant;

/**
 * A located, verified disassembler ready to be invoked.
 *
 * @param executable executable the probe succeeded with
 * @param locatedAt  when it was verified
 */
public record ToolHandle(String executable, Instant locatedAt) {
}
