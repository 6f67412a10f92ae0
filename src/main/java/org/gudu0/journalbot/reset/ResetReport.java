package org.gudu0.journalbot.reset;

import java.time.LocalDate;

/**
 * Outcome of one reset pass for the boundary that closed {@code boundaryDay}.
 *
 * @param firstRun false when the boundary had already been recorded by an earlier run
 */
public record ResetReport(LocalDate boundaryDay, int revoked, int failed, boolean firstRun) {
}
