package org.gudu0.journalbot.util;

import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class ConsoleLogTest {

    private static final Instant AT = Instant.parse("2026-03-10T12:00:00Z");

    @Test
    void plainLineCarriesLevelThreadAndTag() {
        String line = ConsoleLog.format(ConsoleLog.Level.WARN, "Access", "grant pending", AT, "journal-worker-1", false);

        assertThat(line)
                .endsWith("[WARN] [journal-worker-1] [Access] grant pending")
                .doesNotContain("\u001B[");
    }

    @Test
    void colorWrapsOnlyTheLevel() {
        String line = ConsoleLog.format(ConsoleLog.Level.ERROR, "Database", "down", AT, "main", true);

        assertThat(line).contains("[\u001B[31mERROR\u001B[0m] [main] [Database] down");
    }

    @Test
    void infoIsNeverColored() {
        String line = ConsoleLog.format(ConsoleLog.Level.INFO, "Main", "ready", AT, "main", true);

        assertThat(line).contains("[INFO] [main] [Main] ready");
    }
}
