package org.gudu0.journalbot.journal;

import java.time.LocalDate;

/** Identifies one daily_stats row. */
public record StatKey(long userId, LocalDate day) {
    @Override
    public String toString() {
        return userId + "@" + day;
    }
}
