package org.gudu0.journalbot.store;

import org.gudu0.journalbot.journal.StatKey;

import java.time.Instant;
import java.time.LocalDate;

public record DailyStat(long id,
                        long userId,
                        long platformUserId,
                        LocalDate day,
                        int totalWords,
                        boolean hasAccess,
                        Instant lastUpdated) {

    public StatKey key() {
        return new StatKey(userId, day);
    }
}
