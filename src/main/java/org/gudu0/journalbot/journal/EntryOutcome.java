package org.gudu0.journalbot.journal;

import java.time.LocalDate;

/**
 * What happened to one incoming entry, for the reply to its author.
 */
public record EntryOutcome(Status status, LocalDate day, int wordCount, int totalWords, int threshold) {

    public enum Status {
        /** No words; nothing stored. */
        EMPTY,
        /** Redelivery of an already recorded message; nothing changed. */
        DUPLICATE,
        /** Stored, still below the requirement. */
        RECORDED,
        /** Stored and this entry unlocked the shared channel. */
        UNLOCKED,
        /** Stored; access was already granted for the day. */
        ALREADY_UNLOCKED,
        /** Stored and over the requirement, but the grant is not confirmed yet. */
        ACCESS_PENDING,
        /** Stored against a day whose boundary has already passed. */
        LATE
    }

    public int remaining() {
        return Math.max(0, threshold - totalWords);
    }
}
