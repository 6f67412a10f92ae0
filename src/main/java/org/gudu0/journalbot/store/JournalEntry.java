package org.gudu0.journalbot.store;

import java.time.Instant;
import java.time.LocalDate;

/**
 * One authored journal message. Display name is kept as it was when the message was written.
 */
public record JournalEntry(long id,
                           long userId,
                           long platformUserId,
                           String displayName,
                           String content,
                           int wordCount,
                           long platformMessageId,
                           long channelId,
                           LocalDate journalDate,
                           Instant createdAt) {
}
