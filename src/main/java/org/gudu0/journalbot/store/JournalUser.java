package org.gudu0.journalbot.store;

import java.time.Instant;

public record JournalUser(long id,
                          long platformUserId,
                          String displayName,
                          Long assignedChannelId,
                          Instant createdAt,
                          Instant updatedAt) {
}
