package org.gudu0.journalbot.journal;

import java.time.Instant;

/**
 * A journal-channel message as delivered by the gateway (at-least-once).
 */
public record IncomingEntry(long platformUserId,
                            String displayName,
                            long channelId,
                            long platformMessageId,
                            String text,
                            Instant timestamp) {
}
