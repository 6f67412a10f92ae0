package org.gudu0.journalbot.store;

/**
 * The platform message id was already ingested. Redelivery, not an error for the caller.
 */
public class DuplicateMessageException extends RuntimeException {

    private final long platformMessageId;

    public DuplicateMessageException(long platformMessageId) {
        super("Message already recorded: " + platformMessageId);
        this.platformMessageId = platformMessageId;
    }

    public long platformMessageId() {
        return platformMessageId;
    }
}
