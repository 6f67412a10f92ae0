package org.gudu0.journalbot.extension;

/**
 * Something an extension can react to. Implementations carry plain data plus, where the
 * event came from a user, a callback for replying to that user.
 */
public interface BotEvent {
    EventType type();
}
