package org.gudu0.journalbot.extension;

import java.util.function.Consumer;

/**
 * @param username the platform username (not the display name), used for channel naming
 */
public record DirectMessageEvent(long platformUserId, String username, String text, Consumer<String> reply)
        implements BotEvent {
    @Override
    public EventType type() {
        return EventType.DIRECT_MESSAGE;
    }
}
