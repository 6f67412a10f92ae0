package org.gudu0.journalbot.extension;

import java.util.Set;

/**
 * A feature module. It is only ever invoked for the event types it lists in {@link #consumes()}.
 */
public interface BotExtension {

    String name();

    Set<EventType> consumes();

    void handle(BotEvent event) throws Exception;
}
