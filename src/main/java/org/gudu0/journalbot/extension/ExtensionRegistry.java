package org.gudu0.journalbot.extension;

import org.gudu0.journalbot.util.ConsoleLog;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Dispatch table from event type to the extensions that consume it.
 */
public class ExtensionRegistry {

    private final Map<EventType, List<BotExtension>> subscribers = new EnumMap<>(EventType.class);

    public ExtensionRegistry() {
        for (EventType t : EventType.values()) {
            subscribers.put(t, new CopyOnWriteArrayList<>());
        }
    }

    public ExtensionRegistry register(BotExtension extension) {
        if (extension.consumes().isEmpty()) {
            ConsoleLog.warn("Extensions", extension.name() + " consumes no event types; it will never run");
        }
        for (EventType t : extension.consumes()) {
            subscribers.get(t).add(extension);
        }
        ConsoleLog.info("Extensions", "Registered " + extension.name() + " for " + extension.consumes());
        return this;
    }

    public List<BotExtension> subscribersOf(EventType type) {
        return new ArrayList<>(subscribers.get(type));
    }

    /**
     * Invokes every subscriber of the event's type in registration order.
     *
     * @return how many subscribers failed
     */
    public int dispatch(BotEvent event) {
        int failures = 0;
        for (BotExtension ext : subscribers.get(event.type())) {
            try {
                ext.handle(event);
            } catch (Exception e) {
                failures++;
                ConsoleLog.error("Extensions", ext.name() + " failed on " + event.type() + ": " + e.getMessage(), e);
            }
        }
        return failures;
    }
}
