package org.gudu0.journalbot.extension;

import org.gudu0.journalbot.journal.IncomingEntry;

import java.util.function.Consumer;

public record JournalMessageEvent(IncomingEntry entry, Consumer<String> reply) implements BotEvent {
    @Override
    public EventType type() {
        return EventType.JOURNAL_MESSAGE;
    }
}
