package org.gudu0.journalbot.extension;

import org.gudu0.journalbot.reset.ResetReport;

public record DailyResetEvent(ResetReport report) implements BotEvent {
    @Override
    public EventType type() {
        return EventType.DAILY_RESET;
    }
}
