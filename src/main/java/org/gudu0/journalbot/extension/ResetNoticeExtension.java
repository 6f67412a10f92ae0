package org.gudu0.journalbot.extension;

import org.gudu0.journalbot.reset.ResetReport;

import java.util.EnumSet;
import java.util.Set;
import java.util.function.Consumer;

/**
 * Marks the start of a new journal day in the shared channel.
 * Repeat runs for an already processed boundary stay silent.
 */
public class ResetNoticeExtension implements BotExtension {

    private final Consumer<String> sharedChannel;
    private final int threshold;

    public ResetNoticeExtension(Consumer<String> sharedChannel, int threshold) {
        this.sharedChannel = sharedChannel;
        this.threshold = threshold;
    }

    @Override
    public String name() {
        return "reset-notice";
    }

    @Override
    public Set<EventType> consumes() {
        return EnumSet.of(EventType.DAILY_RESET);
    }

    @Override
    public void handle(BotEvent event) {
        ResetReport report = ((DailyResetEvent) event).report();
        if (!report.firstRun()) return;
        sharedChannel.accept("A new journal day has started (" + report.boundaryDay().plusDays(1) + "). "
                + "Write " + threshold + " words in your journal to unlock this channel again.");
    }
}
