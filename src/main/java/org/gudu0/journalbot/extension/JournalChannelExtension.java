package org.gudu0.journalbot.extension;

import org.gudu0.journalbot.discord.JournalChannelService;
import org.gudu0.journalbot.util.ConsoleLog;

import java.util.EnumSet;
import java.util.Set;

/**
 * Any direct message to the bot creates (or points to) the author's journal channel.
 */
public class JournalChannelExtension implements BotExtension {

    private final JournalChannelService channels;
    private final int threshold;

    public JournalChannelExtension(JournalChannelService channels, int threshold) {
        this.channels = channels;
        this.threshold = threshold;
    }

    @Override
    public String name() {
        return "journal-channels";
    }

    @Override
    public Set<EventType> consumes() {
        return EnumSet.of(EventType.DIRECT_MESSAGE);
    }

    @Override
    public void handle(BotEvent event) {
        DirectMessageEvent dm = (DirectMessageEvent) event;
        JournalChannelService.Provisioned p;
        try {
            p = channels.provision(dm.platformUserId(), dm.username());
        } catch (RuntimeException e) {
            dm.reply().accept("Sorry, there was an error creating your journal channel. Please contact an admin.");
            throw e;
        }

        String mention = "<#" + p.channelId() + ">";
        switch (p.kind()) {
            case EXISTING -> dm.reply().accept("You already have a journal channel: " + mention
                    + "\nPlease write your journal entries there!");
            case ADOPTED -> dm.reply().accept("Your journal channel is " + mention
                    + "\nWrite at least " + threshold + " words per day to access the shared channel!");
            case CREATED -> {
                dm.reply().accept("Created your journal channel: " + mention
                        + "\nWrite at least " + threshold + " words per day to access the shared channel!");
                try {
                    channels.welcome(p.channelId(), dm.platformUserId(), threshold);
                } catch (RuntimeException e) {
                    ConsoleLog.warn("JournalChannels", "Welcome message failed for " + p.channelId() + ": " + e.getMessage());
                }
            }
        }
    }
}
