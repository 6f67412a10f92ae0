package org.gudu0.journalbot.extension;

import org.gudu0.journalbot.journal.AccessController;
import org.gudu0.journalbot.journal.EntryOutcome;
import org.gudu0.journalbot.store.StoreUnavailableException;
import org.gudu0.journalbot.util.ConsoleLog;

import java.util.EnumSet;
import java.util.Set;

/**
 * Feeds journal messages into the access controller and tells the author where they stand.
 */
public class JournalIngestExtension implements BotExtension {

    private final AccessController access;
    private final long sharedChannelId;

    public JournalIngestExtension(AccessController access, long sharedChannelId) {
        this.access = access;
        this.sharedChannelId = sharedChannelId;
    }

    @Override
    public String name() {
        return "journal-ingest";
    }

    @Override
    public Set<EventType> consumes() {
        return EnumSet.of(EventType.JOURNAL_MESSAGE);
    }

    @Override
    public void handle(BotEvent event) {
        JournalMessageEvent msg = (JournalMessageEvent) event;
        EntryOutcome outcome;
        try {
            outcome = access.onNewEntry(msg.entry());
        } catch (StoreUnavailableException e) {
            msg.reply().accept("I couldn't save that entry right now. Please post it again in a few minutes.");
            throw e;
        }

        ConsoleLog.debug("Ingest", "msgId=" + msg.entry().platformMessageId() + " -> " + outcome);

        String reply = replyFor(outcome);
        if (reply != null) msg.reply().accept(reply);
    }

    /** The author-facing reply for an outcome, or null when nothing should be said. */
    public String replyFor(EntryOutcome o) {
        String shared = "<#" + sharedChannelId + ">";
        String logged = "Logged **" + o.wordCount() + "** words. Today: **" + o.totalWords() + "/" + o.threshold() + "**.";
        return switch (o.status()) {
            case EMPTY, DUPLICATE -> null;
            case RECORDED -> logged + " **" + o.remaining() + "** more to unlock " + shared + ".";
            case UNLOCKED -> logged + " You've reached today's goal, welcome to " + shared + "!";
            case ALREADY_UNLOCKED -> logged + " You already have access to " + shared + " today.";
            case ACCESS_PENDING -> logged + " You've met the requirement but access is delayed. It will be granted shortly.";
            case LATE -> "Logged **" + o.wordCount() + "** words for " + o.day()
                    + ". That day has already closed, so it no longer counts toward access.";
        };
    }
}
