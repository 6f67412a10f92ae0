package org.gudu0.journalbot.extension;

public enum EventType {
    /** A message posted in a journal channel. */
    JOURNAL_MESSAGE,
    /** A direct message to the bot. */
    DIRECT_MESSAGE,
    /** A completed daily reset pass. */
    DAILY_RESET
}
