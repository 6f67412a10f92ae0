package org.gudu0.journalbot.journal;

public enum AccessDecision {
    /** No external call, no state change. */
    HOLD,
    /** LOCKED -> UNLOCKED. */
    GRANT,
    /** Forced back to LOCKED once the day's boundary has fired. */
    REVOKE
}
