package org.gudu0.journalbot.journal;

/** Shared-channel access for one (user, journal day). */
public enum AccessState {
    LOCKED,
    UNLOCKED;

    public static AccessState of(boolean hasAccess) {
        return hasAccess ? UNLOCKED : LOCKED;
    }
}
