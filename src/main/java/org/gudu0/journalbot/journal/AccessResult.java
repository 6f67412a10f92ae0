package org.gudu0.journalbot.journal;

/** Result of applying one GRANT or REVOKE. */
public enum AccessResult {
    GRANTED,
    REVOKED,
    /** The flag already had the target value (another writer got there first). */
    UNCHANGED,
    /** The external call failed after retries; the flag still shows the last confirmed state. */
    PENDING,
    /** Another thread is already applying a transition for the same (user, day). */
    IN_FLIGHT,
    /** The day's boundary fired; grants for it are refused. */
    BOUNDARY_PASSED
}
