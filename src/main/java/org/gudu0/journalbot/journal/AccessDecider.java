package org.gudu0.journalbot.journal;

/**
 * Pure transition function for the per-day access state.
 * <ul>
 *   <li>boundary fired, any state: REVOKE</li>
 *   <li>LOCKED, total &gt;= threshold: GRANT</li>
 *   <li>UNLOCKED, total &gt;= threshold: HOLD</li>
 *   <li>otherwise: HOLD</li>
 * </ul>
 * Totals only grow within a day, so UNLOCKED below the threshold only happens
 * if the threshold was raised mid-day; access is kept until the boundary.
 */
public final class AccessDecider {
    private AccessDecider() {}

    public static AccessDecision decide(AccessState current, long totalWords, int threshold) {
        return decide(current, totalWords, threshold, false);
    }

    public static AccessDecision decide(AccessState current, long totalWords, int threshold, boolean boundaryFired) {
        if (current == null) throw new IllegalArgumentException("current state is required");
        if (boundaryFired) return AccessDecision.REVOKE;

        if (current == AccessState.LOCKED && totalWords >= threshold) {
            return AccessDecision.GRANT;
        }
        return AccessDecision.HOLD;
    }
}
