package org.gudu0.journalbot.access;

import org.gudu0.journalbot.util.ConsoleLog;

/**
 * Bounded retries with exponential backoff around another {@link ChannelAccess}.
 * After the last attempt the failure is rethrown so the caller can alert and leave the flag pending.
 */
public class RetryingChannelAccess implements ChannelAccess {

    @FunctionalInterface
    public interface Sleeper {
        void sleep(long millis) throws InterruptedException;
    }

    private final ChannelAccess delegate;
    private final int maxAttempts;
    private final long initialBackoffMillis;
    private final Sleeper sleeper;

    public RetryingChannelAccess(ChannelAccess delegate, int maxAttempts, long initialBackoffMillis) {
        this(delegate, maxAttempts, initialBackoffMillis, Thread::sleep);
    }

    public RetryingChannelAccess(ChannelAccess delegate, int maxAttempts, long initialBackoffMillis, Sleeper sleeper) {
        if (maxAttempts < 1) throw new IllegalArgumentException("maxAttempts must be >= 1");
        this.delegate = delegate;
        this.maxAttempts = maxAttempts;
        this.initialBackoffMillis = initialBackoffMillis;
        this.sleeper = sleeper;
    }

    @Override
    public void grant(long platformUserId, long sharedChannelId) {
        withRetry("grant", platformUserId, () -> delegate.grant(platformUserId, sharedChannelId));
    }

    @Override
    public void revoke(long platformUserId, long sharedChannelId) {
        withRetry("revoke", platformUserId, () -> delegate.revoke(platformUserId, sharedChannelId));
    }

    private void withRetry(String op, long platformUserId, Runnable call) {
        long backoff = initialBackoffMillis;
        for (int attempt = 1; ; attempt++) {
            try {
                call.run();
                if (attempt > 1) {
                    ConsoleLog.info("ChannelAccess", op + " userId=" + platformUserId + " succeeded on attempt " + attempt);
                }
                return;
            } catch (AccessCallFailedException e) {
                if (!e.retryable() || attempt >= maxAttempts) {
                    throw new AccessCallFailedException(
                            op + " userId=" + platformUserId + " failed after " + attempt + " attempt(s): " + e.getMessage(),
                            e.retryable(), e);
                }
                ConsoleLog.warn("ChannelAccess", op + " userId=" + platformUserId + " attempt " + attempt + "/" + maxAttempts
                        + " failed, retrying in " + backoff + "ms: " + e.getMessage());
                pause(backoff, op, platformUserId);
                backoff *= 2;
            }
        }
    }

    private void pause(long millis, String op, long platformUserId) {
        try {
            sleeper.sleep(millis);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new AccessCallFailedException(op + " userId=" + platformUserId + " interrupted during backoff", false, ie);
        }
    }
}
