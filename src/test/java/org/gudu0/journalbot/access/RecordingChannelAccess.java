package org.gudu0.journalbot.access;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * In-memory {@link ChannelAccess} that records confirmed calls and can be told to fail.
 */
public class RecordingChannelAccess implements ChannelAccess {

    public final List<Long> grants = new CopyOnWriteArrayList<>();
    public final List<Long> revokes = new CopyOnWriteArrayList<>();

    public volatile boolean failing = false;
    /** Runs inside every grant call before it is confirmed. */
    public volatile Runnable onGrant = () -> {};
    /** Runs inside every revoke call before it is confirmed. */
    public volatile Runnable onRevoke = () -> {};

    @Override
    public void grant(long platformUserId, long sharedChannelId) {
        if (failing) throw new AccessCallFailedException("simulated outage", true);
        onGrant.run();
        grants.add(platformUserId);
    }

    @Override
    public void revoke(long platformUserId, long sharedChannelId) {
        if (failing) throw new AccessCallFailedException("simulated outage", true);
        onRevoke.run();
        revokes.add(platformUserId);
    }
}
