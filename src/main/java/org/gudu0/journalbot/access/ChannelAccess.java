package org.gudu0.journalbot.access;

/**
 * Grants or removes a member's access to the shared channel.
 * Implementations either complete normally (confirmed) or throw {@link AccessCallFailedException}.
 */
public interface ChannelAccess {

    void grant(long platformUserId, long sharedChannelId);

    void revoke(long platformUserId, long sharedChannelId);
}
