package org.gudu0.journalbot.discord;

import java.util.Optional;

/**
 * The guild-side operations needed to provision journal channels.
 * Every method blocks until Discord confirms; failures surface as {@link ProvisioningFailedException}.
 */
public interface JournalChannelGateway {

    boolean exists(long channelId);

    /** A text channel with this name that the user can already view. */
    Optional<Long> findVisible(String name, long platformUserId);

    /** Creates a channel visible only to the user and the bot. */
    long create(String name, long platformUserId, String username);

    void delete(long channelId);

    void send(long channelId, String text);
}
