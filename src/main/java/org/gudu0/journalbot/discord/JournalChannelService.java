package org.gudu0.journalbot.discord;

import org.gudu0.journalbot.store.Database;
import org.gudu0.journalbot.store.JournalUser;
import org.gudu0.journalbot.store.UserRepository;
import org.gudu0.journalbot.util.ConsoleLog;

import java.time.Clock;
import java.util.Locale;
import java.util.Optional;

/**
 * Gives each user exactly one private journal channel.
 * <p>
 * The stored channel id is only written when none is set, so two concurrent requests for the
 * same user end with one stored channel; the loser deletes the channel it just created.
 */
public class JournalChannelService {

    public enum Kind {
        /** The channel already stored for the user. */
        EXISTING,
        /** A matching channel found by name and now stored. */
        ADOPTED,
        /** A brand new channel. */
        CREATED
    }

    public record Provisioned(long channelId, Kind kind) {}

    private static final int MAX_CHANNEL_NAME = 100;

    private final Database db;
    private final UserRepository users;
    private final JournalChannelGateway gateway;
    private final String prefix;
    private final Clock clock;

    public JournalChannelService(Database db, UserRepository users, JournalChannelGateway gateway, String prefix, Clock clock) {
        this.db = db;
        this.users = users;
        this.gateway = gateway;
        this.prefix = prefix;
        this.clock = clock;
    }

    public String channelName(String username) {
        String name = (prefix + username).toLowerCase(Locale.ROOT).replace(' ', '-');
        return name.length() > MAX_CHANNEL_NAME ? name.substring(0, MAX_CHANNEL_NAME) : name;
    }

    public Provisioned provision(long platformUserId, String username) {
        JournalUser user = db.inTransaction("dm user " + platformUserId,
                conn -> users.upsert(conn, platformUserId, username, clock.instant()));

        Long assigned = user.assignedChannelId();
        if (assigned != null) {
            if (gateway.exists(assigned)) return new Provisioned(assigned, Kind.EXISTING);

            ConsoleLog.warn("JournalChannels", "Stored channel " + assigned + " for userId=" + platformUserId + " is gone; clearing");
            db.inTransaction("clear channel " + platformUserId,
                    conn -> users.assignChannel(conn, platformUserId, null, false, clock.instant()));
        }

        String name = channelName(username);
        Optional<Long> found = gateway.findVisible(name, platformUserId);
        long channelId = found.orElseGet(() -> gateway.create(name, platformUserId, username));
        Kind kind = found.isPresent() ? Kind.ADOPTED : Kind.CREATED;

        boolean stored = db.inTransaction("assign channel " + platformUserId,
                conn -> users.assignChannel(conn, platformUserId, channelId, true, clock.instant()));
        if (stored) {
            ConsoleLog.info("JournalChannels", kind + " #" + name + " (" + channelId + ") for userId=" + platformUserId);
            return new Provisioned(channelId, kind);
        }

        // A concurrent request stored its channel first.
        Long winner = db.inTransaction("reload user " + platformUserId,
                conn -> users.findByPlatformId(conn, platformUserId))
                .map(JournalUser::assignedChannelId)
                .orElse(null);

        if (winner != null && winner != channelId && gateway.exists(winner)) {
            if (kind == Kind.CREATED) {
                ConsoleLog.warn("JournalChannels", "Lost channel race for userId=" + platformUserId + "; deleting duplicate " + channelId);
                gateway.delete(channelId);
            }
            return new Provisioned(winner, Kind.EXISTING);
        }
        if (winner != null && winner == channelId) {
            return new Provisioned(channelId, Kind.EXISTING);
        }

        // The winner's channel is already gone: ours replaces it.
        db.inTransaction("replace channel " + platformUserId,
                conn -> users.assignChannel(conn, platformUserId, channelId, false, clock.instant()));
        return new Provisioned(channelId, kind);
    }

    public void welcome(long channelId, long platformUserId, int threshold) {
        gateway.send(channelId, "Welcome to your journal, <@" + platformUserId + ">! \uD83D\uDCD4\n\n"
                + "Write at least **" + threshold + " words** here each day to unlock access to the shared channel.\n"
                + "All your messages in this channel count toward your daily word count.");
    }
}
