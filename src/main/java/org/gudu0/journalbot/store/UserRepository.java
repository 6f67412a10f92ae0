package org.gudu0.journalbot.store;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.Optional;

public class UserRepository extends JdbcRepository {

    private static final String COLUMNS =
            "id, platform_user_id, display_name, assigned_channel_id, created_at, updated_at";

    /**
     * Creates the user on first interaction, otherwise refreshes the display name (last seen wins).
     */
    public JournalUser upsert(Connection conn, long platformUserId, String displayName, Instant now) throws SQLException {
        String name = displayName == null || displayName.isBlank() ? Long.toString(platformUserId) : displayName;

        if (touch(conn, platformUserId, name, now) == 0) {
            boolean inserted = insertIfAbsent(conn,
                    "INSERT INTO users (platform_user_id, display_name, created_at, updated_at) VALUES (?, ?, ?, ?)",
                    platformUserId, name, now, now);
            if (!inserted) {
                // Someone else created the row between our update and insert.
                touch(conn, platformUserId, name, now);
            }
        }

        return findByPlatformId(conn, platformUserId)
                .orElseThrow(() -> new SQLException("User vanished after upsert: " + platformUserId));
    }

    private int touch(Connection conn, long platformUserId, String name, Instant now) throws SQLException {
        return update(conn,
                "UPDATE users SET display_name = ?, updated_at = ? WHERE platform_user_id = ?",
                name, now, platformUserId);
    }

    public Optional<JournalUser> findByPlatformId(Connection conn, long platformUserId) throws SQLException {
        return queryOne(conn, "SELECT " + COLUMNS + " FROM users WHERE platform_user_id = ?",
                UserRepository::map, platformUserId);
    }

    /**
     * Stores the journal channel for a user.
     *
     * @param onlyIfUnset when true the write only happens if no channel is assigned yet
     * @return whether a row was updated
     */
    public boolean assignChannel(Connection conn, long platformUserId, Long channelId, boolean onlyIfUnset, Instant now) throws SQLException {
        String sql = "UPDATE users SET assigned_channel_id = ?, updated_at = ? WHERE platform_user_id = ?"
                + (onlyIfUnset ? " AND assigned_channel_id IS NULL" : "");
        return update(conn, sql, channelId, now, platformUserId) > 0;
    }

    private static JournalUser map(ResultSet rs) throws SQLException {
        return new JournalUser(
                rs.getLong("id"),
                rs.getLong("platform_user_id"),
                rs.getString("display_name"),
                nullableLong(rs, "assigned_channel_id"),
                instant(rs, "created_at"),
                instant(rs, "updated_at"));
    }
}
