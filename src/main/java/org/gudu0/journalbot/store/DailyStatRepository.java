package org.gudu0.journalbot.store;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

public class DailyStatRepository extends JdbcRepository {

    private static final String COLUMNS =
            "id, user_id, platform_user_id, stat_date, total_words, has_access, last_updated";

    /**
     * Adds {@code words} to the (user, day) total, creating the row (access=false) on first entry.
     * The increment is a single UPDATE, so the store's row lock serializes concurrent writers.
     *
     * @return the total after this increment
     */
    public int addWords(Connection conn, long userId, long platformUserId, LocalDate day, int words, Instant now) throws SQLException {
        if (words < 0) throw new IllegalArgumentException("words must be >= 0");

        if (increment(conn, userId, day, words, now) == 0) {
            boolean inserted = insertIfAbsent(conn,
                    "INSERT INTO daily_stats (user_id, platform_user_id, stat_date, total_words, has_access, last_updated) "
                            + "VALUES (?, ?, ?, ?, FALSE, ?)",
                    userId, platformUserId, day, words, now);
            if (!inserted && increment(conn, userId, day, words, now) == 0) {
                throw new SQLException("daily_stats row for " + userId + "@" + day + " neither insertable nor updatable");
            }
        }

        return find(conn, userId, day)
                .map(DailyStat::totalWords)
                .orElseThrow(() -> new SQLException("daily_stats row missing after increment: " + userId + "@" + day));
    }

    private int increment(Connection conn, long userId, LocalDate day, int words, Instant now) throws SQLException {
        return update(conn,
                "UPDATE daily_stats SET total_words = total_words + ?, last_updated = ? WHERE user_id = ? AND stat_date = ?",
                words, now, userId, day);
    }

    public Optional<DailyStat> find(Connection conn, long userId, LocalDate day) throws SQLException {
        return queryOne(conn, "SELECT " + COLUMNS + " FROM daily_stats WHERE user_id = ? AND stat_date = ?",
                DailyStatRepository::map, userId, day);
    }

    /**
     * Flips the access flag only if it still holds {@code expected}.
     *
     * @return false when a concurrent writer already changed it
     */
    public boolean compareAndSetAccess(Connection conn, long userId, LocalDate day, boolean expected, boolean next, Instant now) throws SQLException {
        return update(conn,
                "UPDATE daily_stats SET has_access = ?, last_updated = ? WHERE user_id = ? AND stat_date = ? AND has_access = ?",
                next, now, userId, day, expected) > 0;
    }

    /** Rows still holding access for any day up to and including {@code lastDay}. */
    public List<DailyStat> findWithAccessThrough(Connection conn, LocalDate lastDay) throws SQLException {
        return queryList(conn, "SELECT " + COLUMNS + " FROM daily_stats WHERE has_access = TRUE AND stat_date <= ? ORDER BY stat_date, id",
                DailyStatRepository::map, lastDay);
    }

    /** Whether the user holds access on a journal day later than {@code day}. */
    public boolean hasAccessAfter(Connection conn, long userId, LocalDate day) throws SQLException {
        return queryOne(conn, "SELECT 1 FROM daily_stats WHERE user_id = ? AND stat_date > ? AND has_access = TRUE",
                rs -> Boolean.TRUE, userId, day).isPresent();
    }

    /** Rows that met the threshold on {@code day} but were never confirmed as granted. */
    public List<DailyStat> findPendingGrants(Connection conn, LocalDate day, int threshold) throws SQLException {
        return queryList(conn, "SELECT " + COLUMNS + " FROM daily_stats WHERE stat_date = ? AND has_access = FALSE AND total_words >= ? ORDER BY id",
                DailyStatRepository::map, day, threshold);
    }

    /** Overwrites the running total, used when repairing drift against journal_entries. */
    public boolean overwriteTotal(Connection conn, long userId, LocalDate day, int total, Instant now) throws SQLException {
        return update(conn,
                "UPDATE daily_stats SET total_words = ?, last_updated = ? WHERE user_id = ? AND stat_date = ?",
                total, now, userId, day) > 0;
    }

    private static DailyStat map(ResultSet rs) throws SQLException {
        return new DailyStat(
                rs.getLong("id"),
                rs.getLong("user_id"),
                rs.getLong("platform_user_id"),
                date(rs, "stat_date"),
                rs.getInt("total_words"),
                rs.getBoolean("has_access"),
                instant(rs, "last_updated"));
    }
}
