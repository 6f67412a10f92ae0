package org.gudu0.journalbot.store;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.LocalDate;
import java.util.List;

public class JournalEntryRepository extends JdbcRepository {

    private static final String COLUMNS = "id, user_id, platform_user_id, display_name, content, word_count, "
            + "platform_message_id, channel_id, journal_date, created_at";

    /**
     * Appends one entry. The unique platform message id makes redelivery detectable.
     *
     * @return the stored entry with its generated id
     * @throws DuplicateMessageException if the message id was already recorded
     */
    public JournalEntry insert(Connection conn, JournalEntry entry) throws SQLException {
        try {
            long id = insertReturningId(conn,
                    "INSERT INTO journal_entries (user_id, platform_user_id, display_name, content, word_count, "
                            + "platform_message_id, channel_id, journal_date, created_at) "
                            + "VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)",
                    entry.userId(), entry.platformUserId(), entry.displayName(), entry.content(), entry.wordCount(),
                    entry.platformMessageId(), entry.channelId(), entry.journalDate(), entry.createdAt());
            return new JournalEntry(id, entry.userId(), entry.platformUserId(), entry.displayName(), entry.content(),
                    entry.wordCount(), entry.platformMessageId(), entry.channelId(), entry.journalDate(), entry.createdAt());
        } catch (SQLException e) {
            if (isUniqueViolation(e)) throw new DuplicateMessageException(entry.platformMessageId());
            throw e;
        }
    }

    public boolean exists(Connection conn, long platformMessageId) throws SQLException {
        return queryOne(conn, "SELECT 1 FROM journal_entries WHERE platform_message_id = ?",
                rs -> Boolean.TRUE, platformMessageId).isPresent();
    }

    /** Every entry of a journal day, oldest first. */
    public List<JournalEntry> findForDay(Connection conn, LocalDate day) throws SQLException {
        return queryList(conn, "SELECT " + COLUMNS + " FROM journal_entries WHERE journal_date = ? ORDER BY created_at, id",
                JournalEntryRepository::map, day);
    }

    public List<JournalEntry> findForUserDay(Connection conn, long userId, LocalDate day) throws SQLException {
        return queryList(conn, "SELECT " + COLUMNS + " FROM journal_entries WHERE user_id = ? AND journal_date = ? ORDER BY created_at, id",
                JournalEntryRepository::map, userId, day);
    }

    /** Total recomputed from the entries themselves. */
    public long sumWords(Connection conn, long userId, LocalDate day) throws SQLException {
        return queryOne(conn, "SELECT COALESCE(SUM(word_count), 0) AS total FROM journal_entries WHERE user_id = ? AND journal_date = ?",
                rs -> rs.getLong("total"), userId, day).orElse(0L);
    }

    private static JournalEntry map(ResultSet rs) throws SQLException {
        return new JournalEntry(
                rs.getLong("id"),
                rs.getLong("user_id"),
                rs.getLong("platform_user_id"),
                rs.getString("display_name"),
                rs.getString("content"),
                rs.getInt("word_count"),
                rs.getLong("platform_message_id"),
                rs.getLong("channel_id"),
                date(rs, "journal_date"),
                instant(rs, "created_at"));
    }
}
