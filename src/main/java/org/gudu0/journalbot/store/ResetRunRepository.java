package org.gudu0.journalbot.store;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Optional;

/**
 * Remembers which daily boundaries have been processed so missed runs can be caught up.
 */
public class ResetRunRepository extends JdbcRepository {

    public Optional<LocalDate> lastBoundaryDay(Connection conn) throws SQLException {
        return queryOne(conn, "SELECT MAX(boundary_date) AS last_day FROM daily_resets",
                rs -> date(rs, "last_day"));
    }

    public boolean isRecorded(Connection conn, LocalDate boundaryDay) throws SQLException {
        return queryOne(conn, "SELECT 1 FROM daily_resets WHERE boundary_date = ?", rs -> Boolean.TRUE, boundaryDay)
                .isPresent();
    }

    /**
     * Records the first completed run for a boundary. Later runs for the same boundary keep the original row.
     *
     * @return true if this call created the record
     */
    public boolean record(Connection conn, LocalDate boundaryDay, int revoked, int failed, Instant ranAt) throws SQLException {
        if (isRecorded(conn, boundaryDay)) return false;
        return insertIfAbsent(conn,
                "INSERT INTO daily_resets (boundary_date, revoked, failed, ran_at) VALUES (?, ?, ?, ?)",
                boundaryDay, revoked, failed, ranAt);
    }
}
