package org.gudu0.journalbot.journal;

import org.gudu0.journalbot.store.DailyStat;
import org.gudu0.journalbot.store.DailyStatRepository;
import org.gudu0.journalbot.store.Database;
import org.gudu0.journalbot.store.JournalEntryRepository;
import org.gudu0.journalbot.util.ConsoleLog;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.time.LocalDate;

/**
 * Maintains the running word total per (user, journal day).
 */
public class StatsAggregator {

    public record Recount(long userId, LocalDate day, int stored, int recomputed, boolean repaired) {
        public boolean consistent() {
            return stored == recomputed;
        }
    }

    private final Database db;
    private final DailyStatRepository stats;
    private final JournalEntryRepository entries;
    private final Clock clock;

    public StatsAggregator(Database db, DailyStatRepository stats, JournalEntryRepository entries, Clock clock) {
        this.db = db;
        this.stats = stats;
        this.entries = entries;
        this.clock = clock;
    }

    /** Adds to the total inside the caller's transaction. */
    public int recordEntry(Connection conn, long userId, long platformUserId, LocalDate day, int wordCount) throws SQLException {
        int total = stats.addWords(conn, userId, platformUserId, day, wordCount, clock.instant());
        ConsoleLog.debug("Stats", "userId=" + userId + " day=" + day + " +" + wordCount + " -> " + total);
        return total;
    }

    public int recordEntry(long userId, long platformUserId, LocalDate day, int wordCount) {
        return db.inTransaction("recordEntry", conn -> recordEntry(conn, userId, platformUserId, day, wordCount));
    }

    /**
     * Recomputes the total from journal_entries and, if {@code repair} is set, overwrites a drifted value.
     */
    public Recount recount(long userId, LocalDate day, boolean repair) {
        return db.inTransaction("recount", conn -> {
            int stored = stats.find(conn, userId, day).map(DailyStat::totalWords).orElse(0);
            int recomputed = Math.toIntExact(entries.sumWords(conn, userId, day));
            boolean repaired = false;
            if (repair && stored != recomputed) {
                repaired = stats.overwriteTotal(conn, userId, day, recomputed, clock.instant());
                ConsoleLog.warn("Stats", "Repaired total userId=" + userId + " day=" + day + " " + stored + " -> " + recomputed);
            }
            return new Recount(userId, day, stored, recomputed, repaired);
        });
    }
}
