package org.gudu0.journalbot.insight;

import org.gudu0.journalbot.journal.JournalDays;
import org.gudu0.journalbot.store.Database;
import org.gudu0.journalbot.store.JournalEntry;
import org.gudu0.journalbot.store.JournalEntryRepository;
import org.gudu0.journalbot.util.ConsoleLog;

import java.time.Clock;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * Runs a user's request over today's journals.
 */
public class JournalInsights {

    private final Database db;
    private final JournalEntryRepository entries;
    private final InsightService insight;
    private final JournalDays days;
    private final Clock clock;

    public JournalInsights(Database db, JournalEntryRepository entries, InsightService insight, JournalDays days, Clock clock) {
        this.db = db;
        this.entries = entries;
        this.insight = insight;
        this.days = days;
        this.clock = clock;
    }

    /**
     * @return the model's answer, or empty when nobody has written anything today
     */
    public Optional<String> ask(String request) {
        LocalDate today = days.dayOf(clock.instant());
        List<JournalEntry> todays = db.inTransaction("entries for " + today, conn -> entries.findForDay(conn, today));
        if (todays.isEmpty()) return Optional.empty();

        String prompt = InsightPromptBuilder.build(todays, request);
        ConsoleLog.info("Insight", "Asking model over " + todays.size() + " entries for " + today);
        return Optional.of(insight.generate(prompt));
    }
}
