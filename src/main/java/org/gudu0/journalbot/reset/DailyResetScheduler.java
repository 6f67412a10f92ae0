package org.gudu0.journalbot.reset;

import org.gudu0.journalbot.journal.AccessController;
import org.gudu0.journalbot.journal.JournalDays;
import org.gudu0.journalbot.logging.LogService;
import org.gudu0.journalbot.store.Database;
import org.gudu0.journalbot.store.ResetRunRepository;
import org.gudu0.journalbot.util.ConsoleLog;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * Revokes shared-channel access at each daily boundary.
 * <p>
 * A periodic tick compares the most recent passed boundary with the last one recorded in
 * daily_resets. The first tick after startup therefore doubles as the missed-run catch-up;
 * a single catch-up run covers every older day because the pass revokes all days up to the boundary.
 */
public class DailyResetScheduler {

    private final Database db;
    private final ResetRunRepository runs;
    private final AccessController access;
    private final JournalDays days;
    private final Clock clock;
    private final LogService logs;
    private final long tickSeconds;

    private final List<Consumer<ResetReport>> listeners = new CopyOnWriteArrayList<>();
    private final ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "DailyReset");
        t.setDaemon(true);
        return t;
    });

    private volatile LocalDate lastRecorded;
    private volatile boolean lastRecordedLoaded = false;

    public DailyResetScheduler(Database db,
                               ResetRunRepository runs,
                               AccessController access,
                               JournalDays days,
                               Clock clock,
                               LogService logs,
                               long tickSeconds) {
        this.db = db;
        this.runs = runs;
        this.access = access;
        this.days = days;
        this.clock = clock;
        this.logs = logs;
        this.tickSeconds = tickSeconds;
    }

    /** Called after every completed pass (including repeated ones). */
    public void addListener(Consumer<ResetReport> listener) {
        listeners.add(listener);
    }

    public void start() {
        ConsoleLog.info("DailyReset", "Starting (zone=" + days.zone() + " resetTime=" + days.resetTime()
                + " next boundary=" + days.nextBoundary(clock.instant()) + ")");
        // Immediate first tick: catch up a boundary missed while the bot was down.
        scheduler.scheduleWithFixedDelay(this::tickSafe, 0, tickSeconds, TimeUnit.SECONDS);
        Runtime.getRuntime().addShutdownHook(new Thread(scheduler::shutdown));
    }

    public void stop() {
        scheduler.shutdownNow();
    }

    private void tickSafe() {
        try {
            tick();
        } catch (Exception e) {
            ConsoleLog.error("DailyReset", "Tick failed: " + e.getMessage(), e);
        }
    }

    /**
     * Runs the reset if the latest passed boundary has not been processed yet.
     *
     * @return the report when a run happened
     */
    public synchronized Optional<ResetReport> tick() {
        Instant now = clock.instant();
        LocalDate due = days.lastPassedBoundaryDay(now);

        if (!lastRecordedLoaded) {
            lastRecorded = db.inTransaction("last reset", runs::lastBoundaryDay).orElse(null);
            lastRecordedLoaded = true;
            if (lastRecorded == null) {
                ConsoleLog.info("DailyReset", "No previous reset recorded");
            } else if (lastRecorded.isBefore(due)) {
                ConsoleLog.warn("DailyReset", "Missed boundary detected: last recorded=" + lastRecorded + " due=" + due + "; catching up");
            }
        }

        if (lastRecorded != null && !lastRecorded.isBefore(due)) return Optional.empty();

        return Optional.of(runReset(due));
    }

    /** Runs the pass for the most recent boundary, whether or not it already ran. */
    public ResetReport runLatest() {
        return runReset(days.lastPassedBoundaryDay(clock.instant()));
    }

    /**
     * Revokes every access flag for days up to and including {@code boundaryDay}.
     * Safe to repeat: a second run finds no flags left and changes nothing.
     */
    public synchronized ResetReport runReset(LocalDate boundaryDay) {
        ConsoleLog.info("DailyReset", "Running reset for boundary of " + boundaryDay);

        AccessController.RevokePass pass = access.revokeAllThrough(boundaryDay);
        boolean firstRun = db.inTransaction("record reset " + boundaryDay,
                conn -> runs.record(conn, boundaryDay, pass.revoked(), pass.failed(), clock.instant()));

        if (lastRecorded == null || lastRecorded.isBefore(boundaryDay)) {
            lastRecorded = boundaryDay;
            lastRecordedLoaded = true;
        }

        ResetReport report = new ResetReport(boundaryDay, pass.revoked(), pass.failed(), firstRun);
        if (pass.failed() > 0) {
            logs.alert("Daily reset for " + boundaryDay + ": " + pass.failed() + " revoke(s) pending, will retry");
        }
        logs.log("Daily reset for " + boundaryDay + " complete: revoked=" + pass.revoked() + " failed=" + pass.failed()
                + (firstRun ? "" : " (repeat run)"));

        for (Consumer<ResetReport> l : listeners) {
            try {
                l.accept(report);
            } catch (Exception e) {
                ConsoleLog.error("DailyReset", "Reset listener failed: " + e.getMessage(), e);
            }
        }
        return report;
    }
}
