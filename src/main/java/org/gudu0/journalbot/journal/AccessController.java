package org.gudu0.journalbot.journal;

import org.gudu0.journalbot.access.AccessCallFailedException;
import org.gudu0.journalbot.access.ChannelAccess;
import org.gudu0.journalbot.logging.LogService;
import org.gudu0.journalbot.store.*;
import org.gudu0.journalbot.util.ConsoleLog;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Ingests journal entries and applies access transitions.
 * <p>
 * The store serializes the (user, day) increment. External grant/revoke calls run outside any
 * transaction; the in-flight map keeps at most one transition per key in progress, and the flag
 * is only written (compare-and-set) after the external call confirmed.
 */
public class AccessController {

    /** Counts from one reconcile pass. */
    public record ReconcileReport(int granted, int revoked, int pending) {}

    /** Counts from one revoke pass. */
    public record RevokePass(int revoked, int failed) {}

    private record Ingested(long userId, int totalWords, boolean hasAccess) {}

    private final Database db;
    private final UserRepository users;
    private final JournalEntryRepository entries;
    private final DailyStatRepository stats;
    private final StatsAggregator aggregator;
    private final ChannelAccess channelAccess;
    private final LogService logs;
    private final JournalDays days;
    private final Clock clock;
    private final int threshold;
    private final long sharedChannelId;

    private final ConcurrentHashMap<StatKey, Boolean> inFlight = new ConcurrentHashMap<>();

    public AccessController(Database db,
                            UserRepository users,
                            JournalEntryRepository entries,
                            DailyStatRepository stats,
                            StatsAggregator aggregator,
                            ChannelAccess channelAccess,
                            LogService logs,
                            JournalDays days,
                            Clock clock,
                            int threshold,
                            long sharedChannelId) {
        this.db = db;
        this.users = users;
        this.entries = entries;
        this.stats = stats;
        this.aggregator = aggregator;
        this.channelAccess = channelAccess;
        this.logs = logs;
        this.days = days;
        this.clock = clock;
        this.threshold = threshold;
        this.sharedChannelId = sharedChannelId;
    }

    public int threshold() { return threshold; }

    // ----------------------------
    // Ingestion
    // ----------------------------

    /**
     * Records one journal message and applies whatever access transition it causes.
     * Redelivered messages come back as {@link EntryOutcome.Status#DUPLICATE} without side effects.
     *
     * @throws StoreUnavailableException if the entry could not be stored. Store failures after
     *         the entry is committed surface as {@link EntryOutcome.Status#ACCESS_PENDING} instead.
     */
    public EntryOutcome onNewEntry(IncomingEntry in) {
        int words = WordCounter.count(in.text());
        LocalDate day = days.dayOf(in.timestamp());

        if (words == 0) {
            ConsoleLog.debug("Access", "Skipping empty message msgId=" + in.platformMessageId());
            return new EntryOutcome(EntryOutcome.Status.EMPTY, day, 0, 0, threshold);
        }

        Ingested ing;
        try {
            ing = db.inTransaction("ingest msgId=" + in.platformMessageId(), conn -> {
                Instant now = clock.instant();
                JournalUser user = users.upsert(conn, in.platformUserId(), in.displayName(), now);
                entries.insert(conn, new JournalEntry(0, user.id(), in.platformUserId(), in.displayName(), in.text(),
                        words, in.platformMessageId(), in.channelId(), day, in.timestamp()));
                int total = aggregator.recordEntry(conn, user.id(), in.platformUserId(), day, words);
                boolean access = stats.find(conn, user.id(), day).map(DailyStat::hasAccess).orElse(false);
                return new Ingested(user.id(), total, access);
            });
        } catch (DuplicateMessageException e) {
            ConsoleLog.info("Access", "Duplicate delivery ignored msgId=" + in.platformMessageId()
                    + " userId=" + in.platformUserId());
            return new EntryOutcome(EntryOutcome.Status.DUPLICATE, day, words, 0, threshold);
        }

        ConsoleLog.info("Access", "Recorded msgId=" + in.platformMessageId() + " userId=" + in.platformUserId()
                + " day=" + day + " words=" + words + " total=" + ing.totalWords() + "/" + threshold);

        boolean boundaryFired = days.boundaryPassed(day, clock.instant());
        AccessState state = AccessState.of(ing.hasAccess());
        AccessDecision decision = AccessDecider.decide(state, ing.totalWords(), threshold, boundaryFired);

        EntryOutcome.Status status = switch (decision) {
            case HOLD -> state == AccessState.UNLOCKED ? EntryOutcome.Status.ALREADY_UNLOCKED : EntryOutcome.Status.RECORDED;
            case GRANT -> switch (grant(ing.userId(), in.platformUserId(), day)) {
                case GRANTED -> EntryOutcome.Status.UNLOCKED;
                // IN_FLIGHT: a concurrent entry from the same user is applying this grant.
                case UNCHANGED, IN_FLIGHT -> EntryOutcome.Status.ALREADY_UNLOCKED;
                case BOUNDARY_PASSED -> EntryOutcome.Status.LATE;
                case PENDING, REVOKED -> EntryOutcome.Status.ACCESS_PENDING;
            };
            case REVOKE -> {
                if (state == AccessState.UNLOCKED) {
                    revoke(new StatKey(ing.userId(), day), in.platformUserId());
                }
                yield EntryOutcome.Status.LATE;
            }
        };

        return new EntryOutcome(status, day, words, ing.totalWords(), threshold);
    }

    // ----------------------------
    // Transitions
    // ----------------------------

    /**
     * LOCKED -> UNLOCKED for one (user, day). Refused once the day's boundary has passed.
     */
    public AccessResult grant(long userId, long platformUserId, LocalDate day) {
        StatKey key = new StatKey(userId, day);
        if (inFlight.putIfAbsent(key, Boolean.TRUE) != null) {
            ConsoleLog.debug("Access", "Grant already in flight for " + key);
            return AccessResult.IN_FLIGHT;
        }
        try {
            if (days.boundaryPassed(day, clock.instant())) {
                ConsoleLog.info("Access", "Refusing grant for " + key + ": boundary passed");
                return AccessResult.BOUNDARY_PASSED;
            }
            // A transition that finished before we took the claim is already committed.
            if (flag(key)) return AccessResult.UNCHANGED;

            try {
                channelAccess.grant(platformUserId, sharedChannelId);
            } catch (AccessCallFailedException e) {
                logs.alert("Entry recorded but access pending for <@" + platformUserId + "> (" + day + "): " + e.getMessage());
                return AccessResult.PENDING;
            }

            if (days.boundaryPassed(day, clock.instant())) {
                // The reset fired while the call was in flight: it wins, undo the grant.
                ConsoleLog.warn("Access", "Boundary passed during grant for " + key + "; undoing");
                undoLateGrant(key, platformUserId);
                return AccessResult.BOUNDARY_PASSED;
            }

            boolean set = db.inTransaction("grant " + key,
                    conn -> stats.compareAndSetAccess(conn, userId, day, false, true, clock.instant()));
            if (set) {
                logs.log("Unlocked shared channel for <@" + platformUserId + "> (" + day + ")");
                return AccessResult.GRANTED;
            }
            return AccessResult.UNCHANGED;
        } catch (StoreUnavailableException e) {
            // The entry is already committed; reconciliation finishes the grant.
            logs.alert("Entry recorded but access pending for <@" + platformUserId + "> (" + day + "): " + e.getMessage());
            return AccessResult.PENDING;
        } finally {
            inFlight.remove(key);
        }
    }

    /**
     * UNLOCKED -> LOCKED for one (user, day). If the user already holds access for a later day,
     * the channel override belongs to that day and only the old flag is cleared.
     */
    public AccessResult revoke(StatKey key, long platformUserId) {
        if (inFlight.putIfAbsent(key, Boolean.TRUE) != null) {
            ConsoleLog.debug("Access", "Revoke deferred, transition in flight for " + key);
            return AccessResult.IN_FLIGHT;
        }
        try {
            if (!flag(key)) return AccessResult.UNCHANGED;

            boolean laterAccess = db.inTransaction("revoke-check " + key,
                    conn -> stats.hasAccessAfter(conn, key.userId(), key.day()));

            if (!laterAccess) {
                try {
                    channelAccess.revoke(platformUserId, sharedChannelId);
                } catch (AccessCallFailedException e) {
                    logs.alert("Revoke pending for <@" + platformUserId + "> (" + key.day() + "): " + e.getMessage());
                    return AccessResult.PENDING;
                }
            }

            boolean cleared = db.inTransaction("revoke " + key,
                    conn -> stats.compareAndSetAccess(conn, key.userId(), key.day(), true, false, clock.instant()));
            return cleared ? AccessResult.REVOKED : AccessResult.UNCHANGED;
        } catch (StoreUnavailableException e) {
            logs.alert("Revoke pending for <@" + platformUserId + "> (" + key.day() + "): " + e.getMessage());
            return AccessResult.PENDING;
        } finally {
            inFlight.remove(key);
        }
    }

    public AccessResult revoke(DailyStat stat) {
        return revoke(stat.key(), stat.platformUserId());
    }

    private boolean flag(StatKey key) {
        return db.inTransaction("flag " + key,
                conn -> stats.find(conn, key.userId(), key.day()).map(DailyStat::hasAccess).orElse(false));
    }

    private void undoLateGrant(StatKey key, long platformUserId) {
        try {
            boolean laterAccess = db.inTransaction("undo-check " + key,
                    conn -> stats.hasAccessAfter(conn, key.userId(), key.day()));
            if (!laterAccess) channelAccess.revoke(platformUserId, sharedChannelId);
        } catch (AccessCallFailedException | StoreUnavailableException e) {
            logs.alert("Could not undo late grant for <@" + platformUserId + "> (" + key.day() + "): " + e.getMessage());
        }
    }

    // ----------------------------
    // Reset + reconciliation
    // ----------------------------

    /**
     * Revokes every flag still set for days up to and including {@code boundaryDay}.
     * One user's failure never stops the pass.
     *
     */
    public RevokePass revokeAllThrough(LocalDate boundaryDay) {
        List<DailyStat> holders = db.inTransaction("list access through " + boundaryDay,
                conn -> stats.findWithAccessThrough(conn, boundaryDay));

        int revoked = 0;
        int failed = 0;
        for (DailyStat s : holders) {
            try {
                AccessResult r = revoke(s);
                if (r == AccessResult.REVOKED) revoked++;
                else if (r == AccessResult.PENDING || r == AccessResult.IN_FLIGHT) failed++;
            } catch (RuntimeException e) {
                failed++;
                ConsoleLog.error("Access", "Revoke crashed for " + s.key() + ": " + e.getMessage(), e);
            }
        }
        return new RevokePass(revoked, failed);
    }

    /**
     * Retries grants that were recorded but never confirmed, and revokes left behind by failed resets.
     */
    public ReconcileReport reconcile() {
        Instant now = clock.instant();
        LocalDate today = days.dayOf(now);

        List<DailyStat> pendingGrants = db.inTransaction("list pending grants",
                conn -> stats.findPendingGrants(conn, today, threshold));

        int granted = 0;
        int pending = 0;
        for (DailyStat s : pendingGrants) {
            try {
                AccessResult r = grant(s.userId(), s.platformUserId(), s.day());
                if (r == AccessResult.GRANTED) granted++;
                else if (r == AccessResult.PENDING) pending++;
            } catch (RuntimeException e) {
                pending++;
                ConsoleLog.error("Access", "Reconcile grant crashed for " + s.key() + ": " + e.getMessage(), e);
            }
        }

        RevokePass revokes = revokeAllThrough(days.lastPassedBoundaryDay(now));

        ReconcileReport report = new ReconcileReport(granted, revokes.revoked(), pending + revokes.failed());
        if (report.granted() + report.revoked() + report.pending() > 0) {
            ConsoleLog.info("Access", "Reconcile: " + report);
        }
        return report;
    }

    // ----------------------------
    // Queries
    // ----------------------------

    public DailyStatusView status(long platformUserId) {
        LocalDate today = days.dayOf(clock.instant());
        return db.inTransaction("status", conn -> {
            var user = users.findByPlatformId(conn, platformUserId);
            if (user.isEmpty()) return new DailyStatusView(today, 0, false, threshold);
            var stat = stats.find(conn, user.get().id(), today);
            return new DailyStatusView(today,
                    stat.map(DailyStat::totalWords).orElse(0),
                    stat.map(DailyStat::hasAccess).orElse(false),
                    threshold);
        });
    }

    /** Compares today's stored total with the sum of today's entries. Empty for unknown users. */
    public Optional<StatsAggregator.Recount> recountToday(long platformUserId, boolean repair) {
        LocalDate today = days.dayOf(clock.instant());
        Optional<JournalUser> user = db.inTransaction("find user", conn -> users.findByPlatformId(conn, platformUserId));
        return user.map(u -> aggregator.recount(u.id(), today, repair));
    }

    public record DailyStatusView(LocalDate day, int totalWords, boolean hasAccess, int threshold) {
        public int remaining() {
            return Math.max(0, threshold - totalWords);
        }
    }
}
