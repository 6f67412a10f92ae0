package org.gudu0.journalbot.journal;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;

/**
 * Maps instants to journal days and days to their reset boundary.
 * <p>
 * The journal day rolls over at {@code resetTime} local time, so with the default
 * reset at midnight a journal day is simply the calendar date in {@code zone}.
 */
public final class JournalDays {

    private final ZoneId zone;
    private final LocalTime resetTime;

    public JournalDays(ZoneId zone, LocalTime resetTime) {
        this.zone = zone;
        this.resetTime = resetTime;
    }

    public ZoneId zone() { return zone; }

    public LocalTime resetTime() { return resetTime; }

    /** Journal day that {@code at} belongs to. */
    public LocalDate dayOf(Instant at) {
        ZonedDateTime local = at.atZone(zone);
        LocalDate date = local.toLocalDate();
        return local.toLocalTime().isBefore(resetTime) ? date.minusDays(1) : date;
    }

    /** Instant at which access earned on {@code day} is revoked. */
    public Instant boundaryOf(LocalDate day) {
        // atZone resolves DST gaps forward, so the boundary always exists.
        return day.plusDays(1).atTime(resetTime).atZone(zone).toInstant();
    }

    public boolean boundaryPassed(LocalDate day, Instant now) {
        return !now.isBefore(boundaryOf(day));
    }

    /** Day whose boundary fired most recently at or before {@code now}. */
    public LocalDate lastPassedBoundaryDay(Instant now) {
        return dayOf(now).minusDays(1);
    }

    /** First boundary strictly after {@code now}. */
    public Instant nextBoundary(Instant now) {
        return boundaryOf(dayOf(now));
    }

    public Duration untilNextBoundary(Instant now) {
        return Duration.between(now, nextBoundary(now));
    }
}
