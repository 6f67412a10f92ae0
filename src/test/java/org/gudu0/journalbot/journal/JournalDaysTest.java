package org.gudu0.journalbot.journal;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;

import static org.assertj.core.api.Assertions.assertThat;

class JournalDaysTest {

    private static final ZoneId NEW_YORK = ZoneId.of("America/New_York");

    @Test
    void midnightResetUsesLocalCalendarDate() {
        JournalDays days = new JournalDays(NEW_YORK, LocalTime.MIDNIGHT);

        // 03:30 UTC is still the previous evening in New York.
        assertThat(days.dayOf(Instant.parse("2026-01-15T03:30:00Z"))).isEqualTo(LocalDate.of(2026, 1, 14));
        assertThat(days.dayOf(Instant.parse("2026-01-15T05:00:00Z"))).isEqualTo(LocalDate.of(2026, 1, 15));
    }

    @Test
    void boundaryIsNextLocalResetTime() {
        JournalDays days = new JournalDays(NEW_YORK, LocalTime.MIDNIGHT);

        assertThat(days.boundaryOf(LocalDate.of(2026, 1, 14))).isEqualTo(Instant.parse("2026-01-15T05:00:00Z"));
    }

    @Test
    void boundaryPassedIsInclusiveOfTheBoundaryInstant() {
        JournalDays days = new JournalDays(NEW_YORK, LocalTime.MIDNIGHT);
        LocalDate day = LocalDate.of(2026, 1, 14);

        assertThat(days.boundaryPassed(day, Instant.parse("2026-01-15T04:59:59Z"))).isFalse();
        assertThat(days.boundaryPassed(day, Instant.parse("2026-01-15T05:00:00Z"))).isTrue();
    }

    @Test
    void laterResetTimeShiftsTheDay() {
        JournalDays days = new JournalDays(ZoneId.of("UTC"), LocalTime.of(4, 0));

        assertThat(days.dayOf(Instant.parse("2026-05-02T03:59:00Z"))).isEqualTo(LocalDate.of(2026, 5, 1));
        assertThat(days.dayOf(Instant.parse("2026-05-02T04:00:00Z"))).isEqualTo(LocalDate.of(2026, 5, 2));
        assertThat(days.boundaryOf(LocalDate.of(2026, 5, 1))).isEqualTo(Instant.parse("2026-05-02T04:00:00Z"));
    }

    @Test
    void springForwardDayIsOneHourShorter() {
        JournalDays days = new JournalDays(NEW_YORK, LocalTime.MIDNIGHT);
        LocalDate dstStart = LocalDate.of(2026, 3, 8);

        Duration length = Duration.between(days.boundaryOf(dstStart.minusDays(1)), days.boundaryOf(dstStart));
        assertThat(length).isEqualTo(Duration.ofHours(23));
    }

    @Test
    void resetInsideDstGapStillHasABoundary() {
        JournalDays days = new JournalDays(NEW_YORK, LocalTime.of(2, 30));

        // 02:30 does not exist on 2026-03-08, the boundary moves to 03:30 EDT.
        assertThat(days.boundaryOf(LocalDate.of(2026, 3, 7))).isEqualTo(Instant.parse("2026-03-08T07:30:00Z"));
    }

    @Test
    void lastPassedAndNextBoundary() {
        JournalDays days = new JournalDays(ZoneId.of("UTC"), LocalTime.MIDNIGHT);
        Instant now = Instant.parse("2026-06-10T18:00:00Z");

        assertThat(days.lastPassedBoundaryDay(now)).isEqualTo(LocalDate.of(2026, 6, 9));
        assertThat(days.nextBoundary(now)).isEqualTo(Instant.parse("2026-06-11T00:00:00Z"));
        assertThat(days.untilNextBoundary(now)).isEqualTo(Duration.ofHours(6));
    }
}
