package org.gudu0.journalbot.store;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JournalEntryRepositoryTest {

    private static final Instant NOW = Instant.parse("2026-03-10T12:00:00Z");
    private static final LocalDate DAY = LocalDate.of(2026, 3, 10);

    private final UserRepository users = new UserRepository();
    private final JournalEntryRepository entries = new JournalEntryRepository();
    private Database db;
    private long alice;
    private long bob;

    @BeforeEach
    void setUp() {
        db = TestDatabase.fresh();
        alice = db.inTransaction("alice", conn -> users.upsert(conn, 1L, "alice", NOW)).id();
        bob = db.inTransaction("bob", conn -> users.upsert(conn, 2L, "bob", NOW)).id();
    }

    @AfterEach
    void tearDown() {
        db.close();
    }

    private JournalEntry entry(long userId, long platformUserId, long messageId, int words, LocalDate day, Instant at) {
        return new JournalEntry(0, userId, platformUserId, "name" + platformUserId, "text " + messageId,
                words, messageId, 77L, day, at);
    }

    @Test
    void insertAssignsIdAndKeepsFields() {
        JournalEntry saved = db.inTransaction("insert", conn -> entries.insert(conn, entry(alice, 1L, 10L, 5, DAY, NOW)));

        assertThat(saved.id()).isPositive();
        assertThat(db.<Boolean>inTransaction("exists", conn -> entries.exists(conn, 10L))).isTrue();
        assertThat(db.<Long>inTransaction("sum", conn -> entries.sumWords(conn, alice, DAY))).isEqualTo(5L);
    }

    @Test
    void secondInsertOfSameMessageIsRejected() {
        db.inTransaction("insert", conn -> entries.insert(conn, entry(alice, 1L, 10L, 5, DAY, NOW)));

        assertThatThrownBy(() -> db.inTransaction("insert", conn -> entries.insert(conn, entry(alice, 1L, 10L, 5, DAY, NOW))))
                .isInstanceOf(DuplicateMessageException.class)
                .satisfies(e -> assertThat(((DuplicateMessageException) e).platformMessageId()).isEqualTo(10L));
    }

    @Test
    void findForDayIsOrderedByTimeAndFilteredByDay() {
        db.inTransaction("seed", conn -> {
            entries.insert(conn, entry(bob, 2L, 3L, 1, DAY, NOW.plusSeconds(20)));
            entries.insert(conn, entry(alice, 1L, 1L, 1, DAY, NOW));
            entries.insert(conn, entry(alice, 1L, 2L, 1, DAY, NOW.plusSeconds(10)));
            entries.insert(conn, entry(alice, 1L, 4L, 1, DAY.minusDays(1), NOW.minusSeconds(86_400)));
            return null;
        });

        List<JournalEntry> day = db.inTransaction("day", conn -> entries.findForDay(conn, DAY));

        assertThat(day).extracting(JournalEntry::platformMessageId).containsExactly(1L, 2L, 3L);
        assertThat(db.<List<JournalEntry>>inTransaction("user", conn -> entries.findForUserDay(conn, alice, DAY))).hasSize(2);
    }

    @Test
    void sumIsZeroWithoutEntries() {
        assertThat(db.<Long>inTransaction("sum", conn -> entries.sumWords(conn, alice, DAY))).isZero();
    }
}
