package org.gudu0.journalbot.store;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

class UserRepositoryTest {

    private static final Instant NOW = Instant.parse("2026-03-10T12:00:00Z");

    private final UserRepository users = new UserRepository();
    private Database db;

    @BeforeEach
    void setUp() {
        db = TestDatabase.fresh();
    }

    @AfterEach
    void tearDown() {
        db.close();
    }

    @Test
    void upsertCreatesOnceAndRefreshesName() {
        JournalUser first = db.inTransaction("u", conn -> users.upsert(conn, 5L, "old", NOW));
        JournalUser second = db.inTransaction("u", conn -> users.upsert(conn, 5L, "new", NOW.plusSeconds(60)));

        assertThat(second.id()).isEqualTo(first.id());
        assertThat(second.displayName()).isEqualTo("new");
        assertThat(second.createdAt()).isEqualTo(NOW);
        assertThat(second.updatedAt()).isEqualTo(NOW.plusSeconds(60));
    }

    @Test
    void blankNameFallsBackToId() {
        JournalUser u = db.inTransaction("u", conn -> users.upsert(conn, 5L, " ", NOW));

        assertThat(u.displayName()).isEqualTo("5");
    }

    @Test
    void channelAssignmentOnlyIfUnsetKeepsFirstWriter() {
        db.inTransaction("u", conn -> users.upsert(conn, 5L, "a", NOW));

        assertThat(db.<Boolean>inTransaction("a", conn -> users.assignChannel(conn, 5L, 100L, true, NOW))).isTrue();
        assertThat(db.<Boolean>inTransaction("a", conn -> users.assignChannel(conn, 5L, 200L, true, NOW))).isFalse();
        assertThat(db.<Optional<JournalUser>>inTransaction("f", conn -> users.findByPlatformId(conn, 5L)).orElseThrow().assignedChannelId())
                .isEqualTo(100L);

        db.inTransaction("clear", conn -> users.assignChannel(conn, 5L, null, false, NOW));
        assertThat(db.<Optional<JournalUser>>inTransaction("f", conn -> users.findByPlatformId(conn, 5L)).orElseThrow().assignedChannelId())
                .isNull();
    }
}
