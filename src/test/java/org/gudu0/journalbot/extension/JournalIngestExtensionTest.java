package org.gudu0.journalbot.extension;

import org.gudu0.journalbot.journal.AccessController;
import org.gudu0.journalbot.journal.EntryOutcome;
import org.gudu0.journalbot.journal.IncomingEntry;
import org.gudu0.journalbot.store.StoreUnavailableException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class JournalIngestExtensionTest {

    private static final LocalDate DAY = LocalDate.of(2026, 3, 10);
    private static final IncomingEntry ENTRY =
            new IncomingEntry(1L, "alice", 5L, 77L, "some words", Instant.parse("2026-03-10T12:00:00Z"));

    @Mock
    AccessController access;

    private final List<String> replies = new ArrayList<>();

    private void ingestWith(EntryOutcome.Status status, int words, int total) {
        when(access.onNewEntry(ENTRY)).thenReturn(new EntryOutcome(status, DAY, words, total, 500));
        new JournalIngestExtension(access, 999L).handle(new JournalMessageEvent(ENTRY, replies::add));
    }

    @Test
    void progressReplyShowsRemainingWords() {
        ingestWith(EntryOutcome.Status.RECORDED, 120, 320);

        assertThat(replies).singleElement().asString()
                .contains("**120** words")
                .contains("320/500")
                .contains("**180** more")
                .contains("<#999>");
    }

    @Test
    void unlockReplyLinksSharedChannel() {
        ingestWith(EntryOutcome.Status.UNLOCKED, 200, 520);

        assertThat(replies).singleElement().asString().contains("welcome to <#999>");
    }

    @Test
    void pendingGrantTellsUserAccessIsDelayed() {
        ingestWith(EntryOutcome.Status.ACCESS_PENDING, 200, 520);

        assertThat(replies).singleElement().asString().contains("met the requirement but access is delayed");
    }

    @Test
    void duplicateDeliveryIsSilent() {
        ingestWith(EntryOutcome.Status.DUPLICATE, 2, 0);

        assertThat(replies).isEmpty();
    }

    @Test
    void lateEntryMentionsClosedDay() {
        ingestWith(EntryOutcome.Status.LATE, 40, 540);

        assertThat(replies).singleElement().asString().contains(DAY.toString()).contains("already closed");
    }

    @Test
    void storeOutageApologizesAndPropagates() {
        when(access.onNewEntry(ENTRY)).thenThrow(new StoreUnavailableException("db down", null));

        JournalIngestExtension ext = new JournalIngestExtension(access, 999L);
        assertThatThrownBy(() -> ext.handle(new JournalMessageEvent(ENTRY, replies::add)))
                .isInstanceOf(StoreUnavailableException.class);
        assertThat(replies).singleElement().asString().contains("couldn't save");
    }

    @Test
    void consumesOnlyJournalMessages() {
        assertThat(new JournalIngestExtension(access, 999L).consumes()).containsExactly(EventType.JOURNAL_MESSAGE);
    }
}
