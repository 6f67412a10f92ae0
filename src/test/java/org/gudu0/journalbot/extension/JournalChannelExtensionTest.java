package org.gudu0.journalbot.extension;

import org.gudu0.journalbot.discord.JournalChannelService;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class JournalChannelExtensionTest {

    @Mock
    JournalChannelService channels;

    private final List<String> replies = new ArrayList<>();

    private void dm() {
        new JournalChannelExtension(channels, 500).handle(new DirectMessageEvent(11L, "alice", "hi", replies::add));
    }

    @Test
    void newChannelIsAnnouncedAndWelcomed() {
        when(channels.provision(11L, "alice"))
                .thenReturn(new JournalChannelService.Provisioned(77L, JournalChannelService.Kind.CREATED));

        dm();

        assertThat(replies).singleElement().asString().contains("Created your journal channel: <#77>").contains("500 words");
        verify(channels).welcome(77L, 11L, 500);
    }

    @Test
    void existingChannelIsPointedTo() {
        when(channels.provision(11L, "alice"))
                .thenReturn(new JournalChannelService.Provisioned(77L, JournalChannelService.Kind.EXISTING));

        dm();

        assertThat(replies).singleElement().asString().contains("already have a journal channel: <#77>");
        verify(channels, never()).welcome(77L, 11L, 500);
    }

    @Test
    void failedWelcomeDoesNotFailTheDm() {
        when(channels.provision(11L, "alice"))
                .thenReturn(new JournalChannelService.Provisioned(77L, JournalChannelService.Kind.CREATED));
        doThrow(new IllegalStateException("send failed")).when(channels).welcome(77L, 11L, 500);

        dm();

        assertThat(replies).hasSize(1);
    }

    @Test
    void provisioningFailureApologizes() {
        when(channels.provision(11L, "alice")).thenThrow(new IllegalStateException("no perms"));

        assertThatThrownBy(this::dm).isInstanceOf(IllegalStateException.class);
        assertThat(replies).singleElement().asString().contains("contact an admin");
    }
}
