package org.gudu0.journalbot.discord;

import net.dv8tion.jda.api.entities.MessageType;
import net.dv8tion.jda.api.entities.channel.ChannelType;
import net.dv8tion.jda.api.events.message.MessageReceivedEvent;
import org.gudu0.journalbot.extension.BotEvent;
import org.gudu0.journalbot.extension.BotExtension;
import org.gudu0.journalbot.extension.DirectMessageEvent;
import org.gudu0.journalbot.extension.EventType;
import org.gudu0.journalbot.extension.ExtensionRegistry;
import org.gudu0.journalbot.extension.JournalMessageEvent;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.RETURNS_DEEP_STUBS;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class GatewayBridgeTest {

    private static final long GUILD = 77L;

    private final List<BotEvent> seen = new ArrayList<>();
    private ExecutorService workers;
    private GatewayBridge bridge;

    @BeforeEach
    void setUp() {
        ExtensionRegistry registry = new ExtensionRegistry().register(new BotExtension() {
            @Override
            public String name() {
                return "recorder";
            }

            @Override
            public Set<EventType> consumes() {
                return EnumSet.allOf(EventType.class);
            }

            @Override
            public void handle(BotEvent event) {
                seen.add(event);
            }
        });
        workers = mock(ExecutorService.class);
        doAnswer(inv -> {
            ((Runnable) inv.getArgument(0)).run();
            return null;
        }).when(workers).execute(any(Runnable.class));
        bridge = new GatewayBridge(registry, GUILD, "journal-", workers);
    }

    private static MessageReceivedEvent message(ChannelType type, String channelName, boolean bot) {
        MessageReceivedEvent event = mock(MessageReceivedEvent.class, RETURNS_DEEP_STUBS);
        when(event.getAuthor().isBot()).thenReturn(bot);
        when(event.getAuthor().getIdLong()).thenReturn(5L);
        when(event.getAuthor().getName()).thenReturn("alice");
        when(event.isWebhookMessage()).thenReturn(false);
        when(event.getMessage().getType()).thenReturn(MessageType.DEFAULT);
        when(event.getMessage().getContentRaw()).thenReturn("dear diary");
        when(event.getMessage().getIdLong()).thenReturn(900L);
        when(event.getMessage().getTimeCreated()).thenReturn(OffsetDateTime.of(2026, 3, 10, 12, 0, 0, 0, ZoneOffset.UTC));
        when(event.getChannelType()).thenReturn(type);
        when(event.isFromGuild()).thenReturn(type != ChannelType.PRIVATE);
        when(event.getGuild().getIdLong()).thenReturn(GUILD);
        when(event.getChannel().getName()).thenReturn(channelName);
        when(event.getChannel().getIdLong()).thenReturn(123L);
        when(event.getMember().getEffectiveName()).thenReturn("Alice A.");
        return event;
    }

    @Test
    void journalChannelMessageBecomesEntry() {
        bridge.onMessageReceived(message(ChannelType.TEXT, "journal-alice", false));

        assertThat(seen).singleElement().isInstanceOf(JournalMessageEvent.class);
        JournalMessageEvent event = (JournalMessageEvent) seen.get(0);
        assertThat(event.entry().platformUserId()).isEqualTo(5L);
        assertThat(event.entry().displayName()).isEqualTo("Alice A.");
        assertThat(event.entry().channelId()).isEqualTo(123L);
        assertThat(event.entry().platformMessageId()).isEqualTo(900L);
        assertThat(event.entry().text()).isEqualTo("dear diary");
    }

    @Test
    void otherChannelsAndBotsAreIgnored() {
        bridge.onMessageReceived(message(ChannelType.TEXT, "general", false));
        bridge.onMessageReceived(message(ChannelType.TEXT, "journal-bob", true));

        assertThat(seen).isEmpty();
    }

    @Test
    void directMessageIsForwarded() {
        bridge.onMessageReceived(message(ChannelType.PRIVATE, null, false));

        assertThat(seen).singleElement().isInstanceOf(DirectMessageEvent.class);
        assertThat(((DirectMessageEvent) seen.get(0)).username()).isEqualTo("alice");
    }

    @Test
    void prefixMatchIsExact() {
        assertThat(bridge.isJournalChannel("journal-x")).isTrue();
        assertThat(bridge.isJournalChannel("my-journal-x")).isFalse();
        assertThat(bridge.isJournalChannel(null)).isFalse();
    }

    @Test
    void rejectedWorkIsDropped() {
        doThrow(new RejectedExecutionException("closed")).when(workers).execute(any(Runnable.class));

        bridge.onMessageReceived(message(ChannelType.TEXT, "journal-alice", false));

        assertThat(seen).isEmpty();
    }
}
