package org.gudu0.journalbot.discord;

import net.dv8tion.jda.api.entities.Message;
import net.dv8tion.jda.api.entities.User;
import net.dv8tion.jda.api.entities.channel.ChannelType;
import net.dv8tion.jda.api.events.message.MessageReceivedEvent;
import net.dv8tion.jda.api.hooks.ListenerAdapter;
import org.gudu0.journalbot.extension.BotEvent;
import org.gudu0.journalbot.extension.DirectMessageEvent;
import org.gudu0.journalbot.extension.ExtensionRegistry;
import org.gudu0.journalbot.extension.JournalMessageEvent;
import org.gudu0.journalbot.journal.IncomingEntry;
import org.gudu0.journalbot.util.ConsoleLog;
import org.jetbrains.annotations.NotNull;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Consumer;

/**
 * Translates gateway messages into {@link BotEvent}s and hands them to the worker pool,
 * keeping database and REST work off the JDA event thread.
 */
public class GatewayBridge extends ListenerAdapter {

    private final ExtensionRegistry registry;
    private final long guildId;
    private final String journalPrefix;
    private final ExecutorService workers;

    public GatewayBridge(ExtensionRegistry registry, long guildId, String journalPrefix, ExecutorService workers) {
        this.registry = registry;
        this.guildId = guildId;
        this.journalPrefix = journalPrefix;
        this.workers = workers;
    }

    @Override
    public void onMessageReceived(@NotNull MessageReceivedEvent event) {
        User author = event.getAuthor();
        if (author.isBot() || event.isWebhookMessage()) return;

        Message msg = event.getMessage();
        if (msg.getType().isSystem()) return;

        if (event.getChannelType() == ChannelType.PRIVATE) {
            publish(new DirectMessageEvent(author.getIdLong(), author.getName(), msg.getContentRaw(), replier(msg)));
            return;
        }

        if (!event.isFromGuild() || event.getGuild().getIdLong() != guildId) return;
        if (event.getChannelType() != ChannelType.TEXT) return;
        if (!isJournalChannel(event.getChannel().getName())) return;

        String displayName = event.getMember() != null
                ? event.getMember().getEffectiveName()
                : author.getEffectiveName();

        IncomingEntry entry = new IncomingEntry(
                author.getIdLong(),
                displayName,
                event.getChannel().getIdLong(),
                msg.getIdLong(),
                msg.getContentRaw(),
                msg.getTimeCreated().toInstant());

        publish(new JournalMessageEvent(entry, replier(msg)));
    }

    public boolean isJournalChannel(String channelName) {
        return channelName != null && channelName.startsWith(journalPrefix);
    }

    public void publish(BotEvent event) {
        try {
            workers.execute(() -> {
                try {
                    registry.dispatch(event);
                } catch (RuntimeException e) {
                    ConsoleLog.error("Gateway", "Dispatch of " + event.type() + " crashed: " + e.getMessage(), e);
                }
            });
        } catch (RejectedExecutionException e) {
            ConsoleLog.warn("Gateway", "Worker pool rejected " + event.type() + " (shutting down?)");
        }
    }

    private static Consumer<String> replier(Message msg) {
        return text -> msg.reply(text)
                .mentionRepliedUser(false)
                .queue(
                        ok -> ConsoleLog.debug("Gateway", "Replied to msgId=" + msg.getId()),
                        err -> ConsoleLog.warn("Gateway", "Reply to msgId=" + msg.getId() + " failed: " + err.getMessage())
                );
    }
}
