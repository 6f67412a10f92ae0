package org.gudu0.journalbot.discord;

import net.dv8tion.jda.api.JDA;
import net.dv8tion.jda.api.Permission;
import net.dv8tion.jda.api.entities.Guild;
import net.dv8tion.jda.api.entities.channel.concrete.Category;
import net.dv8tion.jda.api.entities.channel.concrete.TextChannel;
import net.dv8tion.jda.api.exceptions.PermissionException;
import org.gudu0.journalbot.util.ConsoleLog;

import java.util.EnumSet;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

public class DiscordJournalChannels implements JournalChannelGateway {

    static final EnumSet<Permission> JOURNAL_ALLOW =
            EnumSet.of(Permission.VIEW_CHANNEL, Permission.MESSAGE_SEND, Permission.MESSAGE_HISTORY);

    private final JDA jda;
    private final long guildId;
    private final String categoryId;
    private final long timeoutSeconds;

    public DiscordJournalChannels(JDA jda, long guildId, String categoryId, long timeoutSeconds) {
        this.jda = jda;
        this.guildId = guildId;
        this.categoryId = categoryId;
        this.timeoutSeconds = timeoutSeconds;
    }

    @Override
    public boolean exists(long channelId) {
        return guild().getTextChannelById(channelId) != null;
    }

    @Override
    public Optional<Long> findVisible(String name, long platformUserId) {
        for (TextChannel ch : guild().getTextChannelsByName(name, true)) {
            boolean visible = ch.getMemberPermissionOverrides().stream()
                    .anyMatch(o -> o.getIdLong() == platformUserId && o.getAllowed().contains(Permission.VIEW_CHANNEL));
            if (visible) {
                ConsoleLog.info("JournalChannels", "Found existing #" + name + " for userId=" + platformUserId);
                return Optional.of(ch.getIdLong());
            }
        }
        return Optional.empty();
    }

    @Override
    public long create(String name, long platformUserId, String username) {
        Guild guild = guild();
        Category parent = categoryId == null || categoryId.isBlank() ? null : guild.getCategoryById(categoryId);
        if (parent == null && categoryId != null && !categoryId.isBlank()) {
            ConsoleLog.warn("JournalChannels", "journalCategoryId not found: " + categoryId + " (creating without category)");
        }

        try {
            TextChannel ch = await("create #" + name, guild.createTextChannel(name, parent)
                    .setTopic("Personal journal for " + username + ". All entries can be read by other journalers through AI commands.")
                    .addRolePermissionOverride(guild.getPublicRole().getIdLong(), null, EnumSet.of(Permission.VIEW_CHANNEL))
                    .addMemberPermissionOverride(platformUserId, JOURNAL_ALLOW, null)
                    .addMemberPermissionOverride(guild.getSelfMember().getIdLong(), JOURNAL_ALLOW, null)
                    .submit());
            return ch.getIdLong();
        } catch (PermissionException e) {
            throw new ProvisioningFailedException("missing permission " + e.getPermission() + " to create journal channels", e);
        }
    }

    @Override
    public void delete(long channelId) {
        TextChannel ch = guild().getTextChannelById(channelId);
        if (ch == null) return;
        await("delete " + channelId, ch.delete().submit());
    }

    @Override
    public void send(long channelId, String text) {
        TextChannel ch = guild().getTextChannelById(channelId);
        if (ch == null) throw new ProvisioningFailedException("channel " + channelId + " not found");
        await("send to " + channelId, ch.sendMessage(text).submit());
    }

    private Guild guild() {
        Guild g = jda.getGuildById(guildId);
        if (g == null) throw new ProvisioningFailedException("guild " + guildId + " not in cache");
        return g;
    }

    private <T> T await(String what, CompletableFuture<T> call) {
        try {
            return call.get(timeoutSeconds, TimeUnit.SECONDS);
        } catch (TimeoutException e) {
            call.cancel(true);
            throw new ProvisioningFailedException(what + " timed out after " + timeoutSeconds + "s", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ProvisioningFailedException(what + " interrupted", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            throw new ProvisioningFailedException(what + " failed: " + cause.getMessage(), cause);
        }
    }
}
