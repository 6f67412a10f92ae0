package org.gudu0.journalbot.access;

import net.dv8tion.jda.api.JDA;
import net.dv8tion.jda.api.Permission;
import net.dv8tion.jda.api.entities.Guild;
import net.dv8tion.jda.api.entities.channel.attribute.IPermissionContainer;
import net.dv8tion.jda.api.entities.channel.middleman.GuildChannel;
import net.dv8tion.jda.api.exceptions.ErrorResponseException;
import net.dv8tion.jda.api.exceptions.PermissionException;
import net.dv8tion.jda.api.requests.ErrorResponse;
import org.gudu0.journalbot.util.ConsoleLog;

import java.util.EnumSet;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Shared-channel access as a member permission override on the channel.
 * Every call blocks for at most {@code timeoutSeconds}; callers must not hold locks around it.
 */
public class DiscordChannelAccess implements ChannelAccess {

    static final EnumSet<Permission> SHARED_ALLOW =
            EnumSet.of(Permission.VIEW_CHANNEL, Permission.MESSAGE_SEND, Permission.MESSAGE_HISTORY);

    private final JDA jda;
    private final long guildId;
    private final long timeoutSeconds;

    public DiscordChannelAccess(JDA jda, long guildId, long timeoutSeconds) {
        this.jda = jda;
        this.guildId = guildId;
        this.timeoutSeconds = timeoutSeconds;
    }

    @Override
    public void grant(long platformUserId, long sharedChannelId) {
        IPermissionContainer channel = resolve(sharedChannelId);
        try {
            await("grant", platformUserId, channel.getManager()
                    .putMemberPermissionOverride(platformUserId, SHARED_ALLOW, null)
                    .submit());
        } catch (PermissionException e) {
            throw new AccessCallFailedException("missing permission " + e.getPermission() + " on shared channel", false, e);
        }
        ConsoleLog.info("ChannelAccess", "Granted shared channel to userId=" + platformUserId);
    }

    @Override
    public void revoke(long platformUserId, long sharedChannelId) {
        IPermissionContainer channel = resolve(sharedChannelId);
        if (channel.getPermissionOverrides().stream().noneMatch(o -> o.getIdLong() == platformUserId)) {
            ConsoleLog.debug("ChannelAccess", "No override to revoke for userId=" + platformUserId);
            return;
        }
        try {
            await("revoke", platformUserId, channel.getManager()
                    .removePermissionOverride(platformUserId)
                    .submit());
        } catch (PermissionException e) {
            throw new AccessCallFailedException("missing permission " + e.getPermission() + " on shared channel", false, e);
        }
        ConsoleLog.info("ChannelAccess", "Revoked shared channel from userId=" + platformUserId);
    }

    private IPermissionContainer resolve(long sharedChannelId) {
        Guild guild = jda.getGuildById(guildId);
        if (guild == null) {
            // Usually a cache that is still warming up after a reconnect.
            throw new AccessCallFailedException("guild " + guildId + " not in cache", true);
        }
        GuildChannel ch = guild.getGuildChannelById(sharedChannelId);
        if (!(ch instanceof IPermissionContainer container)) {
            throw new AccessCallFailedException("shared channel " + sharedChannelId + " not found or has no permission overrides", false);
        }
        return container;
    }

    private void await(String op, long platformUserId, CompletableFuture<Void> call) {
        try {
            call.get(timeoutSeconds, TimeUnit.SECONDS);
        } catch (TimeoutException e) {
            call.cancel(true);
            throw new AccessCallFailedException(op + " timed out after " + timeoutSeconds + "s", true, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AccessCallFailedException(op + " interrupted", false, e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof ErrorResponseException ere) {
                ErrorResponse r = ere.getErrorResponse();
                if (op.equals("revoke") && (r == ErrorResponse.UNKNOWN_MEMBER || r == ErrorResponse.UNKNOWN_OVERRIDE)) {
                    ConsoleLog.warn("ChannelAccess", "revoke userId=" + platformUserId + ": " + r + " (treated as revoked)");
                    return;
                }
                boolean retryable = ere.isServerError() || r == ErrorResponse.SERVER_ERROR;
                throw new AccessCallFailedException(op + " rejected: " + r + " " + ere.getMeaning(), retryable, ere);
            }
            throw new AccessCallFailedException(op + " failed: " + cause.getMessage(), true, cause);
        }
    }
}
