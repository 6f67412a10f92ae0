package org.gudu0.journalbot;

import net.dv8tion.jda.api.JDA;
import net.dv8tion.jda.api.Permission;
import net.dv8tion.jda.api.entities.Guild;
import net.dv8tion.jda.api.entities.Member;
import net.dv8tion.jda.api.entities.channel.middleman.GuildChannel;
import org.gudu0.journalbot.config.BotConfig;
import org.gudu0.journalbot.logging.LogService;
import org.gudu0.journalbot.util.ConsoleLog;

import java.util.EnumSet;
import java.util.stream.Collectors;

/**
 * Startup checks that the bot can actually do its job in the configured guild.
 * Problems are reported, never fatal: grants would just stay pending until fixed.
 */
public final class SafetyChecks {

    private SafetyChecks() {}

    /** @return true if everything looked fine */
    public static boolean run(JDA jda, BotConfig cfg, LogService logs) {
        Guild guild = jda.getGuildById(cfg.guildId);
        if (guild == null) {
            logs.alert("Bot is not in guildId=" + cfg.guildId + " (or it is not cached yet)");
            return false;
        }

        boolean ok = true;
        Member self = guild.getSelfMember();

        GuildChannel shared = guild.getGuildChannelById(cfg.sharedChannelId);
        if (shared == null) {
            logs.alert("Shared channel not found / not visible (sharedChannelId=" + cfg.sharedChannelId + ")");
            ok = false;
        } else {
            EnumSet<Permission> missing = missing(self, shared,
                    Permission.VIEW_CHANNEL, Permission.MANAGE_PERMISSIONS, Permission.MESSAGE_SEND);
            if (!missing.isEmpty()) {
                logs.alert("Missing permissions in #" + shared.getName() + ": " + names(missing)
                        + " (access grants will stay pending)");
                ok = false;
            }
        }

        if (!self.hasPermission(Permission.MANAGE_CHANNEL)) {
            logs.alert("Missing guild permission MANAGE_CHANNEL (journal channels cannot be created)");
            ok = false;
        }

        if (ok) {
            ConsoleLog.info("Safety", "Permissions OK: guild=" + guild.getName()
                    + " shared=#" + shared.getName());
        }
        return ok;
    }

    private static EnumSet<Permission> missing(Member self, GuildChannel channel, Permission... perms) {
        EnumSet<Permission> missing = EnumSet.noneOf(Permission.class);
        for (Permission p : perms) {
            if (!self.hasPermission(channel, p)) missing.add(p);
        }
        return missing;
    }

    private static String names(EnumSet<Permission> perms) {
        return perms.stream().map(Permission::getName).collect(Collectors.joining(", "));
    }
}
