package org.gudu0.journalbot.discord;

import net.dv8tion.jda.api.Permission;
import net.dv8tion.jda.api.entities.Guild;
import net.dv8tion.jda.api.entities.Member;
import net.dv8tion.jda.api.events.interaction.command.SlashCommandInteractionEvent;
import org.gudu0.journalbot.util.ConsoleLog;

public interface CommandGuards {

    default Guild requireGuild(SlashCommandInteractionEvent event) {
        Guild g = event.getGuild();
        if (g == null) {
            event.reply("This command can only be used in a server.")
                    .setEphemeral(true).queue();
            return null;
        }
        return g;
    }

    default boolean requireMemberPerms(SlashCommandInteractionEvent event, Permission... perms) {
        Member m = event.getMember();
        if (m == null || !m.hasPermission(perms)) {
            event.reply("You don't have permission to use this.")
                    .setEphemeral(true).queue();
            return false;
        }
        return true;
    }

    // Operator subcommands (/journal reset, /journal reconcile)
    default boolean requireManageServer(SlashCommandInteractionEvent event) {
        return requireGuild(event) != null && requireMemberPerms(event, Permission.MANAGE_SERVER);
    }

    default boolean requireChannel(SlashCommandInteractionEvent event, long channelId, String what) {
        if (event.getChannel().getIdLong() == channelId) return true;
        event.reply(what + " can only be used in <#" + channelId + ">!")
                .setEphemeral(true).queue();
        return false;
    }

    default void logUse(SlashCommandInteractionEvent event) {
        if (!ConsoleLog.DEBUG) return;
        ConsoleLog.debug("Command - " + getClass().getSimpleName(),
                "/" + event.getName()
                        + (event.getSubcommandName() != null ? " " + event.getSubcommandName() : "")
                        + " by userId=" + event.getUser().getId()
                        + " name=" + event.getUser().getName()
                        + " guildId=" + (event.getGuild() != null ? event.getGuild().getId() : "DM")
                        + " channelId=" + event.getChannel().getId());
    }
}
