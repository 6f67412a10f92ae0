package org.gudu0.journalbot.discord;

import net.dv8tion.jda.api.entities.User;
import net.dv8tion.jda.api.events.interaction.command.SlashCommandInteractionEvent;
import net.dv8tion.jda.api.hooks.ListenerAdapter;
import net.dv8tion.jda.api.interactions.commands.OptionMapping;
import org.gudu0.journalbot.journal.AccessController;
import org.gudu0.journalbot.reset.DailyResetScheduler;
import org.gudu0.journalbot.reset.ResetReport;
import org.gudu0.journalbot.store.StoreUnavailableException;
import org.gudu0.journalbot.util.ConsoleLog;
import org.jetbrains.annotations.NotNull;

import java.util.concurrent.ExecutorService;

/**
 * /journal status | reset | reconcile | recount
 */
public class JournalCommandListener extends ListenerAdapter implements CommandGuards {

    private final AccessController access;
    private final DailyResetScheduler resets;
    private final ExecutorService workers;
    private final long sharedChannelId;

    public JournalCommandListener(AccessController access, DailyResetScheduler resets, ExecutorService workers, long sharedChannelId) {
        this.access = access;
        this.resets = resets;
        this.workers = workers;
        this.sharedChannelId = sharedChannelId;
    }

    @Override
    public void onSlashCommandInteraction(@NotNull SlashCommandInteractionEvent event) {
        if (!event.getName().equals("journal")) return;
        logUse(event);

        String sub = event.getSubcommandName();
        if (sub == null) {
            event.reply("Missing subcommand.").setEphemeral(true).queue();
            return;
        }

        switch (sub) {
            case "status" -> status(event);
            case "reset" -> reset(event);
            case "reconcile" -> reconcile(event);
            case "recount" -> recount(event);
            default -> event.reply("Unknown subcommand.").setEphemeral(true).queue();
        }
    }

    private void status(SlashCommandInteractionEvent event) {
        AccessController.DailyStatusView v;
        try {
            v = access.status(event.getUser().getIdLong());
        } catch (StoreUnavailableException e) {
            ConsoleLog.error("Command", "/journal status failed: " + e.getMessage(), e);
            event.reply("Journal data is unavailable right now, try again shortly.").setEphemeral(true).queue();
            return;
        }

        String state = v.hasAccess()
                ? "unlocked (<#" + sharedChannelId + ">)"
                : "locked, **" + v.remaining() + "** more words needed";

        event.reply("**Journal day " + v.day() + "**\n"
                        + "Words today: **" + v.totalWords() + "/" + v.threshold() + "**\n"
                        + "Shared channel: " + state)
                .setEphemeral(true).queue();
    }

    private void reset(SlashCommandInteractionEvent event) {
        if (!requireManageServer(event)) return;

        event.deferReply(true).queue();
        workers.execute(() -> {
            try {
                ResetReport r = resets.runLatest();
                event.getHook().sendMessage("Reset for " + r.boundaryDay() + " done: revoked **" + r.revoked()
                        + "**, pending **" + r.failed() + "**" + (r.firstRun() ? "" : " (boundary had already been processed)")).queue();
            } catch (RuntimeException e) {
                ConsoleLog.error("Command", "/journal reset failed: " + e.getMessage(), e);
                event.getHook().sendMessage("Reset failed: " + e.getMessage()).queue();
            }
        });
    }

    private void reconcile(SlashCommandInteractionEvent event) {
        if (!requireManageServer(event)) return;

        event.deferReply(true).queue();
        workers.execute(() -> {
            try {
                AccessController.ReconcileReport r = access.reconcile();
                event.getHook().sendMessage("Reconciled: granted **" + r.granted() + "**, revoked **" + r.revoked()
                        + "**, still pending **" + r.pending() + "**").queue();
            } catch (RuntimeException e) {
                ConsoleLog.error("Command", "/journal reconcile failed: " + e.getMessage(), e);
                event.getHook().sendMessage("Reconcile failed: " + e.getMessage()).queue();
            }
        });
    }

    private void recount(SlashCommandInteractionEvent event) {
        if (!requireManageServer(event)) return;

        User target = event.getOption("user", OptionMapping::getAsUser);
        boolean repair = event.getOption("repair", false, OptionMapping::getAsBoolean);
        if (target == null) {
            event.reply("Missing user.").setEphemeral(true).queue();
            return;
        }

        event.deferReply(true).queue();
        workers.execute(() -> {
            try {
                String text = access.recountToday(target.getIdLong(), repair)
                        .map(r -> target.getAsMention() + " on " + r.day() + ": stored **" + r.stored()
                                + "**, entries **" + r.recomputed() + "**"
                                + (r.consistent() ? " (consistent)" : r.repaired() ? " (repaired)" : " (drifted)"))
                        .orElse(target.getAsMention() + " has no journal data.");
                event.getHook().sendMessage(text).queue();
            } catch (RuntimeException e) {
                ConsoleLog.error("Command", "/journal recount failed: " + e.getMessage(), e);
                event.getHook().sendMessage("Recount failed: " + e.getMessage()).queue();
            }
        });
    }
}
