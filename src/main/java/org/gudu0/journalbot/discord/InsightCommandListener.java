package org.gudu0.journalbot.discord;

import net.dv8tion.jda.api.events.interaction.command.SlashCommandInteractionEvent;
import net.dv8tion.jda.api.hooks.ListenerAdapter;
import net.dv8tion.jda.api.interactions.commands.OptionMapping;
import org.gudu0.journalbot.insight.InsightException;
import org.gudu0.journalbot.insight.JournalInsights;
import org.gudu0.journalbot.journal.AccessController;
import org.gudu0.journalbot.store.StoreUnavailableException;
import org.gudu0.journalbot.util.ConsoleLog;
import org.gudu0.journalbot.util.MessageChunks;
import org.jetbrains.annotations.NotNull;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutorService;

/**
 * /gemini prompt:&lt;text&gt; runs a request over today's journals. Only for users who unlocked
 * the shared channel today, and only inside it.
 */
public class InsightCommandListener extends ListenerAdapter implements CommandGuards {

    private final AccessController access;
    private final JournalInsights insights;
    private final ExecutorService workers;
    private final long sharedChannelId;

    public InsightCommandListener(AccessController access, JournalInsights insights, ExecutorService workers, long sharedChannelId) {
        this.access = access;
        this.insights = insights;
        this.workers = workers;
        this.sharedChannelId = sharedChannelId;
    }

    @Override
    public void onSlashCommandInteraction(@NotNull SlashCommandInteractionEvent event) {
        if (!event.getName().equals("gemini")) return;
        logUse(event);

        if (!requireChannel(event, sharedChannelId, "The /gemini command")) return;

        OptionMapping opt = event.getOption("prompt");
        String prompt = opt == null ? "" : opt.getAsString().trim();
        if (prompt.isEmpty()) {
            event.reply("Prompt can't be empty.").setEphemeral(true).queue();
            return;
        }

        boolean unlocked;
        try {
            unlocked = access.status(event.getUser().getIdLong()).hasAccess();
        } catch (StoreUnavailableException e) {
            ConsoleLog.error("Command", "/gemini access check failed: " + e.getMessage(), e);
            event.reply("Journal data is unavailable right now, try again shortly.").setEphemeral(true).queue();
            return;
        }
        if (!unlocked) {
            event.reply("You need to write " + access.threshold() + " words in your journal today to use this command!")
                    .setEphemeral(true).queue();
            return;
        }

        event.deferReply().queue();
        workers.execute(() -> {
            try {
                Optional<String> answer = insights.ask(prompt);
                if (answer.isEmpty()) {
                    event.getHook().sendMessage("No journal entries found for today!").queue();
                    return;
                }
                List<String> chunks = MessageChunks.split(answer.get(), MessageChunks.DISCORD_LIMIT);
                for (String chunk : chunks) {
                    event.getHook().sendMessage(chunk).queue();
                }
            } catch (InsightException | StoreUnavailableException e) {
                ConsoleLog.error("Insight", "/gemini failed: " + e.getMessage(), e);
                event.getHook().sendMessage("Sorry, there was an error processing your request.").queue();
            }
        });
    }
}
