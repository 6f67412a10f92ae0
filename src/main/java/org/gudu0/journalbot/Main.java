package org.gudu0.journalbot;

import net.dv8tion.jda.api.JDA;
import net.dv8tion.jda.api.JDABuilder;
import net.dv8tion.jda.api.entities.Guild;
import net.dv8tion.jda.api.entities.channel.middleman.MessageChannel;
import net.dv8tion.jda.api.interactions.commands.OptionType;
import net.dv8tion.jda.api.interactions.commands.build.Commands;
import net.dv8tion.jda.api.interactions.commands.build.SubcommandData;
import net.dv8tion.jda.api.requests.GatewayIntent;
import org.gudu0.journalbot.access.ChannelAccess;
import org.gudu0.journalbot.access.DiscordChannelAccess;
import org.gudu0.journalbot.access.RetryingChannelAccess;
import org.gudu0.journalbot.config.BotConfig;
import org.gudu0.journalbot.config.ConfigInvalidException;
import org.gudu0.journalbot.config.ConfigValidation;
import org.gudu0.journalbot.config.TypedConfigStore;
import org.gudu0.journalbot.discord.DiscordJournalChannels;
import org.gudu0.journalbot.discord.GatewayBridge;
import org.gudu0.journalbot.discord.InsightCommandListener;
import org.gudu0.journalbot.discord.JournalChannelService;
import org.gudu0.journalbot.discord.JournalCommandListener;
import org.gudu0.journalbot.extension.DailyResetEvent;
import org.gudu0.journalbot.extension.ExtensionRegistry;
import org.gudu0.journalbot.extension.JournalChannelExtension;
import org.gudu0.journalbot.extension.JournalIngestExtension;
import org.gudu0.journalbot.extension.ResetNoticeExtension;
import org.gudu0.journalbot.insight.GeminiInsightService;
import org.gudu0.journalbot.insight.InsightService;
import org.gudu0.journalbot.insight.JournalInsights;
import org.gudu0.journalbot.journal.AccessController;
import org.gudu0.journalbot.journal.JournalDays;
import org.gudu0.journalbot.journal.StatsAggregator;
import org.gudu0.journalbot.logging.LogService;
import org.gudu0.journalbot.reset.AccessReconciler;
import org.gudu0.journalbot.reset.DailyResetScheduler;
import org.gudu0.journalbot.store.DailyStatRepository;
import org.gudu0.journalbot.store.Database;
import org.gudu0.journalbot.store.JournalEntryRepository;
import org.gudu0.journalbot.store.ResetRunRepository;
import org.gudu0.journalbot.store.UserRepository;
import org.gudu0.journalbot.util.BotPaths;
import org.gudu0.journalbot.util.ConsoleLog;

import java.time.Clock;
import java.time.LocalTime;
import java.time.ZoneId;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

public class Main {

    private static final int WORKER_THREADS = 4;
    private static final long RESET_TICK_SECONDS = 30;

    public static void main(String[] args) throws Exception {
        ConsoleLog.info("Main", "Starting Bot");
        BotPaths.ensureBaseDirs();

        // 1) Token (env)
        String token = reqEnv("DISCORD_TOKEN");

        // 2) Config (data/config.json + env overrides), fatal if invalid
        BotConfig cfg;
        try {
            cfg = loadConfig();
        } catch (ConfigInvalidException e) {
            ConsoleLog.error("Main", "Invalid configuration, refusing to start:");
            for (String p : e.problems()) ConsoleLog.error("Main", "  - " + p);
            System.exit(2);
            return;
        }

        long guildId = Long.parseLong(cfg.guildId.trim());
        long sharedChannelId = Long.parseLong(cfg.sharedChannelId.trim());
        int threshold = cfg.dailyWordRequirement;
        ZoneId zone = ZoneId.of(cfg.timezone);
        JournalDays days = new JournalDays(zone, LocalTime.parse(cfg.resetTime));
        Clock clock = Clock.systemUTC();

        ConsoleLog.info("Main", "Config: guildId=" + guildId + " sharedChannelId=" + sharedChannelId
                + " threshold=" + threshold + " zone=" + zone + " resetTime=" + days.resetTime());

        // 3) Store
        Database db = Database.open(cfg.database, System.getenv("DATABASE_PASSWORD"));
        db.applySchema();

        UserRepository users = new UserRepository();
        JournalEntryRepository entries = new JournalEntryRepository();
        DailyStatRepository stats = new DailyStatRepository();
        ResetRunRepository resetRuns = new ResetRunRepository();

        // 4) Dispatch plumbing
        LogService logs = new LogService(cfg, zone);
        ExtensionRegistry registry = new ExtensionRegistry();
        ExecutorService workers = Executors.newFixedThreadPool(WORKER_THREADS, namedThreads("journal-worker"));
        GatewayBridge bridge = new GatewayBridge(registry, guildId, cfg.journalChannelPrefix, workers);

        // 5) Build JDA (connects in the background; services below are wired before it is ready)
        ConsoleLog.info("Main", "Building JDA (MESSAGE_CONTENT enabled)");
        JDA jda = JDABuilder.createDefault(token)
                .enableIntents(GatewayIntent.GUILD_MESSAGES, GatewayIntent.DIRECT_MESSAGES, GatewayIntent.MESSAGE_CONTENT)
                .addEventListeners(bridge)
                .build();

        // 6) Services
        ChannelAccess channelAccess = new RetryingChannelAccess(
                new DiscordChannelAccess(jda, guildId, cfg.access.timeoutSeconds),
                cfg.access.maxAttempts,
                cfg.access.initialBackoffMillis);

        StatsAggregator aggregator = new StatsAggregator(db, stats, entries, clock);
        AccessController access = new AccessController(db, users, entries, stats, aggregator,
                channelAccess, logs, days, clock, threshold, sharedChannelId);

        JournalChannelService channels = new JournalChannelService(db, users,
                new DiscordJournalChannels(jda, guildId, cfg.journalCategoryId, cfg.access.timeoutSeconds),
                cfg.journalChannelPrefix, clock);

        String geminiKey = System.getenv("GEMINI_API_KEY");
        InsightService insight = geminiKey == null || geminiKey.isBlank()
                ? InsightService.disabled("GEMINI_API_KEY is not set")
                : new GeminiInsightService(cfg.insight, geminiKey);
        JournalInsights insights = new JournalInsights(db, entries, insight, days, clock);

        DailyResetScheduler resets = new DailyResetScheduler(db, resetRuns, access, days, clock, logs, RESET_TICK_SECONDS);
        resets.addListener(report -> bridge.publish(new DailyResetEvent(report)));
        AccessReconciler reconciler = new AccessReconciler(access, cfg.reconcileIntervalMinutes);

        // 7) Extensions
        registry.register(new JournalIngestExtension(access, sharedChannelId))
                .register(new JournalChannelExtension(channels, threshold));
        if (cfg.announceResets) {
            registry.register(new ResetNoticeExtension(text -> postToChannel(jda, sharedChannelId, text), threshold));
        }

        jda.addEventListener(
                new JournalCommandListener(access, resets, workers, sharedChannelId),
                new InsightCommandListener(access, insights, workers, sharedChannelId));

        jda.awaitReady();
        ConsoleLog.info("Main", "JDA ready as " + jda.getSelfUser().getName());

        // 8) Attach services that need a ready JDA
        logs.attach(jda);
        SafetyChecks.run(jda, cfg, logs);

        // 9) Schedulers (first reset tick doubles as missed-boundary catch-up)
        resets.start();
        reconciler.start();

        // 10) Commands
        Guild guild = jda.getGuildById(guildId);
        if (guild != null) registerGuildCommands(guild);

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            ConsoleLog.info("Main", "Shutting down");
            workers.shutdown();
            jda.shutdown();
            db.close();
        }, "shutdown"));

        ConsoleLog.info("Main", "Startup complete (db pool " + db.poolStatus() + ")");
        logs.log("Bot Startup Completed Successfully.");
    }

    private static BotConfig loadConfig() {
        TypedConfigStore<BotConfig> store = new TypedConfigStore<>(BotPaths.CONFIG_FILE, BotConfig.class, BotConfig::new);

        // TypedConfigStore loads defaults but DOES NOT write by itself.
        if (!store.existed()) {
            ConsoleLog.warn("Main", "Config missing; creating default at " + BotPaths.CONFIG_FILE);
            try {
                store.save();
            } catch (Exception e) {
                ConsoleLog.error("Main", "Could not write default config: " + e.getMessage(), e);
            }
        }

        BotConfig cfg = store.cfg();
        cfg.applyEnvOverrides(System.getenv());
        ConfigValidation.validate(cfg);
        return cfg;
    }

    private static void registerGuildCommands(Guild g) {
        g.updateCommands()
                .addCommands(
                        Commands.slash("journal", "Daily journal status and admin tools")
                                .addSubcommands(
                                        new SubcommandData("status", "Your words today and shared channel access"),
                                        new SubcommandData("reset", "Run the daily access reset now (admin only)"),
                                        new SubcommandData("reconcile", "Retry pending access changes now (admin only)"),
                                        new SubcommandData("recount", "Check a user's total against their entries (admin only)")
                                                .addOption(OptionType.USER, "user", "Whose total to check", true)
                                                .addOption(OptionType.BOOLEAN, "repair", "Overwrite a drifted total", false)
                                ),

                        Commands.slash("gemini", "Run a prompt over today's journals")
                                .addOption(OptionType.STRING, "prompt", "What do you want to know?", true)
                )
                .queue(
                        ok -> ConsoleLog.info("Main", "Guild commands updated: " + g.getName() + " (" + g.getId() + ")"),
                        err -> ConsoleLog.error("Main", "Failed registering commands in guildId=" + g.getId() + ": " + err.getMessage(), err)
                );
    }

    private static void postToChannel(JDA jda, long channelId, String text) {
        MessageChannel ch = jda.getChannelById(MessageChannel.class, channelId);
        if (ch == null) {
            ConsoleLog.warn("Main", "Channel not found for post: " + channelId);
            return;
        }
        ch.sendMessage(text).queue(
                ok -> ConsoleLog.debug("Main", "Posted to " + channelId),
                err -> ConsoleLog.error("Main", "Post to " + channelId + " failed: " + err.getMessage(), err)
        );
    }

    private static ThreadFactory namedThreads(String prefix) {
        AtomicInteger n = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + "-" + n.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }

    private static String reqEnv(String key) {
        String v = System.getenv(key);
        if (v == null || v.isBlank()) throw new IllegalStateException("Missing environment variable: " + key);
        return v;
    }
}
