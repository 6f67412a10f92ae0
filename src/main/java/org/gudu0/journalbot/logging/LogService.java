package org.gudu0.journalbot.logging;

import net.dv8tion.jda.api.JDA;
import net.dv8tion.jda.api.entities.channel.middleman.MessageChannel;
import org.gudu0.journalbot.config.BotConfig;
import org.gudu0.journalbot.util.ConsoleLog;

import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.FormatStyle;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Operator-facing logging: always the console, plus the configured log channel when enabled.
 * Never used for messages meant for the end user's journal.
 */
public class LogService {
    private final BotConfig cfg;
    private final ZoneId zone;
    private final AtomicBoolean ready = new AtomicBoolean(false);
    private volatile JDA jda;

    public static final DateTimeFormatter TS = DateTimeFormatter.ofLocalizedDateTime(FormatStyle.MEDIUM);

    public LogService(BotConfig cfg, ZoneId zone) {
        this.cfg = cfg;
        this.zone = zone;
    }

    public void attach(JDA jda) {
        this.jda = jda;
        this.ready.set(true);
    }

    public void log(String message) {
        ConsoleLog.info("LogService", message);
        send(message);
    }

    /** Something an operator has to look at (persistent access failures, store outages). */
    public void alert(String message) {
        ConsoleLog.warn("LogService", "ALERT " + message);
        send(":warning: " + message);
    }

    private void send(String message) {
        if (!cfg.enableLogs) {
            ConsoleLog.debug("LogService", "Discord logging disabled (enableLogs=false)");
            return;
        }
        if (cfg.logChannelId == null || cfg.logChannelId.isBlank()) {
            ConsoleLog.debug("LogService", "Discord logging disabled (logChannelId missing)");
            return;
        }
        if (!ready.get() || jda == null) {
            ConsoleLog.debug("LogService", "Discord logging skipped (JDA not ready yet)");
            return;
        }

        MessageChannel ch = jda.getChannelById(MessageChannel.class, cfg.logChannelId);
        if (ch == null) {
            ConsoleLog.warn("LogService", "logChannelId not found: " + cfg.logChannelId);
            return;
        }

        String out = "[" + ZonedDateTime.now(zone).format(TS) + "] " + message;
        if (out.length() > 2000) out = out.substring(0, 1997) + "...";

        ch.sendMessage(out).queue(
                ok -> ConsoleLog.debug("LogService", "Sent discord log"),
                err -> ConsoleLog.error("LogService", "Log send failed: " + err.getMessage(), err)
        );
    }
}
