package org.gudu0.journalbot.config;

import java.util.Map;

/**
 * Persistent config stored in data/config.json.
 * <p>
 * Secrets (DISCORD_TOKEN, DATABASE_PASSWORD, GEMINI_API_KEY) stay in environment variables.
 */
public class BotConfig {
    /** Words a user must write in one journal day to unlock the shared channel. */
    public int dailyWordRequirement = 500;

    /** IANA zone id used to compute journal days and the daily boundary. */
    public String timezone = "America/New_York";

    /** Local time (HH:mm) at which the journal day rolls over and access is revoked. */
    public String resetTime = "00:00";

    /** Guild/server ID that this bot runs in. */
    public String guildId = "";

    /** The shared channel unlocked by meeting the daily requirement. */
    public String sharedChannelId = "";

    /** Guild text channels whose name starts with this prefix are journal channels. */
    public String journalChannelPrefix = "journal-";

    /** Optional category for newly created journal channels. */
    public String journalCategoryId = "";

    /** Operator channel for alerts. */
    public String logChannelId = "";

    public boolean enableLogs = false;

    /** Post a short notice in the shared channel after each daily reset. */
    public boolean announceResets = true;

    /** How often pending grants/revokes are retried. */
    public int reconcileIntervalMinutes = 5;

    public DatabaseSettings database = new DatabaseSettings();
    public AccessSettings access = new AccessSettings();
    public InsightSettings insight = new InsightSettings();

    public static class DatabaseSettings {
        public String jdbcUrl = "jdbc:postgresql://localhost:5432/journalbot";
        public String username = "journalbot";
        public int maximumPoolSize = 5;
    }

    /** Retry budget for grant/revoke calls against Discord. */
    public static class AccessSettings {
        public int timeoutSeconds = 5;
        public int maxAttempts = 3;
        public long initialBackoffMillis = 500;
    }

    public static class InsightSettings {
        public String model = "gemini-2.0-flash";
        public String endpoint = "https://generativelanguage.googleapis.com/v1beta/models/";
        public int timeoutSeconds = 60;
    }

    /**
     * DAILY_WORD_REQUIREMENT and TIMEZONE from the environment win over the file.
     * A non-numeric requirement becomes 0 so validation rejects it.
     */
    public void applyEnvOverrides(Map<String, String> env) {
        String req = env.get("DAILY_WORD_REQUIREMENT");
        if (req != null && !req.isBlank()) {
            try {
                dailyWordRequirement = Integer.parseInt(req.trim());
            } catch (NumberFormatException e) {
                dailyWordRequirement = 0;
            }
        }
        String tz = env.get("TIMEZONE");
        if (tz != null && !tz.isBlank()) {
            timezone = tz.trim();
        }
    }
}
