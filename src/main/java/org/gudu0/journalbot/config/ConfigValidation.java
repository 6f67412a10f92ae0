package org.gudu0.journalbot.config;

import java.time.DateTimeException;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;

public final class ConfigValidation {
    private ConfigValidation() {}

    /**
     * Collects every problem instead of stopping at the first one.
     *
     * @throws ConfigInvalidException if anything is wrong
     */
    public static void validate(BotConfig cfg) {
        List<String> problems = new ArrayList<>();

        if (cfg.dailyWordRequirement <= 0) {
            problems.add("dailyWordRequirement must be positive (was " + cfg.dailyWordRequirement + ")");
        }

        try {
            ZoneId.of(cfg.timezone);
        } catch (DateTimeException | NullPointerException e) {
            problems.add("timezone is not a valid zone id: " + cfg.timezone);
        }

        try {
            LocalTime.parse(cfg.resetTime);
        } catch (DateTimeParseException | NullPointerException e) {
            problems.add("resetTime must be HH:mm (was " + cfg.resetTime + ")");
        }

        requireSnowflake(problems, "guildId", cfg.guildId);
        requireSnowflake(problems, "sharedChannelId", cfg.sharedChannelId);

        if (cfg.journalChannelPrefix == null || cfg.journalChannelPrefix.isBlank()) {
            problems.add("journalChannelPrefix must not be blank");
        }

        if (cfg.database == null || cfg.database.jdbcUrl == null || cfg.database.jdbcUrl.isBlank()) {
            problems.add("database.jdbcUrl is required");
        } else if (cfg.database.maximumPoolSize < 1) {
            problems.add("database.maximumPoolSize must be >= 1");
        }

        if (cfg.access == null) {
            problems.add("access settings missing");
        } else {
            if (cfg.access.maxAttempts < 1) problems.add("access.maxAttempts must be >= 1");
            if (cfg.access.timeoutSeconds < 1) problems.add("access.timeoutSeconds must be >= 1");
            if (cfg.access.initialBackoffMillis < 0) problems.add("access.initialBackoffMillis must be >= 0");
        }

        if (cfg.reconcileIntervalMinutes < 1) {
            problems.add("reconcileIntervalMinutes must be >= 1");
        }

        if (!problems.isEmpty()) throw new ConfigInvalidException(problems);
    }

    private static void requireSnowflake(List<String> problems, String name, String value) {
        if (value == null || value.isBlank()) {
            problems.add(name + " is required");
            return;
        }
        try {
            if (Long.parseLong(value.trim()) <= 0) problems.add(name + " must be a positive id");
        } catch (NumberFormatException e) {
            problems.add(name + " is not a numeric id: " + value);
        }
    }
}
