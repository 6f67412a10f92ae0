package org.gudu0.journalbot.util;

import java.nio.file.Files;
import java.nio.file.Path;

public final class BotPaths {
    private BotPaths() {}

    public static final Path DATA = Path.of("data");

    public static final Path CONFIG_FILE = DATA.resolve("config.json");

    public static void ensureBaseDirs() {
        try {
            Files.createDirectories(DATA);
            ConsoleLog.info("BotPaths", "Ensured data dir: " + DATA.toAbsolutePath());
        } catch (Exception e) {
            ConsoleLog.error("BotPaths", "Failed to create data dir: " + e.getMessage(), e);
        }
    }
}
