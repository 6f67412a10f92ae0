package org.gudu0.journalbot.util;

import java.io.PrintStream;
import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;

/**
 * Tagged console output. DEBUG lines show per-entry access decisions and are off unless
 * {@code JOURNALBOT_DEBUG=true}. Colors are dropped when stdout is not a terminal or
 * {@code NO_COLOR} is set, so redirected logs stay plain.
 */
public final class ConsoleLog {
    private ConsoleLog() {}

    @SuppressWarnings("CanBeFinal")
    public static volatile boolean DEBUG = Boolean.parseBoolean(System.getenv("JOURNALBOT_DEBUG"));

    enum Level {
        DEBUG("32"),
        INFO(null),
        WARN("93"),
        ERROR("31");

        private final String ansi;

        Level(String ansi) {
            this.ansi = ansi;
        }
    }

    private static final boolean COLOR = System.console() != null && System.getenv("NO_COLOR") == null;

    private static final DateTimeFormatter TS =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss.SSS")
                    .withZone(ZoneId.systemDefault());

    static String format(Level level, String tag, String msg, Instant at, String thread, boolean color) {
        String lvl = color && level.ansi != null
                ? "\u001B[" + level.ansi + "m" + level.name() + "\u001B[0m"
                : level.name();
        return "[" + TS.format(at) + "] [" + lvl + "] [" + thread + "] [" + tag + "] " + msg;
    }

    private static void emit(Level level, String tag, String msg, Throwable t) {
        PrintStream out = level == Level.ERROR ? System.err : System.out;
        out.println(format(level, tag, msg, Instant.now(), Thread.currentThread().getName(), COLOR));
        if (t != null) t.printStackTrace(out);
    }

    public static void info(String tag, String msg) {
        emit(Level.INFO, tag, msg, null);
    }

    public static void warn(String tag, String msg) {
        emit(Level.WARN, tag, msg, null);
    }

    public static void debug(String tag, String msg) {
        if (DEBUG) emit(Level.DEBUG, tag, msg, null);
    }

    public static void error(String tag, String msg) {
        emit(Level.ERROR, tag, msg, null);
    }

    public static void error(String tag, String msg, Throwable t) {
        emit(Level.ERROR, tag, msg, t);
    }
}
