package org.gudu0.journalbot.store;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.gudu0.journalbot.config.BotConfig;
import org.gudu0.journalbot.util.ConsoleLog;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.SQLRecoverableException;
import java.sql.SQLTransientException;
import java.sql.Statement;

/**
 * Connection pool plus short, retried transactions.
 */
public final class Database implements AutoCloseable {

    private static final int MAX_ATTEMPTS = 3;
    private static final long INITIAL_BACKOFF_MS = 200;

    private final HikariDataSource dataSource;

    private Database(HikariDataSource dataSource) {
        this.dataSource = dataSource;
    }

    public static Database open(BotConfig.DatabaseSettings settings, String password) {
        HikariConfig config = new HikariConfig();
        config.setJdbcUrl(settings.jdbcUrl);
        if (settings.username != null && !settings.username.isBlank()) {
            config.setUsername(settings.username);
        }
        if (password != null) {
            config.setPassword(password);
        }
        config.setPoolName("journalbot-db");
        config.setMaximumPoolSize(settings.maximumPoolSize);
        config.setMinimumIdle(1);
        config.setConnectionTimeout(10000);
        config.setValidationTimeout(5000);
        config.setIdleTimeout(600000);
        config.setMaxLifetime(1800000);
        config.setLeakDetectionThreshold(60000);
        config.setAutoCommit(true);

        HikariDataSource ds = new HikariDataSource(config);
        ConsoleLog.info("Database", "Connection pool ready url=" + settings.jdbcUrl + " maxPool=" + settings.maximumPoolSize);
        return new Database(ds);
    }

    /** Runs db/schema.sql from the classpath. Every statement is CREATE ... IF NOT EXISTS. */
    public void applySchema() {
        String script;
        try (InputStream in = Database.class.getClassLoader().getResourceAsStream("db/schema.sql")) {
            if (in == null) throw new IllegalStateException("db/schema.sql missing from classpath");
            script = new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new IllegalStateException("Failed reading db/schema.sql: " + e.getMessage(), e);
        }

        inTransaction("applySchema", conn -> {
            int n = 0;
            try (Statement st = conn.createStatement()) {
                for (String sql : script.split(";")) {
                    String trimmed = stripComments(sql).trim();
                    if (trimmed.isEmpty()) continue;
                    st.execute(trimmed);
                    n++;
                }
            }
            ConsoleLog.info("Database", "Schema applied (" + n + " statements)");
            return null;
        });
    }

    /**
     * Runs {@code work} in one transaction, retrying transient failures with backoff.
     * Exceptions thrown by {@code work} that are not SQL failures roll back and propagate as-is.
     *
     * @throws StoreUnavailableException when the store keeps failing
     */
    public <T> T inTransaction(String what, SqlWork<T> work) {
        long backoff = INITIAL_BACKOFF_MS;
        for (int attempt = 1; ; attempt++) {
            try {
                return runOnce(work);
            } catch (SQLException e) {
                if (!isTransient(e) || attempt >= MAX_ATTEMPTS) {
                    throw new StoreUnavailableException(what + " failed after " + attempt + " attempt(s): " + e.getMessage(), e);
                }
                ConsoleLog.warn("Database", what + " transient failure (attempt " + attempt + "/" + MAX_ATTEMPTS
                        + ", sqlState=" + e.getSQLState() + "): " + e.getMessage());
                sleep(backoff);
                backoff *= 2;
            }
        }
    }

    private <T> T runOnce(SqlWork<T> work) throws SQLException {
        try (Connection conn = dataSource.getConnection()) {
            conn.setAutoCommit(false);
            try {
                T result = work.run(conn);
                conn.commit();
                return result;
            } catch (SQLException | RuntimeException e) {
                rollbackQuietly(conn, e);
                throw e;
            } finally {
                conn.setAutoCommit(true);
            }
        }
    }

    static boolean isTransient(SQLException e) {
        if (e instanceof SQLTransientException || e instanceof SQLRecoverableException) return true;
        String state = e.getSQLState();
        if (state == null) return false;
        return state.startsWith("08")        // connection exception
                || state.equals("40001")     // serialization failure / deadlock
                || state.equals("40P01")     // postgres deadlock detected
                || state.equals("HYT00")     // lock timeout
                || state.equals("90131");    // h2 concurrent update
    }

    private static void rollbackQuietly(Connection conn, Exception cause) {
        try {
            conn.rollback();
        } catch (SQLException re) {
            cause.addSuppressed(re);
        }
    }

    private static void sleep(long ms) {
        try {
            Thread.sleep(ms);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new StoreUnavailableException("Interrupted while waiting to retry", ie);
        }
    }

    private static String stripComments(String sql) {
        StringBuilder out = new StringBuilder();
        for (String line : sql.split("\n")) {
            String l = line.trim();
            if (l.startsWith("--")) continue;
            out.append(line).append('\n');
        }
        return out.toString();
    }

    public String poolStatus() {
        try {
            var pool = dataSource.getHikariPoolMXBean();
            return String.format("active=%d idle=%d waiting=%d total=%d",
                    pool.getActiveConnections(),
                    pool.getIdleConnections(),
                    pool.getThreadsAwaitingConnection(),
                    pool.getTotalConnections());
        } catch (Exception e) {
            return "unavailable: " + e.getMessage();
        }
    }

    @Override
    public void close() {
        if (!dataSource.isClosed()) {
            dataSource.close();
            ConsoleLog.info("Database", "Connection pool closed");
        }
    }
}
