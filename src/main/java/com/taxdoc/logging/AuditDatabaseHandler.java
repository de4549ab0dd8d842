package com.taxdoc.logging;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;

import java.io.IOException;
import java.io.InputStream;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.util.Locale;
import java.util.Objects;
import java.util.Properties;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;

/**
 * Asynchronously persists the {@code [AUDIT]} decision trail to a central {@code audit_log} table,
 * one row per decision keyed by run id, stage and subject. Warnings and errors outside the trail
 * are kept as rows without a stage. Construction fails with {@link IllegalStateException} when no
 * JDBC URL is configured, which callers treat as "console only".
 */
public final class AuditDatabaseHandler extends Handler {

    private static final String INSERT_SQL = """
        INSERT INTO audit_log (
            logged_at,
            level,
            run_id,
            stage,
            subject,
            message,
            thrown_type,
            thrown_msg
        ) VALUES (?, ?, ?, ?, ?, ?, ?, ?)
        """;

    private final BlockingQueue<LogRecord> queue = new LinkedBlockingQueue<>(2048);
    private final HikariDataSource dataSource;
    private final Thread worker;

    private volatile boolean running = true;

    public AuditDatabaseHandler() {
        DbConfig config = DbConfig.load();
        if (!config.enabled()) {
            throw new IllegalStateException("no JDBC configuration provided");
        }
        this.dataSource = createDataSource(config);
        this.worker = new Thread(this::drainLoop, "audit-log-writer");
        this.worker.setDaemon(true);
        this.worker.start();
        setLevel(Level.INFO);
    }

    private void drainLoop() {
        while (running && !Thread.currentThread().isInterrupted()) {
            try {
                LogRecord record = queue.poll(1, TimeUnit.SECONDS);
                if (record != null) {
                    writeRecord(record);
                }
            } catch (InterruptedException interrupted) {
                Thread.currentThread().interrupt();
            } catch (SQLException | RuntimeException ex) {
                System.err.println("AuditDatabaseHandler failure: " + ex.getMessage());
            }
        }

        // drain what is left after close(); the pool refuses interrupted borrowers
        boolean interrupted = Thread.interrupted();
        LogRecord record;
        while ((record = queue.poll()) != null) {
            try {
                writeRecord(record);
            } catch (SQLException | RuntimeException ex) {
                System.err.println("AuditDatabaseHandler shutdown failure: " + ex.getMessage());
            }
        }
        if (interrupted) {
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Queues audit entries and records at WARNING or above; other plain messages stay on the console.
     */
    @Override
    public void publish(LogRecord record) {
        Objects.requireNonNull(record);
        if (!isLoggable(record) || !running) {
            return;
        }
        if (AuditLog.entryOf(record) == null && record.getLevel().intValue() < Level.WARNING.intValue()) {
            return;
        }
        if (!queue.offer(record)) {
            queue.poll();
            queue.offer(record);
        }
    }

    @Override
    public void flush() {
        // rows are written by the worker thread
    }

    @Override
    public void close() throws SecurityException {
        running = false;
        worker.interrupt();
        try {
            worker.join(TimeUnit.SECONDS.toMillis(2));
        } catch (InterruptedException interrupted) {
            Thread.currentThread().interrupt();
        }
        dataSource.close();
    }

    private void writeRecord(LogRecord record) throws SQLException {
        AuditLog.Entry entry = AuditLog.entryOf(record);
        try (Connection connection = dataSource.getConnection();
             PreparedStatement statement = connection.prepareStatement(INSERT_SQL)) {
            statement.setTimestamp(1, Timestamp.from(record.getInstant()));
            statement.setString(2, record.getLevel().getName());
            if (entry != null) {
                statement.setString(3, entry.runId());
                statement.setString(4, entry.stage().name());
                statement.setString(5, entry.subject());
                statement.setString(6, entry.message());
            } else {
                statement.setString(3, null);
                statement.setString(4, null);
                statement.setString(5, null);
                statement.setString(6, record.getMessage());
            }
            Throwable thrown = record.getThrown();
            statement.setString(7, thrown == null ? null : thrown.getClass().getName());
            statement.setString(8, thrown == null ? null : thrown.getMessage());
            statement.executeUpdate();
        }
    }

    private static HikariDataSource createDataSource(DbConfig config) {
        HikariConfig hikariConfig = new HikariConfig();
        hikariConfig.setJdbcUrl(config.url());
        hikariConfig.setUsername(config.username());
        hikariConfig.setPassword(config.password());
        hikariConfig.setMaximumPoolSize(config.poolSize());
        hikariConfig.setPoolName("AuditTrailPool");
        hikariConfig.setAutoCommit(true);
        hikariConfig.setConnectionTestQuery("SELECT 1");
        hikariConfig.setInitializationFailTimeout(-1);
        return new HikariDataSource(hikariConfig);
    }

    /**
     * Connection settings. Each key is looked up as system property {@code taxdoc.audit.<key>},
     * then environment variable {@code TAXDOC_AUDIT_<KEY>}, then {@code <key>} in
     * {@code audit-db.properties}.
     */
    private record DbConfig(String url, String username, String password, int poolSize, boolean enabled) {

        private static final int DEFAULT_POOL_SIZE = 3;

        static DbConfig load() {
            Properties file = loadFileProperties();
            String url = setting(file, "jdbc.url");
            String poolSize = setting(file, "jdbc.poolSize");
            return new DbConfig(url, setting(file, "jdbc.user"), setting(file, "jdbc.password"),
                parsePoolSize(poolSize), url != null);
        }

        private static String setting(Properties file, String key) {
            String env = "TAXDOC_AUDIT_" + key.replace('.', '_').toUpperCase(Locale.ROOT);
            for (String value : new String[] {System.getProperty("taxdoc.audit." + key), System.getenv(env),
                file.getProperty(key)}) {
                if (value != null && !value.isBlank()) {
                    return value.trim();
                }
            }
            return null;
        }

        private static Properties loadFileProperties() {
            Properties props = new Properties();
            try (InputStream stream = AuditDatabaseHandler.class
                .getClassLoader()
                .getResourceAsStream("audit-db.properties")) {
                if (stream != null) {
                    props.load(stream);
                }
            } catch (IOException ex) {
                System.err.println("Ignoring unreadable audit-db.properties: " + ex.getMessage());
            }
            return props;
        }

        private static int parsePoolSize(String raw) {
            try {
                return raw == null ? DEFAULT_POOL_SIZE : Math.max(1, Integer.parseInt(raw));
            } catch (NumberFormatException ex) {
                System.err.println("Ignoring non-numeric audit pool size " + raw);
                return DEFAULT_POOL_SIZE;
            }
        }
    }
}
