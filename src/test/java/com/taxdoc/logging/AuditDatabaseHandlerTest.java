package com.taxdoc.logging;

import com.taxdoc.logging.AuditLog.Stage;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.logging.Level;
import java.util.logging.LogRecord;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AuditDatabaseHandlerTest {

    private static final String JDBC_URL = "jdbc:h2:mem:audit-logs;MODE=PostgreSQL;DATABASE_TO_UPPER=false;DB_CLOSE_DELAY=-1";
    private static final String JDBC_USER = "sa";
    private static final String JDBC_PASS = "";

    @BeforeAll
    static void setUpDatabase() throws SQLException {
        try {
            Class.forName("org.h2.Driver");
        } catch (ClassNotFoundException e) {
            throw new IllegalStateException("H2 driver not found on classpath", e);
        }
        System.setProperty("taxdoc.audit.jdbc.url", JDBC_URL);
        System.setProperty("taxdoc.audit.jdbc.user", JDBC_USER);
        System.setProperty("taxdoc.audit.jdbc.password", JDBC_PASS);
        System.setProperty("taxdoc.audit.jdbc.poolSize", "2");

        try (Connection connection = DriverManager.getConnection(JDBC_URL, JDBC_USER, JDBC_PASS);
             Statement statement = connection.createStatement()) {
            statement.execute("DROP TABLE IF EXISTS audit_log");
            statement.execute("""
                CREATE TABLE audit_log (
                    logged_at   TIMESTAMP NOT NULL,
                    level       VARCHAR(16) NOT NULL,
                    run_id      VARCHAR(32),
                    stage       VARCHAR(16),
                    subject     TEXT,
                    message     TEXT,
                    thrown_type VARCHAR(256),
                    thrown_msg  TEXT
                )
                """);
        }
    }

    @AfterEach
    void clearTable() throws SQLException {
        try (Connection connection = DriverManager.getConnection(JDBC_URL, JDBC_USER, JDBC_PASS);
             Statement statement = connection.createStatement()) {
            statement.executeUpdate("DELETE FROM audit_log");
        }
    }

    @AfterAll
    static void tearDown() {
        System.clearProperty("taxdoc.audit.jdbc.url");
        System.clearProperty("taxdoc.audit.jdbc.user");
        System.clearProperty("taxdoc.audit.jdbc.password");
        System.clearProperty("taxdoc.audit.jdbc.poolSize");
    }

    @Test
    void auditEntryIsStoredByRunStageAndSubject() throws Exception {
        AuditDatabaseHandler handler = new AuditDatabaseHandler();
        boolean closed = false;
        try {
            AuditLog.Entry entry = new AuditLog.Entry("20250831-101500", Stage.SEQ, "notice.pdf#2",
                "original=1003 final=1013 (slot 2 via exact match)");
            handler.publish(auditRecord(Level.INFO, entry));
            handler.publish(auditRecord(Level.WARNING,
                new AuditLog.Entry("20250831-101500", Stage.PROTECTED, "6001", "violation, period source=NONE")));

            handler.close();
            closed = true;

            try (Connection connection = DriverManager.getConnection(JDBC_URL, JDBC_USER, JDBC_PASS);
                 PreparedStatement statement = connection.prepareStatement(
                     "SELECT level, run_id, stage, subject, message FROM audit_log ORDER BY stage DESC")) {
                ResultSet resultSet = statement.executeQuery();
                assertTrue(resultSet.next(), "No audit record persisted");
                assertEquals("INFO", resultSet.getString("level"));
                assertEquals("20250831-101500", resultSet.getString("run_id"));
                assertEquals("SEQ", resultSet.getString("stage"));
                assertEquals("notice.pdf#2", resultSet.getString("subject"));
                assertEquals("original=1003 final=1013 (slot 2 via exact match)", resultSet.getString("message"));
                assertTrue(resultSet.next(), "Warning entry missing");
                assertEquals("WARNING", resultSet.getString("level"));
                assertEquals("PROTECTED", resultSet.getString("stage"));
                assertFalse(resultSet.next());
            }
        } finally {
            if (!closed) {
                handler.close();
            }
        }
    }

    @Test
    void plainWarningsAreKeptAndPlainInfoIsNot() throws Exception {
        AuditDatabaseHandler handler = new AuditDatabaseHandler();
        boolean closed = false;
        try {
            handler.publish(new LogRecord(Level.INFO, "Run 20250831-101500: 3 inputs"));
            LogRecord failure = new LogRecord(Level.SEVERE, "Could not read broken.pdf");
            failure.setThrown(new IllegalStateException("boom"));
            handler.publish(failure);

            handler.close();
            closed = true;

            try (Connection connection = DriverManager.getConnection(JDBC_URL, JDBC_USER, JDBC_PASS);
                 PreparedStatement statement = connection.prepareStatement(
                     "SELECT run_id, stage, subject, message, thrown_type, thrown_msg FROM audit_log")) {
                ResultSet resultSet = statement.executeQuery();
                assertTrue(resultSet.next(), "No log record persisted");
                assertNull(resultSet.getString("run_id"));
                assertNull(resultSet.getString("stage"));
                assertNull(resultSet.getString("subject"));
                assertEquals("Could not read broken.pdf", resultSet.getString("message"));
                assertEquals(IllegalStateException.class.getName(), resultSet.getString("thrown_type"));
                assertEquals("boom", resultSet.getString("thrown_msg"));
                assertFalse(resultSet.next(), "INFO record without audit entry was persisted");
            }
        } finally {
            if (!closed) {
                handler.close();
            }
        }
    }

    private static LogRecord auditRecord(Level level, AuditLog.Entry entry) {
        LogRecord record = new LogRecord(level, entry.line());
        record.setParameters(new Object[] {entry});
        return record;
    }
}
