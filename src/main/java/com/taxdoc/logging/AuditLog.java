package com.taxdoc.logging;

import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;

/**
 * Emits the one-line {@code [AUDIT][STAGE]} records written at every decision point. Each record
 * carries its {@link Entry} as the single log parameter, so handlers can store the run id, stage
 * and subject without parsing the line.
 */
public final class AuditLog {

    private static final Logger LOGGER = AppLogger.get();

    public enum Stage {
        BUNDLE,
        SPLIT,
        CLASSIFY,
        SEQ,
        PROTECTED,
        PERIOD,
        FILE
    }

    /**
     * One audited decision.
     */
    public record Entry(String runId, Stage stage, String subject, String message) {

        public String line() {
            return format(stage, subject, message);
        }
    }

    private AuditLog() {
    }

    public static void record(String runId, Stage stage, String subject, String message) {
        log(Level.INFO, new Entry(runId, stage, subject, message));
    }

    public static void warn(String runId, Stage stage, String subject, String message) {
        log(Level.WARNING, new Entry(runId, stage, subject, message));
    }

    private static void log(Level level, Entry entry) {
        if (!LOGGER.isLoggable(level)) {
            return;
        }
        LogRecord record = new LogRecord(level, entry.line());
        record.setLoggerName(LOGGER.getName());
        record.setParameters(new Object[] {entry});
        LOGGER.log(record);
    }

    public static String format(Stage stage, String subject, String message) {
        String who = subject == null || subject.isBlank() ? "-" : subject;
        return "[AUDIT][%s] %s: %s".formatted(stage.name(), who, message);
    }

    /**
     * Audit entry carried by a log record, or {@code null} for ordinary log messages.
     */
    public static Entry entryOf(LogRecord record) {
        Object[] params = record == null ? null : record.getParameters();
        if (params != null && params.length == 1 && params[0] instanceof Entry entry) {
            return entry;
        }
        return null;
    }
}
