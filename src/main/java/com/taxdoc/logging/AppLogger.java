package com.taxdoc.logging;

import java.io.UnsupportedEncodingException;
import java.util.logging.Formatter;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;
import java.util.logging.StreamHandler;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * Provides the shared logger for the renamer. Console output is always on; the audit database
 * handler is attached only when a JDBC URL is configured.
 */
public final class AppLogger {
    public static final String LOGGER_NAME = "com.taxdoc.TaxDocRenamer";

    private static final Logger LOGGER = createLogger();

    private AppLogger() {
    }

    public static Logger get() {
        return LOGGER;
    }

    private static Logger createLogger() {
        Logger logger = Logger.getLogger(LOGGER_NAME);
        logger.setUseParentHandlers(false);
        Formatter formatter = new Formatter() {
            @Override
            public String format(LogRecord record) {
                String text = AuditLog.entryOf(record) != null ? record.getMessage() : formatMessage(record);
                String line = "%s %s%n".formatted(record.getLevel().getName(), text);
                if (record.getThrown() != null) {
                    line += "  caused by " + record.getThrown() + System.lineSeparator();
                }
                return line;
            }
        };

        StreamHandler consoleHandler = new StreamHandler(System.out, formatter) {
            @Override
            public synchronized void publish(LogRecord record) {
                super.publish(record);
                flush();
            }
        };
        try {
            consoleHandler.setEncoding(UTF_8.name());
        } catch (UnsupportedEncodingException ex) {
            System.err.println("UTF-8 console encoding unavailable, using platform default: " + ex.getMessage());
        }
        consoleHandler.setLevel(Level.ALL);
        logger.addHandler(consoleHandler);
        logger.setLevel(Level.INFO);

        try {
            AuditDatabaseHandler dbHandler = new AuditDatabaseHandler();
            dbHandler.setLevel(Level.INFO);
            logger.addHandler(dbHandler);
        } catch (IllegalStateException ex) {
            logger.fine("Audit database disabled: " + ex.getMessage());
        } catch (RuntimeException ex) {
            logger.warning("Failed to initialize audit database logging: " + ex.getMessage());
        }
        return logger;
    }
}
