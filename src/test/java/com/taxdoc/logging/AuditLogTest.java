package com.taxdoc.logging;

import com.taxdoc.logging.AuditLog.Stage;
import org.junit.jupiter.api.Test;

import java.util.logging.Level;
import java.util.logging.LogRecord;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

class AuditLogTest {

    @Test
    void formatsStageSubjectAndMessage() {
        assertEquals("[AUDIT][SEQ] 1003: original=1003 final=1013",
            AuditLog.format(Stage.SEQ, "1003", "original=1003 final=1013"));
        assertEquals("[AUDIT][FILE] -: started", AuditLog.format(Stage.FILE, " ", "started"));
    }

    @Test
    void entryIsReadBackFromItsLogRecord() {
        AuditLog.Entry entry = new AuditLog.Entry("run1", Stage.PROTECTED, "6001", "period=2508 source=UI");
        LogRecord record = new LogRecord(Level.INFO, entry.line());
        record.setParameters(new Object[] {entry});

        assertEquals(entry, AuditLog.entryOf(record));
        assertEquals("[AUDIT][PROTECTED] 6001: period=2508 source=UI", entry.line());
    }

    @Test
    void plainRecordsCarryNoEntry() {
        LogRecord plain = new LogRecord(Level.INFO, "Processed {0} files");
        assertNull(AuditLog.entryOf(plain));
        plain.setParameters(new Object[] {3});
        assertNull(AuditLog.entryOf(plain));
        assertNull(AuditLog.entryOf(null));
    }
}
