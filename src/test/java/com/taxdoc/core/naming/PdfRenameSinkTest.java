package com.taxdoc.core.naming;

import com.taxdoc.core.model.SplitUnit;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PdfRenameSinkTest {

    @TempDir
    Path tempDir;

    @Test
    void copiesUnitUnderFinalName() throws IOException {
        Path source = Files.write(tempDir.resolve("scan.pdf"), new byte[]{1, 2, 3});
        PdfRenameSink sink = new PdfRenameSink(tempDir.resolve("out"));

        RenameOutcome outcome = sink.finalize(SplitUnit.wholeDocument(source, ""), "0001", "法人税申告書", "2508");

        assertTrue(outcome.success(), outcome.message());
        assertEquals("0001_法人税申告書_2508.pdf", outcome.target().getFileName().toString());
        assertArrayEquals(new byte[]{1, 2, 3}, Files.readAllBytes(outcome.target()));
        assertTrue(Files.exists(source), "Source file is left in place");
    }

    @Test
    void collisionsGetNumericSuffix() throws IOException {
        Path first = Files.write(tempDir.resolve("a.pdf"), new byte[]{1});
        Path second = Files.write(tempDir.resolve("b.pdf"), new byte[]{2});
        PdfRenameSink sink = new PdfRenameSink(tempDir.resolve("out"));

        RenameOutcome one = sink.finalize(SplitUnit.wholeDocument(first, ""), "5002", "総勘定元帳", "2503");
        RenameOutcome two = sink.finalize(SplitUnit.wholeDocument(second, ""), "5002", "総勘定元帳", "2503");

        assertEquals("5002_総勘定元帳_2503.pdf", one.target().getFileName().toString());
        assertEquals("5002_総勘定元帳_2503_2.pdf", two.target().getFileName().toString());
        assertArrayEquals(new byte[]{1}, Files.readAllBytes(one.target()), "Existing file is never overwritten");
    }

    @Test
    void unrepresentableNameIsReportedNotThrown() throws IOException {
        Path source = Files.write(tempDir.resolve("scan.pdf"), new byte[]{1});
        PdfRenameSink sink = new PdfRenameSink(tempDir.resolve("out"));

        RenameOutcome outcome = sink.finalize(SplitUnit.wholeDocument(source, ""), "0001", "法人税申告書", "25\u000008");

        assertFalse(outcome.success());
        assertTrue(outcome.message().contains("not representable"), outcome.message());
    }

    @Test
    void missingPageFileIsReportedNotThrown() {
        SplitUnit unit = new SplitUnit(tempDir.resolve("bundle.pdf"), 2, 3, null, "", "page copy failed");

        RenameOutcome outcome = new PdfRenameSink(tempDir).finalize(unit, "1003", "受信通知", "2508");

        assertFalse(outcome.success());
        assertTrue(outcome.message().contains("bundle.pdf#p3"), outcome.message());
    }
}
