package com.taxdoc.core.pdf;

import com.taxdoc.core.model.BundleDecision;
import com.taxdoc.core.model.BundleDecision.FamilyCounters;
import com.taxdoc.core.model.BundleFamily;
import com.taxdoc.core.model.SplitUnit;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class BundleSplitterTest {

    private static final BundleDecision LOCAL_BUNDLE = new BundleDecision(true, BundleFamily.LOCAL, 0.8, 3,
        new FamilyCounters(2, 1, 3), FamilyCounters.EMPTY, "thresholds met");

    @TempDir
    Path tempDir;

    @Test
    void everyPageBecomesOneUnitWithContiguousOrdinals() throws IOException {
        Path source = TestPdfs.blankPages(tempDir.resolve("bundle.pdf"), 4);
        BundleSplitter splitter = new BundleSplitter(new PdfBoxTextExtractor(), new PdfBoxPdfIO());

        try (PDDocument doc = PDDocument.load(source.toFile())) {
            List<SplitUnit> units = splitter.split(doc, source, LOCAL_BUNDLE, false, tempDir.resolve("work"));

            assertEquals(4, units.size());
            for (int i = 0; i < units.size(); i++) {
                SplitUnit unit = units.get(i);
                assertEquals(i, unit.pageIndex());
                assertEquals(i + 1, unit.ordinal());
                assertFalse(unit.isWholeDocument());
                assertTrue(unit.text().contains("page " + (i + 1)), unit.text());
                assertNotNull(unit.pageFile());
                assertEquals("page_%05d.pdf".formatted(i + 1), unit.pageFile().getFileName().toString());
                try (PDDocument single = PDDocument.load(unit.pageFile().toFile())) {
                    assertEquals(1, single.getNumberOfPages());
                }
            }
        }
    }

    @Test
    void splitWithoutBundleOrForceIsRejected() throws IOException {
        Path source = TestPdfs.blankPages(tempDir.resolve("plain.pdf"), 2);
        BundleSplitter splitter = new BundleSplitter(new PdfBoxTextExtractor(), new PdfBoxPdfIO());

        try (PDDocument doc = PDDocument.load(source.toFile())) {
            BundleDecision notBundle = BundleDecision.notBundle(2, "below threshold");
            assertThrows(IllegalStateException.class,
                () -> splitter.split(doc, source, notBundle, false, tempDir.resolve("work")));

            List<SplitUnit> forced = splitter.split(doc, source, notBundle, true, tempDir.resolve("forced"));
            assertEquals(2, forced.size());
        }
    }

    @Test
    void unreadablePageIsKeptWithErrorMarker() throws IOException {
        Path source = TestPdfs.blankPages(tempDir.resolve("broken.pdf"), 3);
        TextExtractor extractor = MappedTextExtractor.of("one", "two", "three").failOn(1);
        BundleSplitter splitter = new BundleSplitter(extractor, new PdfBoxPdfIO());

        try (PDDocument doc = PDDocument.load(source.toFile())) {
            List<SplitUnit> units = splitter.split(doc, source, LOCAL_BUNDLE, false, tempDir.resolve("work"));

            assertEquals(3, units.size());
            SplitUnit broken = units.get(1);
            assertTrue(broken.isUnreadable());
            assertEquals("", broken.text());
            assertTrue(Files.exists(broken.pageFile()), "Page file is still written");
            assertFalse(units.get(2).isUnreadable());
        }
    }

    @Test
    void failedPageCopyLeavesNoPageFile() throws IOException {
        Path source = TestPdfs.blankPages(tempDir.resolve("copy.pdf"), 2);
        PdfBoxPdfIO real = new PdfBoxPdfIO();
        PdfIO failingSecondPage = new PdfIO() {
            @Override
            public PDDocument load(Path file) throws IOException {
                return real.load(file);
            }

            @Override
            public int pageCount(PDDocument document) {
                return real.pageCount(document);
            }

            @Override
            public PDDocument copySinglePage(PDDocument document, int pageIndex) throws IOException {
                if (pageIndex == 1) {
                    throw new IOException("disk full");
                }
                return real.copySinglePage(document, pageIndex);
            }
        };
        BundleSplitter splitter = new BundleSplitter(MappedTextExtractor.of("a", "b"), failingSecondPage);

        try (PDDocument doc = real.load(source)) {
            List<SplitUnit> units = splitter.split(doc, source, LOCAL_BUNDLE, false, tempDir.resolve("work"));

            assertEquals(2, units.size());
            assertNotNull(units.get(0).pageFile());
            assertNull(units.get(1).pageFile());
            assertTrue(units.get(1).errorMarker().contains("disk full"));
        }
    }
}
