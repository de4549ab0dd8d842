package com.taxdoc.core.pdf;

import com.taxdoc.core.model.BundleDecision;
import com.taxdoc.core.model.SplitUnit;
import com.taxdoc.logging.AppLogger;
import org.apache.pdfbox.pdmodel.PDDocument;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Splits a bundle into one {@link SplitUnit} per page, writing each page to {@code workDir}.
 * Every source page yields a unit, blank or unreadable pages included, and ordinals run 1..N
 * without gaps.
 */
public final class BundleSplitter {

    private static final Logger LOGGER = AppLogger.get();

    private final TextExtractor extractor;
    private final PdfIO pdfIO;

    public BundleSplitter(TextExtractor extractor, PdfIO pdfIO) {
        this.extractor = Objects.requireNonNull(extractor, "extractor");
        this.pdfIO = Objects.requireNonNull(pdfIO, "pdfIO");
    }

    /**
     * @param forced split regardless of {@code decision}
     * @throws IllegalStateException when {@code decision} is not a bundle and {@code forced} is false
     */
    public List<SplitUnit> split(PDDocument document,
                                 Path sourceFile,
                                 BundleDecision decision,
                                 boolean forced,
                                 Path workDir) throws IOException {
        if (!forced && (decision == null || !decision.isBundle())) {
            throw new IllegalStateException("Split requested for %s without a bundle decision or force flag"
                .formatted(sourceFile));
        }
        Files.createDirectories(workDir);
        int pageCount = pdfIO.pageCount(document);
        List<SplitUnit> units = new ArrayList<>(pageCount);
        for (int pageIndex = 0; pageIndex < pageCount; pageIndex++) {
            int ordinal = pageIndex + 1;
            String text = "";
            String error = "";
            try {
                text = extractor.extractPage(document, pageIndex);
            } catch (IOException | RuntimeException ex) {
                error = "text extraction failed: " + ex.getMessage();
                LOGGER.log(Level.WARNING, "Page %d of %s unreadable: %s".formatted(ordinal, sourceFile.getFileName(), ex.getMessage()));
            }
            Path pageFile = workDir.resolve(String.format("page_%05d.pdf", ordinal));
            try (PDDocument single = pdfIO.copySinglePage(document, pageIndex)) {
                single.save(pageFile.toFile());
            } catch (IOException | RuntimeException ex) {
                pageFile = null;
                error = error.isEmpty() ? "page copy failed: " + ex.getMessage() : error + "; page copy failed: " + ex.getMessage();
                LOGGER.log(Level.WARNING, "Page %d of %s could not be copied: %s".formatted(ordinal, sourceFile.getFileName(), ex.getMessage()));
            }
            units.add(new SplitUnit(sourceFile, pageIndex, ordinal, pageFile, text, error));
        }
        return units;
    }
}
