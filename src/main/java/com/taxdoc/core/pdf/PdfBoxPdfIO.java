package com.taxdoc.core.pdf;

import org.apache.pdfbox.multipdf.Splitter;
import org.apache.pdfbox.pdmodel.PDDocument;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

public final class PdfBoxPdfIO implements PdfIO {

    @Override
    public PDDocument load(Path file) throws IOException {
        if (file == null || !Files.isRegularFile(file)) {
            throw new IOException("PDF not found: " + file);
        }
        return PDDocument.load(file.toFile());
    }

    @Override
    public int pageCount(PDDocument document) {
        return document.getNumberOfPages();
    }

    @Override
    public PDDocument copySinglePage(PDDocument document, int pageIndex) throws IOException {
        if (pageIndex < 0 || pageIndex >= document.getNumberOfPages()) {
            throw new IOException("Page index %d out of range (pages=%d)".formatted(pageIndex, document.getNumberOfPages()));
        }
        Splitter splitter = new Splitter();
        splitter.setStartPage(pageIndex + 1);
        splitter.setEndPage(pageIndex + 1);
        splitter.setSplitAtPage(1);
        List<PDDocument> parts = splitter.split(document);
        if (parts.size() != 1) {
            for (PDDocument part : parts) {
                part.close();
            }
            throw new IOException("Expected one page for index %d, got %d documents".formatted(pageIndex, parts.size()));
        }
        return parts.get(0);
    }
}
