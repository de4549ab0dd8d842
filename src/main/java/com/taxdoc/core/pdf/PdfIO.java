package com.taxdoc.core.pdf;

import org.apache.pdfbox.pdmodel.PDDocument;

import java.io.IOException;
import java.nio.file.Path;

/**
 * PDF loading and page copying. Callers own and close every returned document.
 */
public interface PdfIO {

    PDDocument load(Path file) throws IOException;

    int pageCount(PDDocument document);

    PDDocument copySinglePage(PDDocument document, int pageIndex) throws IOException;
}
