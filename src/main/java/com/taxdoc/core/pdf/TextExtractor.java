package com.taxdoc.core.pdf;

import org.apache.pdfbox.pdmodel.PDDocument;

import java.awt.geom.Rectangle2D;
import java.io.IOException;

/**
 * Source of page text. Page indices are 0-based.
 */
public interface TextExtractor {

    String extractPage(PDDocument document, int pageIndex) throws IOException;

    /**
     * Text inside {@code region}, in PDF user-space units measured from the top-left corner.
     */
    String extractRegion(PDDocument document, int pageIndex, Rectangle2D region) throws IOException;
}
