package com.taxdoc.core.pdf;

import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.text.PDFTextStripper;
import org.apache.pdfbox.text.PDFTextStripperByArea;

import java.awt.geom.Rectangle2D;
import java.io.IOException;

/**
 * {@link TextExtractor} backed by the PDF text layer. Scanned pages without a text layer yield
 * empty strings.
 */
public final class PdfBoxTextExtractor implements TextExtractor {

    private static final String REGION_NAME = "region";

    @Override
    public String extractPage(PDDocument document, int pageIndex) throws IOException {
        checkIndex(document, pageIndex);
        PDFTextStripper stripper = new PDFTextStripper();
        stripper.setSortByPosition(true);
        stripper.setStartPage(pageIndex + 1);
        stripper.setEndPage(pageIndex + 1);
        String text = stripper.getText(document);
        return text == null ? "" : text;
    }

    @Override
    public String extractRegion(PDDocument document, int pageIndex, Rectangle2D region) throws IOException {
        checkIndex(document, pageIndex);
        PDFTextStripperByArea stripper = new PDFTextStripperByArea();
        stripper.setSortByPosition(true);
        stripper.addRegion(REGION_NAME, region);
        PDPage page = document.getPage(pageIndex);
        stripper.extractRegions(page);
        String text = stripper.getTextForRegion(REGION_NAME);
        return text == null ? "" : text;
    }

    /**
     * Top band of a page where notices carry the issuing office and addressee.
     */
    public static Rectangle2D headerBand(PDDocument document, int pageIndex, double fraction) {
        PDPage page = document.getPage(pageIndex);
        float width = page.getMediaBox().getWidth();
        float height = page.getMediaBox().getHeight();
        return new Rectangle2D.Double(0, 0, width, height * fraction);
    }

    private static void checkIndex(PDDocument document, int pageIndex) throws IOException {
        if (pageIndex < 0 || pageIndex >= document.getNumberOfPages()) {
            throw new IOException("Page index %d out of range (pages=%d)".formatted(pageIndex, document.getNumberOfPages()));
        }
    }
}
