package com.taxdoc.core.model;

import java.nio.file.Path;
import java.util.Objects;

/**
 * A single-document unit produced by splitting, or the whole file when no split happened
 * ({@code pageIndex == WHOLE_DOCUMENT}). {@code pageIndex} is 0-based, {@code ordinal} 1-based.
 * {@code pageFile} is the file holding just this unit, or {@code null} when it could not be written.
 */
public record SplitUnit(Path sourceFile, int pageIndex, int ordinal, Path pageFile, String text, String errorMarker) {

    public static final int WHOLE_DOCUMENT = -1;

    public SplitUnit {
        Objects.requireNonNull(sourceFile, "sourceFile");
        if (ordinal < 1) {
            throw new IllegalArgumentException("ordinal must be >= 1: " + ordinal);
        }
        if (pageIndex < WHOLE_DOCUMENT) {
            throw new IllegalArgumentException("pageIndex out of range: " + pageIndex);
        }
        text = text == null ? "" : text;
        errorMarker = errorMarker == null ? "" : errorMarker;
    }

    public static SplitUnit wholeDocument(Path sourceFile, String text) {
        return wholeDocument(sourceFile, text, "");
    }

    public static SplitUnit wholeDocument(Path sourceFile, String text, String errorMarker) {
        return new SplitUnit(sourceFile, WHOLE_DOCUMENT, 1, sourceFile, text, errorMarker);
    }

    public boolean isWholeDocument() {
        return pageIndex == WHOLE_DOCUMENT;
    }

    public boolean isUnreadable() {
        return !errorMarker.isEmpty();
    }

    public String describe() {
        String name = sourceFile.getFileName() == null ? sourceFile.toString() : sourceFile.getFileName().toString();
        return isWholeDocument() ? name : "%s#p%d".formatted(name, pageIndex + 1);
    }
}
