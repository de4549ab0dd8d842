package com.taxdoc.core.naming;

import java.text.Normalizer;
import java.util.Locale;

/**
 * Builds output names of the form {@code {code}_{qualifier}_{YYMM}.{ext}} and keeps them
 * filesystem safe on Windows and macOS.
 */
public final class FinalNameBuilder {

    private static final int MAX_QUALIFIER_LENGTH = 80;

    private FinalNameBuilder() {
    }

    /**
     * Qualifier text for a unit: jurisdiction name first when there is one, then the document label.
     */
    public static String qualifier(String label, String jurisdiction) {
        String cleanLabel = label == null ? "" : label.strip();
        if (jurisdiction == null || jurisdiction.isBlank()) {
            return cleanLabel;
        }
        return cleanLabel.isEmpty() ? jurisdiction.strip() : jurisdiction.strip() + "_" + cleanLabel;
    }

    public static String build(String code, String qualifierText, String period, String extension) {
        if (code == null || code.isBlank()) {
            throw new IllegalArgumentException("code is required");
        }
        StringBuilder name = new StringBuilder(code.strip());
        String qualifier = sanitize(qualifierText);
        if (!qualifier.isEmpty()) {
            name.append('_').append(qualifier);
        }
        if (period != null && !period.isBlank()) {
            name.append('_').append(period.strip());
        }
        String ext = extension == null || extension.isBlank() ? "pdf" : extension.toLowerCase(Locale.ROOT);
        return name.append('.').append(ext).toString();
    }

    public static String sanitize(String input) {
        if (input == null || input.isBlank()) {
            return "";
        }
        String value = Normalizer.normalize(input, Normalizer.Form.NFC)
            .replace('/', '-')
            .replace('\\', '-')
            .replace(':', '-')
            .replace('*', '-')
            .replace('?', '-')
            .replace('"', '\'')
            .replace('<', '(')
            .replace('>', ')')
            .replace('|', '-')
            .replaceAll("[\\p{Cntrl}]", "")
            .replaceAll("[\\s\\u3000]+", "_")
            .strip();
        if (value.length() > MAX_QUALIFIER_LENGTH) {
            value = value.substring(0, MAX_QUALIFIER_LENGTH);
        }
        return value;
    }

    public static String extensionOf(String fileName) {
        if (fileName == null) {
            return "pdf";
        }
        int dot = fileName.lastIndexOf('.');
        if (dot < 0 || dot == fileName.length() - 1) {
            return "pdf";
        }
        return fileName.substring(dot + 1).toLowerCase(Locale.ROOT);
    }
}
