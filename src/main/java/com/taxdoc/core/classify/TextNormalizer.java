package com.taxdoc.core.classify;

import java.text.Normalizer;
import java.util.regex.Pattern;

/**
 * Canonical matching form for extracted text and keywords: NFKC folded, whitespace removed.
 * PDF text extraction splits Japanese runs at arbitrary points, so spacing carries no meaning.
 */
public final class TextNormalizer {

    private static final Pattern WHITESPACE = Pattern.compile("[\\s\\u3000]+");

    private TextNormalizer() {
    }

    public static String normalize(String raw) {
        if (raw == null || raw.isEmpty()) {
            return "";
        }
        String folded = Normalizer.normalize(raw, Normalizer.Form.NFKC);
        return WHITESPACE.matcher(folded).replaceAll("");
    }

    public static boolean containsKeyword(String normalizedText, String keyword) {
        if (normalizedText == null || normalizedText.isEmpty() || keyword == null) {
            return false;
        }
        String needle = normalize(keyword);
        return !needle.isEmpty() && normalizedText.contains(needle);
    }
}
