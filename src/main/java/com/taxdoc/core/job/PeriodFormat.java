package com.taxdoc.core.job;

import java.text.Normalizer;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * YYMM period values: validation and normalisation of what users type.
 */
public final class PeriodFormat {

    private static final Pattern YYMM = Pattern.compile("\\d{2}(0[1-9]|1[0-2])");
    private static final Pattern SHORT_YEAR = Pattern.compile("(\\d{2})[/\\-.](\\d{1,2})");
    private static final Pattern FULL_YEAR = Pattern.compile("(\\d{4})[/\\-.年](\\d{1,2})月?");
    private static final Pattern COMPACT_FULL_YEAR = Pattern.compile("(\\d{4})(\\d{2})");

    private PeriodFormat() {
    }

    public static boolean isValid(String value) {
        return value != null && YYMM.matcher(value).matches();
    }

    /**
     * Accepts {@code 2508}, {@code 25/08}, {@code 25-8}, {@code 2025-08}, {@code 202508},
     * {@code 2025年8月} and full-width digits. Returns empty when the value is not a real month.
     */
    public static Optional<String> normalize(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        String value = Normalizer.normalize(raw, Normalizer.Form.NFKC).strip();
        if (value.isEmpty()) {
            return Optional.empty();
        }
        if (YYMM.matcher(value).matches()) {
            return Optional.of(value);
        }
        Matcher matcher = SHORT_YEAR.matcher(value);
        if (matcher.matches()) {
            return of(matcher.group(1), matcher.group(2));
        }
        matcher = FULL_YEAR.matcher(value);
        if (matcher.matches()) {
            return of(matcher.group(1).substring(2), matcher.group(2));
        }
        matcher = COMPACT_FULL_YEAR.matcher(value);
        if (matcher.matches()) {
            return of(matcher.group(1).substring(2), matcher.group(2));
        }
        return Optional.empty();
    }

    static Optional<String> of(String twoDigitYear, String month) {
        int m;
        try {
            m = Integer.parseInt(month);
        } catch (NumberFormatException ex) {
            return Optional.empty();
        }
        if (m < 1 || m > 12) {
            return Optional.empty();
        }
        return Optional.of(twoDigitYear + "%02d".formatted(m));
    }

    static Optional<String> fromWesternYear(int year, int month) {
        if (year < 2000 || year > 2099) {
            return Optional.empty();
        }
        return of("%02d".formatted(year % 100), Integer.toString(month));
    }
}
