package com.taxdoc.core.job;

import java.text.Normalizer;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds the YYMM a document refers to from its own text, falling back to the file name.
 *
 * <p>Order: period end date ({@code 至 ...}), first Reiwa-era month, first western-year month,
 * then a {@code _YYYYMMDD_} or {@code _YYMM} token in the file name.</p>
 */
public final class PeriodDetector {

    private static final int REIWA_OFFSET = 2018;

    private static final Pattern END_DATE = Pattern.compile(
        "至(?:令和(\\d{1,2}|元)年(\\d{1,2})月|(20\\d{2})[年/.\\-](\\d{1,2}))");
    private static final Pattern REIWA = Pattern.compile("令和(\\d{1,2}|元)年(\\d{1,2})月");
    private static final Pattern WESTERN = Pattern.compile("(20\\d{2})年(\\d{1,2})月");
    private static final Pattern FILE_DATE = Pattern.compile("(?:^|[_\\-])(20\\d{2})(\\d{2})(\\d{2})(?=[_\\-.]|$)");
    private static final Pattern FILE_YYMM = Pattern.compile("_((?:19|2\\d|3\\d)(?:0[1-9]|1[0-2]))(?=[_.]|$)");
    private static final Pattern SPACES = Pattern.compile("[\\s\\u3000]+");

    private PeriodDetector() {
    }

    public static Optional<String> detect(String text, String fileName) {
        Optional<String> fromText = detectFromText(text);
        if (fromText.isPresent()) {
            return fromText;
        }
        return detectFromFileName(fileName);
    }

    public static Optional<String> detectFromText(String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        String normalized = SPACES.matcher(Normalizer.normalize(text, Normalizer.Form.NFKC)).replaceAll("");

        Matcher matcher = END_DATE.matcher(normalized);
        if (matcher.find()) {
            Optional<String> value = matcher.group(1) != null
                ? reiwa(matcher.group(1), matcher.group(2))
                : western(matcher.group(3), matcher.group(4));
            if (value.isPresent()) {
                return value;
            }
        }
        matcher = REIWA.matcher(normalized);
        while (matcher.find()) {
            Optional<String> value = reiwa(matcher.group(1), matcher.group(2));
            if (value.isPresent()) {
                return value;
            }
        }
        matcher = WESTERN.matcher(normalized);
        while (matcher.find()) {
            Optional<String> value = western(matcher.group(1), matcher.group(2));
            if (value.isPresent()) {
                return value;
            }
        }
        return Optional.empty();
    }

    public static Optional<String> detectFromFileName(String fileName) {
        if (fileName == null || fileName.isBlank()) {
            return Optional.empty();
        }
        String name = Normalizer.normalize(fileName, Normalizer.Form.NFKC);
        Matcher matcher = FILE_DATE.matcher(name);
        if (matcher.find()) {
            Optional<String> value = western(matcher.group(1), matcher.group(2));
            if (value.isPresent()) {
                return value;
            }
        }
        matcher = FILE_YYMM.matcher(name);
        if (matcher.find()) {
            return Optional.of(matcher.group(1));
        }
        return Optional.empty();
    }

    private static Optional<String> reiwa(String eraYear, String month) {
        int year = "元".equals(eraYear) ? 1 : Integer.parseInt(eraYear);
        return PeriodFormat.fromWesternYear(REIWA_OFFSET + year, Integer.parseInt(month));
    }

    private static Optional<String> western(String year, String month) {
        return PeriodFormat.fromWesternYear(Integer.parseInt(year), Integer.parseInt(month));
    }
}
