package com.taxdoc.config;

import com.taxdoc.core.job.JobContext;

import java.util.Objects;

/**
 * Tunables of the classification engine for one run.
 *
 * @param bundleScanPages     pages sampled by bundle detection
 * @param bundleMinimumHits   minimum per-counter hits for a bundle family to qualify
 * @param blankTextThreshold  normalized text shorter than this, with no rule match, is a blank page
 * @param specialJurisdiction prefecture that never receives municipality numbering
 * @param outputFolderName    folder created next to the first input when no output folder is given
 */
public record RenamerSettings(int bundleScanPages,
                              int bundleMinimumHits,
                              int blankTextThreshold,
                              String specialJurisdiction,
                              String outputFolderName) {

    public static final int DEFAULT_SCAN_PAGES = 10;
    public static final int DEFAULT_MINIMUM_HITS = 1;
    public static final int DEFAULT_BLANK_THRESHOLD = 50;
    public static final String DEFAULT_SPECIAL_JURISDICTION = JobContext.DEFAULT_SPECIAL_JURISDICTION;
    public static final String DEFAULT_OUTPUT_FOLDER = "renamed";

    public RenamerSettings {
        if (bundleScanPages < 1) {
            throw new IllegalArgumentException("bundleScanPages must be >= 1");
        }
        if (bundleMinimumHits < 1) {
            throw new IllegalArgumentException("bundleMinimumHits must be >= 1");
        }
        if (blankTextThreshold < 0) {
            throw new IllegalArgumentException("blankTextThreshold must be >= 0");
        }
        specialJurisdiction = specialJurisdiction == null ? "" : specialJurisdiction.strip();
        Objects.requireNonNull(outputFolderName, "outputFolderName");
    }

    public static RenamerSettings defaults() {
        return new RenamerSettings(DEFAULT_SCAN_PAGES, DEFAULT_MINIMUM_HITS, DEFAULT_BLANK_THRESHOLD,
            DEFAULT_SPECIAL_JURISDICTION, DEFAULT_OUTPUT_FOLDER);
    }
}
