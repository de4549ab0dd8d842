package com.taxdoc.core.job;

import com.taxdoc.core.model.PeriodSource;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Counters for one run. Updated from the batch worker, read by reporting.
 */
public final class ProcessingStats {

    private final AtomicInteger totalFiles = new AtomicInteger();
    private final AtomicInteger processedFiles = new AtomicInteger();
    private final AtomicInteger abortedFiles = new AtomicInteger();
    private final AtomicInteger bundleSplits = new AtomicInteger();
    private final AtomicInteger unitsRenamed = new AtomicInteger();
    private final AtomicInteger unitsUnclassified = new AtomicInteger();
    private final AtomicInteger unitsBlank = new AtomicInteger();
    private final AtomicInteger unitsFailed = new AtomicInteger();
    private final AtomicInteger periodsDetected = new AtomicInteger();
    private final AtomicInteger periodsFromUi = new AtomicInteger();
    private final AtomicInteger periodsUiForced = new AtomicInteger();
    private final AtomicInteger sequenceMisses = new AtomicInteger();
    private final List<Path> errorFiles = new ArrayList<>();

    public void fileQueued() {
        totalFiles.incrementAndGet();
    }

    public void fileProcessed() {
        processedFiles.incrementAndGet();
    }

    public void fileAborted(Path file) {
        abortedFiles.incrementAndGet();
        synchronized (errorFiles) {
            errorFiles.add(file);
        }
    }

    public void bundleSplit() {
        bundleSplits.incrementAndGet();
    }

    public void unitRenamed() {
        unitsRenamed.incrementAndGet();
    }

    public void unitUnclassified() {
        unitsUnclassified.incrementAndGet();
    }

    public void unitBlank() {
        unitsBlank.incrementAndGet();
    }

    public void unitFailed() {
        unitsFailed.incrementAndGet();
    }

    public void sequenceMiss() {
        sequenceMisses.incrementAndGet();
    }

    void periodResolved(PeriodSource source) {
        switch (source) {
            case DETECTED -> periodsDetected.incrementAndGet();
            case UI -> periodsFromUi.incrementAndGet();
            case UI_FORCED -> periodsUiForced.incrementAndGet();
            default -> {
            }
        }
    }

    public List<Path> errorFiles() {
        synchronized (errorFiles) {
            return List.copyOf(errorFiles);
        }
    }

    public Map<String, Integer> snapshot() {
        Map<String, Integer> values = new LinkedHashMap<>();
        values.put("total_files", totalFiles.get());
        values.put("processed_files", processedFiles.get());
        values.put("aborted_files", abortedFiles.get());
        values.put("bundle_splits", bundleSplits.get());
        values.put("units_renamed", unitsRenamed.get());
        values.put("units_unclassified", unitsUnclassified.get());
        values.put("units_blank", unitsBlank.get());
        values.put("units_failed", unitsFailed.get());
        values.put("periods_detected", periodsDetected.get());
        values.put("periods_ui", periodsFromUi.get());
        values.put("periods_ui_forced", periodsUiForced.get());
        values.put("sequence_misses", sequenceMisses.get());
        return values;
    }
}
