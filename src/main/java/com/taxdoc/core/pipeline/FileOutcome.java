package com.taxdoc.core.pipeline;

import com.taxdoc.core.model.BundleDecision;
import com.taxdoc.core.model.DecisionRecord;
import com.taxdoc.core.model.DecisionStatus;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * Result of running one input file through the pipeline. An aborted file carries no records:
 * nothing of it was written.
 */
public record FileOutcome(Path source,
                          BundleDecision bundleDecision,
                          List<DecisionRecord> records,
                          boolean aborted,
                          String abortReason) {

    public FileOutcome {
        Objects.requireNonNull(source, "source");
        records = records == null ? List.of() : List.copyOf(records);
        abortReason = abortReason == null ? "" : abortReason;
    }

    public static FileOutcome completed(Path source, BundleDecision decision, List<DecisionRecord> records) {
        return new FileOutcome(source, decision, records, false, "");
    }

    public static FileOutcome aborted(Path source, BundleDecision decision, String reason) {
        return new FileOutcome(source, decision, List.of(), true, reason);
    }

    public long count(DecisionStatus status) {
        return records.stream().filter(r -> r.status() == status).count();
    }
}
