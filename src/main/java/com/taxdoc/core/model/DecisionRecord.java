package com.taxdoc.core.model;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * Per-unit outcome handed to reporting. {@code outputFile} is null unless the unit was written.
 */
public record DecisionRecord(Path source,
                             int pageIndex,
                             int ordinal,
                             String finalCode,
                             String originalCode,
                             String label,
                             String qualifier,
                             String period,
                             PeriodSource periodSource,
                             double confidence,
                             DecisionStatus status,
                             List<String> evidenceLog,
                             String message,
                             Path outputFile) {

    public DecisionRecord {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(status, "status");
        finalCode = finalCode == null ? "" : finalCode;
        originalCode = originalCode == null ? finalCode : originalCode;
        label = label == null ? "" : label;
        qualifier = qualifier == null ? "" : qualifier;
        period = period == null ? "" : period;
        periodSource = periodSource == null ? PeriodSource.NONE : periodSource;
        evidenceLog = evidenceLog == null ? List.of() : List.copyOf(evidenceLog);
        message = message == null ? "" : message;
    }

    public static DecisionRecord failed(SplitUnit unit, ClassificationResult result, String message) {
        String code = result == null ? "" : result.code();
        String original = result == null ? "" : result.originalCode();
        String label = result == null ? "" : result.label();
        double confidence = result == null ? 0.0 : result.confidence();
        List<String> evidence = result == null ? List.of() : result.evidenceLog();
        return new DecisionRecord(unit.sourceFile(), unit.pageIndex(), unit.ordinal(), code, original, label,
            "", "", PeriodSource.NONE, confidence, DecisionStatus.FAILED, evidence, message, null);
    }

    public DecisionRecord withOutput(DecisionStatus newStatus, Path output, String newMessage) {
        return new DecisionRecord(source, pageIndex, ordinal, finalCode, originalCode, label, qualifier, period,
            periodSource, confidence, newStatus, evidenceLog, newMessage, output);
    }
}
