package com.taxdoc.core.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Immutable outcome of classifying one unit. A result produced by sequence resolution keeps the
 * catalog code it started from in {@code originalCode}.
 */
public record ClassificationResult(String code,
                                   String label,
                                   double confidence,
                                   List<String> matchedKeywords,
                                   DocumentDomain domain,
                                   DocumentKind kind,
                                   MatchTier tier,
                                   String originalCode,
                                   String jurisdictionQualifier,
                                   List<String> evidenceLog) {

    public static final String UNCLASSIFIED_CODE = "9999";
    public static final String UNCLASSIFIED_LABEL = "未分類";

    public ClassificationResult {
        Objects.requireNonNull(code, "code");
        Objects.requireNonNull(label, "label");
        Objects.requireNonNull(tier, "tier");
        Objects.requireNonNull(kind, "kind");
        if (confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("confidence out of range: " + confidence);
        }
        matchedKeywords = matchedKeywords == null ? List.of() : List.copyOf(matchedKeywords);
        evidenceLog = evidenceLog == null ? List.of() : List.copyOf(evidenceLog);
        originalCode = originalCode == null ? code : originalCode;
        jurisdictionQualifier = jurisdictionQualifier == null ? "" : jurisdictionQualifier;
    }

    public static ClassificationResult fromRule(DocumentTypeRule rule,
                                                double confidence,
                                                List<String> matchedKeywords,
                                                MatchTier tier,
                                                List<String> evidenceLog) {
        return new ClassificationResult(rule.code(), rule.label(), confidence, matchedKeywords,
            rule.domain(), rule.kind(), tier, rule.code(), "", evidenceLog);
    }

    public static ClassificationResult unclassified(List<String> evidenceLog) {
        return new ClassificationResult(UNCLASSIFIED_CODE, UNCLASSIFIED_LABEL, 0.0, List.of(),
            null, DocumentKind.UNCLASSIFIED, MatchTier.UNCLASSIFIED, UNCLASSIFIED_CODE, "", evidenceLog);
    }

    public boolean isUnclassified() {
        return tier == MatchTier.UNCLASSIFIED;
    }

    public boolean wasResequenced() {
        return !code.equals(originalCode);
    }

    /**
     * Returns a copy carrying a resolved code. The original catalog code is preserved.
     */
    public ClassificationResult withResolvedCode(String resolvedCode, String qualifier, String evidence) {
        List<String> log = new ArrayList<>(evidenceLog);
        if (evidence != null && !evidence.isBlank()) {
            log.add(evidence);
        }
        return new ClassificationResult(resolvedCode, label, confidence, matchedKeywords, domain, kind,
            tier, originalCode, qualifier, log);
    }

    public ClassificationResult withEvidence(String evidence) {
        return withResolvedCode(code, jurisdictionQualifier, evidence);
    }
}
