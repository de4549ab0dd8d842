package com.taxdoc.core.classify;

import com.taxdoc.core.catalog.RuleCatalog;
import com.taxdoc.core.model.ClassificationResult;
import com.taxdoc.core.model.DocumentDomain;
import com.taxdoc.core.model.DocumentTypeRule;
import com.taxdoc.core.model.MatchTier;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Priority-ranked keyword classifier over a {@link RuleCatalog}.
 *
 * <p>Holds no mutable state; the same text, file name and domain hint always produce the same result.</p>
 */
public final class DocumentClassifier {

    static final int MIN_PARTIAL_HITS = 2;
    static final double PARTIAL_CONFIDENCE_CAP = 0.65;
    static final int FULL_CONFIDENCE_PRIORITY = 200;

    private final RuleCatalog catalog;

    public DocumentClassifier(RuleCatalog catalog) {
        this.catalog = Objects.requireNonNull(catalog, "catalog");
    }

    public RuleCatalog catalog() {
        return catalog;
    }

    public ClassificationResult classify(String text, String filenameHint) {
        return classify(text, filenameHint, Set.of());
    }

    /**
     * Classifies {@code text}, evaluating rules of {@code plausibleDomains} first. When none of
     * those rules is satisfied by a required keyword group, the whole catalog is evaluated.
     */
    public ClassificationResult classify(String text, String filenameHint, Collection<DocumentDomain> plausibleDomains) {
        String normalizedText = TextNormalizer.normalize(text);
        String normalizedName = TextNormalizer.normalize(filenameHint);
        List<String> evidence = new ArrayList<>();

        boolean restricted = plausibleDomains != null && !plausibleDomains.isEmpty();
        List<RuleEvaluation> evaluations = evaluate(catalog.rulesFor(plausibleDomains), normalizedText, normalizedName, evidence);
        if (restricted && evaluations.stream().noneMatch(RuleEvaluation::eligible)) {
            evidence.add("no required match within " + plausibleDomains + ", widening to full catalog");
            evaluations = evaluate(catalog.rules(), normalizedText, normalizedName, evidence);
        }

        RuleEvaluation best = evaluations.stream()
            .filter(RuleEvaluation::eligible)
            .min(Comparator.comparingInt((RuleEvaluation e) -> -e.rule().priority())
                .thenComparingInt(e -> -e.partialHits().size())
                .thenComparingInt(e -> catalog.orderOf(e.rule())))
            .orElse(null);
        if (best != null) {
            evidence.add("selected %s priority=%d partial=%d".formatted(
                best.rule().codeAndLabel(), best.rule().priority(), best.partialHits().size()));
            List<String> matched = new ArrayList<>(best.requiredGroup());
            matched.addAll(best.partialHits());
            return ClassificationResult.fromRule(best.rule(), requiredConfidence(best), matched, MatchTier.REQUIRED, evidence);
        }

        RuleEvaluation partial = evaluations.stream()
            .filter(e -> e.exclusionHit() == null && e.partialHits().size() >= MIN_PARTIAL_HITS)
            .min(Comparator.comparingInt((RuleEvaluation e) -> -e.partialHits().size())
                .thenComparingInt(e -> -e.rule().priority())
                .thenComparingInt(e -> catalog.orderOf(e.rule())))
            .orElse(null);
        if (partial != null) {
            double confidence = Math.min(PARTIAL_CONFIDENCE_CAP, 0.2 + 0.45 * partialRatio(partial));
            evidence.add("partial fallback %s hits=%s".formatted(partial.rule().codeAndLabel(), partial.partialHits()));
            return ClassificationResult.fromRule(partial.rule(), confidence, partial.partialHits(), MatchTier.PARTIAL, evidence);
        }

        evidence.add("no rule matched");
        return ClassificationResult.unclassified(evidence);
    }

    private static List<RuleEvaluation> evaluate(List<DocumentTypeRule> rules,
                                                 String text,
                                                 String fileName,
                                                 List<String> evidence) {
        List<RuleEvaluation> evaluations = new ArrayList<>(rules.size());
        for (DocumentTypeRule rule : rules) {
            List<String> group = firstSatisfiedGroup(rule, text);
            List<String> partialHits = new ArrayList<>();
            for (String keyword : rule.partialKeywords()) {
                if (TextNormalizer.containsKeyword(text, keyword)) {
                    partialHits.add(keyword);
                }
            }
            for (String keyword : rule.filenameKeywords()) {
                if (TextNormalizer.containsKeyword(fileName, keyword) && !partialHits.contains(keyword)) {
                    partialHits.add(keyword);
                }
            }
            String exclusion = null;
            for (String keyword : rule.exclusionKeywords()) {
                if (TextNormalizer.containsKeyword(text, keyword)) {
                    exclusion = keyword;
                    break;
                }
            }
            if (exclusion != null && group != null) {
                evidence.add("%s vetoed by exclusion '%s'".formatted(rule.code(), exclusion));
            }
            evaluations.add(new RuleEvaluation(rule, group, partialHits, exclusion));
        }
        return evaluations;
    }

    private static List<String> firstSatisfiedGroup(DocumentTypeRule rule, String text) {
        for (List<String> group : rule.requirementGroups()) {
            boolean all = true;
            for (String keyword : group) {
                if (!TextNormalizer.containsKeyword(text, keyword)) {
                    all = false;
                    break;
                }
            }
            if (all) {
                return group;
            }
        }
        return null;
    }

    private static double requiredConfidence(RuleEvaluation evaluation) {
        int priority = evaluation.rule().priority();
        if (priority >= FULL_CONFIDENCE_PRIORITY) {
            return 1.0;
        }
        double priorityRatio = Math.max(0.0, (double) priority / FULL_CONFIDENCE_PRIORITY);
        return 0.7 + 0.3 * (0.5 * partialRatio(evaluation) + 0.5 * priorityRatio);
    }

    private static double partialRatio(RuleEvaluation evaluation) {
        int available = evaluation.rule().partialKeywords().size() + evaluation.rule().filenameKeywords().size();
        if (available == 0) {
            return 0.0;
        }
        return Math.min(1.0, (double) evaluation.partialHits().size() / available);
    }

    private record RuleEvaluation(DocumentTypeRule rule,
                                  List<String> requiredGroup,
                                  List<String> partialHits,
                                  String exclusionHit) {

        boolean eligible() {
            return requiredGroup != null && exclusionHit == null;
        }
    }
}
