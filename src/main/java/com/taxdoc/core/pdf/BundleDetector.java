package com.taxdoc.core.pdf;

import com.taxdoc.core.classify.DocumentClassifier;
import com.taxdoc.core.classify.TextNormalizer;
import com.taxdoc.core.model.BundleDecision;
import com.taxdoc.core.model.BundleDecision.FamilyCounters;
import com.taxdoc.core.model.BundleFamily;
import com.taxdoc.core.model.ClassificationResult;
import com.taxdoc.core.model.DocumentDomain;
import com.taxdoc.core.model.MatchTier;
import com.taxdoc.logging.AppLogger;
import org.apache.pdfbox.pdmodel.PDDocument;

import java.io.IOException;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Decides whether a PDF is a bundle of separate e-filing notices that must be split per page.
 *
 * <p>Only the first {@code scanPages} pages are read. A family qualifies when its receipt,
 * payment and code counters each reach {@code minimumHits}; a file or first page matching a
 * never-split pattern is never a bundle.</p>
 */
public final class BundleDetector {

    private static final Logger LOGGER = AppLogger.get();

    private static final Set<DocumentDomain> LOCAL_DOMAINS =
        EnumSet.of(DocumentDomain.LOCAL_TAX_PREFECTURE, DocumentDomain.LOCAL_TAX_MUNICIPALITY);
    private static final Set<DocumentDomain> NATIONAL_DOMAINS =
        EnumSet.of(DocumentDomain.NATIONAL_TAX, DocumentDomain.CONSUMPTION_TAX);

    private final TextExtractor extractor;
    private final DocumentClassifier classifier;
    private final BundleRules rules;
    private final int scanPages;
    private final int minimumHits;
    private final Pattern localCodePattern;
    private final Pattern nationalCodePattern;

    public BundleDetector(TextExtractor extractor,
                          DocumentClassifier classifier,
                          BundleRules rules,
                          int scanPages,
                          int minimumHits) {
        this.extractor = Objects.requireNonNull(extractor, "extractor");
        this.classifier = Objects.requireNonNull(classifier, "classifier");
        this.rules = Objects.requireNonNull(rules, "rules");
        if (scanPages < 1) {
            throw new IllegalArgumentException("scanPages must be >= 1: " + scanPages);
        }
        if (minimumHits < 1) {
            throw new IllegalArgumentException("minimumHits must be >= 1: " + minimumHits);
        }
        this.scanPages = scanPages;
        this.minimumHits = minimumHits;
        this.localCodePattern = codePattern(rules.local().codes());
        this.nationalCodePattern = codePattern(rules.national().codes());
    }

    public BundleDecision detect(PDDocument document, String fileName) {
        int pageCount = document.getNumberOfPages();
        int sampled = Math.min(scanPages, pageCount);

        String guard = neverSplitMatch(TextNormalizer.normalize(fileName));
        if (guard != null) {
            return BundleDecision.notBundle(0, "never-split pattern '%s' in file name".formatted(guard));
        }
        if (pageCount < 2) {
            return BundleDecision.notBundle(sampled, "single page");
        }

        List<String> pages = new ArrayList<>(sampled);
        for (int i = 0; i < sampled; i++) {
            pages.add(TextNormalizer.normalize(safeExtract(document, i, fileName)));
        }
        guard = neverSplitMatch(pages.get(0));
        if (guard != null) {
            return BundleDecision.notBundle(sampled, "never-split pattern '%s' on first page".formatted(guard));
        }

        FamilyCounters local = count(pages, fileName, rules.local(), localCodePattern, LOCAL_DOMAINS);
        FamilyCounters national = count(pages, fileName, rules.national(), nationalCodePattern, NATIONAL_DOMAINS);
        return decide(local, national, sampled);
    }

    BundleDecision decide(FamilyCounters local, FamilyCounters national, int sampled) {
        boolean localOk = local.qualifies(minimumHits);
        boolean nationalOk = national.qualifies(minimumHits);
        if (!localOk && !nationalOk) {
            return new BundleDecision(false, BundleFamily.NONE, 0.0, sampled, local, national, "below threshold");
        }
        BundleFamily family;
        if (localOk && nationalOk) {
            if (local.total() == national.total()) {
                return new BundleDecision(false, BundleFamily.NONE, 0.0, sampled, local, national,
                    "ambiguous: both families qualify with equal totals");
            }
            family = local.total() > national.total() ? BundleFamily.LOCAL : BundleFamily.NATIONAL;
        } else {
            family = localOk ? BundleFamily.LOCAL : BundleFamily.NATIONAL;
        }
        FamilyCounters winner = family == BundleFamily.LOCAL ? local : national;
        double confidence = Math.min(1.0, 0.5 + 0.1 * winner.excessOver(minimumHits));
        return new BundleDecision(true, family, confidence, sampled, local, national, "thresholds met");
    }

    private FamilyCounters count(List<String> pages,
                                 String fileName,
                                 BundleRules.FamilyRules family,
                                 Pattern codePattern,
                                 Set<DocumentDomain> domains) {
        int receipt = 0;
        int payment = 0;
        int code = 0;
        for (String page : pages) {
            if (page.isEmpty()) {
                continue;
            }
            if (containsAny(page, family.receiptKeywords())) {
                receipt++;
            }
            if (containsAny(page, family.paymentKeywords())) {
                payment++;
            }
            if (codePattern.matcher(page).find()) {
                code++;
            } else {
                ClassificationResult result = classifier.classify(page, fileName, domains);
                if (result.tier() == MatchTier.REQUIRED && family.codes().contains(result.code())) {
                    code++;
                }
            }
        }
        return new FamilyCounters(receipt, payment, code);
    }

    private String neverSplitMatch(String normalized) {
        for (String pattern : rules.neverSplitPatterns()) {
            if (TextNormalizer.containsKeyword(normalized, pattern)) {
                return pattern;
            }
        }
        return null;
    }

    private String safeExtract(PDDocument document, int pageIndex, String fileName) {
        try {
            return extractor.extractPage(document, pageIndex);
        } catch (IOException | RuntimeException ex) {
            LOGGER.log(Level.WARNING, "Bundle sampling could not read %s page %d: %s"
                .formatted(fileName, pageIndex + 1, ex.getMessage()));
            return "";
        }
    }

    private static boolean containsAny(String normalized, List<String> keywords) {
        for (String keyword : keywords) {
            if (TextNormalizer.containsKeyword(normalized, keyword)) {
                return true;
            }
        }
        return false;
    }

    private static Pattern codePattern(Set<String> codes) {
        String alternatives = codes.stream().sorted().map(Pattern::quote).collect(Collectors.joining("|"));
        // code tokens as printed in file-style labels ("1013_受信通知"); bare years like 2023 do not count
        return Pattern.compile("(?<!\\d)(?:" + alternatives + ")_");
    }
}
