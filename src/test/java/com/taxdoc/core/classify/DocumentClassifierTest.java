package com.taxdoc.core.classify;

import com.taxdoc.core.catalog.RuleCatalog;
import com.taxdoc.core.catalog.RuleCatalogLoader;
import com.taxdoc.core.model.ClassificationResult;
import com.taxdoc.core.model.DocumentDomain;
import com.taxdoc.core.model.DocumentKind;
import com.taxdoc.core.model.DocumentTypeRule;
import com.taxdoc.core.model.MatchTier;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.EnumSet;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DocumentClassifierTest {

    private static DocumentClassifier classifier;

    @BeforeAll
    static void loadCatalog() throws IOException {
        classifier = new DocumentClassifier(RuleCatalogLoader.loadDefault());
    }

    @Test
    void exclusionVetoesRuleWhoseRequiredKeywordsMatch() {
        ClassificationResult result = classifier.classify("勘定科目別税区分集計表", "");

        assertEquals("7001", result.code());
        assertEquals(MatchTier.REQUIRED, result.tier());
        assertTrue(result.evidenceLog().stream().anyMatch(line -> line.contains("7002 vetoed by exclusion '勘定科目別'")),
            result.evidenceLog().toString());
    }

    @Test
    void attachmentOutranksReturnWhenBothMatch() {
        ClassificationResult result = classifier.classify("イメージ添付書類\n法人税\n内国法人の確定申告", "scan.pdf");

        assertEquals("0002", result.code());
        assertEquals(DocumentKind.ATTACHMENT, result.kind());
        assertEquals(1.0, result.confidence(), 1e-9, "Priority 200+ yields full confidence");
    }

    @Test
    void vetoedAttachmentFallsThroughToOtherRule() {
        ClassificationResult result = classifier.classify("勘定科目別税区分集計表\nイメージ添付書類\n消費税", "");

        assertEquals("3002", result.code());
        assertTrue(result.evidenceLog().stream().anyMatch(line -> line.contains("7001 vetoed")));
    }

    @Test
    void whitespaceAndFullWidthDoNotBreakKeywords() {
        ClassificationResult result = classifier.classify("内 国 法 人　の 確定 申告", "");

        assertEquals("0001", result.code());
        assertEquals(DocumentDomain.NATIONAL_TAX, result.domain());
    }

    @Test
    void partialFallbackIsCappedBelowRequiredMatches() {
        ClassificationResult result = classifier.classify("決算報告\n貸借対照表", "");

        assertEquals("5001", result.code());
        assertEquals(MatchTier.PARTIAL, result.tier());
        assertEquals(0.38, result.confidence(), 1e-9);
        assertTrue(result.confidence() <= DocumentClassifier.PARTIAL_CONFIDENCE_CAP);
    }

    @Test
    void fileNameKeywordsCountTowardPartialHits() {
        ClassificationResult result = classifier.classify("補助", "補助元帳_2025.pdf");

        assertEquals("5003", result.code());
        assertEquals(MatchTier.PARTIAL, result.tier());
    }

    @Test
    void singlePartialHitIsNotEnough() {
        ClassificationResult result = classifier.classify("決算報告", "");

        assertTrue(result.isUnclassified());
    }

    @Test
    void unmatchedTextIsUnclassified() {
        ClassificationResult result = classifier.classify("Quarterly newsletter", "newsletter.pdf");

        assertEquals(ClassificationResult.UNCLASSIFIED_CODE, result.code());
        assertEquals(ClassificationResult.UNCLASSIFIED_LABEL, result.label());
        assertEquals(MatchTier.UNCLASSIFIED, result.tier());
        assertEquals(0.0, result.confidence());
        assertNull(result.domain());
    }

    @Test
    void plausibleDomainsAreEvaluatedFirst() {
        String text = "申告受付完了通知\n法人事業税\n内国法人の確定申告";

        assertEquals("0001", classifier.classify(text, "").code());
        ClassificationResult local = classifier.classify(text, "",
            EnumSet.of(DocumentDomain.LOCAL_TAX_PREFECTURE, DocumentDomain.LOCAL_TAX_MUNICIPALITY));
        assertEquals("1003", local.code());
    }

    @Test
    void restrictedDomainsWidenWhenNothingMatches() {
        ClassificationResult result = classifier.classify("総勘定元帳", "",
            EnumSet.of(DocumentDomain.LOCAL_TAX_PREFECTURE, DocumentDomain.LOCAL_TAX_MUNICIPALITY));

        assertEquals("5002", result.code());
        assertTrue(result.evidenceLog().stream().anyMatch(line -> line.contains("widening")));
    }

    @Test
    void classificationIsDeterministic() {
        String text = "納付情報発行結果\n蒲郡市\n法人市民税";
        ClassificationResult first = classifier.classify(text, "bundle.pdf");
        ClassificationResult second = classifier.classify(text, "bundle.pdf");

        assertEquals("2004", first.code());
        assertEquals(first, second);
    }

    @Test
    void tiesFallBackToPartialHitsThenCatalogOrder() {
        DocumentTypeRule first = rule("8001", List.of("alpha"), List.of("beta"));
        DocumentTypeRule second = rule("8002", List.of("alpha"), List.of("gamma"));
        DocumentClassifier custom = new DocumentClassifier(new RuleCatalog("tie", List.of(first, second)));

        assertEquals("8001", custom.classify("alpha", "").code(), "Catalog order decides a full tie");
        assertEquals("8002", custom.classify("alpha gamma", "").code(), "More partial hits wins");
    }

    private static DocumentTypeRule rule(String code, List<String> required, List<String> partial) {
        return new DocumentTypeRule(code, "rule" + code, required, List.of(), partial, List.of(), List.of(),
            150, DocumentDomain.ACCOUNTING, DocumentKind.LEDGER);
    }
}
