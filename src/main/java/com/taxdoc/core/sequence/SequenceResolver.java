package com.taxdoc.core.sequence;

import com.taxdoc.core.classify.TextNormalizer;
import com.taxdoc.core.job.JobContext;
import com.taxdoc.core.model.ClassificationResult;
import com.taxdoc.core.model.DocumentDomain;
import com.taxdoc.core.model.DocumentKind;
import com.taxdoc.core.model.JurisdictionSlot;
import com.taxdoc.logging.AuditLog.Stage;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * Renumbers local-tax receipt and payment notices by jurisdiction slot.
 *
 * <ul>
 *   <li>prefecture receipt: {@code 1003 + (N - 1) * 10}</li>
 *   <li>municipality receipt: {@code 2003 + (M - 1) * 10}, M being the slot's municipal ordinal</li>
 *   <li>payment notices: always {@code 1004} or {@code 2004}</li>
 * </ul>
 *
 * <p>A municipality-level notice that matches the special jurisdiction's slot is numbered on the
 * prefecture path instead, for receipts and payments alike. Local returns keep their code and only
 * gain the jurisdiction name as qualifier.</p>
 *
 * <p>Slot choices are recorded in the run's {@link SlotAssignmentTracker}.</p>
 */
public final class SequenceResolver {

    static final int PREFECTURE_RECEIPT_BASE = 1003;
    static final int MUNICIPALITY_RECEIPT_BASE = 2003;
    static final String PREFECTURE_PAYMENT_CODE = "1004";
    static final String MUNICIPALITY_PAYMENT_CODE = "2004";
    static final int SLOT_STEP = 10;

    private SequenceResolver() {
    }

    public static ClassificationResult resolve(ClassificationResult result, String jurisdictionText, JobContext context) {
        return resolve(result, jurisdictionText, context, null, null);
    }

    /**
     * @param unitKey stable identity of the unit, so repeated resolution returns the same slot
     * @param owner   source file of the unit, used to release assignments when the file is aborted
     */
    public static ClassificationResult resolve(ClassificationResult result,
                                               String jurisdictionText,
                                               JobContext context,
                                               String unitKey,
                                               String owner) {
        Objects.requireNonNull(result, "result");
        Objects.requireNonNull(context, "context");
        DocumentDomain domain = result.domain();
        if (result.isUnclassified() || domain == null || !domain.isLocalTax()) {
            context.audit(Stage.SEQ, result.code(), "skipped, domain=" + (domain == null ? "NONE" : domain));
            return result;
        }
        DocumentKind kind = result.kind();
        if (kind != DocumentKind.RECEIPT_NOTICE && kind != DocumentKind.PAYMENT_NOTICE && kind != DocumentKind.RETURN) {
            context.audit(Stage.SEQ, result.code(), "skipped, kind=" + kind);
            return result;
        }

        ExtractedJurisdiction extracted = JurisdictionExtractor.extract(jurisdictionText);
        String normalizedText = TextNormalizer.normalize(jurisdictionText);
        boolean municipalLevel = domain == DocumentDomain.LOCAL_TAX_MUNICIPALITY;

        Optional<SlotMatch> match = Optional.empty();
        if (municipalLevel) {
            match = match(result.originalCode(), extracted.municipalities(), normalizedText, context,
                JurisdictionSlot::municipality, unitKey, owner);
        }
        if (match.isEmpty()) {
            match = match(result.originalCode(), extracted.prefectures(), normalizedText, context,
                JurisdictionSlot::prefecture, unitKey, owner);
        }
        if (match.isEmpty()) {
            context.auditWarning(Stage.SEQ, result.code(), "resolution failed, no slot for %s; keeping base code".formatted(extracted));
            context.stats().sequenceMiss();
            return result.withEvidence("sequence: no slot matched " + extracted);
        }

        JurisdictionSlot slot = match.get().slot();
        String via = "%s via %s match".formatted(slot, match.get().tier());
        if (kind == DocumentKind.RETURN) {
            String qualifier = municipalLevel && slot.hasMunicipality() ? slot.municipality() : slot.prefecture();
            context.audit(Stage.SEQ, result.code(), "return qualified as %s (%s)".formatted(qualifier, via));
            return result.withResolvedCode(result.code(), qualifier, "sequence: qualifier " + qualifier + " " + via);
        }

        boolean receipt = kind == DocumentKind.RECEIPT_NOTICE;
        String finalCode;
        String qualifier;
        if (!municipalLevel) {
            finalCode = receipt ? prefectureReceiptCode(slot) : PREFECTURE_PAYMENT_CODE;
            qualifier = slot.prefecture();
        } else if (context.isSpecialJurisdiction(slot)) {
            finalCode = receipt ? prefectureReceiptCode(slot) : PREFECTURE_PAYMENT_CODE;
            qualifier = slot.prefecture();
            context.audit(Stage.SEQ, result.originalCode(),
                "special jurisdiction %s, municipal numbering skipped".formatted(slot.prefecture()));
        } else if (!slot.hasMunicipality()) {
            context.auditWarning(Stage.SEQ, result.code(),
                "resolution failed, %s has no municipality configured; keeping base code".formatted(slot));
            context.stats().sequenceMiss();
            return result.withEvidence("sequence: slot without municipality " + slot);
        } else {
            finalCode = receipt ? municipalReceiptCode(context.municipalOrdinal(slot)) : MUNICIPALITY_PAYMENT_CODE;
            qualifier = slot.municipality();
        }

        String change = finalCode.equals(result.originalCode())
            ? "code %s kept".formatted(finalCode)
            : "original=%s final=%s".formatted(result.originalCode(), finalCode);
        context.audit(Stage.SEQ, result.originalCode(), "%s (%s)".formatted(change, via));
        return result.withResolvedCode(finalCode, qualifier, "sequence: " + change + " " + via);
    }

    static String prefectureReceiptCode(JurisdictionSlot slot) {
        return "%04d".formatted(PREFECTURE_RECEIPT_BASE + (slot.slotIndex() - 1) * SLOT_STEP);
    }

    static String municipalReceiptCode(int municipalOrdinal) {
        return "%04d".formatted(MUNICIPALITY_RECEIPT_BASE + (municipalOrdinal - 1) * SLOT_STEP);
    }

    private static Optional<SlotMatch> match(String family,
                                             List<String> extractedNames,
                                             String normalizedText,
                                             JobContext context,
                                             Function<JurisdictionSlot, String> field,
                                             String unitKey,
                                             String owner) {
        List<JurisdictionSlot> slots = context.jurisdictionSlots();
        SlotAssignmentTracker tracker = context.slotTracker();

        List<JurisdictionSlot> exact = new ArrayList<>();
        for (String name : extractedNames) {
            for (JurisdictionSlot slot : slots) {
                if (!field.apply(slot).isEmpty() && field.apply(slot).equals(name) && !exact.contains(slot)) {
                    exact.add(slot);
                }
            }
        }
        if (!exact.isEmpty()) {
            return Optional.of(new SlotMatch(tracker.choose(family, exact, unitKey, owner), "exact"));
        }

        List<JurisdictionSlot> normalized = new ArrayList<>();
        for (String name : extractedNames) {
            String wanted = JurisdictionExtractor.normalizeName(name);
            for (JurisdictionSlot slot : slots) {
                String configured = JurisdictionExtractor.normalizeName(field.apply(slot));
                if (!configured.isEmpty() && configured.equals(wanted) && !normalized.contains(slot)) {
                    normalized.add(slot);
                }
            }
        }
        if (!normalized.isEmpty()) {
            return Optional.of(new SlotMatch(tracker.choose(family, normalized, unitKey, owner), "normalized"));
        }

        List<JurisdictionSlot> partial = new ArrayList<>();
        for (JurisdictionSlot slot : slots) {
            String configured = JurisdictionExtractor.normalizeName(field.apply(slot));
            if (configured.length() >= 2 && normalizedText.contains(configured)) {
                partial.add(slot);
            }
        }
        if (!partial.isEmpty()) {
            return Optional.of(new SlotMatch(tracker.choose(family, partial, unitKey, owner), "partial"));
        }
        return Optional.empty();
    }

    private record SlotMatch(JurisdictionSlot slot, String tier) {
    }
}
