package com.taxdoc.core.job;

import com.taxdoc.core.model.JurisdictionSlot;
import com.taxdoc.core.model.PeriodSource;
import com.taxdoc.core.sequence.SlotAssignmentTracker;
import com.taxdoc.logging.AuditLog;
import com.taxdoc.logging.AuditLog.Stage;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Run-scoped state shared by every file of one batch: the user-confirmed period, the ordered
 * jurisdiction slots, and the protected-code period guard.
 *
 * <p>Protected codes may only ever receive the period the user confirmed. Everything else prefers
 * the period detected in the document itself.</p>
 */
public final class JobContext {

    public static final Set<String> PROTECTED_CODES = Set.of("0000", "6001", "6002", "6003");
    public static final String DEFAULT_SPECIAL_JURISDICTION = "東京都";

    private final String runId;
    private final String confirmedPeriod;
    private final PeriodSource periodSource;
    private final List<JurisdictionSlot> slots;
    private final String specialJurisdiction;
    private final String defaultPeriod;
    private final ProcessingStats stats = new ProcessingStats();
    private final SlotAssignmentTracker slotTracker = new SlotAssignmentTracker();
    private final List<String> auditTrail = Collections.synchronizedList(new ArrayList<>());

    /**
     * @param confirmedPeriod     YYMM the user confirmed, or {@code null}
     * @param periodSource        source of {@code confirmedPeriod}; {@link PeriodSource#NONE} when absent
     * @param slots               jurisdiction slots numbered 1..M in entry order
     * @param specialJurisdiction prefecture that never receives municipality numbering, or {@code null} for none
     * @param defaultPeriod       last-resort YYMM for non-protected codes, or {@code null}
     * @throws IllegalArgumentException when the configuration is inconsistent
     */
    public JobContext(String runId,
                      String confirmedPeriod,
                      PeriodSource periodSource,
                      List<JurisdictionSlot> slots,
                      String specialJurisdiction,
                      String defaultPeriod) {
        this.runId = Objects.requireNonNull(runId, "runId");
        this.periodSource = Objects.requireNonNull(periodSource, "periodSource");
        this.slots = List.copyOf(Objects.requireNonNull(slots, "slots"));
        this.specialJurisdiction = specialJurisdiction == null || specialJurisdiction.isBlank()
            ? null
            : specialJurisdiction.strip();

        if (confirmedPeriod == null || confirmedPeriod.isBlank()) {
            if (periodSource != PeriodSource.NONE) {
                throw new IllegalArgumentException("Period source " + periodSource + " given without a period");
            }
            this.confirmedPeriod = null;
        } else {
            this.confirmedPeriod = PeriodFormat.normalize(confirmedPeriod)
                .orElseThrow(() -> new IllegalArgumentException("Invalid confirmed period: " + confirmedPeriod));
            if (periodSource == PeriodSource.NONE || periodSource == PeriodSource.DEFAULT) {
                throw new IllegalArgumentException("Confirmed period needs a UI, UI_FORCED or DETECTED source");
            }
        }
        if (defaultPeriod == null || defaultPeriod.isBlank()) {
            this.defaultPeriod = null;
        } else {
            this.defaultPeriod = PeriodFormat.normalize(defaultPeriod)
                .orElseThrow(() -> new IllegalArgumentException("Invalid default period: " + defaultPeriod));
        }
        validateSlots();
    }

    private void validateSlots() {
        for (int i = 0; i < slots.size(); i++) {
            JurisdictionSlot slot = slots.get(i);
            if (slot.slotIndex() != i + 1) {
                throw new IllegalArgumentException("Jurisdiction slots must be numbered 1..%d in order, found %s at position %d"
                    .formatted(slots.size(), slot, i + 1));
            }
            if (isSpecialJurisdiction(slot)) {
                if (slot.slotIndex() != 1) {
                    throw new IllegalArgumentException("Special jurisdiction %s must be configured in slot 1, found in slot %d"
                        .formatted(specialJurisdiction, slot.slotIndex()));
                }
                if (slot.hasMunicipality()) {
                    throw new IllegalArgumentException("Special jurisdiction %s cannot carry a municipality (%s)"
                        .formatted(specialJurisdiction, slot.municipality()));
                }
            }
        }
    }

    public String runId() {
        return runId;
    }

    public Optional<String> confirmedPeriod() {
        return Optional.ofNullable(confirmedPeriod);
    }

    public PeriodSource periodSource() {
        return periodSource;
    }

    public List<JurisdictionSlot> jurisdictionSlots() {
        return slots;
    }

    public Optional<String> specialJurisdiction() {
        return Optional.ofNullable(specialJurisdiction);
    }

    public ProcessingStats stats() {
        return stats;
    }

    public SlotAssignmentTracker slotTracker() {
        return slotTracker;
    }

    public List<String> auditTrail() {
        synchronized (auditTrail) {
            return List.copyOf(auditTrail);
        }
    }

    public static boolean isProtected(String code) {
        return code != null && PROTECTED_CODES.contains(code);
    }

    public boolean isSpecialJurisdiction(JurisdictionSlot slot) {
        return specialJurisdiction != null && slot != null && specialJurisdiction.equals(slot.prefecture());
    }

    /**
     * 1-based position of {@code slot} among slots that can carry municipality numbering.
     * Special-jurisdiction slots are not counted.
     */
    public int municipalOrdinal(JurisdictionSlot slot) {
        int skipped = 0;
        for (JurisdictionSlot candidate : slots) {
            if (candidate.slotIndex() >= slot.slotIndex()) {
                break;
            }
            if (isSpecialJurisdiction(candidate)) {
                skipped++;
            }
        }
        return slot.slotIndex() - skipped;
    }

    public String getPeriodFor(String code) throws PeriodResolutionException {
        return resolvePeriod(code, null).value();
    }

    public String getPeriodFor(String code, String detectedPeriod) throws PeriodResolutionException {
        return resolvePeriod(code, detectedPeriod).value();
    }

    /**
     * Resolves the period for {@code code}.
     *
     * @throws ProtectedCodeViolationException protected code without a UI or UI_FORCED period
     * @throws MissingPeriodException          non-protected code with nothing to fall back to
     */
    public PeriodDecision resolvePeriod(String code, String detectedPeriod) throws PeriodResolutionException {
        Objects.requireNonNull(code, "code");
        if (isProtected(code)) {
            if (detectedPeriod != null && !detectedPeriod.isBlank()) {
                audit(Stage.PROTECTED, code, "detected value %s discarded for protected code".formatted(detectedPeriod));
            }
            if (confirmedPeriod != null && periodSource.isUserConfirmed()) {
                audit(Stage.PROTECTED, code, "period=%s source=%s".formatted(confirmedPeriod, periodSource));
                stats.periodResolved(periodSource);
                return new PeriodDecision(confirmedPeriod, periodSource);
            }
            auditWarning(Stage.PROTECTED, code, "violation, period source=%s".formatted(periodSource));
            throw new ProtectedCodeViolationException(code, periodSource);
        }

        if (detectedPeriod != null && !detectedPeriod.isBlank()) {
            Optional<String> detected = PeriodFormat.normalize(detectedPeriod);
            if (detected.isPresent()) {
                audit(Stage.PERIOD, code, "period=%s source=DETECTED".formatted(detected.get()));
                stats.periodResolved(PeriodSource.DETECTED);
                return new PeriodDecision(detected.get(), PeriodSource.DETECTED);
            }
            audit(Stage.PERIOD, code, "ignored malformed detected value '%s'".formatted(detectedPeriod));
        }
        if (confirmedPeriod != null) {
            audit(Stage.PERIOD, code, "period=%s source=%s".formatted(confirmedPeriod, periodSource));
            stats.periodResolved(periodSource);
            return new PeriodDecision(confirmedPeriod, periodSource);
        }
        if (defaultPeriod != null) {
            audit(Stage.PERIOD, code, "period=%s source=DEFAULT".formatted(defaultPeriod));
            return new PeriodDecision(defaultPeriod, PeriodSource.DEFAULT);
        }
        audit(Stage.PERIOD, code, "no period available");
        throw new MissingPeriodException(code);
    }

    /**
     * Records an audit line both in the run's trail and in the application log.
     */
    public void audit(Stage stage, String subject, String message) {
        auditTrail.add(AuditLog.format(stage, subject, message));
        AuditLog.record(runId, stage, subject, message);
    }

    public void auditWarning(Stage stage, String subject, String message) {
        auditTrail.add(AuditLog.format(stage, subject, message));
        AuditLog.warn(runId, stage, subject, message);
    }
}
