package com.taxdoc.core.pipeline;

import com.taxdoc.config.RenamerSettings;
import com.taxdoc.core.catalog.RuleCatalog;
import com.taxdoc.core.classify.DocumentClassifier;
import com.taxdoc.core.classify.TextNormalizer;
import com.taxdoc.core.job.JobContext;
import com.taxdoc.core.job.MissingPeriodException;
import com.taxdoc.core.job.PeriodDecision;
import com.taxdoc.core.job.PeriodDetector;
import com.taxdoc.core.job.PeriodResolutionException;
import com.taxdoc.core.job.ProtectedCodeViolationException;
import com.taxdoc.core.model.BundleDecision;
import com.taxdoc.core.model.BundleFamily;
import com.taxdoc.core.model.ClassificationResult;
import com.taxdoc.core.model.DecisionRecord;
import com.taxdoc.core.model.DecisionStatus;
import com.taxdoc.core.model.DocumentDomain;
import com.taxdoc.core.model.PeriodSource;
import com.taxdoc.core.model.SplitUnit;
import com.taxdoc.core.naming.FinalNameBuilder;
import com.taxdoc.core.naming.RenameOutcome;
import com.taxdoc.core.naming.RenameSink;
import com.taxdoc.core.pdf.BundleDetector;
import com.taxdoc.core.pdf.BundleRules;
import com.taxdoc.core.pdf.BundleSplitter;
import com.taxdoc.core.pdf.PdfBoxTextExtractor;
import com.taxdoc.core.pdf.PdfIO;
import com.taxdoc.core.pdf.TextExtractor;
import com.taxdoc.core.sequence.JurisdictionExtractor;
import com.taxdoc.core.sequence.SequenceResolver;
import com.taxdoc.logging.AppLogger;
import com.taxdoc.logging.AuditLog.Stage;
import org.apache.pdfbox.pdmodel.PDDocument;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Stream;

/**
 * Runs one input file through bundle detection, splitting, classification, sequence resolution,
 * period resolution and final naming.
 *
 * <p>Every unit of a file is planned before anything is written. A protected-code violation on any
 * unit therefore aborts the whole file with no output at all.</p>
 */
public final class DocumentPipeline {

    private static final Logger LOGGER = AppLogger.get();

    static final double HEADER_BAND_FRACTION = 0.25;

    private final PdfIO pdfIO;
    private final TextExtractor extractor;
    private final DocumentClassifier classifier;
    private final BundleDetector detector;
    private final BundleSplitter splitter;
    private final RenameSink sink;
    private final RenamerSettings settings;
    private final Path workRoot;
    private final AtomicInteger workSequence = new AtomicInteger();

    public DocumentPipeline(PdfIO pdfIO,
                            TextExtractor extractor,
                            RuleCatalog catalog,
                            BundleRules bundleRules,
                            RenameSink sink,
                            RenamerSettings settings,
                            Path workRoot) {
        this.pdfIO = Objects.requireNonNull(pdfIO, "pdfIO");
        this.extractor = Objects.requireNonNull(extractor, "extractor");
        this.sink = Objects.requireNonNull(sink, "sink");
        this.settings = Objects.requireNonNull(settings, "settings");
        this.workRoot = Objects.requireNonNull(workRoot, "workRoot");
        this.classifier = new DocumentClassifier(Objects.requireNonNull(catalog, "catalog"));
        this.detector = new BundleDetector(extractor, classifier, Objects.requireNonNull(bundleRules, "bundleRules"),
            settings.bundleScanPages(), settings.bundleMinimumHits());
        this.splitter = new BundleSplitter(extractor, pdfIO);
    }

    /**
     * @param forceSplit split per page even when the file is not detected as a bundle
     */
    public FileOutcome process(Path file, JobContext context, boolean forceSplit) {
        Objects.requireNonNull(file, "file");
        Objects.requireNonNull(context, "context");
        String fileName = file.getFileName().toString();
        String owner = file.toAbsolutePath().normalize().toString();
        Path workDir = null;
        BundleDecision decision = null;
        try {
            List<PlannedUnit> plan;
            if (fileName.toLowerCase(Locale.ROOT).endsWith(".csv")) {
                decision = BundleDecision.notBundle(0, "csv input");
                SplitUnit unit = SplitUnit.wholeDocument(file, TextFileReader.read(file));
                plan = List.of(planUnit(unit, unit.text(), EnumSet.noneOf(DocumentDomain.class), context, owner));
            } else {
                try (PDDocument document = pdfIO.load(file)) {
                    decision = detector.detect(document, fileName);
                    context.audit(Stage.BUNDLE, fileName, describe(decision));
                    List<SplitUnit> units;
                    if (decision.isBundle() || forceSplit) {
                        workDir = workRoot.resolve(context.runId())
                            .resolve("%s_%d".formatted(stem(fileName), workSequence.incrementAndGet()));
                        units = splitter.split(document, file, decision, forceSplit, workDir);
                        context.stats().bundleSplit();
                        context.audit(Stage.SPLIT, fileName, "%d units%s".formatted(units.size(),
                            decision.isBundle() ? "" : " (forced)"));
                    } else {
                        units = List.of(wholeDocument(document, file));
                    }
                    Set<DocumentDomain> domains = domainsFor(decision.family());
                    plan = new ArrayList<>(units.size());
                    for (SplitUnit unit : units) {
                        String jurisdictionText = jurisdictionText(document, unit);
                        plan.add(planUnit(unit, jurisdictionText, domains, context, owner));
                    }
                }
            }
            List<DecisionRecord> records = emit(plan, context);
            context.stats().fileProcessed();
            return FileOutcome.completed(file, decision, records);
        } catch (ProtectedCodeViolationException violation) {
            int released = context.slotTracker().release(owner);
            String reason = "protected code %s without confirmed period (source=%s)"
                .formatted(violation.getCode(), violation.getPeriodSource());
            context.auditWarning(Stage.FILE, fileName, "aborted: %s; %d slot assignments released".formatted(reason, released));
            context.stats().fileAborted(file);
            return FileOutcome.aborted(file, decision, reason);
        } catch (IOException ex) {
            LOGGER.log(Level.SEVERE, "Could not read %s".formatted(fileName), ex);
            context.slotTracker().release(owner);
            context.auditWarning(Stage.FILE, fileName, "aborted: " + ex.getMessage());
            context.stats().fileAborted(file);
            return FileOutcome.aborted(file, decision, "unreadable: " + ex.getMessage());
        } catch (RuntimeException ex) {
            LOGGER.log(Level.SEVERE, "Processing failed for %s".formatted(fileName), ex);
            int released = context.slotTracker().release(owner);
            context.auditWarning(Stage.FILE, fileName, "aborted: %s; %d slot assignments released".formatted(ex, released));
            context.stats().fileAborted(file);
            return FileOutcome.aborted(file, decision, "failed: " + ex);
        } finally {
            cleanDir(workDir);
        }
    }

    private PlannedUnit planUnit(SplitUnit unit,
                                 String jurisdictionText,
                                 Collection<DocumentDomain> domains,
                                 JobContext context,
                                 String owner) throws ProtectedCodeViolationException {
        String subject = unit.describe();
        if (unit.pageFile() == null) {
            context.auditWarning(Stage.SPLIT, subject, "no page file: " + unit.errorMarker());
            return PlannedUnit.done(DecisionRecord.failed(unit, null, unit.errorMarker()));
        }
        ClassificationResult result = null;
        try {
            String fileName = unit.sourceFile().getFileName().toString();
            result = classifier.classify(unit.text(), fileName, domains);
            context.audit(Stage.CLASSIFY, subject, result.isUnclassified()
                ? "unclassified"
                : "%s %s tier=%s confidence=%.2f".formatted(result.code(), result.label(), result.tier(), result.confidence()));

            if (isBlank(unit, result)) {
                context.audit(Stage.SPLIT, subject, "blank page skipped");
                return PlannedUnit.done(new DecisionRecord(unit.sourceFile(), unit.pageIndex(), unit.ordinal(),
                    "", "", "", "", "", PeriodSource.NONE, 0.0, DecisionStatus.SKIPPED_BLANK,
                    result.evidenceLog(), "blank page", null));
            }

            String unitKey = owner + "#" + unit.ordinal();
            result = SequenceResolver.resolve(result, jurisdictionText, context, unitKey, owner);

            String detected = null;
            if (!JobContext.isProtected(result.code())) {
                detected = PeriodDetector.detect(unit.text(), fileName).orElse(null);
            }
            PeriodDecision period;
            try {
                period = context.resolvePeriod(result.code(), detected);
            } catch (MissingPeriodException missing) {
                if (!result.isUnclassified()) {
                    throw missing;
                }
                period = new PeriodDecision("", PeriodSource.NONE);
            }
            return PlannedUnit.pending(unit, result, period);
        } catch (ProtectedCodeViolationException violation) {
            throw violation;
        } catch (PeriodResolutionException ex) {
            LOGGER.log(Level.WARNING, "%s: %s".formatted(subject, ex.getMessage()));
            return PlannedUnit.done(DecisionRecord.failed(unit, result, ex.getMessage()));
        } catch (RuntimeException ex) {
            LOGGER.log(Level.SEVERE, "Unexpected failure on " + subject, ex);
            return PlannedUnit.done(DecisionRecord.failed(unit, result, ex.toString()));
        }
    }

    private List<DecisionRecord> emit(List<PlannedUnit> plan, JobContext context) {
        List<DecisionRecord> records = new ArrayList<>(plan.size());
        for (PlannedUnit planned : plan) {
            if (planned.record() != null) {
                countTerminal(planned.record().status(), context);
                records.add(planned.record());
                continue;
            }
            SplitUnit unit = planned.unit();
            ClassificationResult result = planned.result();
            PeriodDecision period = planned.period();
            String qualifier = FinalNameBuilder.qualifier(result.label(), result.jurisdictionQualifier());
            DecisionRecord record = new DecisionRecord(unit.sourceFile(), unit.pageIndex(), unit.ordinal(),
                result.code(), result.originalCode(), result.label(), qualifier, period.value(), period.source(),
                result.confidence(), result.isUnclassified() ? DecisionStatus.UNCLASSIFIED : DecisionStatus.RENAMED,
                result.evidenceLog(), unit.errorMarker(), null);

            RenameOutcome outcome;
            try {
                outcome = sink.finalize(unit, result.code(), qualifier, period.value());
            } catch (RuntimeException ex) {
                LOGGER.log(Level.SEVERE, "Rename failed for " + unit.describe(), ex);
                outcome = RenameOutcome.failed(ex.toString());
            }
            if (outcome.success()) {
                context.audit(Stage.FILE, unit.describe(), "written " + outcome.target().getFileName());
                record = record.withOutput(record.status(), outcome.target(), record.message());
            } else {
                context.auditWarning(Stage.FILE, unit.describe(), "write failed: " + outcome.message());
                record = record.withOutput(DecisionStatus.FAILED, null, outcome.message());
            }
            countTerminal(record.status(), context);
            records.add(record);
        }
        return records;
    }

    private static void countTerminal(DecisionStatus status, JobContext context) {
        switch (status) {
            case RENAMED -> context.stats().unitRenamed();
            case UNCLASSIFIED -> context.stats().unitUnclassified();
            case SKIPPED_BLANK -> context.stats().unitBlank();
            case FAILED -> context.stats().unitFailed();
        }
    }

    private boolean isBlank(SplitUnit unit, ClassificationResult result) {
        return !unit.isWholeDocument()
            && !unit.isUnreadable()
            && result.isUnclassified()
            && TextNormalizer.normalize(unit.text()).length() < settings.blankTextThreshold();
    }

    /**
     * Joins the text of every page. Pages that cannot be read contribute no text and are named in
     * the unit's error marker.
     */
    private SplitUnit wholeDocument(PDDocument document, Path file) {
        String fileName = file.getFileName().toString();
        StringBuilder text = new StringBuilder();
        List<String> unreadable = new ArrayList<>();
        int pages = pdfIO.pageCount(document);
        for (int i = 0; i < pages; i++) {
            if (i > 0) {
                text.append('\n');
            }
            try {
                text.append(extractor.extractPage(document, i));
            } catch (IOException | RuntimeException ex) {
                unreadable.add(String.valueOf(i + 1));
                LOGGER.log(Level.WARNING, "Page %d of %s unreadable: %s".formatted(i + 1, fileName, ex.getMessage()));
            }
        }
        LOGGER.fine(() -> "Extracted %d pages of %s as one document".formatted(pages, fileName));
        String marker = unreadable.isEmpty() ? "" : "text extraction failed on page " + String.join(", ", unreadable);
        return SplitUnit.wholeDocument(file, text.toString(), marker);
    }

    /**
     * Prefers the page header, where the addressee authority is printed, over the full page text.
     */
    private String jurisdictionText(PDDocument document, SplitUnit unit) {
        int pageIndex = unit.isWholeDocument() ? 0 : unit.pageIndex();
        if (pageIndex >= pdfIO.pageCount(document)) {
            return unit.text();
        }
        try {
            String header = extractor.extractRegion(document, pageIndex,
                PdfBoxTextExtractor.headerBand(document, pageIndex, HEADER_BAND_FRACTION));
            if (header != null && !JurisdictionExtractor.extract(header).isEmpty()) {
                return header;
            }
        } catch (IOException | RuntimeException ex) {
            LOGGER.log(Level.FINE, "Header band unreadable on " + unit.describe(), ex);
        }
        return unit.text();
    }

    static Set<DocumentDomain> domainsFor(BundleFamily family) {
        return switch (family) {
            case LOCAL -> EnumSet.of(DocumentDomain.LOCAL_TAX_PREFECTURE, DocumentDomain.LOCAL_TAX_MUNICIPALITY);
            case NATIONAL -> EnumSet.of(DocumentDomain.NATIONAL_TAX, DocumentDomain.CONSUMPTION_TAX);
            case NONE -> EnumSet.noneOf(DocumentDomain.class);
        };
    }

    private static String describe(BundleDecision decision) {
        return "bundle=%s family=%s confidence=%.2f sampled=%d local=%s national=%s (%s)".formatted(
            decision.isBundle(), decision.family(), decision.confidence(), decision.sampledPages(),
            decision.localCounters(), decision.nationalCounters(), decision.reason());
    }

    private static String stem(String fileName) {
        int dot = fileName.lastIndexOf('.');
        String base = dot > 0 ? fileName.substring(0, dot) : fileName;
        return FinalNameBuilder.sanitize(base);
    }

    private static void cleanDir(Path dir) {
        if (dir == null || !Files.exists(dir)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(dir)) {
            walk.sorted(Comparator.reverseOrder()).forEach(p -> {
                try {
                    Files.deleteIfExists(p);
                } catch (IOException ex) {
                    LOGGER.log(Level.FINE, "Could not delete work file " + p, ex);
                }
            });
        } catch (IOException ex) {
            LOGGER.log(Level.WARNING, "Could not clean work directory %s: %s".formatted(dir, ex.getMessage()));
        }
    }

    private record PlannedUnit(SplitUnit unit, ClassificationResult result, PeriodDecision period, DecisionRecord record) {

        static PlannedUnit pending(SplitUnit unit, ClassificationResult result, PeriodDecision period) {
            return new PlannedUnit(unit, result, period, null);
        }

        static PlannedUnit done(DecisionRecord record) {
            return new PlannedUnit(null, null, null, record);
        }
    }
}
