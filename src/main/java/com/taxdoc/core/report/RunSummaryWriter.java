package com.taxdoc.core.report;

import com.taxdoc.core.job.JobContext;
import com.taxdoc.core.model.BundleDecision;
import com.taxdoc.core.model.DecisionRecord;
import com.taxdoc.core.model.DecisionStatus;
import com.taxdoc.core.pipeline.FileOutcome;
import org.json.JSONArray;
import org.json.JSONObject;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Writes the JSON summary of a run: counters, error files, the audit trail and per-file results.
 */
public final class RunSummaryWriter {

    public static final String DEFAULT_FILENAME = "run-summary.json";

    private RunSummaryWriter() {
    }

    public static JSONObject toJson(JobContext context, String catalogVersion, List<FileOutcome> outcomes) {
        JSONObject root = new JSONObject();
        root.put("runId", context.runId());
        root.put("generatedAt", Instant.now().toString());
        root.put("catalogVersion", catalogVersion);
        root.put("confirmedPeriod", context.confirmedPeriod().orElse(""));
        root.put("periodSource", context.periodSource().name());

        JSONObject stats = new JSONObject();
        for (Map.Entry<String, Integer> entry : context.stats().snapshot().entrySet()) {
            stats.put(entry.getKey(), entry.getValue().intValue());
        }
        root.put("stats", stats);

        JSONArray errorFiles = new JSONArray();
        context.stats().errorFiles().forEach(p -> errorFiles.put(p.toString()));
        root.put("errorFiles", errorFiles);

        JSONArray files = new JSONArray();
        for (FileOutcome outcome : outcomes) {
            files.put(fileJson(outcome));
        }
        root.put("files", files);

        root.put("audit", new JSONArray(context.auditTrail()));
        return root;
    }

    public static void write(Path target, JobContext context, String catalogVersion, List<FileOutcome> outcomes) throws IOException {
        Path parent = target.getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(
            target,
            toJson(context, catalogVersion, outcomes).toString(2),
            StandardCharsets.UTF_8,
            StandardOpenOption.CREATE,
            StandardOpenOption.TRUNCATE_EXISTING,
            StandardOpenOption.WRITE
        );
    }

    private static JSONObject fileJson(FileOutcome outcome) {
        JSONObject obj = new JSONObject();
        obj.put("source", outcome.source().toString());
        obj.put("aborted", outcome.aborted());
        if (outcome.aborted()) {
            obj.put("abortReason", outcome.abortReason());
        }
        BundleDecision decision = outcome.bundleDecision();
        if (decision != null) {
            JSONObject bundle = new JSONObject();
            bundle.put("isBundle", decision.isBundle());
            bundle.put("family", decision.family().name());
            bundle.put("confidence", decision.confidence());
            bundle.put("sampledPages", decision.sampledPages());
            bundle.put("reason", decision.reason());
            obj.put("bundle", bundle);
        }
        JSONArray units = new JSONArray();
        for (DecisionRecord record : outcome.records()) {
            JSONObject unit = new JSONObject();
            unit.put("ordinal", record.ordinal());
            unit.put("status", record.status().name());
            unit.put("finalCode", record.finalCode());
            unit.put("originalCode", record.originalCode());
            unit.put("qualifier", record.qualifier());
            unit.put("period", record.period());
            unit.put("periodSource", record.periodSource().name());
            unit.put("confidence", record.confidence());
            if (record.outputFile() != null) {
                unit.put("output", record.outputFile().getFileName().toString());
            }
            if (!record.message().isEmpty()) {
                unit.put("message", record.message());
            }
            units.put(unit);
        }
        obj.put("units", units);
        obj.put("renamed", outcome.count(DecisionStatus.RENAMED));
        return obj;
    }
}
