package com.taxdoc.core.report;

import com.taxdoc.core.model.DecisionRecord;
import com.taxdoc.core.pipeline.FileOutcome;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;

/**
 * Writes one CSV row per unit decision so a run can be reviewed after the fact. Aborted files get a
 * single {@code ABORTED} row carrying the reason.
 */
public final class DecisionCsvExporter {

    static final String HEADER =
        "source,page,ordinal,status,final_code,original_code,label,qualifier,period,period_source,confidence,output,message,evidence";

    private DecisionCsvExporter() {
    }

    public static void write(Path csvFile, List<FileOutcome> outcomes) throws IOException {
        if (csvFile.getParent() != null) {
            Files.createDirectories(csvFile.getParent());
        }
        try (BufferedWriter writer = Files.newBufferedWriter(csvFile, StandardCharsets.UTF_8)) {
            writer.write(HEADER);
            writer.newLine();
            for (FileOutcome outcome : outcomes) {
                if (outcome.aborted()) {
                    writer.write(toCsv(new String[] {
                        outcome.source().toString(), "", "", "ABORTED", "", "", "", "", "", "", "", "",
                        outcome.abortReason(), ""
                    }));
                    writer.newLine();
                    continue;
                }
                for (DecisionRecord record : outcome.records()) {
                    writer.write(toCsv(columns(record)));
                    writer.newLine();
                }
            }
        }
    }

    static String[] columns(DecisionRecord record) {
        return new String[] {
            record.source().toString(),
            record.pageIndex() < 0 ? "" : String.valueOf(record.pageIndex() + 1),
            String.valueOf(record.ordinal()),
            record.status().name(),
            record.finalCode(),
            record.originalCode(),
            record.label(),
            record.qualifier(),
            record.period(),
            record.periodSource().name(),
            String.format(Locale.ROOT, "%.2f", record.confidence()),
            record.outputFile() == null ? "" : record.outputFile().getFileName().toString(),
            record.message(),
            String.join(" | ", record.evidenceLog())
        };
    }

    static String toCsv(String[] columns) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < columns.length; i++) {
            if (i > 0) {
                sb.append(',');
            }
            sb.append(escape(columns[i]));
        }
        return sb.toString();
    }

    static String escape(String value) {
        if (value == null) {
            return "";
        }
        boolean needsQuotes = value.contains(",") || value.contains("\"") || value.contains("\n") || value.contains("\r");
        String escaped = value.replace("\"", "\"\"");
        if (needsQuotes) {
            return "\"" + escaped + "\"";
        }
        return escaped;
    }
}
