package com.taxdoc.config;

import com.taxdoc.core.model.JurisdictionSlot;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Parses {@code run-config.json}:
 * <pre>
 * {
 *   "period": "2508",
 *   "forcePeriod": false,
 *   "jurisdictions": [
 *     {"prefecture": "東京都"},
 *     {"prefecture": "愛知県", "municipality": "蒲郡市"}
 *   ]
 * }
 * </pre>
 * Slot numbers follow array order starting at 1.
 */
public final class RunConfigLoader {

    private RunConfigLoader() {
    }

    public static RunConfig load(Path file) throws IOException {
        if (file == null || !Files.isRegularFile(file)) {
            throw new IOException("Run configuration not found: " + file);
        }
        return parse(Files.readString(file, StandardCharsets.UTF_8));
    }

    public static RunConfig parse(String content) throws IOException {
        try {
            JSONObject root = new JSONObject(content);
            List<JurisdictionSlot> slots = new ArrayList<>();
            JSONArray jurisdictions = root.optJSONArray("jurisdictions");
            if (jurisdictions != null) {
                for (int i = 0; i < jurisdictions.length(); i++) {
                    JSONObject entry = jurisdictions.getJSONObject(i);
                    String prefecture = entry.optString("prefecture", "").trim();
                    if (prefecture.isEmpty()) {
                        throw new IOException("Jurisdiction %d is missing 'prefecture'".formatted(i + 1));
                    }
                    slots.add(new JurisdictionSlot(i + 1, prefecture, entry.optString("municipality", "")));
                }
            }
            return new RunConfig(
                blankToNull(root.optString("period", "")),
                root.optBoolean("forcePeriod", false),
                blankToNull(root.optString("defaultPeriod", "")),
                blankToNull(root.optString("specialJurisdiction", "")),
                slots
            );
        } catch (JSONException ex) {
            throw new IOException("Invalid run configuration: " + ex.getMessage(), ex);
        }
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }
}
