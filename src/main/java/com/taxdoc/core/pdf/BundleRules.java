package com.taxdoc.core.pdf;

import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Indicator vocabulary for bundle detection, loaded from {@code bundle-rules.json}.
 */
public record BundleRules(FamilyRules local, FamilyRules national, List<String> neverSplitPatterns) {

    public static final String DEFAULT_RESOURCE = "bundle-rules.json";

    public BundleRules {
        Objects.requireNonNull(local, "local");
        Objects.requireNonNull(national, "national");
        neverSplitPatterns = neverSplitPatterns == null ? List.of() : List.copyOf(neverSplitPatterns);
    }

    public record FamilyRules(List<String> receiptKeywords, List<String> paymentKeywords, Set<String> codes) {
        public FamilyRules {
            receiptKeywords = List.copyOf(receiptKeywords);
            paymentKeywords = List.copyOf(paymentKeywords);
            codes = Set.copyOf(codes);
            if (receiptKeywords.isEmpty() || paymentKeywords.isEmpty() || codes.isEmpty()) {
                throw new IllegalArgumentException("Bundle family rules need receipt, payment and code indicators");
            }
        }
    }

    public static BundleRules loadDefault() throws IOException {
        try (InputStream stream = BundleRules.class.getClassLoader().getResourceAsStream(DEFAULT_RESOURCE)) {
            if (stream == null) {
                throw new IOException("Bundle rules resource not found: " + DEFAULT_RESOURCE);
            }
            return parse(new String(stream.readAllBytes(), StandardCharsets.UTF_8));
        }
    }

    static BundleRules parse(String content) throws IOException {
        try {
            JSONObject root = new JSONObject(content);
            return new BundleRules(
                family(root.getJSONObject("local")),
                family(root.getJSONObject("national")),
                strings(root.optJSONArray("neverSplit"))
            );
        } catch (JSONException | IllegalArgumentException ex) {
            throw new IOException("Invalid bundle rules: " + ex.getMessage(), ex);
        }
    }

    private static FamilyRules family(JSONObject node) {
        return new FamilyRules(
            strings(node.optJSONArray("receipt")),
            strings(node.optJSONArray("payment")),
            new LinkedHashSet<>(strings(node.optJSONArray("codes")))
        );
    }

    private static List<String> strings(JSONArray array) {
        List<String> values = new ArrayList<>();
        if (array == null) {
            return values;
        }
        for (int i = 0; i < array.length(); i++) {
            String value = array.optString(i, "").trim();
            if (!value.isEmpty()) {
                values.add(value);
            }
        }
        return values;
    }
}
