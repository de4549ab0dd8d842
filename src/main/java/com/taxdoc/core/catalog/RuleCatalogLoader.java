package com.taxdoc.core.catalog;

import com.taxdoc.core.model.DocumentDomain;
import com.taxdoc.core.model.DocumentKind;
import com.taxdoc.core.model.DocumentTypeRule;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Reads {@link RuleCatalog} definitions from JSON, either the bundled {@code rule-catalog.json}
 * or an external file supplied on the command line.
 */
public final class RuleCatalogLoader {

    public static final String DEFAULT_RESOURCE = "rule-catalog.json";

    private RuleCatalogLoader() {
    }

    public static RuleCatalog loadDefault() throws IOException {
        try (InputStream stream = RuleCatalogLoader.class.getClassLoader().getResourceAsStream(DEFAULT_RESOURCE)) {
            if (stream == null) {
                throw new IOException("Rule catalog resource not found: " + DEFAULT_RESOURCE);
            }
            return parse(new String(stream.readAllBytes(), StandardCharsets.UTF_8), DEFAULT_RESOURCE);
        }
    }

    public static RuleCatalog load(Path file) throws IOException {
        if (file == null || !Files.isRegularFile(file)) {
            throw new IOException("Rule catalog not found: " + file);
        }
        return parse(Files.readString(file, StandardCharsets.UTF_8), file.toString());
    }

    static RuleCatalog parse(String content, String origin) throws IOException {
        try {
            JSONObject root = new JSONObject(content);
            String version = root.optString("version", "").trim();
            if (version.isEmpty()) {
                throw new IOException("Rule catalog is missing 'version': " + origin);
            }
            JSONArray array = root.optJSONArray("rules");
            if (array == null || array.isEmpty()) {
                throw new IOException("Rule catalog has no rules: " + origin);
            }
            List<DocumentTypeRule> rules = new ArrayList<>(array.length());
            for (int i = 0; i < array.length(); i++) {
                rules.add(readRule(array.getJSONObject(i)));
            }
            return new RuleCatalog(version, rules);
        } catch (JSONException | IllegalArgumentException ex) {
            throw new IOException("Invalid rule catalog " + origin + ": " + ex.getMessage(), ex);
        }
    }

    private static DocumentTypeRule readRule(JSONObject node) {
        String code = node.getString("code");
        List<List<String>> alternatives = new ArrayList<>();
        JSONArray groups = node.optJSONArray("alternatives");
        if (groups != null) {
            for (int i = 0; i < groups.length(); i++) {
                alternatives.add(strings(groups.optJSONArray(i)));
            }
        }
        return new DocumentTypeRule(
            code,
            node.getString("label"),
            strings(node.optJSONArray("required")),
            alternatives,
            strings(node.optJSONArray("partial")),
            strings(node.optJSONArray("exclude")),
            strings(node.optJSONArray("filename")),
            node.optInt("priority", 100),
            DocumentDomain.valueOf(node.getString("domain").trim().toUpperCase(Locale.ROOT)),
            DocumentKind.valueOf(node.optString("kind", "RETURN").trim().toUpperCase(Locale.ROOT))
        );
    }

    static List<String> strings(JSONArray array) {
        if (array == null) {
            return List.of();
        }
        List<String> values = new ArrayList<>(array.length());
        for (int i = 0; i < array.length(); i++) {
            String value = array.optString(i, "").trim();
            if (!value.isEmpty()) {
                values.add(value);
            }
        }
        return values;
    }
}
