package com.taxdoc.core.sequence;

import java.util.List;

/**
 * Jurisdiction names found in a unit's text, in order of first appearance.
 */
public record ExtractedJurisdiction(List<String> prefectures, List<String> municipalities) {

    public ExtractedJurisdiction {
        prefectures = prefectures == null ? List.of() : List.copyOf(prefectures);
        municipalities = municipalities == null ? List.of() : List.copyOf(municipalities);
    }

    public boolean isEmpty() {
        return prefectures.isEmpty() && municipalities.isEmpty();
    }

    @Override
    public String toString() {
        return "prefectures=%s municipalities=%s".formatted(prefectures, municipalities);
    }
}
