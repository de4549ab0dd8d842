package com.taxdoc.core.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * One entry of the rule catalog.
 *
 * <p>{@code requiredKeywords} is the primary keyword group; {@code alternativeGroups} lists further
 * groups that satisfy the rule on their own. Within a group every keyword must be present.
 * A single exclusion hit vetoes the rule regardless of its required matches.</p>
 */
public record DocumentTypeRule(String code,
                               String label,
                               List<String> requiredKeywords,
                               List<List<String>> alternativeGroups,
                               List<String> partialKeywords,
                               List<String> exclusionKeywords,
                               List<String> filenameKeywords,
                               int priority,
                               DocumentDomain domain,
                               DocumentKind kind) {

    private static final Pattern CODE_PATTERN = Pattern.compile("\\d{4}");

    public DocumentTypeRule {
        Objects.requireNonNull(code, "code");
        Objects.requireNonNull(label, "label");
        Objects.requireNonNull(domain, "domain");
        Objects.requireNonNull(kind, "kind");
        if (!CODE_PATTERN.matcher(code).matches()) {
            throw new IllegalArgumentException("Rule code must be 4 digits: " + code);
        }
        requiredKeywords = requiredKeywords == null ? List.of() : List.copyOf(requiredKeywords);
        List<List<String>> groups = new ArrayList<>();
        if (alternativeGroups != null) {
            for (List<String> group : alternativeGroups) {
                if (group != null && !group.isEmpty()) {
                    groups.add(List.copyOf(group));
                }
            }
        }
        alternativeGroups = List.copyOf(groups);
        partialKeywords = partialKeywords == null ? List.of() : List.copyOf(partialKeywords);
        exclusionKeywords = exclusionKeywords == null ? List.of() : List.copyOf(exclusionKeywords);
        filenameKeywords = filenameKeywords == null ? List.of() : List.copyOf(filenameKeywords);
    }

    /**
     * All keyword groups that can satisfy this rule, primary group first. Empty groups never count.
     */
    public List<List<String>> requirementGroups() {
        List<List<String>> groups = new ArrayList<>(alternativeGroups.size() + 1);
        if (!requiredKeywords.isEmpty()) {
            groups.add(requiredKeywords);
        }
        groups.addAll(alternativeGroups);
        return groups;
    }

    public String codeAndLabel() {
        return code + "_" + label;
    }
}
