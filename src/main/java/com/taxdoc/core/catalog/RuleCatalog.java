package com.taxdoc.core.catalog;

import com.taxdoc.core.model.DocumentDomain;
import com.taxdoc.core.model.DocumentTypeRule;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Versioned, ordered table of document type rules. Declaration order is the final tie-breaker
 * during classification, so it is preserved.
 */
public final class RuleCatalog {

    private final String version;
    private final List<DocumentTypeRule> rules;
    private final Map<String, DocumentTypeRule> byCode;

    public RuleCatalog(String version, List<DocumentTypeRule> rules) {
        this.version = Objects.requireNonNull(version, "version");
        Objects.requireNonNull(rules, "rules");
        Map<String, DocumentTypeRule> index = new LinkedHashMap<>();
        for (DocumentTypeRule rule : rules) {
            DocumentTypeRule previous = index.putIfAbsent(rule.code(), rule);
            if (previous != null) {
                throw new IllegalArgumentException("Duplicate rule code in catalog " + version + ": " + rule.code());
            }
        }
        this.rules = List.copyOf(rules);
        this.byCode = index;
    }

    public String version() {
        return version;
    }

    public List<DocumentTypeRule> rules() {
        return rules;
    }

    public int size() {
        return rules.size();
    }

    public Optional<DocumentTypeRule> findByCode(String code) {
        if (code == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(byCode.get(code));
    }

    /**
     * Rules whose domain is in {@code domains}, in catalog order.
     */
    public List<DocumentTypeRule> rulesFor(Collection<DocumentDomain> domains) {
        if (domains == null || domains.isEmpty()) {
            return rules;
        }
        List<DocumentTypeRule> subset = new ArrayList<>();
        for (DocumentTypeRule rule : rules) {
            if (domains.contains(rule.domain())) {
                subset.add(rule);
            }
        }
        return subset;
    }

    /**
     * Position of a rule in declaration order, or {@link Integer#MAX_VALUE} when unknown.
     */
    public int orderOf(DocumentTypeRule rule) {
        int idx = rules.indexOf(rule);
        return idx < 0 ? Integer.MAX_VALUE : idx;
    }
}
