package com.taxdoc.core.model;

/**
 * How strongly a classification was supported by the text.
 */
public enum MatchTier {
    /** Every keyword of a required group was present. */
    REQUIRED,
    /** No required group matched; best partial-keyword candidate. */
    PARTIAL,
    UNCLASSIFIED
}
