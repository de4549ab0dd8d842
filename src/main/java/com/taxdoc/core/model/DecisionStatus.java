package com.taxdoc.core.model;

public enum DecisionStatus {
    RENAMED,
    UNCLASSIFIED,
    SKIPPED_BLANK,
    FAILED
}
