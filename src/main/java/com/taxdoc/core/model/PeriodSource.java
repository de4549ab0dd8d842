package com.taxdoc.core.model;

/**
 * Where a YYMM period value came from.
 */
public enum PeriodSource {
    UI,
    UI_FORCED,
    DETECTED,
    DEFAULT,
    NONE;

    public boolean isUserConfirmed() {
        return this == UI || this == UI_FORCED;
    }
}
