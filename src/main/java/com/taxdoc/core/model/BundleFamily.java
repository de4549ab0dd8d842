package com.taxdoc.core.model;

public enum BundleFamily {
    NONE,
    NATIONAL,
    LOCAL
}
