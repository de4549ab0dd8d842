package com.taxdoc.core.job;

import com.taxdoc.core.model.PeriodSource;

import java.util.Objects;

public record PeriodDecision(String value, PeriodSource source) {
    public PeriodDecision {
        Objects.requireNonNull(value, "value");
        Objects.requireNonNull(source, "source");
    }
}
