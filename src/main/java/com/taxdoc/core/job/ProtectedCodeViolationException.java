package com.taxdoc.core.job;

import com.taxdoc.core.model.PeriodSource;

/**
 * A protected code asked for a period that was not confirmed by the user.
 */
public class ProtectedCodeViolationException extends PeriodResolutionException {

    private final PeriodSource periodSource;

    public ProtectedCodeViolationException(String code, PeriodSource periodSource) {
        super(code, "Protected code %s requires a user-confirmed period, but the job period source is %s"
            .formatted(code, periodSource));
        this.periodSource = periodSource;
    }

    public PeriodSource getPeriodSource() {
        return periodSource;
    }
}
