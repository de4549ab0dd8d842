package com.taxdoc.core.job;

public class MissingPeriodException extends PeriodResolutionException {

    public MissingPeriodException(String code) {
        super(code, "No period detected, confirmed or defaulted for code " + code);
    }
}
