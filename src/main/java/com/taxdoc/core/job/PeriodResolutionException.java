package com.taxdoc.core.job;

/**
 * Raised when no acceptable YYMM period can be produced for a document code.
 */
public class PeriodResolutionException extends Exception {

    private final String code;

    public PeriodResolutionException(String code, String message) {
        super(message);
        this.code = code;
    }

    public String getCode() {
        return code;
    }
}
