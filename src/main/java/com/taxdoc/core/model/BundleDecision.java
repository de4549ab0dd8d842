package com.taxdoc.core.model;

import java.util.Objects;

/**
 * Verdict of bundle detection. Confidence is advisory and never changes {@code isBundle}.
 */
public record BundleDecision(boolean isBundle,
                             BundleFamily family,
                             double confidence,
                             int sampledPages,
                             FamilyCounters localCounters,
                             FamilyCounters nationalCounters,
                             String reason) {

    public BundleDecision {
        Objects.requireNonNull(family, "family");
        localCounters = localCounters == null ? FamilyCounters.EMPTY : localCounters;
        nationalCounters = nationalCounters == null ? FamilyCounters.EMPTY : nationalCounters;
        reason = reason == null ? "" : reason;
        if (!isBundle && family != BundleFamily.NONE) {
            throw new IllegalArgumentException("Non-bundle decision cannot carry a family");
        }
    }

    public static BundleDecision notBundle(int sampledPages, String reason) {
        return new BundleDecision(false, BundleFamily.NONE, 0.0, sampledPages, null, null, reason);
    }

    /**
     * Indicator counts gathered for one bundle family while sampling.
     */
    public record FamilyCounters(int receipt, int payment, int code) {
        public static final FamilyCounters EMPTY = new FamilyCounters(0, 0, 0);

        public int total() {
            return receipt + payment + code;
        }

        public boolean qualifies(int minimum) {
            return receipt >= minimum && payment >= minimum && code >= minimum;
        }

        public int excessOver(int minimum) {
            return (receipt - minimum) + (payment - minimum) + (code - minimum);
        }

        @Override
        public String toString() {
            return "receipt=%d payment=%d code=%d".formatted(receipt, payment, code);
        }
    }
}
