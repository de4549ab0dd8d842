package com.taxdoc.config;

import com.taxdoc.core.job.JobContext;
import com.taxdoc.core.model.JurisdictionSlot;
import com.taxdoc.core.model.PeriodSource;

import java.util.List;

/**
 * User input for one run: the confirmed period and the jurisdictions in entry order.
 */
public record RunConfig(String period,
                        boolean forcePeriod,
                        String defaultPeriod,
                        String specialJurisdiction,
                        List<JurisdictionSlot> jurisdictions) {

    public RunConfig {
        jurisdictions = jurisdictions == null ? List.of() : List.copyOf(jurisdictions);
    }

    public RunConfig withPeriod(String newPeriod, boolean forced) {
        return new RunConfig(newPeriod, forced, defaultPeriod, specialJurisdiction, jurisdictions);
    }

    public RunConfig withDefaultPeriod(String newDefaultPeriod) {
        return new RunConfig(period, forcePeriod, newDefaultPeriod, specialJurisdiction, jurisdictions);
    }

    public PeriodSource periodSource() {
        if (period == null || period.isBlank()) {
            return PeriodSource.NONE;
        }
        return forcePeriod ? PeriodSource.UI_FORCED : PeriodSource.UI;
    }

    /**
     * @throws IllegalArgumentException when the jurisdictions or periods are inconsistent
     */
    public JobContext toJobContext(String runId, RenamerSettings settings) {
        String special = specialJurisdiction != null && !specialJurisdiction.isBlank()
            ? specialJurisdiction
            : settings.specialJurisdiction();
        return new JobContext(runId, period, periodSource(), jurisdictions, special, defaultPeriod);
    }
}
