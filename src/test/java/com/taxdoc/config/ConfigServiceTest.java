package com.taxdoc.config;

import com.taxdoc.core.job.JobContext;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

class ConfigServiceTest {

    @AfterEach
    void clearProperties() {
        System.clearProperty(ConfigService.SCAN_PAGES_PROPERTY);
        System.clearProperty(ConfigService.MINIMUM_HITS_PROPERTY);
        System.clearProperty(ConfigService.SPECIAL_JURISDICTION_PROPERTY);
    }

    @Test
    void defaultsApplyWithoutOverrides() {
        assertEquals(RenamerSettings.defaults(), ConfigService.getInstance().currentSettings());
    }

    @Test
    void specialJurisdictionDefaultMatchesJobContext() {
        assertEquals(JobContext.DEFAULT_SPECIAL_JURISDICTION, RenamerSettings.defaults().specialJurisdiction());
    }

    @Test
    void systemPropertiesOverrideDefaults() {
        System.setProperty(ConfigService.SCAN_PAGES_PROPERTY, "4");
        System.setProperty(ConfigService.MINIMUM_HITS_PROPERTY, " 2 ");
        System.setProperty(ConfigService.SPECIAL_JURISDICTION_PROPERTY, "北海道");

        RenamerSettings settings = ConfigService.getInstance().currentSettings();

        assertEquals(4, settings.bundleScanPages());
        assertEquals(2, settings.bundleMinimumHits());
        assertEquals("北海道", settings.specialJurisdiction());
        assertEquals(RenamerSettings.DEFAULT_BLANK_THRESHOLD, settings.blankTextThreshold());
    }

    @Test
    void nonNumericValueFallsBack() {
        System.setProperty(ConfigService.SCAN_PAGES_PROPERTY, "ten");

        assertEquals(RenamerSettings.DEFAULT_SCAN_PAGES, ConfigService.intProperty(ConfigService.SCAN_PAGES_PROPERTY,
            RenamerSettings.DEFAULT_SCAN_PAGES));
    }
}
