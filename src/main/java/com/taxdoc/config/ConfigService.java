package com.taxdoc.config;

import com.taxdoc.logging.AppLogger;

import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Central entry point for resolving configuration values. Settings come from system properties,
 * falling back to built-in defaults. The period, output folder and run configuration of the last
 * run are persisted as preferences and read back only when a run asks to reuse them.
 */
public final class ConfigService {
    private static final Logger LOGGER = AppLogger.get();

    static final String SCAN_PAGES_PROPERTY = "taxdoc.bundle.scanPages";
    static final String MINIMUM_HITS_PROPERTY = "taxdoc.bundle.minimumHits";
    static final String BLANK_THRESHOLD_PROPERTY = "taxdoc.blankThreshold";
    static final String SPECIAL_JURISDICTION_PROPERTY = "taxdoc.specialJurisdiction";
    static final String OUTPUT_FOLDER_PROPERTY = "taxdoc.outputFolder";

    private static final String PREF_KEY_LAST_PERIOD = "period.last";
    private static final String PREF_KEY_OUTPUT_DIR = "output.dir";
    private static final String PREF_KEY_RUN_CONFIG = "runConfig.path";

    private static final ConfigService INSTANCE = new ConfigService(PreferencesStore.global());

    private final PreferencesStore preferences;

    private ConfigService(PreferencesStore preferences) {
        this.preferences = preferences;
    }

    public static ConfigService getInstance() {
        return INSTANCE;
    }

    /**
     * A service over its own preference store, for callers that must not touch the user's saved
     * values.
     */
    public static ConfigService withPreferences(PreferencesStore preferences) {
        return new ConfigService(Objects.requireNonNull(preferences, "preferences"));
    }

    public RenamerSettings currentSettings() {
        return new RenamerSettings(
            intProperty(SCAN_PAGES_PROPERTY, RenamerSettings.DEFAULT_SCAN_PAGES),
            intProperty(MINIMUM_HITS_PROPERTY, RenamerSettings.DEFAULT_MINIMUM_HITS),
            intProperty(BLANK_THRESHOLD_PROPERTY, RenamerSettings.DEFAULT_BLANK_THRESHOLD),
            stringProperty(SPECIAL_JURISDICTION_PROPERTY, RenamerSettings.DEFAULT_SPECIAL_JURISDICTION),
            stringProperty(OUTPUT_FOLDER_PROPERTY, RenamerSettings.DEFAULT_OUTPUT_FOLDER)
        );
    }

    public Optional<String> getLastPeriod() {
        return preferences.getString(PREF_KEY_LAST_PERIOD);
    }

    public void setLastPeriod(String period) {
        preferences.putString(PREF_KEY_LAST_PERIOD, period);
    }

    public Optional<Path> getOutputDirectory() {
        return preferences.getPath(PREF_KEY_OUTPUT_DIR);
    }

    public void setOutputDirectory(Path outputDirectory) {
        if (outputDirectory == null) return;
        preferences.putPath(PREF_KEY_OUTPUT_DIR, outputDirectory);
    }

    public Optional<Path> getRunConfigPath() {
        return preferences.getPath(PREF_KEY_RUN_CONFIG);
    }

    public void setRunConfigPath(Path runConfig) {
        if (runConfig == null) return;
        preferences.putPath(PREF_KEY_RUN_CONFIG, runConfig);
    }

    static int intProperty(String name, int fallback) {
        String raw = System.getProperty(name);
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException ex) {
            LOGGER.warning("Ignoring non-numeric %s=%s, using %d".formatted(name, raw, fallback));
            return fallback;
        }
    }

    static String stringProperty(String name, String fallback) {
        String raw = System.getProperty(name);
        return raw == null || raw.isBlank() ? fallback : raw.trim();
    }
}
