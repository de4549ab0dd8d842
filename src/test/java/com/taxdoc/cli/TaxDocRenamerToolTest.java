package com.taxdoc.cli;

import com.taxdoc.config.ConfigService;
import com.taxdoc.config.PreferencesStore;
import com.taxdoc.config.RunConfig;
import com.taxdoc.core.model.PeriodSource;
import com.taxdoc.core.pdf.TestPdfs;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.UUID;
import java.util.prefs.BackingStoreException;
import java.util.prefs.Preferences;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TaxDocRenamerToolTest {

    @TempDir
    Path tempDir;

    private Preferences node;

    @BeforeEach
    void isolatePreferences() {
        node = Preferences.userRoot().node("com/taxdoc/renamer-test/" + UUID.randomUUID());
    }

    @AfterEach
    void clearInputsProperty() throws BackingStoreException {
        System.clearProperty(TaxDocRenamerTool.INPUTS_PROPERTY);
        node.removeNode();
    }

    @Test
    void parsesOptionsAndInputs() {
        TaxDocRenamerTool.Options options = TaxDocRenamerTool.Options.parse(new String[] {
            "--period", "2508", "--force-period", "--out", "renamed", "--force-split", "a.pdf", "b.csv"
        });

        assertEquals("2508", options.period());
        assertTrue(options.forcePeriod());
        assertTrue(options.forceSplit());
        assertEquals(Path.of("renamed"), options.outDir());
        assertNull(options.configFile());
        assertEquals(List.of("a.pdf", "b.csv"), options.inputs());
        assertFalse(options.reuseLast());
        assertTrue(TaxDocRenamerTool.Options.parse(new String[] {"--last", "a.pdf"}).reuseLast());
    }

    @Test
    void rejectsInvalidUsage() {
        assertThrows(IllegalArgumentException.class, () -> TaxDocRenamerTool.Options.parse(new String[] {"--verbose"}));
        assertThrows(IllegalArgumentException.class, () -> TaxDocRenamerTool.Options.parse(new String[] {"--period"}));
        assertThrows(IllegalArgumentException.class,
            () -> TaxDocRenamerTool.Options.parse(new String[] {"--force-period", "a.pdf"}));
    }

    @Test
    void invalidUsageExitsWithTwo() throws Exception {
        assertEquals(2, TaxDocRenamerTool.run(new String[] {"--force-period", "a.pdf"}));

        Path input = TestPdfs.blankPages(tempDir.resolve("notice.pdf"), 1);
        Path config = Files.writeString(tempDir.resolve("run.json"),
            "{\"jurisdictions\": [{\"prefecture\": \"東京都\", \"municipality\": \"千代田区\"}]}");
        assertEquals(2, TaxDocRenamerTool.run(new String[] {"--config", config.toString(), input.toString()}));

        Path malformed = Files.writeString(tempDir.resolve("broken.json"), "{\"jurisdictions\": [");
        assertEquals(2, TaxDocRenamerTool.run(new String[] {"--config", malformed.toString(), input.toString()}));
        assertEquals(2, TaxDocRenamerTool.run(new String[] {"--config", tempDir.resolve("absent.json").toString(),
            input.toString()}));
        assertEquals(2, TaxDocRenamerTool.run(new String[] {"--period", "2508", tempDir.resolve("missing.pdf").toString()}));
        assertFalse(Files.exists(tempDir.resolve("renamed")));
    }

    @Test
    void directoriesAreScannedForSupportedFiles() throws IOException {
        Path dir = Files.createDirectories(tempDir.resolve("inbox").resolve("nested"));
        Path pdf = Files.writeString(dir.resolve("b.PDF"), "x");
        Path csv = Files.writeString(tempDir.resolve("inbox").resolve("a.csv"), "x");
        Files.writeString(dir.resolve("notes.txt"), "x");

        List<Path> inputs = TaxDocRenamerTool.resolveInputs(List.of(tempDir.resolve("inbox").toString()), "renamed");

        assertEquals(List.of(csv, pdf), inputs);
    }

    @Test
    void outputOfEarlierRunsIsNotRescanned() throws IOException {
        Path inbox = Files.createDirectories(tempDir.resolve("inbox"));
        Path pdf = Files.writeString(inbox.resolve("a.pdf"), "x");
        Path renamed = Files.createDirectories(inbox.resolve("renamed"));
        Files.writeString(renamed.resolve("5002_総勘定元帳_2508.pdf"), "x");
        Files.writeString(renamed.resolve(TaxDocRenamerTool.DECISIONS_FILENAME), "x");
        Path work = Files.createDirectories(renamed.resolve(TaxDocRenamerTool.WORK_FOLDER).resolve("run1"));
        Files.writeString(work.resolve("page_00001.pdf"), "x");
        Files.writeString(inbox.resolve(TaxDocRenamerTool.DECISIONS_FILENAME), "x");

        assertEquals(List.of(pdf), TaxDocRenamerTool.resolveInputs(List.of(inbox.toString()), "renamed"));

        Path explicit = renamed.resolve("5002_総勘定元帳_2508.pdf");
        assertEquals(List.of(explicit), TaxDocRenamerTool.resolveInputs(List.of(explicit.toString()), "renamed"));
    }

    @Test
    void runOutputMatchesOnlyReportsAndOutputFolders() {
        assertTrue(TaxDocRenamerTool.isRunOutput(Path.of("出力", "a.pdf"), "出力"));
        assertTrue(TaxDocRenamerTool.isRunOutput(Path.of("x", "decisions.csv"), "renamed"));
        assertFalse(TaxDocRenamerTool.isRunOutput(Path.of("renamed.pdf"), "renamed"));
        assertFalse(TaxDocRenamerTool.isRunOutput(Path.of("2025", "仕訳帳.csv"), "renamed"));
    }

    @Test
    void inputsFallBackToSystemProperty() throws IOException {
        Path pdf = Files.writeString(tempDir.resolve("c.pdf"), "x");
        System.setProperty(TaxDocRenamerTool.INPUTS_PROPERTY, " " + pdf + " ,");

        assertEquals(List.of(pdf), TaxDocRenamerTool.resolveInputs(List.of(), "renamed"));

        System.clearProperty(TaxDocRenamerTool.INPUTS_PROPERTY);
        assertThrows(IOException.class, () -> TaxDocRenamerTool.resolveInputs(List.of(tempDir.resolve("none.pdf").toString()), "renamed"));
    }

    @Test
    void lastRunFillsMissingConfigAndOutput() throws IOException {
        ConfigService config = ConfigService.withPreferences(PreferencesStore.of(node));
        Path runJson = Files.writeString(tempDir.resolve("run.json"), "{\"period\": \"2508\"}");
        config.setRunConfigPath(runJson);
        config.setOutputDirectory(tempDir.resolve("out"));

        TaxDocRenamerTool.Options remembered = TaxDocRenamerTool.withRememberedDefaults(
            TaxDocRenamerTool.Options.parse(new String[] {"--last", "a.pdf"}), config);
        assertEquals(runJson, remembered.configFile());
        assertEquals(tempDir.resolve("out"), remembered.outDir());

        TaxDocRenamerTool.Options explicit = TaxDocRenamerTool.withRememberedDefaults(
            TaxDocRenamerTool.Options.parse(new String[] {"--last", "--out", "elsewhere", "a.pdf"}), config);
        assertEquals(Path.of("elsewhere"), explicit.outDir());

        Files.delete(runJson);
        assertNull(TaxDocRenamerTool.withRememberedDefaults(
            TaxDocRenamerTool.Options.parse(new String[] {"--last", "a.pdf"}), config).configFile());
    }

    @Test
    void lastPeriodOnlyBecomesDefaultPeriod() {
        ConfigService config = ConfigService.withPreferences(PreferencesStore.of(node));
        RunConfig empty = new RunConfig(null, false, null, null, List.of());
        assertNull(TaxDocRenamerTool.withRememberedPeriod(empty, config).defaultPeriod());

        config.setLastPeriod("2503");
        RunConfig remembered = TaxDocRenamerTool.withRememberedPeriod(empty, config);

        assertEquals("2503", remembered.defaultPeriod());
        assertNull(remembered.period());
        assertEquals(PeriodSource.NONE, remembered.periodSource());
        assertEquals("2412", TaxDocRenamerTool.withRememberedPeriod(
            new RunConfig(null, false, "2412", null, List.of()), config).defaultPeriod());
    }

    @Test
    void onlyPdfAndCsvAreSupported() {
        assertTrue(TaxDocRenamerTool.isSupported(Path.of("x/申告書.PDF")));
        assertTrue(TaxDocRenamerTool.isSupported(Path.of("仕訳帳.csv")));
        assertFalse(TaxDocRenamerTool.isSupported(Path.of("readme.txt")));
    }
}
