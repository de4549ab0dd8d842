package com.taxdoc.cli;

import com.taxdoc.config.ConfigService;
import com.taxdoc.config.RenamerSettings;
import com.taxdoc.config.RunConfig;
import com.taxdoc.config.RunConfigLoader;
import com.taxdoc.core.catalog.RuleCatalog;
import com.taxdoc.core.catalog.RuleCatalogLoader;
import com.taxdoc.core.job.JobContext;
import com.taxdoc.core.naming.PdfRenameSink;
import com.taxdoc.core.pdf.BundleRules;
import com.taxdoc.core.pdf.PdfBoxPdfIO;
import com.taxdoc.core.pdf.PdfBoxTextExtractor;
import com.taxdoc.core.pipeline.BatchProcessor;
import com.taxdoc.core.pipeline.DocumentPipeline;
import com.taxdoc.core.pipeline.FileOutcome;
import com.taxdoc.core.report.DecisionCsvExporter;
import com.taxdoc.core.report.RunSummaryWriter;
import com.taxdoc.logging.AppLogger;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Stream;

/**
 * Command-line entry point. Renames tax PDFs and accounting CSVs into {@code code_qualifier_YYMM}
 * files, splitting e-filing bundles on the way.
 *
 * <pre>
 * TaxDocRenamerTool [--period 2508] [--force-period] [--config run.json] [--out dir]
 *                   [--force-split] [--catalog rules.json] [--last] input...
 * </pre>
 *
 * Inputs may also come from {@code -Dtaxdoc.inputs=a.pdf,b.pdf}. Directories are scanned for PDF and
 * CSV files, skipping output and work folders of earlier runs. {@code --last} reuses the run
 * configuration and output folder of the previous run where none is given, and its period as the
 * default period.
 */
public final class TaxDocRenamerTool {

    private static final Logger LOGGER = AppLogger.get();

    static final String INPUTS_PROPERTY = "taxdoc.inputs";
    static final String DECISIONS_FILENAME = "decisions.csv";
    static final String WORK_FOLDER = "_tmp_split";
    private static final DateTimeFormatter RUN_ID_FORMAT = DateTimeFormatter.ofPattern("yyyyMMdd-HHmmss");

    private TaxDocRenamerTool() {}

    public static void main(String[] args) throws Exception {
        int exit = run(args);
        if (exit != 0) {
            System.exit(exit);
        }
    }

    /**
     * @return 0 when every file completed, 1 when any file was aborted, 2 on invalid usage
     */
    static int run(String[] args) throws IOException, InterruptedException {
        Options options;
        try {
            options = Options.parse(args);
        } catch (IllegalArgumentException ex) {
            LOGGER.severe(ex.getMessage());
            return 2;
        }
        ConfigService config = ConfigService.getInstance();
        RenamerSettings settings = config.currentSettings();
        if (options.reuseLast()) {
            options = withRememberedDefaults(options, config);
        }

        List<Path> inputs;
        RunConfig runConfig;
        RuleCatalog catalog;
        try {
            inputs = resolveInputs(options.inputs(), settings.outputFolderName());
            runConfig = options.configFile() != null
                ? RunConfigLoader.load(options.configFile())
                : new RunConfig(null, false, null, null, List.of());
            catalog = options.catalogFile() != null
                ? RuleCatalogLoader.load(options.catalogFile())
                : RuleCatalogLoader.loadDefault();
        } catch (IOException ex) {
            LOGGER.severe(ex.getMessage());
            return 2;
        }
        if (options.period() != null) {
            runConfig = runConfig.withPeriod(options.period(), options.forcePeriod());
        }
        if (options.reuseLast()) {
            runConfig = withRememberedPeriod(runConfig, config);
        }

        String runId = LocalDateTime.now().format(RUN_ID_FORMAT);
        JobContext context;
        try {
            context = runConfig.toJobContext(runId, settings);
        } catch (IllegalArgumentException ex) {
            LOGGER.severe("Invalid run configuration: " + ex.getMessage());
            return 2;
        }

        Path outDir = options.outDir() != null
            ? options.outDir()
            : inputs.get(0).toAbsolutePath().getParent().resolve(settings.outputFolderName());
        Files.createDirectories(outDir);

        LOGGER.info("Run %s: %d inputs, catalog %s (%d rules), period %s (%s), %d jurisdictions".formatted(
            runId, inputs.size(), catalog.version(), catalog.size(),
            context.confirmedPeriod().orElse("-"), context.periodSource(), context.jurisdictionSlots().size()));

        DocumentPipeline pipeline = new DocumentPipeline(new PdfBoxPdfIO(), new PdfBoxTextExtractor(), catalog,
            BundleRules.loadDefault(), new PdfRenameSink(outDir), settings, outDir.resolve(WORK_FOLDER));

        List<FileOutcome> outcomes;
        try (BatchProcessor batch = new BatchProcessor(pipeline, context, options.forceSplit())) {
            outcomes = batch.processAll(inputs);
        }

        DecisionCsvExporter.write(outDir.resolve(DECISIONS_FILENAME), outcomes);
        RunSummaryWriter.write(outDir.resolve(RunSummaryWriter.DEFAULT_FILENAME), context, catalog.version(), outcomes);

        context.confirmedPeriod().ifPresent(config::setLastPeriod);
        config.setOutputDirectory(outDir.toAbsolutePath());
        if (options.configFile() != null) {
            config.setRunConfigPath(options.configFile().toAbsolutePath());
        }

        for (Map.Entry<String, Integer> entry : context.stats().snapshot().entrySet()) {
            LOGGER.info("  %s = %d".formatted(entry.getKey(), entry.getValue()));
        }
        List<Path> errors = context.stats().errorFiles();
        if (!errors.isEmpty()) {
            errors.forEach(p -> LOGGER.warning("Aborted: " + p));
            return 1;
        }
        return 0;
    }

    /**
     * Fills the run configuration and output folder from the previous run where the command line
     * leaves them out. A remembered configuration that no longer exists is ignored.
     */
    static Options withRememberedDefaults(Options options, ConfigService config) {
        Path configFile = options.configFile() != null
            ? options.configFile()
            : config.getRunConfigPath().filter(Files::isRegularFile).orElse(null);
        Path outDir = options.outDir() != null
            ? options.outDir()
            : config.getOutputDirectory().orElse(null);
        if (configFile != null && options.configFile() == null) {
            LOGGER.info("Reusing run configuration " + configFile);
        }
        return new Options(options.period(), options.forcePeriod(), configFile, outDir, options.forceSplit(),
            options.catalogFile(), true, options.inputs());
    }

    /**
     * The previous run's period only ever becomes the default period: it never confirms a period for
     * protected codes.
     */
    static RunConfig withRememberedPeriod(RunConfig runConfig, ConfigService config) {
        if (runConfig.defaultPeriod() != null && !runConfig.defaultPeriod().isBlank()) {
            return runConfig;
        }
        return config.getLastPeriod().map(runConfig::withDefaultPeriod).orElse(runConfig);
    }

    static List<Path> resolveInputs(List<String> args, String outputFolderName) throws IOException {
        List<Path> inputs = new ArrayList<>();

        // 1) CLI arguments
        for (String p : args) {
            if (p == null || p.isBlank()) continue;
            addInput(Path.of(p.trim()), outputFolderName, inputs);
        }

        // 2) System property (comma-separated): -Dtaxdoc.inputs=/path/a.pdf,/path/b.pdf
        if (inputs.isEmpty()) {
            String csv = System.getProperty(INPUTS_PROPERTY);
            if (csv != null && !csv.isBlank()) {
                for (String p : csv.split(",")) {
                    String s = p.trim();
                    if (s.isEmpty()) continue;
                    addInput(Path.of(s), outputFolderName, inputs);
                }
            }
        }

        if (inputs.isEmpty()) throw new IOException("No input file");
        return inputs;
    }

    private static void addInput(Path path, String outputFolderName, List<Path> inputs) throws IOException {
        if (Files.isDirectory(path)) {
            try (Stream<Path> walk = Files.walk(path)) {
                walk.filter(Files::isRegularFile)
                    .filter(TaxDocRenamerTool::isSupported)
                    .filter(p -> !isRunOutput(path.relativize(p), outputFolderName))
                    .sorted()
                    .forEach(inputs::add);
            }
        } else if (Files.isRegularFile(path) && isSupported(path)) {
            inputs.add(path);
        } else {
            LOGGER.log(Level.WARNING, "Skipping unsupported or missing input: " + path);
        }
    }

    /**
     * True for files a previous run wrote below a scanned folder: anything inside an output or work
     * folder, and the run reports.
     */
    static boolean isRunOutput(Path relative, String outputFolderName) {
        String name = relative.getFileName().toString();
        if (name.equals(DECISIONS_FILENAME) || name.equals(RunSummaryWriter.DEFAULT_FILENAME)) {
            return true;
        }
        for (int i = 0; i < relative.getNameCount() - 1; i++) {
            String folder = relative.getName(i).toString();
            if (folder.equals(outputFolderName) || folder.equals(WORK_FOLDER)) {
                return true;
            }
        }
        return false;
    }

    static boolean isSupported(Path path) {
        String name = path.getFileName().toString().toLowerCase(Locale.ROOT);
        return name.endsWith(".pdf") || name.endsWith(".csv");
    }

    record Options(String period,
                   boolean forcePeriod,
                   Path configFile,
                   Path outDir,
                   boolean forceSplit,
                   Path catalogFile,
                   boolean reuseLast,
                   List<String> inputs) {

        static Options parse(String[] args) {
            String period = null;
            boolean forcePeriod = false;
            Path config = null;
            Path out = null;
            boolean forceSplit = false;
            Path catalog = null;
            boolean reuseLast = false;
            List<String> inputs = new ArrayList<>();
            String[] safe = args == null ? new String[0] : args;
            for (int i = 0; i < safe.length; i++) {
                String arg = safe[i];
                switch (arg) {
                    case "--period" -> period = value(safe, ++i, arg);
                    case "--force-period" -> forcePeriod = true;
                    case "--config" -> config = Path.of(value(safe, ++i, arg));
                    case "--out" -> out = Path.of(value(safe, ++i, arg));
                    case "--force-split" -> forceSplit = true;
                    case "--catalog" -> catalog = Path.of(value(safe, ++i, arg));
                    case "--last" -> reuseLast = true;
                    default -> {
                        if (arg.startsWith("--")) {
                            throw new IllegalArgumentException("Unknown option " + arg);
                        }
                        inputs.add(arg);
                    }
                }
            }
            if (forcePeriod && period == null) {
                throw new IllegalArgumentException("--force-period needs --period");
            }
            return new Options(period, forcePeriod, config, out, forceSplit, catalog, reuseLast, List.copyOf(inputs));
        }

        private static String value(String[] args, int index, String option) {
            if (index >= args.length || args[index].isBlank()) {
                throw new IllegalArgumentException(option + " needs a value");
            }
            return args[index];
        }
    }
}
