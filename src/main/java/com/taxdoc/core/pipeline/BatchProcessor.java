package com.taxdoc.core.pipeline;

import com.taxdoc.core.job.JobContext;
import com.taxdoc.core.model.BundleDecision;
import com.taxdoc.logging.AppLogger;
import com.taxdoc.logging.AuditLog.Stage;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Feeds the files of one run through a {@link DocumentPipeline} on a single background worker,
 * so slot assignments see files in submission order.
 */
public final class BatchProcessor implements AutoCloseable {

    private static final Logger LOGGER = AppLogger.get();

    private final DocumentPipeline pipeline;
    private final JobContext context;
    private final boolean forceSplit;
    private final ExecutorService worker;

    public BatchProcessor(DocumentPipeline pipeline, JobContext context, boolean forceSplit) {
        this.pipeline = Objects.requireNonNull(pipeline, "pipeline");
        this.context = Objects.requireNonNull(context, "context");
        this.forceSplit = forceSplit;
        ThreadFactory tf = r -> {
            Thread t = new Thread(r, "TaxDoc-Worker");
            t.setDaemon(true);
            return t;
        };
        this.worker = Executors.newSingleThreadExecutor(tf);
    }

    public Future<FileOutcome> submit(Path file) {
        context.stats().fileQueued();
        return worker.submit(() -> pipeline.process(file, context, forceSplit));
    }

    /**
     * Processes {@code files} in order and waits for all of them. A file whose processing throws is
     * reported as aborted; the remaining files still run.
     */
    public List<FileOutcome> processAll(List<Path> files) throws InterruptedException {
        List<Future<FileOutcome>> futures = new ArrayList<>(files.size());
        for (Path file : files) {
            futures.add(submit(file));
        }
        List<FileOutcome> outcomes = new ArrayList<>(files.size());
        for (int i = 0; i < futures.size(); i++) {
            Path file = files.get(i);
            try {
                outcomes.add(futures.get(i).get());
            } catch (ExecutionException ex) {
                Throwable cause = ex.getCause() == null ? ex : ex.getCause();
                LOGGER.log(Level.SEVERE, "Processing failed for " + file, cause);
                context.auditWarning(Stage.FILE, String.valueOf(file.getFileName()), "aborted: " + cause);
                context.stats().fileAborted(file);
                outcomes.add(FileOutcome.aborted(file, BundleDecision.notBundle(0, "not evaluated"), String.valueOf(cause)));
            }
        }
        return outcomes;
    }

    @Override
    public void close() {
        worker.shutdown();
        try {
            if (!worker.awaitTermination(30, TimeUnit.SECONDS)) {
                LOGGER.warning("Worker did not finish within 30s, interrupting");
                worker.shutdownNow();
            }
        } catch (InterruptedException ex) {
            worker.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
