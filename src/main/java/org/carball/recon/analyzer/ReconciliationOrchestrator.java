package org.carball.recon.analyzer;

import lombok.extern.slf4j.Slf4j;
import org.carball.recon.config.AnalysisSettings;
import org.carball.recon.model.analysis.AnalysisReport;
import org.carball.recon.model.analysis.FileAnalysis;
import org.carball.recon.model.field.CanonicalFieldRegistry;
import org.carball.recon.model.field.FieldMapping;
import org.carball.recon.model.quality.FieldCompletenessRecord;
import org.carball.recon.model.table.SourceTable;
import org.carball.recon.parser.DateFormatClassifier;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Drives a reconciliation run over a set of source files.
 * <p>
 * Each file is analyzed on its own into a {@link FileAnalysis}, either sequentially or on a worker
 * pool. The partial results are then folded in file-id order on the calling thread, and only after
 * every file has been folded are the field mapping and the completeness view computed. The report is
 * therefore the same whichever order the files finish in.
 */
@Slf4j
public class ReconciliationOrchestrator {

    private final CanonicalFieldRegistry registry;
    private final AnalysisSettings settings;
    private final FileAnalyzer fileAnalyzer;
    private final FieldMapper fieldMapper;
    private final CompletenessAggregator completenessAggregator;

    public ReconciliationOrchestrator(CanonicalFieldRegistry registry) {
        this(registry, AnalysisSettings.createDefaults());
    }

    public ReconciliationOrchestrator(CanonicalFieldRegistry registry, AnalysisSettings settings) {
        this.registry = registry;
        this.settings = settings;
        this.completenessAggregator = new CompletenessAggregator();
        this.fileAnalyzer = new FileAnalyzer(settings, new DateFormatClassifier(),
                completenessAggregator);
        this.fieldMapper = new FieldMapper(settings.getSimilarityThreshold());

        log.info("Initialized ReconciliationOrchestrator with {} canonical fields", registry.size());
        log.info("Using {}", settings.getDescription());
    }

    /**
     * Runs sequentially or in parallel depending on the configured parallelism.
     */
    public AnalysisReport reconcile(List<SourceTable> sources) {
        if (settings.getParallelism() > 1) {
            return reconcileParallel(sources, settings.getParallelism());
        }
        return reconcileSequential(sources);
    }

    public AnalysisReport reconcileSequential(List<SourceTable> sources) {
        requireSources(sources);
        log.info("Starting sequential reconciliation of {} files", sources.size());

        List<FileAnalysis> partials = new ArrayList<>();
        for (SourceTable source : sources) {
            if (Thread.currentThread().isInterrupted()) {
                throw new CancellationException(
                        "Reconciliation cancelled after " + partials.size() + " of " + sources.size() + " files");
            }
            partials.add(fileAnalyzer.analyze(source));
        }
        return fanIn(partials);
    }

    public AnalysisReport reconcileParallel(List<SourceTable> sources, int parallelism) {
        requireSources(sources);
        if (parallelism < 1) {
            throw new IllegalArgumentException("Parallelism must be at least 1: " + parallelism);
        }
        log.info("Starting parallel reconciliation of {} files on {} workers", sources.size(), parallelism);

        ExecutorService executor = Executors.newFixedThreadPool(parallelism, workerThreadFactory());
        List<CompletableFuture<FileAnalysis>> futures = new ArrayList<>();
        try {
            for (SourceTable source : sources) {
                futures.add(CompletableFuture.supplyAsync(() -> fileAnalyzer.analyze(source), executor));
            }

            List<FileAnalysis> partials = new ArrayList<>();
            for (CompletableFuture<FileAnalysis> future : futures) {
                partials.add(future.get());
            }
            return fanIn(partials);

        } catch (InterruptedException e) {
            futures.forEach(future -> future.cancel(true));
            Thread.currentThread().interrupt();
            throw new CancellationException("Reconciliation cancelled while files were being analyzed");
        } catch (ExecutionException e) {
            throw new IllegalStateException("File analysis failed unexpectedly", e.getCause());
        } finally {
            executor.shutdownNow();
        }
    }

    private AnalysisReport fanIn(List<FileAnalysis> partials) {
        AnalysisAccumulator accumulator = new AnalysisAccumulator();
        partials.stream()
                .sorted(Comparator.comparing(FileAnalysis::fileId))
                .forEach(accumulator::fold);

        FieldMapping mapping = fieldMapper.buildMapping(accumulator.normalizedHeaders(), registry);
        Map<String, List<FieldCompletenessRecord>> completeness =
                completenessAggregator.merge(accumulator.completenessRecords());

        AnalysisReport report = accumulator.toReport(mapping, completeness);
        log.info("Reconciliation complete: {} files analyzed, {} failed, {} unique headers, {} canonical fields mapped",
                report.summary().filesAnalyzed(), report.summary().filesFailed(),
                report.summary().uniqueNormalizedHeaders(), mapping.mappedFieldCount());
        return report;
    }

    private static void requireSources(List<SourceTable> sources) {
        if (sources == null) {
            throw new IllegalArgumentException("No source files given");
        }
        if (sources.isEmpty()) {
            log.warn("No source files to reconcile; the report will be empty");
        }
    }

    private static ThreadFactory workerThreadFactory() {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "recon-worker-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
