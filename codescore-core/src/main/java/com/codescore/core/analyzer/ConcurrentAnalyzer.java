package com.codescore.core.analyzer;

import com.codescore.core.config.RuntimeConfig;
import com.codescore.core.model.AnalysisStatistics;
import com.codescore.core.model.FileAnalysisResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Analyzes files on a bounded worker pool.
 *
 * <p>Each task parses and scores one file. A failing file is logged, counted and dropped; it
 * never aborts the run. Files above {@link #MAX_FILE_SIZE_KB}, and files marked
 * {@link SourceFile#isSkipped() skipped} by discovery, are counted as skipped without parsing.
 * Result order is not significant.
 *
 * <p><b>Usage Example:</b></p>
 * <pre>{@code
 * ConcurrentAnalyzer analyzer = new ConcurrentAnalyzer(fileAnalyzer, config);
 * ConcurrentAnalyzer.Outcome outcome = analyzer.analyze(files,
 *     (done, total) -> System.out.printf("%d/%d%n", done, total));
 * List<FileAnalysisResult> results = outcome.results();
 * }</pre>
 *
 * @since 1.0.0
 */
public class ConcurrentAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(ConcurrentAnalyzer.class);

    /** Files larger than this are skipped. */
    public static final int MAX_FILE_SIZE_KB = 500;

    private final FileAnalyzer fileAnalyzer;
    private final RuntimeConfig config;

    public ConcurrentAnalyzer(FileAnalyzer fileAnalyzer, RuntimeConfig config) {
        this.fileAnalyzer = Objects.requireNonNull(fileAnalyzer, "fileAnalyzer must not be null");
        this.config = config != null ? config : RuntimeConfig.defaults();
    }

    /**
     * Results of one concurrent run.
     *
     * @param results results of successfully analyzed files
     * @param statistics tier, skip and failure counts
     */
    public record Outcome(List<FileAnalysisResult> results, AnalysisStatistics statistics) {
        public Outcome {
            results = results == null ? List.of() : List.copyOf(results);
            if (statistics == null) {
                statistics = AnalysisStatistics.empty();
            }
        }
    }

    /**
     * Analyzes every file and waits for all of them to finish.
     *
     * @param files files to analyze
     * @param listener progress callback, invoked after each file
     * @return successful results and run statistics
     * @throws InterruptedException if the calling thread is interrupted while waiting
     */
    public Outcome analyze(List<SourceFile> files, ProgressListener listener) throws InterruptedException {
        ProgressListener progress = listener != null ? listener : ProgressListener.NONE;
        AnalysisStatistics.Builder statistics = new AnalysisStatistics.Builder().filesSubmitted(files.size());
        if (files.isEmpty()) {
            return new Outcome(List.of(), statistics.build());
        }

        int total = files.size();
        AtomicInteger completed = new AtomicInteger();
        ExecutorService executor = Executors.newFixedThreadPool(Math.min(config.concurrency(), total));
        try {
            List<Future<FileAnalysisResult>> futures = new ArrayList<>(total);
            for (SourceFile file : files) {
                futures.add(executor.submit(() -> {
                    try {
                        return analyzeOne(file, statistics);
                    } finally {
                        reportProgress(progress, completed.incrementAndGet(), total);
                    }
                }));
            }

            List<FileAnalysisResult> results = new ArrayList<>(total);
            for (int i = 0; i < futures.size(); i++) {
                try {
                    FileAnalysisResult result = futures.get(i).get();
                    if (result != null) {
                        results.add(result);
                    }
                } catch (ExecutionException e) {
                    // Only errors escape analyzeOne
                    recordFailure(files.get(i), e.getCause(), statistics);
                }
            }
            return new Outcome(results, statistics.build());
        } finally {
            executor.shutdownNow();
        }
    }

    private static void reportProgress(ProgressListener progress, int completed, int total) {
        try {
            progress.onProgress(completed, total);
        } catch (RuntimeException e) {
            log.warn("Progress listener failed at {}/{}: {}", completed, total, e.getMessage(), e);
        }
    }

    private FileAnalysisResult analyzeOne(SourceFile file, AnalysisStatistics.Builder statistics) {
        if (file.isSkipped()) {
            log.warn("Skipping {}: {}", file.filePath(), file.skipReason());
            synchronized (statistics) {
                statistics.incrementFilesSkipped();
            }
            return null;
        }

        long sizeKb = file.sizeInKb();
        if (sizeKb > MAX_FILE_SIZE_KB) {
            log.warn("Skipping large file ({} KB): {}", sizeKb, file.filePath());
            synchronized (statistics) {
                statistics.incrementFilesSkipped();
            }
            return null;
        }

        try {
            FileAnalysisResult result = fileAnalyzer.analyze(file);
            synchronized (statistics) {
                statistics.incrementParsedWith(result.parseResult().tier());
            }
            return result;
        } catch (RuntimeException e) {
            recordFailure(file, e, statistics);
            return null;
        }
    }

    private void recordFailure(SourceFile file, Throwable error, AnalysisStatistics.Builder statistics) {
        if (config.isVerbose()) {
            log.warn("Failed to analyze {}", file.filePath(), error);
        } else {
            log.warn("Failed to analyze {}: {}", file.filePath(), error.getMessage());
        }
        synchronized (statistics) {
            statistics.incrementFilesFailed()
                .addError(error.getClass().getSimpleName(), file.filePath() + ": " + error.getMessage());
        }
    }
}
