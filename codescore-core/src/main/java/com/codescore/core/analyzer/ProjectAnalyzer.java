package com.codescore.core.analyzer;

import com.codescore.core.config.RuntimeConfig;
import com.codescore.core.model.AggregatedMetric;
import com.codescore.core.model.AnalysisStatistics;
import com.codescore.core.model.FileAnalysisResult;
import com.codescore.core.model.ProjectAnalysisResult;
import com.codescore.core.parser.ParserSelector;
import com.codescore.core.scoring.ScoreCalculator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Entry point for analyzing a whole project.
 *
 * <p>Runs the concurrent analysis, rolls the metrics up across files and computes the
 * code-line weighted project score.
 *
 * <p><b>Usage Example:</b></p>
 * <pre>{@code
 * ProjectAnalyzer analyzer = new ProjectAnalyzer(ConfigLoader.load(root.resolve("codescore.yaml")));
 * ProjectAnalysisResult result = analyzer.analyze(root.toString(), files, ProgressListener.NONE);
 * System.out.printf("Score: %.1f%n", result.overallScore());
 * }</pre>
 *
 * @since 1.0.0
 */
public class ProjectAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(ProjectAnalyzer.class);

    private final ConcurrentAnalyzer concurrentAnalyzer;
    private final ScoreCalculator scoreCalculator;

    public ProjectAnalyzer(RuntimeConfig config) {
        this(config, new ParserSelector());
    }

    public ProjectAnalyzer(RuntimeConfig config, ParserSelector parserSelector) {
        RuntimeConfig effective = config != null ? config : RuntimeConfig.defaults();
        FileAnalyzer fileAnalyzer = new FileAnalyzer(parserSelector, effective);
        this.concurrentAnalyzer = new ConcurrentAnalyzer(fileAnalyzer, effective);
        this.scoreCalculator = fileAnalyzer.scoreCalculator();
    }

    /**
     * Analyzes the given files as one project.
     *
     * @param projectPath project root, recorded in the result
     * @param files files to analyze
     * @param listener progress callback
     * @return project result; the score is 100 when no file could be analyzed
     * @throws InterruptedException if interrupted while waiting for workers
     */
    public ProjectAnalysisResult analyze(String projectPath, List<SourceFile> files, ProgressListener listener)
            throws InterruptedException {
        long start = System.nanoTime();
        log.info("Analyzing {} files in {}", files.size(), projectPath);

        ConcurrentAnalyzer.Outcome outcome = concurrentAnalyzer.analyze(files, listener);
        List<FileAnalysisResult> results = outcome.results();
        List<AggregatedMetric> aggregated = scoreCalculator.aggregateMetrics(results);
        double overall = scoreCalculator.projectScore(results);
        AnalysisStatistics statistics = outcome.statistics();

        long elapsedMillis = (System.nanoTime() - start) / 1_000_000;
        log.info("Analysis complete in {} ms: {}", elapsedMillis, statistics.getSummary());

        return new ProjectAnalysisResult(
            projectPath,
            files.size(),
            results.size(),
            statistics.filesSkipped(),
            statistics.filesFailed(),
            results,
            aggregated,
            overall,
            elapsedMillis,
            statistics
        );
    }
}
