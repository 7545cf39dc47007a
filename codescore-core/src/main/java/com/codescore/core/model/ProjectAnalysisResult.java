package com.codescore.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Result of analyzing a whole project.
 *
 * <p>Skipped files (over the size ceiling or unreadable) and failed files (exception surviving every
 * fallback) are counted separately from analyzed files and do not contribute to the score.
 *
 * @param projectPath project root as supplied by the caller
 * @param totalFiles files submitted for analysis
 * @param analyzedFiles files that produced a result
 * @param skippedFiles files skipped for size or because they could not be read
 * @param failedFiles files dropped after an analysis failure
 * @param fileResults per-file results (order not significant)
 * @param aggregatedMetrics per-metric rollups
 * @param overallScore code-line weighted project score
 * @param analysisTimeMillis wall-clock duration of the run
 * @param statistics parser tier and failure statistics
 *
 * @since 1.0.0
 */
public record ProjectAnalysisResult(
    String projectPath,
    int totalFiles,
    int analyzedFiles,
    int skippedFiles,
    int failedFiles,
    List<FileAnalysisResult> fileResults,
    List<AggregatedMetric> aggregatedMetrics,
    double overallScore,
    long analysisTimeMillis,
    AnalysisStatistics statistics
) {
    public ProjectAnalysisResult {
        Objects.requireNonNull(projectPath, "projectPath must not be null");
        fileResults = fileResults == null ? List.of() : List.copyOf(fileResults);
        aggregatedMetrics = aggregatedMetrics == null ? List.of() : List.copyOf(aggregatedMetrics);
        if (statistics == null) {
            statistics = AnalysisStatistics.empty();
        }
    }
}
