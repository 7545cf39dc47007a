package com.codescore.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Parse result, metric verdicts and weighted score for one file.
 *
 * @param filePath file path as supplied by the discovery layer
 * @param parseResult structural facts
 * @param metrics one result per metric calculator
 * @param score weighted file score in {@code [0, 100]}
 *
 * @since 1.0.0
 */
public record FileAnalysisResult(
    String filePath,
    ParseResult parseResult,
    List<MetricResult> metrics,
    double score
) {
    public FileAnalysisResult {
        Objects.requireNonNull(filePath, "filePath must not be null");
        Objects.requireNonNull(parseResult, "parseResult must not be null");
        metrics = metrics == null ? List.of() : List.copyOf(metrics);
    }
}
