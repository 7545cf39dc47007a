package com.codescore.core.scoring;

import com.codescore.core.config.MetricWeights;
import com.codescore.core.config.RuntimeConfig;
import com.codescore.core.model.AggregatedMetric;
import com.codescore.core.model.FileAnalysisResult;
import com.codescore.core.model.MetricCategory;
import com.codescore.core.model.MetricResult;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Combines metric verdicts into file scores, project scores and per-metric rollups.
 *
 * <p>Each metric contributes its normalized score weighted by its category weight. With the
 * default weights a file where every metric scores 100 gets 100, and a file where only the
 * complexity metrics collapse to 0 loses roughly a third of its score.
 *
 * <p><b>Usage Example:</b></p>
 * <pre>{@code
 * ScoreCalculator calculator = new ScoreCalculator(config);
 * double fileScore = calculator.calculateScore(metricResults);
 * List<AggregatedMetric> rollups = calculator.aggregateMetrics(fileResults);
 * double overall = calculator.projectScore(fileResults);
 * }</pre>
 *
 * @since 1.0.0
 */
public class ScoreCalculator {

    /** Score reported when there is nothing to score. */
    public static final double PERFECT_SCORE = 100.0;

    private final MetricWeights weights;

    public ScoreCalculator(RuntimeConfig config) {
        this.weights = (config != null ? config : RuntimeConfig.defaults()).weights();
    }

    public ScoreCalculator() {
        this(RuntimeConfig.defaults());
    }

    // ==================== File Score ====================

    /**
     * Computes the weighted score of one file.
     *
     * @param metrics metric results for the file
     * @return weighted mean of normalized scores, or 100 for empty input or zero total weight
     */
    public double calculateScore(List<MetricResult> metrics) {
        if (metrics == null || metrics.isEmpty()) {
            return PERFECT_SCORE;
        }

        double weightedSum = 0.0;
        double totalWeight = 0.0;
        for (MetricResult metric : metrics) {
            double weight = weightOf(metric.category());
            weightedSum += metric.normalizedScore() * weight;
            totalWeight += weight;
        }

        return totalWeight > 0 ? weightedSum / totalWeight : PERFECT_SCORE;
    }

    // ==================== Aggregation ====================

    /**
     * Rolls up each metric's normalized scores across files.
     *
     * <p>Metrics keep the order in which they were first seen.
     *
     * @param fileResults per-file results
     * @return one entry per metric name, empty for empty input
     */
    public List<AggregatedMetric> aggregateMetrics(List<FileAnalysisResult> fileResults) {
        if (fileResults == null || fileResults.isEmpty()) {
            return List.of();
        }

        Map<String, List<MetricResult>> byName = new LinkedHashMap<>();
        for (FileAnalysisResult file : fileResults) {
            for (MetricResult metric : file.metrics()) {
                byName.computeIfAbsent(metric.name(), key -> new ArrayList<>()).add(metric);
            }
        }

        List<AggregatedMetric> aggregated = new ArrayList<>(byName.size());
        for (Map.Entry<String, List<MetricResult>> entry : byName.entrySet()) {
            List<MetricResult> results = entry.getValue();
            List<Double> scores = new ArrayList<>(results.size());
            double sum = 0.0;
            for (MetricResult result : results) {
                scores.add(result.normalizedScore());
                sum += result.normalizedScore();
            }
            Collections.sort(scores);

            MetricCategory category = results.get(0).category();
            aggregated.add(new AggregatedMetric(
                entry.getKey(),
                category,
                sum / scores.size(),
                scores.get(0),
                scores.get(scores.size() - 1),
                median(scores),
                weightOf(category)
            ));
        }
        return aggregated;
    }

    /**
     * Median of an ascending list. Even-sized lists average the two middle values.
     *
     * @param sortedValues values in ascending order
     * @return median, or 0 for an empty list
     */
    public static double median(List<Double> sortedValues) {
        if (sortedValues == null || sortedValues.isEmpty()) {
            return 0.0;
        }
        int middle = sortedValues.size() / 2;
        if (sortedValues.size() % 2 == 0) {
            return (sortedValues.get(middle - 1) + sortedValues.get(middle)) / 2.0;
        }
        return sortedValues.get(middle);
    }

    // ==================== Project Score ====================

    /**
     * Computes the project score, weighting each file by its code lines.
     *
     * <p>Files without code lines still count with weight 1.
     *
     * @param fileResults per-file results
     * @return weighted mean of file scores, or 100 when there are no files
     */
    public double projectScore(List<FileAnalysisResult> fileResults) {
        if (fileResults == null || fileResults.isEmpty()) {
            return PERFECT_SCORE;
        }

        double weightedSum = 0.0;
        double totalWeight = 0.0;
        for (FileAnalysisResult file : fileResults) {
            int weight = Math.max(1, file.parseResult().codeLines());
            weightedSum += file.score() * weight;
            totalWeight += weight;
        }
        return weightedSum / totalWeight;
    }

    private double weightOf(MetricCategory category) {
        return weights.weightFor(category);
    }
}
