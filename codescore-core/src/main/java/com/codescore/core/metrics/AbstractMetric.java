package com.codescore.core.metrics;

import com.codescore.core.metrics.thresholds.ThresholdConfig;
import com.codescore.core.model.FunctionInfo;
import com.codescore.core.model.MetricCategory;
import com.codescore.core.model.MetricLocation;
import com.codescore.core.model.MetricResult;
import com.codescore.core.model.ParseResult;
import com.codescore.core.model.Severity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Locale;

/**
 * Base class for metric implementations.
 *
 * <p>Provides:
 * <ul>
 *   <li>Logger initialization (one logger per metric class)</li>
 *   <li>Result helpers that round scores to one decimal place
 *       ({@link #result}, {@link #insufficientData})</li>
 *   <li>The worst-case severity rule ({@link #severityFor})</li>
 * </ul>
 *
 * @since 1.0.0
 */
public abstract class AbstractMetric implements Metric {

    protected final Logger log;

    private final String name;
    private final MetricCategory category;
    private final double weight;

    protected AbstractMetric(String name, MetricCategory category, double weight) {
        this.log = LoggerFactory.getLogger(getClass());
        this.name = name;
        this.category = category;
        this.weight = weight;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public MetricCategory category() {
        return category;
    }

    @Override
    public double weight() {
        return weight;
    }

    // ==================== Result Helpers ====================

    /**
     * Creates a result with the score rounded to one decimal place.
     */
    protected MetricResult result(double value, double score, Severity severity, String details,
                                  List<MetricLocation> locations) {
        return new MetricResult(name, category, value, round1(score), severity, details, locations);
    }

    /**
     * Result for input with nothing to measure: score 100, severity info.
     */
    protected MetricResult insufficientData(double value, String details) {
        return new MetricResult(name, category, value, 100.0, Severity.INFO, details, List.of());
    }

    // ==================== Scoring Helpers ====================

    /**
     * Maps the worst-case statistic to a severity: {@code <= good} info,
     * {@code <= acceptable} warning, {@code <= poor} error, otherwise critical.
     */
    protected static Severity severityFor(double worst, ThresholdConfig thresholds) {
        if (worst <= thresholds.good()) {
            return Severity.INFO;
        }
        if (worst <= thresholds.acceptable()) {
            return Severity.WARNING;
        }
        if (worst <= thresholds.poor()) {
            return Severity.ERROR;
        }
        return Severity.CRITICAL;
    }

    protected static double round1(double value) {
        return Math.round(value * 10.0) / 10.0;
    }

    protected static MetricLocation locationOf(ParseResult parseResult, FunctionInfo function, String message) {
        return new MetricLocation(parseResult.filePath(), function.startLine(), function.name(), message);
    }

    protected static String format(String pattern, Object... args) {
        return String.format(Locale.ROOT, pattern, args);
    }
}
