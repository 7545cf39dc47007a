package com.codescore.core.metrics;

import com.codescore.core.model.MetricCategory;
import com.codescore.core.model.MetricResult;
import com.codescore.core.model.ParseResult;

/**
 * A quality metric computed from one file's {@link ParseResult}.
 *
 * <p>Implementations are pure: the same input always yields the same result, and a metric
 * instance may be shared across threads. When the input holds nothing to measure (no
 * functions, no code lines, no raw text) a metric returns score 100 with severity info
 * rather than failing.
 *
 * @see MetricsFactory
 * @since 1.0.0
 */
public interface Metric {

    /**
     * Returns the metric identifier, for example {@code cyclomatic_complexity}.
     */
    String name();

    MetricCategory category();

    /**
     * Returns this metric's share of its category weight.
     */
    double weight();

    /**
     * Computes the metric for one file.
     *
     * @param parseResult structural facts of the file
     * @return metric verdict
     */
    MetricResult calculate(ParseResult parseResult);
}
