package com.codescore.core.model;

import java.util.Objects;

/**
 * Cross-file rollup of one metric's normalized scores.
 *
 * @param name metric identifier
 * @param category metric category
 * @param average mean score
 * @param min lowest score
 * @param max highest score
 * @param median median score
 * @param weight category weight applied to this metric
 *
 * @since 1.0.0
 */
public record AggregatedMetric(
    String name,
    MetricCategory category,
    double average,
    double min,
    double max,
    double median,
    double weight
) {
    public AggregatedMetric {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(category, "category must not be null");
    }
}
