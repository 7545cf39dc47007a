package com.codescore.core.model;

import java.util.List;
import java.util.Objects;

/**
 * One metric's verdict for one file.
 *
 * @param name metric identifier, e.g. {@code cyclomatic_complexity}
 * @param category metric category
 * @param value raw statistic the score was derived from
 * @param normalizedScore score in {@code [0, 100]}; 100 is best
 * @param severity severity derived from the worst-case statistic
 * @param details short human-readable summary
 * @param locations diagnostic locations (may be empty)
 *
 * @since 1.0.0
 */
public record MetricResult(
    String name,
    MetricCategory category,
    double value,
    double normalizedScore,
    Severity severity,
    String details,
    List<MetricLocation> locations
) {
    public MetricResult {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(category, "category must not be null");
        Objects.requireNonNull(severity, "severity must not be null");
        if (Double.isNaN(normalizedScore)) {
            throw new IllegalArgumentException("normalizedScore is NaN for metric " + name);
        }
        normalizedScore = Math.max(0.0, Math.min(100.0, normalizedScore));
        if (details == null) {
            details = "";
        }
        locations = locations == null ? List.of() : List.copyOf(locations);
    }
}
