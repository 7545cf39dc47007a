package com.codescore.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Metric categories and their default weights in the file score.
 *
 * <p>Defaults sum to 1.0. Complexity and size each cover three metrics.
 *
 * @since 1.0.0
 */
public enum MetricCategory {

    COMPLEXITY("complexity", 0.32),
    DUPLICATION("duplication", 0.20),
    SIZE("size", 0.18),
    STRUCTURE("structure", 0.12),
    ERROR("error", 0.08),
    DOCUMENTATION("documentation", 0.05),
    NAMING("naming", 0.05);

    private final String id;
    private final double defaultWeight;

    MetricCategory(String id, double defaultWeight) {
        this.id = id;
        this.defaultWeight = defaultWeight;
    }

    @JsonValue
    public String id() {
        return id;
    }

    public double defaultWeight() {
        return defaultWeight;
    }
}
