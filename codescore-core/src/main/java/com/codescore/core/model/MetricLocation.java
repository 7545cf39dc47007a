package com.codescore.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Objects;

/**
 * A diagnostic location attached to a metric result.
 *
 * @param filePath file the finding belongs to
 * @param line 1-based line number
 * @param functionName function the finding belongs to, or {@code null} for file-level findings
 * @param message human-readable description
 *
 * @since 1.0.0
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record MetricLocation(
    String filePath,
    int line,
    String functionName,
    String message
) {
    public MetricLocation {
        Objects.requireNonNull(filePath, "filePath must not be null");
        Objects.requireNonNull(message, "message must not be null");
    }

    /**
     * Creates a file-level location (no function).
     */
    public static MetricLocation ofFile(String filePath, int line, String message) {
        return new MetricLocation(filePath, line, null, message);
    }
}
