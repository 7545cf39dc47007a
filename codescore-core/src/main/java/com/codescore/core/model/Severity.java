package com.codescore.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Severity of a metric verdict, ordered from least to most severe.
 *
 * @since 1.0.0
 */
public enum Severity {
    INFO,
    WARNING,
    ERROR,
    CRITICAL;

    @JsonValue
    public String id() {
        return name().toLowerCase(Locale.ROOT);
    }
}
