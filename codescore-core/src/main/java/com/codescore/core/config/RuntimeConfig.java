package com.codescore.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Runtime settings consumed by the analysis engine.
 *
 * <p>Loaded from {@code codescore.yaml} by {@link ConfigLoader}. Every field is optional.
 *
 * <p><b>Example YAML:</b>
 * <pre>{@code
 * concurrency: 4
 * verbose: false
 * weights:
 *   complexity: 0.32
 *   duplication: 0.20
 * exclude:
 *   - "**&#47;generated/**"
 * }</pre>
 *
 * @param concurrency worker pool size, clamped to {@code [1, 32]} (default 2)
 * @param verbose whether per-file diagnostics are logged at INFO
 * @param weights category weights
 * @param exclude glob patterns the discovery layer should skip
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record RuntimeConfig(
    @JsonProperty("concurrency") Integer concurrency,
    @JsonProperty("verbose") Boolean verbose,
    @JsonProperty("weights") MetricWeights weights,
    @JsonProperty("exclude") List<String> exclude
) {
    public static final int DEFAULT_CONCURRENCY = 2;
    public static final int MIN_CONCURRENCY = 1;
    public static final int MAX_CONCURRENCY = 32;

    public RuntimeConfig {
        if (concurrency == null) {
            concurrency = DEFAULT_CONCURRENCY;
        } else if (concurrency < MIN_CONCURRENCY) {
            concurrency = MIN_CONCURRENCY;
        } else if (concurrency > MAX_CONCURRENCY) {
            concurrency = MAX_CONCURRENCY;
        }
        if (verbose == null) {
            verbose = Boolean.FALSE;
        }
        if (weights == null) {
            weights = MetricWeights.defaults();
        }
        exclude = exclude == null ? List.of() : List.copyOf(exclude);
    }

    /**
     * Creates the default configuration.
     *
     * @return default configuration
     */
    public static RuntimeConfig defaults() {
        return new RuntimeConfig(null, null, null, null);
    }

    /**
     * Returns a copy with a different concurrency limit.
     */
    public RuntimeConfig withConcurrency(int newConcurrency) {
        return new RuntimeConfig(newConcurrency, verbose, weights, exclude);
    }

    public boolean isVerbose() {
        return Boolean.TRUE.equals(verbose);
    }
}
