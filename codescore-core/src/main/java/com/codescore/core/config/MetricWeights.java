package com.codescore.core.config;

import com.codescore.core.model.MetricCategory;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Per-category weights used to combine metric scores into a file score.
 *
 * <p>Any category left unset falls back to {@link MetricCategory#defaultWeight()}.
 * Negative values are treated as unset.
 *
 * <p><b>Example YAML:</b>
 * <pre>{@code
 * weights:
 *   complexity: 0.40
 *   duplication: 0.15
 * }</pre>
 *
 * @param complexity weight of the complexity category
 * @param duplication weight of the duplication category
 * @param size weight of the size category
 * @param structure weight of the structure category
 * @param error weight of the error-handling category
 * @param documentation weight of the documentation category
 * @param naming weight of the naming category
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record MetricWeights(
    @JsonProperty("complexity") Double complexity,
    @JsonProperty("duplication") Double duplication,
    @JsonProperty("size") Double size,
    @JsonProperty("structure") Double structure,
    @JsonProperty("error") Double error,
    @JsonProperty("documentation") Double documentation,
    @JsonProperty("naming") Double naming
) {
    public MetricWeights {
        complexity = sanitize(complexity);
        duplication = sanitize(duplication);
        size = sanitize(size);
        structure = sanitize(structure);
        error = sanitize(error);
        documentation = sanitize(documentation);
        naming = sanitize(naming);
    }

    /**
     * Weights with every category at its default.
     *
     * @return default weights
     */
    public static MetricWeights defaults() {
        return new MetricWeights(null, null, null, null, null, null, null);
    }

    /**
     * Returns the effective weight for a category.
     *
     * @param category metric category
     * @return configured weight, or the category default
     */
    public double weightFor(MetricCategory category) {
        Double configured = switch (category) {
            case COMPLEXITY -> complexity;
            case DUPLICATION -> duplication;
            case SIZE -> size;
            case STRUCTURE -> structure;
            case ERROR -> error;
            case DOCUMENTATION -> documentation;
            case NAMING -> naming;
        };
        return configured != null ? configured : category.defaultWeight();
    }

    private static Double sanitize(Double value) {
        if (value == null || value.isNaN() || value < 0) {
            return null;
        }
        return value;
    }
}
