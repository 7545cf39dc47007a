package com.codescore.core.metrics;

import com.codescore.core.config.MetricWeights;
import com.codescore.core.config.RuntimeConfig;
import com.codescore.core.metrics.complexity.CognitiveComplexityMetric;
import com.codescore.core.metrics.complexity.CyclomaticComplexityMetric;
import com.codescore.core.metrics.complexity.NestingDepthMetric;
import com.codescore.core.metrics.documentation.CommentRatioMetric;
import com.codescore.core.metrics.duplication.CodeDuplicationMetric;
import com.codescore.core.metrics.error.ErrorHandlingMetric;
import com.codescore.core.metrics.naming.NamingConventionMetric;
import com.codescore.core.metrics.size.FileLengthMetric;
import com.codescore.core.metrics.size.FunctionLengthMetric;
import com.codescore.core.metrics.size.ParameterCountMetric;
import com.codescore.core.metrics.structure.StructureAnalysisMetric;
import com.codescore.core.model.Language;
import com.codescore.core.model.MetricCategory;

import java.util.List;

/**
 * Builds the full set of metric calculators for one language.
 *
 * <p>The complexity and size category weights are split evenly across the three metrics
 * of each category. Every other category is served by a single metric that carries the
 * whole category weight.
 *
 * <p><b>Usage Example:</b></p>
 * <pre>{@code
 * List<Metric> metrics = MetricsFactory.create(config, Language.GO);
 * List<MetricResult> results = metrics.stream()
 *     .map(metric -> metric.calculate(parseResult))
 *     .toList();
 * }</pre>
 *
 * @since 1.0.0
 */
public final class MetricsFactory {

    private static final int COMPLEXITY_METRICS = 3;
    private static final int SIZE_METRICS = 3;

    private MetricsFactory() {
        // Utility class - no instantiation
    }

    /**
     * Creates the metric calculators for a language.
     *
     * @param config runtime configuration supplying category weights
     * @param language language whose thresholds the calculators use
     * @return metric calculators in reporting order
     */
    public static List<Metric> create(RuntimeConfig config, Language language) {
        MetricWeights weights = (config != null ? config : RuntimeConfig.defaults()).weights();
        double complexity = weights.weightFor(MetricCategory.COMPLEXITY) / COMPLEXITY_METRICS;
        double size = weights.weightFor(MetricCategory.SIZE) / SIZE_METRICS;

        return List.of(
            new CyclomaticComplexityMetric(complexity, language),
            new CognitiveComplexityMetric(complexity, language),
            new NestingDepthMetric(complexity, language),
            new FunctionLengthMetric(size, language),
            new FileLengthMetric(size, language),
            new ParameterCountMetric(size, language),
            new CodeDuplicationMetric(weights.weightFor(MetricCategory.DUPLICATION)),
            new StructureAnalysisMetric(weights.weightFor(MetricCategory.STRUCTURE)),
            new ErrorHandlingMetric(weights.weightFor(MetricCategory.ERROR)),
            new CommentRatioMetric(weights.weightFor(MetricCategory.DOCUMENTATION)),
            new NamingConventionMetric(weights.weightFor(MetricCategory.NAMING), language)
        );
    }
}
