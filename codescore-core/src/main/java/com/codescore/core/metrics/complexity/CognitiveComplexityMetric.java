package com.codescore.core.metrics.complexity;

import com.codescore.core.metrics.AbstractMetric;
import com.codescore.core.metrics.ScoringCurve;
import com.codescore.core.metrics.thresholds.LanguageThresholds;
import com.codescore.core.metrics.thresholds.ThresholdConfig;
import com.codescore.core.model.FunctionInfo;
import com.codescore.core.model.Language;
import com.codescore.core.model.MetricCategory;
import com.codescore.core.model.MetricLocation;
import com.codescore.core.model.MetricResult;
import com.codescore.core.model.ParseResult;

import java.util.ArrayList;
import java.util.List;

/**
 * Cognitive complexity approximated as {@code complexity + 2 * nestingDepth} per function.
 *
 * <p>Scored on the average; severity follows the worst function.
 *
 * @since 1.0.0
 */
public class CognitiveComplexityMetric extends AbstractMetric {

    public static final String NAME = "cognitive_complexity";

    private static final int NESTING_PENALTY = 2;

    private final ThresholdConfig thresholds;

    public CognitiveComplexityMetric(double weight, Language language) {
        super(NAME, MetricCategory.COMPLEXITY, weight);
        this.thresholds = LanguageThresholds.forLanguage(language).cognitiveComplexity();
    }

    @Override
    public MetricResult calculate(ParseResult parseResult) {
        List<FunctionInfo> functions = parseResult.functions();
        if (functions.isEmpty()) {
            return insufficientData(0, "No functions found");
        }

        int total = 0;
        int max = 0;
        List<MetricLocation> locations = new ArrayList<>();
        for (FunctionInfo function : functions) {
            int cognitive = cognitiveOf(function);
            total += cognitive;
            max = Math.max(max, cognitive);
            if (cognitive > thresholds.good()) {
                locations.add(locationOf(parseResult, function, "Cognitive complexity: " + cognitive));
            }
        }

        double average = (double) total / functions.size();
        return result(average, ScoringCurve.COGNITIVE.score(average, thresholds),
            severityFor(max, thresholds), format("Average %.1f, max %d", average, max), locations);
    }

    static int cognitiveOf(FunctionInfo function) {
        return function.complexity() + NESTING_PENALTY * function.nestingDepth();
    }
}
