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
 * Maximum nesting depth across a file's functions. The average is reported in the details.
 *
 * @since 1.0.0
 */
public class NestingDepthMetric extends AbstractMetric {

    public static final String NAME = "nesting_depth";

    private final ThresholdConfig thresholds;

    public NestingDepthMetric(double weight, Language language) {
        super(NAME, MetricCategory.COMPLEXITY, weight);
        this.thresholds = LanguageThresholds.forLanguage(language).nestingDepth();
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
            total += function.nestingDepth();
            max = Math.max(max, function.nestingDepth());
            if (function.nestingDepth() > thresholds.excellent()) {
                locations.add(locationOf(parseResult, function, "Nesting depth: " + function.nestingDepth()));
            }
        }

        double average = (double) total / functions.size();
        return result(max, ScoringCurve.NESTING.score(max, thresholds), severityFor(max, thresholds),
            format("Average %.1f, max %d", average, max), locations);
    }
}
