package com.codescore.core.metrics.size;

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
 * Largest parameter count among a file's functions.
 *
 * @since 1.0.0
 */
public class ParameterCountMetric extends AbstractMetric {

    public static final String NAME = "parameter_count";

    private final ThresholdConfig thresholds;

    public ParameterCountMetric(double weight, Language language) {
        super(NAME, MetricCategory.SIZE, weight);
        this.thresholds = LanguageThresholds.forLanguage(language).parameterCount();
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
            total += function.parameterCount();
            max = Math.max(max, function.parameterCount());
            if (function.parameterCount() > thresholds.good()) {
                locations.add(locationOf(parseResult, function, function.parameterCount() + " parameters"));
            }
        }

        double average = (double) total / functions.size();
        return result(max, ScoringCurve.PARAMETER_COUNT.score(max, thresholds), severityFor(max, thresholds),
            format("Average %.1f, max %d", average, max), locations);
    }
}
