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
 * Average function length in lines; severity follows the longest function.
 *
 * @since 1.0.0
 */
public class FunctionLengthMetric extends AbstractMetric {

    public static final String NAME = "function_length";

    private final ThresholdConfig thresholds;

    public FunctionLengthMetric(double weight, Language language) {
        super(NAME, MetricCategory.SIZE, weight);
        this.thresholds = LanguageThresholds.forLanguage(language).functionLength();
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
            total += function.lineCount();
            max = Math.max(max, function.lineCount());
            if (function.lineCount() > thresholds.good()) {
                locations.add(locationOf(parseResult, function, function.lineCount() + " lines"));
            }
        }

        double average = (double) total / functions.size();
        return result(average, ScoringCurve.FUNCTION_LENGTH.score(average, thresholds),
            severityFor(max, thresholds), format("Average %.1f lines, max %d lines", average, max), locations);
    }
}
