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
 * Cyclomatic complexity: 1 + branches, loops, case labels and logical operators per function.
 *
 * <p>The score blends the average-based and the max-based curve scores 50/50, so one very
 * complex function drags the file down even when the rest are simple. The reported value is
 * the average. Functions above the {@code good} threshold are listed as locations.
 *
 * @since 1.0.0
 */
public class CyclomaticComplexityMetric extends AbstractMetric {

    public static final String NAME = "cyclomatic_complexity";

    private final ThresholdConfig thresholds;

    public CyclomaticComplexityMetric(double weight, Language language) {
        super(NAME, MetricCategory.COMPLEXITY, weight);
        this.thresholds = LanguageThresholds.forLanguage(language).cyclomaticComplexity();
    }

    @Override
    public MetricResult calculate(ParseResult parseResult) {
        List<FunctionInfo> functions = parseResult.functions();
        if (functions.isEmpty()) {
            return insufficientData(1, "No functions found");
        }

        int total = 0;
        int max = 0;
        List<MetricLocation> locations = new ArrayList<>();
        for (FunctionInfo function : functions) {
            total += function.complexity();
            max = Math.max(max, function.complexity());
            if (function.complexity() > thresholds.good()) {
                locations.add(locationOf(parseResult, function, "Complexity: " + function.complexity()));
            }
        }

        double average = (double) total / functions.size();
        double score = 0.5 * ScoringCurve.CYCLOMATIC.score(average, thresholds)
            + 0.5 * ScoringCurve.CYCLOMATIC.score(max, thresholds);

        return result(average, score, severityFor(max, thresholds),
            format("Average %.1f, max %d", average, max), locations);
    }
}
