package com.codescore.core.metrics.documentation;

import com.codescore.core.metrics.AbstractMetric;
import com.codescore.core.model.MetricCategory;
import com.codescore.core.model.MetricResult;
import com.codescore.core.model.ParseResult;
import com.codescore.core.model.Severity;

import java.util.List;

/**
 * Comment lines as a percentage of code lines.
 *
 * <p>Unlike the size metrics this curve is two-sided: a ratio inside the optimal band scores
 * 100, and both under- and over-commented files lose points at different rates.
 *
 * @since 1.0.0
 */
public class CommentRatioMetric extends AbstractMetric {

    public static final String NAME = "comment_ratio";

    static final double MIN_OPTIMAL = 10;
    static final double MAX_OPTIMAL = 25;
    static final double MIN_ACCEPTABLE = 5;
    static final double MAX_ACCEPTABLE = 40;

    public CommentRatioMetric(double weight) {
        super(NAME, MetricCategory.DOCUMENTATION, weight);
    }

    @Override
    public MetricResult calculate(ParseResult parseResult) {
        if (parseResult.codeLines() == 0) {
            return insufficientData(0, "No code lines");
        }

        double ratio = parseResult.commentLines() * 100.0 / parseResult.codeLines();
        return result(ratio, scoreFor(ratio), severityForRatio(ratio),
            format("%.1f%% (%d comment lines, %d code lines)", ratio,
                parseResult.commentLines(), parseResult.codeLines()),
            List.of());
    }

    static double scoreFor(double ratio) {
        if (ratio >= MIN_OPTIMAL && ratio <= MAX_OPTIMAL) {
            return 100.0;
        }
        if (ratio < MIN_OPTIMAL) {
            if (ratio >= MIN_ACCEPTABLE) {
                return 70.0 + (ratio - MIN_ACCEPTABLE) / (MIN_OPTIMAL - MIN_ACCEPTABLE) * 30.0;
            }
            return Math.max(0.0, ratio * 14.0);
        }
        if (ratio <= MAX_ACCEPTABLE) {
            return 100.0 - (ratio - MAX_OPTIMAL) / (MAX_ACCEPTABLE - MAX_OPTIMAL) * 40.0;
        }
        return Math.max(0.0, 60.0 - (ratio - MAX_ACCEPTABLE) * 1.5);
    }

    private static Severity severityForRatio(double ratio) {
        if (ratio >= MIN_OPTIMAL && ratio <= MAX_OPTIMAL) {
            return Severity.INFO;
        }
        if (ratio >= MIN_ACCEPTABLE && ratio <= MAX_ACCEPTABLE) {
            return Severity.WARNING;
        }
        return Severity.ERROR;
    }
}
