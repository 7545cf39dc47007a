package com.codescore.core.metrics.documentation;

import com.codescore.core.model.Language;
import com.codescore.core.model.MetricResult;
import com.codescore.core.model.ParseResult;
import com.codescore.core.model.ParserTier;
import com.codescore.core.model.Severity;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

/**
 * Tests for {@link CommentRatioMetric}.
 */
class CommentRatioMetricTest {

    private final CommentRatioMetric metric = new CommentRatioMetric(0.05);

    @ParameterizedTest
    @CsvSource({
        "0, 0",
        "2, 28",
        "5, 70",
        "7.5, 85",
        "10, 100",
        "25, 100",
        "32.5, 80",
        "40, 60",
        "60, 30",
        "100, 0"
    })
    void scoreFor_followsBands(double ratio, double expected) {
        assertThat(CommentRatioMetric.scoreFor(ratio)).isCloseTo(expected, within(1e-9));
    }

    @Test
    void calculate_optimalRatio_isInfo() {
        MetricResult result = metric.calculate(lines(100, 15));

        assertThat(result.value()).isEqualTo(15.0);
        assertThat(result.normalizedScore()).isEqualTo(100.0);
        assertThat(result.severity()).isEqualTo(Severity.INFO);
    }

    @Test
    void calculate_underDocumented_isError() {
        MetricResult result = metric.calculate(lines(100, 2));

        assertThat(result.normalizedScore()).isEqualTo(28.0);
        assertThat(result.severity()).isEqualTo(Severity.ERROR);
    }

    @Test
    void calculate_noCodeLines_returnsInsufficientData() {
        MetricResult result = metric.calculate(lines(0, 4));

        assertThat(result.normalizedScore()).isEqualTo(100.0);
        assertThat(result.severity()).isEqualTo(Severity.INFO);
    }

    private static ParseResult lines(int code, int comment) {
        return new ParseResult("a.go", Language.GO, code + comment, code, comment, 0,
            List.of(), List.of(), List.of(), List.of(), null, ParserTier.AST);
    }
}
