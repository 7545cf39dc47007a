package com.codescore.core.metrics.complexity;

import com.codescore.core.metrics.MetricTestBase;
import com.codescore.core.model.Language;
import com.codescore.core.model.MetricResult;
import com.codescore.core.model.Severity;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link NestingDepthMetric}.
 */
class NestingDepthMetricTest extends MetricTestBase {

    private final NestingDepthMetric metric = new NestingDepthMetric(0.1, Language.JAVASCRIPT);

    @Test
    void calculate_shallowFunctions_scores100() {
        MetricResult result = metric.calculate(parseResult(List.of(
            function("a", 1, 1, 1),
            function("b", 10, 1, 3))));

        assertThat(result.value()).isEqualTo(3.0);
        assertThat(result.normalizedScore()).isEqualTo(100.0);
        assertThat(result.locations()).isEmpty();
    }

    @Test
    void calculate_scoresMaxDepth() {
        MetricResult result = metric.calculate(parseResult(List.of(
            function("a", 1, 1, 0),
            function("b", 10, 1, 0),
            function("deep", 20, 1, 4))));

        // JavaScript nesting thresholds (3, 4, 5, 7): depth 4 sits on good
        assertThat(result.value()).isEqualTo(4.0);
        assertThat(result.normalizedScore()).isEqualTo(80.0);
        assertThat(result.severity()).isEqualTo(Severity.INFO);
        assertThat(result.locations()).extracting(location -> location.functionName()).containsExactly("deep");
    }

    @Test
    void calculate_beyondPoor_isCritical() {
        MetricResult result = metric.calculate(parseResult(List.of(function("deep", 1, 1, 8))));

        assertThat(result.severity()).isEqualTo(Severity.CRITICAL);
        assertThat(result.normalizedScore()).isLessThan(15.0);
    }
}
