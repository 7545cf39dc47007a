package com.codescore.core.scoring;

import com.codescore.core.config.MetricWeights;
import com.codescore.core.config.RuntimeConfig;
import com.codescore.core.model.AggregatedMetric;
import com.codescore.core.model.FileAnalysisResult;
import com.codescore.core.model.Language;
import com.codescore.core.model.MetricCategory;
import com.codescore.core.model.MetricResult;
import com.codescore.core.model.ParseResult;
import com.codescore.core.model.ParserTier;
import com.codescore.core.model.Severity;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

/**
 * Tests for {@link ScoreCalculator}.
 */
class ScoreCalculatorTest {

    private final ScoreCalculator calculator = new ScoreCalculator();

    @Test
    void calculateScore_emptyOrNull_returnsPerfectScore() {
        assertThat(calculator.calculateScore(List.of())).isEqualTo(100.0);
        assertThat(calculator.calculateScore(null)).isEqualTo(100.0);
    }

    @Test
    void calculateScore_weightsByCategory() {
        List<MetricResult> metrics = List.of(
            metric("cyclomatic_complexity", MetricCategory.COMPLEXITY, 50.0),
            metric("naming_convention", MetricCategory.NAMING, 100.0));

        // (50 * 0.32 + 100 * 0.05) / 0.37
        assertThat(calculator.calculateScore(metrics)).isCloseTo(56.757, within(0.01));
    }

    @Test
    void calculateScore_zeroTotalWeight_returnsPerfectScore() {
        MetricWeights muted = new MetricWeights(0.0, null, null, null, null, null, 0.0);
        ScoreCalculator custom = new ScoreCalculator(new RuntimeConfig(null, null, muted, null));

        double score = custom.calculateScore(List.of(
            metric("cyclomatic_complexity", MetricCategory.COMPLEXITY, 10.0),
            metric("naming_convention", MetricCategory.NAMING, 20.0)));

        assertThat(score).isEqualTo(100.0);
    }

    @Test
    void aggregateMetrics_computesStatisticsPerMetricInFirstSeenOrder() {
        List<FileAnalysisResult> files = List.of(
            file("a.js", 10, 0.0,
                metric("naming_convention", MetricCategory.NAMING, 40.0),
                metric("file_length", MetricCategory.SIZE, 100.0)),
            file("b.js", 10, 0.0,
                metric("naming_convention", MetricCategory.NAMING, 80.0)),
            file("c.js", 10, 0.0,
                metric("naming_convention", MetricCategory.NAMING, 90.0)));

        List<AggregatedMetric> aggregated = calculator.aggregateMetrics(files);

        assertThat(aggregated).extracting(AggregatedMetric::name).containsExactly("naming_convention", "file_length");
        AggregatedMetric naming = aggregated.get(0);
        assertThat(naming.average()).isCloseTo(70.0, within(0.001));
        assertThat(naming.min()).isEqualTo(40.0);
        assertThat(naming.max()).isEqualTo(90.0);
        assertThat(naming.median()).isEqualTo(80.0);
        assertThat(naming.weight()).isEqualTo(0.05);
        assertThat(naming.category()).isEqualTo(MetricCategory.NAMING);
    }

    @Test
    void aggregateMetrics_empty_returnsEmptyList() {
        assertThat(calculator.aggregateMetrics(List.of())).isEmpty();
    }

    @Test
    void median_evenAndOddSizes() {
        assertThat(ScoreCalculator.median(List.of(1.0, 3.0, 7.0))).isEqualTo(3.0);
        assertThat(ScoreCalculator.median(List.of(1.0, 3.0, 7.0, 9.0))).isEqualTo(5.0);
        assertThat(ScoreCalculator.median(List.of())).isZero();
    }

    @Test
    void projectScore_weightsFilesByCodeLines() {
        List<FileAnalysisResult> files = List.of(
            file("big.js", 30, 80.0),
            file("small.js", 10, 40.0));

        assertThat(calculator.projectScore(files)).isCloseTo(70.0, within(0.001));
    }

    @Test
    void projectScore_fileWithoutCode_countsWithWeightOne() {
        List<FileAnalysisResult> files = List.of(
            file("code.js", 3, 100.0),
            file("empty.js", 0, 0.0));

        assertThat(calculator.projectScore(files)).isCloseTo(75.0, within(0.001));
    }

    @Test
    void projectScore_noFiles_returnsPerfectScore() {
        assertThat(calculator.projectScore(List.of())).isEqualTo(100.0);
    }

    private static MetricResult metric(String name, MetricCategory category, double score) {
        return new MetricResult(name, category, score, score, Severity.INFO, "", List.of());
    }

    private static FileAnalysisResult file(String path, int codeLines, double score, MetricResult... metrics) {
        ParseResult parse = new ParseResult(path, Language.JAVASCRIPT, codeLines, codeLines, 0, 0,
            null, null, null, null, null, ParserTier.PATTERN);
        return new FileAnalysisResult(path, parse, List.of(metrics), score);
    }
}
