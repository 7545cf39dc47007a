package com.codescore.core.model;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link AnalysisStatistics}.
 */
class AnalysisStatisticsTest {

    @Test
    void empty_createsZeroStatistics() {
        AnalysisStatistics stats = AnalysisStatistics.empty();

        assertThat(stats.filesSubmitted()).isZero();
        assertThat(stats.filesAnalyzed()).isZero();
        assertThat(stats.errorCounts()).isEmpty();
        assertThat(stats.topErrors()).isEmpty();
        assertThat(stats.hasFailures()).isFalse();
    }

    @Test
    void rates_withNothingAnalyzed_returnZero() {
        AnalysisStatistics stats = new AnalysisStatistics(0, 0, 0, 0, 0, 0, Map.of(), List.of());

        assertThat(stats.getAstRate()).isZero();
        assertThat(stats.getFallbackRate()).isZero();
        assertThat(stats.getFailureRate()).isZero();
    }

    @Test
    void rates_splitByParserTier() {
        AnalysisStatistics stats = new AnalysisStatistics(10, 6, 3, 1, 0, 0, Map.of(), List.of());

        assertThat(stats.filesAnalyzed()).isEqualTo(10);
        assertThat(stats.getAstRate()).isEqualTo(60.0);
        assertThat(stats.getFallbackRate()).isEqualTo(40.0);
    }

    @Test
    void getFailureRate_relativeToSubmittedFiles() {
        AnalysisStatistics stats = new AnalysisStatistics(20, 10, 4, 0, 1, 5, Map.of(), List.of());

        assertThat(stats.getFailureRate()).isEqualTo(25.0);
        assertThat(stats.hasFailures()).isTrue();
    }

    @Test
    void builder_countsTiersAndErrors() {
        AnalysisStatistics stats = new AnalysisStatistics.Builder()
            .filesSubmitted(4)
            .incrementParsedWith(ParserTier.AST)
            .incrementParsedWith(ParserTier.PATTERN)
            .incrementFilesSkipped()
            .incrementFilesFailed()
            .addError("IllegalStateException", "broken.go: boom")
            .build();

        assertThat(stats.filesParsedWithAst()).isEqualTo(1);
        assertThat(stats.filesParsedWithPattern()).isEqualTo(1);
        assertThat(stats.filesSkipped()).isEqualTo(1);
        assertThat(stats.filesFailed()).isEqualTo(1);
        assertThat(stats.errorCounts()).containsEntry("IllegalStateException", 1);
        assertThat(stats.topErrors()).containsExactly("broken.go: boom");
    }

    @Test
    void builder_addError_keepsOnlyFirstTenDetails() {
        AnalysisStatistics.Builder builder = new AnalysisStatistics.Builder();
        for (int i = 0; i < 15; i++) {
            builder.addError("IOException", "file" + i);
        }

        AnalysisStatistics stats = builder.build();

        assertThat(stats.errorCounts()).containsEntry("IOException", 15);
        assertThat(stats.topErrors()).hasSize(10).startsWith("file0");
    }

    @Test
    void getSummary_containsCounts() {
        AnalysisStatistics stats = new AnalysisStatistics(10, 8, 1, 0, 0, 1, Map.of(), List.of());

        String summary = stats.getSummary();

        assertThat(summary).contains("Submitted: 10").contains("AST: 8").contains("Failed: 1");
    }
}
