package com.codescore.core.model;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Statistics collected while analyzing a project.
 *
 * <p>Shows which parser tier serviced each file and why files were dropped. Useful for
 * spotting languages whose grammar never loaded (everything lands in the pattern tier) and
 * for troubleshooting failed runs.
 *
 * <p><b>Usage Example:</b></p>
 * <pre>{@code
 * AnalysisStatistics stats = new AnalysisStatistics.Builder()
 *     .filesSubmitted(120)
 *     .incrementParsedWith(ParserTier.AST)
 *     .incrementParsedWith(ParserTier.PATTERN)
 *     .incrementFilesSkipped()
 *     .build();
 *
 * System.out.println(stats.getSummary());
 * }</pre>
 *
 * @param filesSubmitted files handed to the analyzer
 * @param filesParsedWithAst files parsed by the AST tier
 * @param filesParsedWithPattern files parsed by the pattern tier
 * @param filesParsedWithGeneric files parsed by the generic tier
 * @param filesSkipped files skipped for exceeding the size ceiling or being unreadable
 * @param filesFailed files dropped after an analysis failure
 * @param errorCounts error type to occurrence count
 * @param topErrors first error messages encountered (max 10)
 *
 * @since 1.0.0
 */
public record AnalysisStatistics(
    int filesSubmitted,
    int filesParsedWithAst,
    int filesParsedWithPattern,
    int filesParsedWithGeneric,
    int filesSkipped,
    int filesFailed,
    Map<String, Integer> errorCounts,
    List<String> topErrors
) {
    private static final int MAX_TOP_ERRORS = 10;

    /**
     * Compact constructor with defaults.
     */
    public AnalysisStatistics {
        filesSubmitted = Math.max(0, filesSubmitted);
        filesParsedWithAst = Math.max(0, filesParsedWithAst);
        filesParsedWithPattern = Math.max(0, filesParsedWithPattern);
        filesParsedWithGeneric = Math.max(0, filesParsedWithGeneric);
        filesSkipped = Math.max(0, filesSkipped);
        filesFailed = Math.max(0, filesFailed);
        errorCounts = errorCounts == null ? Map.of() : Map.copyOf(errorCounts);
        topErrors = topErrors == null ? List.of() : List.copyOf(topErrors);
    }

    /**
     * Creates an empty statistics instance (no files processed).
     *
     * @return empty statistics
     */
    public static AnalysisStatistics empty() {
        return new AnalysisStatistics(0, 0, 0, 0, 0, 0, Map.of(), List.of());
    }

    /**
     * Total number of files that produced a parse result, across all tiers.
     */
    public int filesAnalyzed() {
        return filesParsedWithAst + filesParsedWithPattern + filesParsedWithGeneric;
    }

    /**
     * Share of analyzed files parsed by the AST tier.
     *
     * @return percentage (0.0 to 100.0), or 0 if nothing was analyzed
     */
    public double getAstRate() {
        int analyzed = filesAnalyzed();
        return analyzed == 0 ? 0.0 : (filesParsedWithAst * 100.0) / analyzed;
    }

    /**
     * Share of analyzed files that needed a fallback tier.
     *
     * @return percentage (0.0 to 100.0), or 0 if nothing was analyzed
     */
    public double getFallbackRate() {
        int analyzed = filesAnalyzed();
        return analyzed == 0 ? 0.0 : ((filesParsedWithPattern + filesParsedWithGeneric) * 100.0) / analyzed;
    }

    /**
     * Share of submitted files that failed.
     *
     * @return percentage (0.0 to 100.0), or 0 if nothing was submitted
     */
    public double getFailureRate() {
        return filesSubmitted == 0 ? 0.0 : (filesFailed * 100.0) / filesSubmitted;
    }

    public boolean hasFailures() {
        return filesFailed > 0;
    }

    /**
     * Returns a human-readable summary of the statistics.
     *
     * @return summary string
     */
    public String getSummary() {
        return String.format(
            "Submitted: %d, AST: %d (%.1f%%), Pattern: %d, Generic: %d, Skipped: %d, Failed: %d (%.1f%%)",
            filesSubmitted,
            filesParsedWithAst,
            getAstRate(),
            filesParsedWithPattern,
            filesParsedWithGeneric,
            filesSkipped,
            filesFailed,
            getFailureRate()
        );
    }

    /**
     * Builder for constructing AnalysisStatistics incrementally.
     *
     * <p>Not thread-safe; concurrent producers must synchronize on the builder.
     */
    public static class Builder {
        private int filesSubmitted = 0;
        private int filesParsedWithAst = 0;
        private int filesParsedWithPattern = 0;
        private int filesParsedWithGeneric = 0;
        private int filesSkipped = 0;
        private int filesFailed = 0;
        private final Map<String, Integer> errorCounts = new HashMap<>();
        private final List<String> topErrors = new ArrayList<>();

        public Builder filesSubmitted(int count) {
            this.filesSubmitted = count;
            return this;
        }

        public Builder incrementParsedWith(ParserTier tier) {
            switch (tier) {
                case AST -> filesParsedWithAst++;
                case PATTERN -> filesParsedWithPattern++;
                case GENERIC -> filesParsedWithGeneric++;
            }
            return this;
        }

        public Builder incrementFilesSkipped() {
            this.filesSkipped++;
            return this;
        }

        public Builder incrementFilesFailed() {
            this.filesFailed++;
            return this;
        }

        public Builder addError(String errorType, String errorDetail) {
            errorCounts.merge(errorType, 1, Integer::sum);
            if (topErrors.size() < MAX_TOP_ERRORS) {
                topErrors.add(errorDetail);
            }
            return this;
        }

        public AnalysisStatistics build() {
            return new AnalysisStatistics(
                filesSubmitted,
                filesParsedWithAst,
                filesParsedWithPattern,
                filesParsedWithGeneric,
                filesSkipped,
                filesFailed,
                errorCounts,
                topErrors
            );
        }
    }
}
