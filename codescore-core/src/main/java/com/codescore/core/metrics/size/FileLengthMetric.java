package com.codescore.core.metrics.size;

import com.codescore.core.metrics.AbstractMetric;
import com.codescore.core.metrics.ScoringCurve;
import com.codescore.core.metrics.thresholds.LanguageThresholds;
import com.codescore.core.metrics.thresholds.ThresholdConfig;
import com.codescore.core.model.Language;
import com.codescore.core.model.MetricCategory;
import com.codescore.core.model.MetricLocation;
import com.codescore.core.model.MetricResult;
import com.codescore.core.model.ParseResult;

import java.util.List;

/**
 * File length measured in code lines; blank and comment lines do not count.
 *
 * @since 1.0.0
 */
public class FileLengthMetric extends AbstractMetric {

    public static final String NAME = "file_length";

    private final ThresholdConfig thresholds;

    public FileLengthMetric(double weight, Language language) {
        super(NAME, MetricCategory.SIZE, weight);
        this.thresholds = LanguageThresholds.forLanguage(language).fileLength();
    }

    @Override
    public MetricResult calculate(ParseResult parseResult) {
        int codeLines = parseResult.codeLines();
        List<MetricLocation> locations = codeLines > thresholds.good()
            ? List.of(MetricLocation.ofFile(parseResult.filePath(), 1, codeLines + " code lines"))
            : List.of();
        return result(codeLines, ScoringCurve.FILE_LENGTH.score(codeLines, thresholds),
            severityFor(codeLines, thresholds),
            format("%d code lines of %d total", codeLines, parseResult.totalLines()), locations);
    }
}
