package com.codescore.core.analyzer;

import com.codescore.core.config.RuntimeConfig;
import com.codescore.core.metrics.Metric;
import com.codescore.core.metrics.MetricsFactory;
import com.codescore.core.model.FileAnalysisResult;
import com.codescore.core.model.Language;
import com.codescore.core.model.MetricResult;
import com.codescore.core.model.ParseResult;
import com.codescore.core.parser.ParserSelector;
import com.codescore.core.scoring.ScoreCalculator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Parses one file, runs every metric over it and scores it.
 *
 * <p>Metric calculators are stateless, so one set per language is built lazily and shared
 * across worker threads.
 *
 * @since 1.0.0
 */
public class FileAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(FileAnalyzer.class);

    private final ParserSelector parserSelector;
    private final RuntimeConfig config;
    private final ScoreCalculator scoreCalculator;
    private final Map<Language, List<Metric>> metricsByLanguage = new ConcurrentHashMap<>();

    public FileAnalyzer(ParserSelector parserSelector, RuntimeConfig config) {
        this.parserSelector = Objects.requireNonNull(parserSelector, "parserSelector must not be null");
        this.config = config != null ? config : RuntimeConfig.defaults();
        this.scoreCalculator = new ScoreCalculator(this.config);
    }

    /**
     * Analyzes a single file.
     *
     * @param file file to analyze
     * @return parse result, metric results and weighted score
     */
    public FileAnalysisResult analyze(SourceFile file) {
        ParseResult parseResult = parserSelector
            .parse(file.language(), file.filePath(), file.content())
            .withContent(file.content());
        log.debug("Parsed {} with {} parser ({} functions, {} classes)",
            file.filePath(), parseResult.tier(), parseResult.functions().size(), parseResult.classes().size());

        List<Metric> metrics = metricsByLanguage.computeIfAbsent(
            parseResult.language(), language -> MetricsFactory.create(config, language));

        List<MetricResult> results = new ArrayList<>(metrics.size());
        for (Metric metric : metrics) {
            results.add(metric.calculate(parseResult));
        }

        double score = scoreCalculator.calculateScore(results);
        return new FileAnalysisResult(file.filePath(), parseResult, results, score);
    }

    public ScoreCalculator scoreCalculator() {
        return scoreCalculator;
    }
}
