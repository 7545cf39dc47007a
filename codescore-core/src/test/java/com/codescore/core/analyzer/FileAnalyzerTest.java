package com.codescore.core.analyzer;

import com.codescore.core.config.RuntimeConfig;
import com.codescore.core.model.FileAnalysisResult;
import com.codescore.core.model.Language;
import com.codescore.core.model.MetricResult;
import com.codescore.core.model.ParserTier;
import com.codescore.core.parser.GrammarUnavailableException;
import com.codescore.core.parser.ParserSelector;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link FileAnalyzer}.
 */
class FileAnalyzerTest {

    private final FileAnalyzer analyzer = new FileAnalyzer(
        new ParserSelector((language, config) -> {
            throw new GrammarUnavailableException(language, "not loaded in tests");
        }),
        RuntimeConfig.defaults());

    @Test
    void analyze_runsEveryMetricAndAttachesContent() {
        String source = String.join("\n",
            "\"\"\"Order helpers.\"\"\"",
            "import json",
            "",
            "def load_order(path):",
            "    \"\"\"Reads one order.\"\"\"",
            "    with open(path) as handle:",
            "        return json.load(handle)",
            "");

        FileAnalysisResult result = analyzer.analyze(SourceFile.of("orders/load.py", source));

        assertThat(result.filePath()).isEqualTo("orders/load.py");
        assertThat(result.parseResult().language()).isEqualTo(Language.PYTHON);
        assertThat(result.parseResult().tier()).isEqualTo(ParserTier.PATTERN);
        assertThat(result.parseResult().hasContent()).isTrue();
        assertThat(result.metrics()).hasSize(11);
        assertThat(result.metrics()).extracting(MetricResult::name).doesNotHaveDuplicates();
        assertThat(result.score()).isBetween(0.0, 100.0);
    }

    @Test
    void analyze_unknownLanguage_usesGenericParser() {
        FileAnalysisResult result = analyzer.analyze(new SourceFile("notes/todo.txt", null, "buy milk\n"));

        assertThat(result.parseResult().tier()).isEqualTo(ParserTier.GENERIC);
        assertThat(result.metrics()).hasSize(11);
    }
}
