package com.codescore.core.metrics;

import com.codescore.core.model.FunctionInfo;
import com.codescore.core.model.Language;
import com.codescore.core.model.ParseResult;
import com.codescore.core.model.ParserTier;

import java.util.List;

/**
 * Fixture helpers shared by metric tests.
 */
public abstract class MetricTestBase {

    protected static final String FILE = "src/sample.js";

    /**
     * A function with the given complexity and nesting, five lines long, starting at {@code line}.
     */
    protected static FunctionInfo function(String name, int line, int complexity, int nesting) {
        return FunctionInfo.of(name, line, line + 4, complexity, 1, nesting, false);
    }

    protected static FunctionInfo functionWithParameters(String name, int line, int parameters) {
        return FunctionInfo.of(name, line, line + 4, 1, parameters, 0, false);
    }

    protected static FunctionInfo functionOfLength(String name, int line, int lineCount) {
        return FunctionInfo.of(name, line, line + lineCount - 1, 1, 1, 0, false);
    }

    /**
     * Parse result whose line counts are derived from the number of code lines.
     */
    protected static ParseResult parseResult(Language language, List<FunctionInfo> functions, int codeLines) {
        return new ParseResult(FILE, language, codeLines, codeLines, 0, 0,
            functions, List.of(), List.of(), List.of(), null, ParserTier.AST);
    }

    protected static ParseResult parseResult(List<FunctionInfo> functions) {
        return parseResult(Language.JAVASCRIPT, functions, 100);
    }

    protected static ParseResult withContent(List<FunctionInfo> functions, String content) {
        int lines = content.split("\n", -1).length;
        return new ParseResult(FILE, Language.JAVASCRIPT, lines, lines, 0, 0,
            functions, List.of(), List.of(), List.of(), content, ParserTier.PATTERN);
    }
}
