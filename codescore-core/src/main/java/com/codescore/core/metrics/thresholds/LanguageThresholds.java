package com.codescore.core.metrics.thresholds;

import com.codescore.core.model.Language;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Compiled-in thresholds per language for the function- and file-size family of metrics.
 *
 * <p>Values follow each ecosystem's common linter defaults (gocyclo, ESLint, Pylint,
 * SonarQube, Checkstyle, Clippy, RuboCop, SwiftLint). TypeScript and unrecognized languages
 * use the JavaScript table.
 *
 * @param cyclomaticComplexity per-function cyclomatic complexity
 * @param cognitiveComplexity per-function cognitive complexity
 * @param functionLength lines per function
 * @param fileLength code lines per file
 * @param parameterCount parameters per function
 * @param nestingDepth nesting depth per function
 *
 * @since 1.0.0
 */
public record LanguageThresholds(
    ThresholdConfig cyclomaticComplexity,
    ThresholdConfig cognitiveComplexity,
    ThresholdConfig functionLength,
    ThresholdConfig fileLength,
    ThresholdConfig parameterCount,
    ThresholdConfig nestingDepth
) {

    private static final LanguageThresholds GO = new LanguageThresholds(
        ThresholdConfig.of(5, 10, 15, 20),
        ThresholdConfig.of(7, 15, 25, 35),
        ThresholdConfig.of(50, 100, 200, 300),
        ThresholdConfig.of(300, 500, 1000, 1500),
        ThresholdConfig.of(3, 5, 7, 10),
        ThresholdConfig.of(3, 4, 5, 7));

    private static final LanguageThresholds JAVASCRIPT = new LanguageThresholds(
        ThresholdConfig.of(5, 10, 20, 30),
        ThresholdConfig.of(8, 15, 25, 40),
        ThresholdConfig.of(50, 100, 200, 300),
        ThresholdConfig.of(250, 400, 800, 1200),
        ThresholdConfig.of(3, 4, 6, 8),
        ThresholdConfig.of(3, 4, 5, 7));

    private static final LanguageThresholds PYTHON = new LanguageThresholds(
        ThresholdConfig.of(5, 10, 15, 20),
        ThresholdConfig.of(7, 12, 20, 30),
        ThresholdConfig.of(30, 50, 100, 150),
        ThresholdConfig.of(300, 500, 1000, 1500),
        ThresholdConfig.of(3, 5, 7, 10),
        ThresholdConfig.of(3, 5, 7, 10));

    private static final LanguageThresholds JAVA = new LanguageThresholds(
        ThresholdConfig.of(5, 10, 15, 20),
        ThresholdConfig.of(8, 15, 25, 35),
        ThresholdConfig.of(50, 100, 150, 250),
        ThresholdConfig.of(300, 500, 1000, 1500),
        ThresholdConfig.of(3, 5, 7, 10),
        ThresholdConfig.of(3, 4, 5, 7));

    private static final LanguageThresholds C = new LanguageThresholds(
        ThresholdConfig.of(5, 10, 15, 20),
        ThresholdConfig.of(7, 12, 20, 30),
        ThresholdConfig.of(40, 80, 150, 250),
        ThresholdConfig.of(300, 500, 1000, 1500),
        ThresholdConfig.of(3, 5, 7, 10),
        ThresholdConfig.of(3, 4, 5, 7));

    // C++, Rust, C# and Lua share the SonarQube-derived defaults
    private static final LanguageThresholds SONAR_DEFAULT = new LanguageThresholds(
        ThresholdConfig.of(5, 10, 15, 20),
        ThresholdConfig.of(8, 15, 25, 35),
        ThresholdConfig.of(50, 100, 200, 300),
        ThresholdConfig.of(300, 500, 1000, 1500),
        ThresholdConfig.of(3, 5, 7, 10),
        ThresholdConfig.of(3, 4, 5, 7));

    private static final LanguageThresholds PHP = new LanguageThresholds(
        ThresholdConfig.of(5, 10, 15, 20),
        ThresholdConfig.of(8, 15, 25, 35),
        ThresholdConfig.of(50, 100, 200, 300),
        ThresholdConfig.of(300, 500, 1000, 1500),
        ThresholdConfig.of(3, 5, 7, 10),
        ThresholdConfig.of(3, 5, 7, 10));

    private static final LanguageThresholds RUBY = new LanguageThresholds(
        ThresholdConfig.of(4, 7, 12, 18),
        ThresholdConfig.of(5, 8, 15, 25),
        ThresholdConfig.of(20, 50, 100, 200),
        ThresholdConfig.of(250, 400, 800, 1200),
        ThresholdConfig.of(3, 4, 6, 8),
        ThresholdConfig.of(3, 4, 5, 7));

    private static final LanguageThresholds SWIFT = new LanguageThresholds(
        ThresholdConfig.of(5, 10, 20, 30),
        ThresholdConfig.of(7, 12, 20, 30),
        ThresholdConfig.of(30, 40, 100, 150),
        ThresholdConfig.of(200, 350, 600, 1000),
        ThresholdConfig.of(3, 5, 7, 10),
        ThresholdConfig.of(3, 4, 5, 7));

    private static final LanguageThresholds SHELL = new LanguageThresholds(
        ThresholdConfig.of(5, 10, 15, 20),
        ThresholdConfig.of(7, 12, 20, 30),
        ThresholdConfig.of(30, 50, 100, 150),
        ThresholdConfig.of(200, 300, 600, 1000),
        ThresholdConfig.of(3, 5, 7, 10),
        ThresholdConfig.of(3, 4, 5, 7));

    private static final Map<Language, LanguageThresholds> TABLE = buildTable();

    /**
     * Returns the thresholds for a language, falling back to the JavaScript table.
     *
     * @param language language, may be {@code null}
     * @return thresholds, never {@code null}
     */
    public static LanguageThresholds forLanguage(Language language) {
        if (language == null) {
            return JAVASCRIPT;
        }
        return TABLE.getOrDefault(language, JAVASCRIPT);
    }

    private static Map<Language, LanguageThresholds> buildTable() {
        Map<Language, LanguageThresholds> table = new EnumMap<>(Language.class);
        table.put(Language.GO, GO);
        table.put(Language.JAVASCRIPT, JAVASCRIPT);
        table.put(Language.TYPESCRIPT, JAVASCRIPT);
        table.put(Language.PYTHON, PYTHON);
        table.put(Language.JAVA, JAVA);
        table.put(Language.C, C);
        table.put(Language.CPP, SONAR_DEFAULT);
        table.put(Language.RUST, SONAR_DEFAULT);
        table.put(Language.CSHARP, SONAR_DEFAULT);
        table.put(Language.LUA, SONAR_DEFAULT);
        table.put(Language.PHP, PHP);
        table.put(Language.RUBY, RUBY);
        table.put(Language.SWIFT, SWIFT);
        table.put(Language.SHELL, SHELL);
        return Collections.unmodifiableMap(table);
    }
}
