package com.codescore.core.metrics.naming;

import com.codescore.core.metrics.AbstractMetric;
import com.codescore.core.model.ClassInfo;
import com.codescore.core.model.FunctionInfo;
import com.codescore.core.model.Language;
import com.codescore.core.model.MetricCategory;
import com.codescore.core.model.MetricLocation;
import com.codescore.core.model.MetricResult;
import com.codescore.core.model.ParseResult;
import com.codescore.core.model.Severity;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Percentage of function and class names that follow the language's naming conventions.
 *
 * <p>Function names must match one of the language's allowed conventions; class names must
 * always be PascalCase. Leading and trailing underscores, Ruby's {@code ?}/{@code !}/{@code =}
 * suffixes, C++'s destructor {@code ~} and Lua's {@code module.} or {@code object:} prefixes
 * are ignored. The first ten violations are reported.
 *
 * @since 1.0.0
 */
public class NamingConventionMetric extends AbstractMetric {

    public static final String NAME = "naming_convention";

    private static final int MAX_LOCATIONS = 10;

    /**
     * Supported identifier conventions.
     */
    public enum Convention {
        CAMEL_CASE("camelCase", "^[a-z][a-zA-Z0-9]*$"),
        PASCAL_CASE("PascalCase", "^[A-Z][a-zA-Z0-9]*$"),
        SNAKE_CASE("snake_case", "^[a-z][a-z0-9_]*$"),
        UPPER_SNAKE_CASE("UPPER_SNAKE_CASE", "^[A-Z][A-Z0-9_]*$");

        private final String label;
        private final Pattern pattern;

        Convention(String label, String regex) {
            this.label = label;
            this.pattern = Pattern.compile(regex);
        }

        public String label() {
            return label;
        }

        public boolean matches(String identifier) {
            return pattern.matcher(identifier).matches();
        }
    }

    private static final List<Convention> DEFAULT_FUNCTION_RULES =
        List.of(Convention.CAMEL_CASE, Convention.SNAKE_CASE, Convention.PASCAL_CASE);

    private static final Map<Language, List<Convention>> FUNCTION_RULES = buildFunctionRules();

    private final List<Convention> functionRules;

    public NamingConventionMetric(double weight, Language language) {
        super(NAME, MetricCategory.NAMING, weight);
        this.functionRules = FUNCTION_RULES.getOrDefault(language, DEFAULT_FUNCTION_RULES);
    }

    @Override
    public MetricResult calculate(ParseResult parseResult) {
        int total = 0;
        int violations = 0;
        List<MetricLocation> locations = new ArrayList<>();
        String allowed = functionRules.stream().map(Convention::label).collect(Collectors.joining("/"));

        for (FunctionInfo function : parseResult.functions()) {
            total++;
            String identifier = normalize(function.name());
            if (identifier.isEmpty() || functionRules.stream().noneMatch(rule -> rule.matches(identifier))) {
                violations++;
                locations.add(locationOf(parseResult, function, "\"" + function.name() + "\" - " + allowed));
            }
        }
        for (ClassInfo cls : parseResult.classes()) {
            total++;
            if (!Convention.PASCAL_CASE.matches(normalize(cls.name()))) {
                violations++;
                locations.add(MetricLocation.ofFile(parseResult.filePath(), cls.startLine(),
                    "\"" + cls.name() + "\" - PascalCase"));
            }
        }

        if (total == 0) {
            return insufficientData(100, "No identifiers to check");
        }

        double compliance = (total - violations) * 100.0 / total;
        String details = violations > 0 ? violations + " naming violations" : "No naming violations";
        return result(compliance, compliance, severityForCompliance(compliance), details,
            locations.subList(0, Math.min(MAX_LOCATIONS, locations.size())));
    }

    static String normalize(String name) {
        String identifier = name;
        int separator = Math.max(identifier.lastIndexOf('.'), identifier.lastIndexOf(':'));
        if (separator >= 0) {
            identifier = identifier.substring(separator + 1);
        }
        if (identifier.startsWith("~")) {
            identifier = identifier.substring(1);
        }
        identifier = identifier.replaceAll("[?!=]$", "");
        return identifier.replaceAll("^_+|_+$", "");
    }

    private static Severity severityForCompliance(double compliance) {
        if (compliance >= 90) {
            return Severity.INFO;
        }
        if (compliance >= 70) {
            return Severity.WARNING;
        }
        if (compliance >= 50) {
            return Severity.ERROR;
        }
        return Severity.CRITICAL;
    }

    private static Map<Language, List<Convention>> buildFunctionRules() {
        Map<Language, List<Convention>> rules = new EnumMap<>(Language.class);
        rules.put(Language.GO, List.of(Convention.PASCAL_CASE, Convention.CAMEL_CASE));
        rules.put(Language.JAVASCRIPT, List.of(Convention.CAMEL_CASE, Convention.PASCAL_CASE));
        rules.put(Language.TYPESCRIPT, List.of(Convention.CAMEL_CASE, Convention.PASCAL_CASE));
        rules.put(Language.PYTHON, List.of(Convention.SNAKE_CASE));
        rules.put(Language.JAVA, List.of(Convention.CAMEL_CASE));
        rules.put(Language.C, List.of(Convention.SNAKE_CASE, Convention.CAMEL_CASE));
        rules.put(Language.CPP, List.of(Convention.CAMEL_CASE, Convention.SNAKE_CASE, Convention.PASCAL_CASE));
        rules.put(Language.RUST, List.of(Convention.SNAKE_CASE));
        rules.put(Language.CSHARP, List.of(Convention.PASCAL_CASE));
        rules.put(Language.LUA, List.of(Convention.CAMEL_CASE, Convention.SNAKE_CASE));
        rules.put(Language.PHP, List.of(Convention.CAMEL_CASE, Convention.SNAKE_CASE));
        rules.put(Language.RUBY, List.of(Convention.SNAKE_CASE));
        rules.put(Language.SWIFT, List.of(Convention.CAMEL_CASE));
        rules.put(Language.SHELL, List.of(Convention.SNAKE_CASE));
        return rules;
    }
}
