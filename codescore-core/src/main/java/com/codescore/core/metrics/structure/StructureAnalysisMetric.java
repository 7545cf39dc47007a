package com.codescore.core.metrics.structure;

import com.codescore.core.metrics.AbstractMetric;
import com.codescore.core.model.FunctionInfo;
import com.codescore.core.model.MetricCategory;
import com.codescore.core.model.MetricLocation;
import com.codescore.core.model.MetricResult;
import com.codescore.core.model.ParseResult;
import com.codescore.core.model.Severity;
import com.codescore.core.parser.base.SourceLines;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Composite structure score built from three sub-scores.
 *
 * <ul>
 *   <li><b>Nesting (60%):</b> {@code 100 - 15 * deep - 5 * medium}, where deep functions
 *       nest {@value #NESTING_HIGH}+ levels and medium ones {@value #NESTING_MEDIUM}+.</li>
 *   <li><b>File organization (25%):</b> penalizes large files (total lines) and files with
 *       many functions.</li>
 *   <li><b>Imports (15%):</b> penalizes many imports and self-imports, where the file's own
 *       package or module name appears in one of its import lines.</li>
 * </ul>
 *
 * <p>The value is the number of issues found. Without raw text only deep nesting, file size
 * and function count are scored.
 *
 * @since 1.0.0
 */
public class StructureAnalysisMetric extends AbstractMetric {

    public static final String NAME = "structure_analysis";

    static final int NESTING_HIGH = 5;
    static final int NESTING_MEDIUM = 3;
    static final int FILE_LARGE = 1000;
    static final int FILE_MEDIUM = 500;
    static final int FUNCTIONS_HIGH = 50;
    static final int FUNCTIONS_MEDIUM = 30;
    static final int IMPORTS_HIGH = 20;
    static final int IMPORTS_MEDIUM = 15;

    private static final int MODULE_DECLARATION_SCAN_LINES = 20;

    private static final List<Pattern> IMPORT_LINES = List.of(
        Pattern.compile("^import\\s+"),
        Pattern.compile("^from\\s+.*\\s+import\\s+"),
        Pattern.compile("^#include\\s+"),
        Pattern.compile("^using\\s+"),
        Pattern.compile("\\brequire\\s*\\(")
    );
    private static final List<Pattern> SELF_IMPORT_CANDIDATES = List.of(
        Pattern.compile("^import\\s+"),
        Pattern.compile("^from\\s+"),
        Pattern.compile("\\brequire\\s*\\(")
    );
    private static final Pattern PACKAGE = Pattern.compile("^package\\s+([\\w.]+)");
    private static final Pattern MODULE = Pattern.compile("^module\\s+['\"]([^'\"]+)['\"]");

    public StructureAnalysisMetric(double weight) {
        super(NAME, MetricCategory.STRUCTURE, weight);
    }

    @Override
    public MetricResult calculate(ParseResult parseResult) {
        List<FunctionInfo> functions = parseResult.functions();
        if (functions.isEmpty()) {
            return insufficientData(0, "No functions found");
        }
        if (!parseResult.hasContent()) {
            return calculateSimplified(parseResult);
        }

        String filePath = parseResult.filePath();
        List<MetricLocation> locations = new ArrayList<>();
        int deep = 0;
        int medium = 0;
        for (FunctionInfo function : functions) {
            if (function.nestingDepth() >= NESTING_HIGH) {
                deep++;
                locations.add(locationOf(parseResult, function, "Deep nesting: " + function.nestingDepth() + " levels"));
            } else if (function.nestingDepth() >= NESTING_MEDIUM) {
                medium++;
                locations.add(locationOf(parseResult, function, "Nesting: " + function.nestingDepth() + " levels"));
            }
        }

        int totalLines = parseResult.totalLines();
        boolean largeFile = totalLines > FILE_LARGE;
        boolean mediumFile = !largeFile && totalLines > FILE_MEDIUM;
        boolean tooManyFunctions = functions.size() > FUNCTIONS_HIGH;
        boolean manyFunctions = !tooManyFunctions && functions.size() > FUNCTIONS_MEDIUM;

        List<String> lines = SourceLines.split(parseResult.content());
        int imports = countImports(lines);
        boolean tooManyImports = imports > IMPORTS_HIGH;
        boolean manyImports = !tooManyImports && imports > IMPORTS_MEDIUM;
        int selfImports = countSelfImports(lines);

        if (largeFile) {
            locations.add(MetricLocation.ofFile(filePath, 1, "File too large: " + totalLines + " lines"));
        }
        if (tooManyFunctions) {
            locations.add(MetricLocation.ofFile(filePath, 1, "Too many functions: " + functions.size()));
        }
        if (tooManyImports) {
            locations.add(MetricLocation.ofFile(filePath, 1, "Too many imports: " + imports));
        }
        if (selfImports > 0) {
            locations.add(MetricLocation.ofFile(filePath, 1, "Possible circular imports: " + selfImports));
        }

        double nestingScore = Math.max(0, 100 - 15 * deep - 5 * medium);
        double fileScore = Math.max(0, 100
            - (largeFile ? 40 : mediumFile ? 20 : 0)
            - (tooManyFunctions ? 40 : manyFunctions ? 20 : 0));
        double importScore = Math.max(0, 100
            - (tooManyImports ? 50 : manyImports ? 25 : 0)
            - 30 * selfImports);
        double score = nestingScore * 0.6 + fileScore * 0.25 + importScore * 0.15;

        Severity severity;
        if (selfImports > 0 || deep >= 3) {
            severity = Severity.CRITICAL;
        } else if (largeFile || tooManyFunctions || tooManyImports || deep > 0) {
            severity = Severity.ERROR;
        } else if (mediumFile || manyFunctions || manyImports || medium > 0) {
            severity = Severity.WARNING;
        } else {
            severity = Severity.INFO;
        }

        int issues = deep + medium + (largeFile ? 1 : 0) + (tooManyFunctions ? 1 : 0)
            + (tooManyImports ? 1 : 0) + selfImports;
        return result(issues, score, severity, issues + " structure issues", locations);
    }

    private MetricResult calculateSimplified(ParseResult parseResult) {
        int deep = (int) parseResult.functions().stream()
            .filter(function -> function.nestingDepth() >= NESTING_HIGH)
            .count();
        boolean largeFile = parseResult.totalLines() > FILE_LARGE;
        boolean tooManyFunctions = parseResult.functions().size() > FUNCTIONS_HIGH;
        int issues = deep + (largeFile ? 1 : 0) + (tooManyFunctions ? 1 : 0);
        double score = Math.max(0, 100.0 - 15 * issues);
        Severity severity = issues > 3 ? Severity.ERROR : issues > 0 ? Severity.WARNING : Severity.INFO;
        return result(issues, score, severity, issues + " structure issues", List.of());
    }

    static int countImports(List<String> lines) {
        int count = 0;
        for (String line : lines) {
            if (SourceLines.anyFind(IMPORT_LINES, line.trim())) {
                count++;
            }
        }
        return count;
    }

    /**
     * Counts import lines that mention the file's own package or module name.
     */
    static int countSelfImports(List<String> lines) {
        String moduleName = null;
        for (int i = 0; i < Math.min(MODULE_DECLARATION_SCAN_LINES, lines.size()) && moduleName == null; i++) {
            String trimmed = lines.get(i).trim();
            Matcher packageMatch = PACKAGE.matcher(trimmed);
            Matcher moduleMatch = MODULE.matcher(trimmed);
            if (packageMatch.find()) {
                moduleName = packageMatch.group(1);
            } else if (moduleMatch.find()) {
                moduleName = moduleMatch.group(1);
            }
        }
        if (moduleName == null) {
            return 0;
        }

        // The name must stand alone: "com.acme.api" does not match an import of "com.acme.api.v2.X"
        Pattern reference = Pattern.compile("(?<![\\w.])" + Pattern.quote(moduleName) + "(?!\\w)(?!\\.\\w)");
        int count = 0;
        for (String line : lines) {
            String trimmed = line.trim();
            if (SourceLines.anyFind(SELF_IMPORT_CANDIDATES, trimmed) && reference.matcher(trimmed).find()) {
                count++;
            }
        }
        return count;
    }
}
