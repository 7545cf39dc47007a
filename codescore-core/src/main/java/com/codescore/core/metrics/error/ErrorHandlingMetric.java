package com.codescore.core.metrics.error;

import com.codescore.core.metrics.AbstractMetric;
import com.codescore.core.metrics.ScoringCurve;
import com.codescore.core.metrics.thresholds.ThresholdConfig;
import com.codescore.core.model.MetricCategory;
import com.codescore.core.model.MetricLocation;
import com.codescore.core.model.MetricResult;
import com.codescore.core.model.ParseResult;
import com.codescore.core.parser.base.SourceLines;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Share of error-prone calls whose failure is ignored.
 *
 * <p>A line is an error-prone call if it invokes a file, network, serialization or database
 * operation by a well-known name. Calls inside a {@code try} block (brace or indentation
 * style) are handled. Outside one, a call is reported as:
 * <ul>
 *   <li><b>ignored</b> when its result goes to the discard identifier {@code _}</li>
 *   <li><b>unhandled</b> when it is a bare statement with no assignment or return</li>
 * </ul>
 * The value is {@code (ignored + unhandled) / errorProneCalls * 100}. This is a text
 * heuristic, not a data-flow analysis.
 *
 * @since 1.0.0
 */
public class ErrorHandlingMetric extends AbstractMetric {

    public static final String NAME = "error_handling";

    private static final ThresholdConfig THRESHOLDS = ThresholdConfig.of(5, 15, 30, 50);

    private static final List<Pattern> ERROR_PRONE_CALLS = List.of(
        Pattern.compile("\\b(?:open|read|write|close|create|remove|rename|mkdir|readFile|writeFile|readdir|stat|access)\\s*\\("),
        Pattern.compile("\\b(?:fetch|get|post|put|delete|request|send|connect|listen|accept)\\s*\\("),
        Pattern.compile("\\b(?:parse|stringify|marshal|unmarshal|decode|encode)\\s*\\("),
        Pattern.compile("\\b(?:query|exec|execute|prepare|transaction|commit|rollback)\\s*\\(")
    );

    private static final Pattern BRACE_TRY = Pattern.compile("\\btry\\s*\\{");
    private static final Pattern INDENT_TRY = Pattern.compile("^try\\s*:");
    private static final Pattern INDENT_HANDLER = Pattern.compile("^(?:except|finally|else)\\b.*:");
    private static final Pattern CATCH = Pattern.compile("\\bcatch\\s*[({]");
    private static final Pattern PROMISE_HANDLER = Pattern.compile("\\.(?:catch|then)\\s*\\(");
    private static final Pattern THROW = Pattern.compile("\\b(?:throw|raise)\\b");
    private static final Pattern DISCARD = Pattern.compile("\\b_\\s*[=:]");
    private static final Pattern DECLARATION = Pattern.compile("\\b(?:const|let|var)\\s+\\w");
    private static final Pattern RETURN = Pattern.compile("\\breturn\\b");

    public ErrorHandlingMetric(double weight) {
        super(NAME, MetricCategory.ERROR, weight);
    }

    @Override
    public MetricResult calculate(ParseResult parseResult) {
        if (parseResult.functions().isEmpty() || !parseResult.hasContent()) {
            return insufficientData(0, "No functions found");
        }

        List<MetricLocation> locations = new ArrayList<>();
        int calls = scan(parseResult.filePath(), SourceLines.split(parseResult.content()), locations);
        if (calls == 0) {
            return insufficientData(0, "No error-prone calls found");
        }

        double percent = locations.size() * 100.0 / calls;
        return result(percent, ScoringCurve.PERCENTAGE.score(percent, THRESHOLDS),
            severityFor(percent, THRESHOLDS),
            format("%d of %d error-prone calls unchecked (%.1f%%)", locations.size(), calls, percent),
            locations);
    }

    /**
     * Scans lines, appending a location per unchecked call.
     *
     * @return number of error-prone calls seen
     */
    private int scan(String filePath, List<String> lines, List<MetricLocation> locations) {
        int calls = 0;
        int braceDepth = 0;
        Deque<Integer> tryDepths = new ArrayDeque<>();
        int indentTry = -1;

        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i);
            String trimmed = line.trim();
            if (trimmed.isEmpty()) {
                continue;
            }

            int depthBefore = braceDepth;
            braceDepth = Math.max(0, braceDepth + SourceLines.count(line, '{') - SourceLines.count(line, '}'));
            while (!tryDepths.isEmpty() && braceDepth <= tryDepths.peek()) {
                tryDepths.pop();
            }

            int indent = SourceLines.indentOf(line);
            if (indentTry >= 0 && indent <= indentTry && !INDENT_HANDLER.matcher(trimmed).find()) {
                indentTry = -1;
            }

            if (BRACE_TRY.matcher(trimmed).find()) {
                tryDepths.push(depthBefore);
                continue;
            }
            if (INDENT_TRY.matcher(trimmed).find()) {
                indentTry = indent;
                continue;
            }
            if (CATCH.matcher(trimmed).find() || INDENT_HANDLER.matcher(trimmed).find()
                || PROMISE_HANDLER.matcher(trimmed).find() || THROW.matcher(trimmed).find()) {
                continue;
            }
            if (!SourceLines.anyFind(ERROR_PRONE_CALLS, trimmed)) {
                continue;
            }

            calls++;
            boolean protectedRegion = !tryDepths.isEmpty() || (indentTry >= 0 && indent > indentTry);
            if (protectedRegion) {
                continue;
            }
            if (DISCARD.matcher(trimmed).find()) {
                locations.add(MetricLocation.ofFile(filePath, i + 1, "Error result discarded"));
            } else if (!DECLARATION.matcher(trimmed).find() && !RETURN.matcher(trimmed).find()
                && trimmed.indexOf('=') < 0) {
                locations.add(MetricLocation.ofFile(filePath, i + 1, "Error-prone call without error handling"));
            }
        }
        return calls;
    }
}
