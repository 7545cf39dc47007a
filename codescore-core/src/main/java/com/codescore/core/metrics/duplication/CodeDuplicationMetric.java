package com.codescore.core.metrics.duplication;

import com.codescore.core.metrics.AbstractMetric;
import com.codescore.core.metrics.ScoringCurve;
import com.codescore.core.metrics.thresholds.ThresholdConfig;
import com.codescore.core.model.FunctionInfo;
import com.codescore.core.model.MetricCategory;
import com.codescore.core.model.MetricLocation;
import com.codescore.core.model.MetricResult;
import com.codescore.core.model.ParseResult;
import com.codescore.core.parser.base.SourceLines;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Structural duplication within a file, detected by control-flow signatures.
 *
 * <p>Each significant body line maps to one letter:
 * <ul>
 *   <li>{@code I} conditional, {@code F} for loop, {@code W} while loop</li>
 *   <li>{@code S} switch or match, {@code C} case label, {@code R} return</li>
 *   <li>{@code A} declaration or assignment</li>
 * </ul>
 * Functions whose signatures are identical and at least {@value #MIN_SIGNATURE_LENGTH}
 * letters long form a duplicate group. Every member beyond the first counts as a duplicate,
 * and the value is {@code duplicates / functions * 100}.
 *
 * <p>Needs at least three functions and the raw file text.
 *
 * @since 1.0.0
 */
public class CodeDuplicationMetric extends AbstractMetric {

    public static final String NAME = "code_duplication";

    static final int MIN_SIGNATURE_LENGTH = 4;
    private static final int MIN_FUNCTIONS = 3;
    private static final ThresholdConfig THRESHOLDS = ThresholdConfig.of(5, 10, 20, 35);

    private static final Pattern IF = Pattern.compile("^(?:}\\s*)?(?:else\\s+if|elif|elsif|if|unless)\\b");
    private static final Pattern FOR = Pattern.compile("^for(?:each)?\\b");
    private static final Pattern WHILE = Pattern.compile("^while\\b");
    private static final Pattern SWITCH = Pattern.compile("^(?:switch|match)\\b");
    private static final Pattern CASE = Pattern.compile("^(?:case|when)\\s+");
    private static final Pattern RETURN = Pattern.compile("^return\\b");
    private static final Pattern DECLARATION = Pattern.compile("^(?:const|let|var)\\s+\\w");
    private static final Pattern COMPARISON = Pattern.compile("[=!<>]=");
    private static final Pattern COMMENT = Pattern.compile("^(?://|#|/\\*|\\*|--)");

    public CodeDuplicationMetric(double weight) {
        super(NAME, MetricCategory.DUPLICATION, weight);
    }

    @Override
    public MetricResult calculate(ParseResult parseResult) {
        List<FunctionInfo> functions = parseResult.functions();
        if (functions.size() < MIN_FUNCTIONS || !parseResult.hasContent()) {
            return insufficientData(0, "Not enough functions to compare");
        }

        List<String> lines = SourceLines.split(parseResult.content());
        Map<String, List<FunctionInfo>> groups = new LinkedHashMap<>();
        for (FunctionInfo function : functions) {
            String signature = signatureOf(function, lines);
            if (signature.length() >= MIN_SIGNATURE_LENGTH) {
                groups.computeIfAbsent(signature, key -> new ArrayList<>()).add(function);
            }
        }

        int duplicates = 0;
        List<MetricLocation> locations = new ArrayList<>();
        for (List<FunctionInfo> group : groups.values()) {
            if (group.size() < 2) {
                continue;
            }
            duplicates += group.size() - 1;
            String names = group.stream().map(FunctionInfo::name).collect(Collectors.joining(", "));
            locations.add(locationOf(parseResult, group.get(0), "Similar control flow: " + names));
        }

        double percent = duplicates * 100.0 / functions.size();
        return result(percent, ScoringCurve.PERCENTAGE.score(percent, THRESHOLDS),
            severityFor(percent, THRESHOLDS),
            format("%.1f%% duplicated (%d of %d functions)", percent, duplicates, functions.size()),
            locations);
    }

    /**
     * Builds the control-flow signature of a function from its source lines.
     */
    static String signatureOf(FunctionInfo function, List<String> lines) {
        StringBuilder signature = new StringBuilder();
        int end = Math.min(function.endLine(), lines.size());
        for (int i = function.startLine() - 1; i < end; i++) {
            String trimmed = lines.get(i).trim();
            if (trimmed.isEmpty() || COMMENT.matcher(trimmed).find()) {
                continue;
            }
            char letter = letterFor(trimmed);
            if (letter != 0) {
                signature.append(letter);
            }
        }
        return signature.toString();
    }

    private static char letterFor(String trimmed) {
        if (IF.matcher(trimmed).find()) {
            return 'I';
        }
        if (FOR.matcher(trimmed).find()) {
            return 'F';
        }
        if (WHILE.matcher(trimmed).find()) {
            return 'W';
        }
        if (SWITCH.matcher(trimmed).find()) {
            return 'S';
        }
        if (CASE.matcher(trimmed).find()) {
            return 'C';
        }
        if (RETURN.matcher(trimmed).find()) {
            return 'R';
        }
        if (DECLARATION.matcher(trimmed).find()
            || (trimmed.indexOf('=') >= 0 && !COMPARISON.matcher(trimmed).find())) {
            return 'A';
        }
        return 0;
    }
}
