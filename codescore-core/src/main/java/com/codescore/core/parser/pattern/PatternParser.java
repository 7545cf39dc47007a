package com.codescore.core.parser.pattern;

import com.codescore.core.model.ClassInfo;
import com.codescore.core.model.FunctionInfo;
import com.codescore.core.model.Language;
import com.codescore.core.model.ParseResult;
import com.codescore.core.model.ParserTier;
import com.codescore.core.parser.SourceParser;
import com.codescore.core.parser.base.SourceLines;
import com.codescore.core.parser.pattern.PatternLanguageConfig.BlockStyle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pattern-tier parser: regex and line-state extraction driven by a {@link PatternLanguageConfig}.
 *
 * <p>Used for a language when its AST parser cannot initialize or fails on a file. The result
 * has the same shape as an AST parse but is approximate:
 * <ul>
 *   <li><b>Brace mode:</b> a function opens on a declaration match and closes when the brace
 *       depth returns to the depth recorded at the declaration. A declaration with no body
 *       that ends in {@code ;} is a one-line function.</li>
 *   <li><b>Indent mode:</b> a function spans the following lines indented deeper than the
 *       declaration, plus an optional terminator line such as Ruby's {@code end}. Nesting is
 *       {@code (indent - defIndent - unit) / unit} where the unit is the first body line's
 *       indentation step.</li>
 *   <li>Complexity is 1 plus keyword and operator matches on body lines.</li>
 *   <li>Lines belonging to a nested function never count toward the enclosing function.</li>
 * </ul>
 *
 * <p>This parser never throws on malformed input; unrecognized code yields fewer functions.
 *
 * @since 1.0.0
 */
public class PatternParser implements SourceParser {

    private static final Logger log = LoggerFactory.getLogger(PatternParser.class);

    // Control keywords that look like "name(...) {" to the declaration patterns
    private static final Set<String> RESERVED_NAMES = Set.of(
        "if", "else", "elif", "for", "foreach", "while", "switch", "catch", "return", "new",
        "do", "try", "sizeof", "using", "lock", "fixed", "when", "match", "guard", "until");

    private static final List<String> DOC_PREFIXES = List.of("/**", "///", "\"\"\"", "'''", "--[");
    private static final Pattern ATTRIBUTE_LINE = Pattern.compile("^(?:@\\w|#\\[|\\[\\w)");
    private static final String SYMBOL_CLASS = "[?\\&|.:=>!<]";

    private static final Map<PatternLanguageConfig, List<Pattern>> KEYWORD_CACHE = new ConcurrentHashMap<>();

    private final PatternLanguageConfig config;
    private final List<Pattern> complexityPatterns;

    public PatternParser(PatternLanguageConfig config) {
        this.config = config;
        this.complexityPatterns = KEYWORD_CACHE.computeIfAbsent(config, PatternParser::compileKeywords);
    }

    /**
     * Creates a parser from the built-in table for a language.
     *
     * @throws IllegalArgumentException if the language has no pattern table
     */
    public static PatternParser forLanguage(Language language) {
        return PatternTables.find(language)
            .map(PatternParser::new)
            .orElseThrow(() -> new IllegalArgumentException("No pattern table for language: " + language.id()));
    }

    @Override
    public ParserTier tier() {
        return ParserTier.PATTERN;
    }

    public Language language() {
        return config.language();
    }

    @Override
    public ParseResult parse(String filePath, String content) {
        List<String> lines = SourceLines.split(content);
        LineKinds kinds = classifyLines(lines);

        List<FunctionInfo> functions = config.blockStyle() == BlockStyle.INDENT
            ? extractIndentFunctions(lines, kinds)
            : extractBraceFunctions(lines, kinds);
        List<ClassInfo> classes = config.blockStyle() == BlockStyle.INDENT
            ? extractIndentClasses(lines, kinds)
            : extractBraceClasses(lines, kinds);

        List<String> codeLines = new ArrayList<>();
        for (int i = 0; i < lines.size(); i++) {
            if (!kinds.comment()[i]) {
                codeLines.add(lines.get(i));
            }
        }

        log.debug("Pattern parse of {}: {} functions, {} classes", filePath, functions.size(), classes.size());
        return new ParseResult(
            filePath,
            config.language(),
            lines.size(),
            lines.size() - kinds.commentCount() - kinds.blankCount(),
            kinds.commentCount(),
            kinds.blankCount(),
            functions,
            classes,
            SourceLines.extractImports(codeLines),
            List.of(),
            null,
            ParserTier.PATTERN
        );
    }

    // ==================== Line classification ====================

    private record LineKinds(boolean[] comment, int commentCount, int blankCount) {
        boolean skip(List<String> lines, int index) {
            return comment[index] || lines.get(index).trim().isEmpty();
        }
    }

    private LineKinds classifyLines(List<String> lines) {
        boolean[] comment = new boolean[lines.size()];
        int comments = 0;
        int blanks = 0;
        boolean inBlock = false;

        for (int i = 0; i < lines.size(); i++) {
            String trimmed = lines.get(i).trim();
            if (trimmed.isEmpty()) {
                blanks++;
                continue;
            }
            if (inBlock) {
                comment[i] = true;
                comments++;
                inBlock = !config.blockCommentEnd().matcher(trimmed).find();
                continue;
            }
            if (config.hasBlockComments()) {
                Matcher start = config.blockCommentStart().matcher(trimmed);
                if (start.find()) {
                    comment[i] = true;
                    comments++;
                    inBlock = !config.blockCommentEnd().matcher(trimmed.substring(start.end())).find();
                    continue;
                }
            }
            if (config.singleLineComment().matcher(trimmed).find()) {
                comment[i] = true;
                comments++;
            }
        }
        return new LineKinds(comment, comments, blanks);
    }

    // ==================== Brace mode ====================

    private static final class PendingFunction {
        final String name;
        final int startIndex;
        final int parameterCount;
        final boolean hasDocstring;
        final int baseDepth;
        int complexity = 1;
        int nesting;
        int lastIndex;
        boolean opened;
        int nestedBase = -1;

        PendingFunction(String name, int startIndex, int parameterCount, boolean hasDocstring, int baseDepth) {
            this.name = name;
            this.startIndex = startIndex;
            this.parameterCount = parameterCount;
            this.hasDocstring = hasDocstring;
            this.baseDepth = baseDepth;
            this.lastIndex = startIndex;
        }

        FunctionInfo finish(int endIndex) {
            return FunctionInfo.of(name, startIndex + 1, endIndex + 1, complexity, parameterCount,
                Math.max(0, nesting), hasDocstring);
        }
    }

    private List<FunctionInfo> extractBraceFunctions(List<String> lines, LineKinds kinds) {
        List<FunctionInfo> functions = new ArrayList<>();
        PendingFunction current = null;
        int depth = 0;

        for (int i = 0; i < lines.size(); i++) {
            if (kinds.skip(lines, i)) {
                continue;
            }
            String line = lines.get(i);
            String trimmed = line.trim();
            int open = SourceLines.count(line, '{');
            int close = SourceLines.count(line, '}');
            int depthBefore = depth;
            depth = Math.max(0, depth + open - close);

            if (current == null) {
                String name = matchName(config.functionPatterns(), trimmed);
                if (name == null) {
                    continue;
                }
                current = new PendingFunction(name, i, SourceLines.countParameters(trimmed),
                    hasDocstring(lines, kinds, i), depthBefore);
            } else if (current.nestedBase < 0 && open > 0 && matchName(config.functionPatterns(), trimmed) != null) {
                current.nestedBase = depthBefore;
            }
            current.lastIndex = i;

            if (current.nestedBase >= 0) {
                if (depth <= current.nestedBase) {
                    current.nestedBase = -1;
                }
            } else {
                current.complexity += lineComplexity(trimmed);
                current.nesting = Math.max(current.nesting, depth - current.baseDepth - 1);
            }

            if (open > 0) {
                current.opened = true;
            }
            if (current.opened && close > 0 && depth <= current.baseDepth) {
                functions.add(current.finish(i));
                current = null;
            } else if (!current.opened && trimmed.endsWith(";")) {
                functions.add(current.finish(i));
                current = null;
            }
        }

        if (current != null) {
            functions.add(current.finish(current.opened ? current.lastIndex : current.startIndex));
        }
        return functions;
    }

    private List<ClassInfo> extractBraceClasses(List<String> lines, LineKinds kinds) {
        List<ClassInfo> classes = new ArrayList<>();
        for (int i = 0; i < lines.size(); i++) {
            if (kinds.skip(lines, i)) {
                continue;
            }
            String name = matchName(config.classPatterns(), lines.get(i).trim());
            if (name == null) {
                continue;
            }
            int endLine = SourceLines.findBraceBlockEnd(lines, i);
            if (endLine < 0) {
                endLine = i + 1;
            }

            int[] members = new int[2];
            int depth = 0;
            for (int j = i; j < endLine && j < lines.size(); j++) {
                String raw = lines.get(j);
                // Only direct members: lines that start at depth 1 inside the class body
                if (j > i && depth == 1 && !kinds.skip(lines, j)) {
                    classifyMember(raw, members);
                }
                depth = Math.max(0, depth + SourceLines.count(raw, '{') - SourceLines.count(raw, '}'));
            }
            classes.add(new ClassInfo(name, i + 1, endLine, members[0], members[1]));
        }
        return classes;
    }

    // ==================== Indent mode ====================

    private List<FunctionInfo> extractIndentFunctions(List<String> lines, LineKinds kinds) {
        List<FunctionInfo> functions = new ArrayList<>();
        for (int i = 0; i < lines.size(); i++) {
            if (kinds.skip(lines, i)) {
                continue;
            }
            String trimmed = lines.get(i).trim();
            String name = matchName(config.functionPatterns(), trimmed);
            if (name == null) {
                continue;
            }

            int defIndent = SourceLines.indentOf(lines.get(i));
            int endIndex = i;
            int unit = -1;
            int complexity = 1;
            int nesting = 0;
            int nestedIndent = -1;

            for (int j = i + 1; j < lines.size(); j++) {
                String body = lines.get(j);
                String bodyTrimmed = body.trim();
                if (bodyTrimmed.isEmpty()) {
                    continue;
                }
                int indent = SourceLines.indentOf(body);
                if (indent <= defIndent) {
                    if (indent == defIndent && isTerminator(bodyTrimmed)) {
                        endIndex = j;
                    }
                    break;
                }
                endIndex = j;
                if (kinds.comment()[j]) {
                    continue;
                }
                if (unit < 0) {
                    unit = indent - defIndent;
                }
                if (nestedIndent >= 0) {
                    if (indent > nestedIndent || (indent == nestedIndent && isTerminator(bodyTrimmed))) {
                        continue;
                    }
                    nestedIndent = -1;
                }
                if (matchName(config.functionPatterns(), bodyTrimmed) != null) {
                    nestedIndent = indent;
                    continue;
                }
                complexity += lineComplexity(bodyTrimmed);
                nesting = Math.max(nesting, (indent - defIndent - unit) / unit);
            }

            functions.add(FunctionInfo.of(name, i + 1, endIndex + 1, complexity,
                SourceLines.countParameters(trimmed), nesting, hasDocstring(lines, kinds, i)));
        }
        return functions;
    }

    private List<ClassInfo> extractIndentClasses(List<String> lines, LineKinds kinds) {
        List<ClassInfo> classes = new ArrayList<>();
        for (int i = 0; i < lines.size(); i++) {
            if (kinds.skip(lines, i)) {
                continue;
            }
            String name = matchName(config.classPatterns(), lines.get(i).trim());
            if (name == null) {
                continue;
            }

            int classIndent = SourceLines.indentOf(lines.get(i));
            int memberIndent = -1;
            int endIndex = i;
            int methods = 0;
            int fields = 0;

            for (int j = i + 1; j < lines.size(); j++) {
                String body = lines.get(j);
                String bodyTrimmed = body.trim();
                if (bodyTrimmed.isEmpty()) {
                    continue;
                }
                int indent = SourceLines.indentOf(body);
                if (indent <= classIndent) {
                    if (indent == classIndent && isTerminator(bodyTrimmed)) {
                        endIndex = j;
                    }
                    break;
                }
                endIndex = j;
                if (kinds.comment()[j]) {
                    continue;
                }
                if (memberIndent < 0) {
                    memberIndent = indent;
                }
                if (indent == memberIndent && isMethod(body)) {
                    methods++;
                } else if (SourceLines.anyFind(config.fieldPatterns(), body)) {
                    fields++;
                }
            }
            classes.add(new ClassInfo(name, i + 1, endIndex + 1, methods, fields));
        }
        return classes;
    }

    private boolean isTerminator(String trimmed) {
        return config.blockTerminator() != null && config.blockTerminator().matcher(trimmed).find();
    }

    // ==================== Shared helpers ====================

    private void classifyMember(String raw, int[] members) {
        if (isMethod(raw)) {
            members[0]++;
        } else if (SourceLines.anyFind(config.fieldPatterns(), raw)) {
            members[1]++;
        }
    }

    private boolean isMethod(String raw) {
        if (config.methodPatterns().isEmpty()) {
            return matchName(config.functionPatterns(), raw.trim()) != null;
        }
        return matchName(config.methodPatterns(), raw) != null;
    }

    /**
     * Returns the first captured name from the first matching pattern, skipping control keywords.
     */
    static String matchName(List<Pattern> patterns, String text) {
        for (Pattern pattern : patterns) {
            Matcher matcher = pattern.matcher(text);
            if (!matcher.find()) {
                continue;
            }
            for (int g = 1; g <= matcher.groupCount(); g++) {
                String name = matcher.group(g);
                if (name != null && !name.isEmpty() && !RESERVED_NAMES.contains(name)) {
                    return name;
                }
            }
        }
        return null;
    }

    private boolean hasDocstring(List<String> lines, LineKinds kinds, int index) {
        int previous = index - 1;
        while (previous >= 0 && ATTRIBUTE_LINE.matcher(lines.get(previous).trim()).find()) {
            previous--;
        }
        if (previous >= 0) {
            String prev = lines.get(previous).trim();
            if (!prev.isEmpty() && (kinds.comment()[previous]
                || config.singleLineComment().matcher(prev).find()
                || DOC_PREFIXES.stream().anyMatch(prev::startsWith)
                || prev.endsWith("*/"))) {
                return true;
            }
        }
        if (config.blockStyle() == BlockStyle.INDENT && index + 1 < lines.size()) {
            String next = lines.get(index + 1).trim();
            return next.startsWith("\"\"\"") || next.startsWith("'''");
        }
        return false;
    }

    int lineComplexity(String trimmed) {
        int count = 0;
        for (Pattern pattern : complexityPatterns) {
            Matcher matcher = pattern.matcher(trimmed);
            while (matcher.find()) {
                count++;
            }
        }
        return count;
    }

    private static List<Pattern> compileKeywords(PatternLanguageConfig config) {
        List<Pattern> patterns = new ArrayList<>();
        for (String keyword : config.branchKeywords()) {
            patterns.add(keywordPattern(keyword));
        }
        for (String keyword : config.loopKeywords()) {
            patterns.add(keywordPattern(keyword));
        }
        return List.copyOf(patterns);
    }

    /**
     * Word keywords match on word boundaries. The ternary {@code ?} must be surrounded by
     * whitespace. Other operators must not be part of a longer operator.
     */
    static Pattern keywordPattern(String keyword) {
        if ("?".equals(keyword)) {
            return Pattern.compile("(?<=\\s)\\?(?=\\s)");
        }
        if (keyword.matches("[\\w ]+")) {
            return Pattern.compile("\\b" + keyword.replace(" ", "\\s+") + "\\b");
        }
        return Pattern.compile("(?<!" + SYMBOL_CLASS + ")" + Pattern.quote(keyword) + "(?!" + SYMBOL_CLASS + ")");
    }
}
