package com.codescore.core.parser.generic;

import com.codescore.core.model.ClassInfo;
import com.codescore.core.model.FunctionInfo;
import com.codescore.core.model.Language;
import com.codescore.core.model.ParseResult;
import com.codescore.core.model.ParserTier;
import com.codescore.core.parser.SourceParser;
import com.codescore.core.parser.base.SourceLines;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Last-resort parser for languages with no grammar or pattern table.
 *
 * <p>Recognizes common declaration keywords ({@code function}, {@code def}, {@code fn},
 * {@code func}, {@code class}, {@code struct}, {@code enum}) and finds block extent by brace
 * counting, falling back to indentation when a declaration opens no brace. Complexity is always
 * 1 and nesting 0; this tier reports structure only.
 *
 * @since 1.0.0
 */
public class GenericParser implements SourceParser {

    private static final List<Pattern> FUNCTION_PATTERNS = List.of(
        Pattern.compile("^(?:export\\s+)?(?:async\\s+)?function\\s+(\\w+)"),
        Pattern.compile("^(?:pub\\s+)?(?:async\\s+)?fn\\s+(\\w+)"),
        Pattern.compile("^(?:async\\s+)?def\\s+(\\w+)"),
        Pattern.compile("^func\\s+(?:\\([^)]+\\)\\s+)?(\\w+)"),
        Pattern.compile("^(?:public|private|protected)?\\s*(?:static\\s+)?(?:\\w+\\s+)+(\\w+)\\s*\\([^)]*\\)\\s*\\{"),
        Pattern.compile("^(?:local\\s+)?function\\s+(\\w+)")
    );

    private static final List<Pattern> CLASS_PATTERNS = List.of(
        Pattern.compile("^(?:export\\s+)?(?:abstract\\s+)?class\\s+(\\w+)"),
        Pattern.compile("^(?:pub\\s+)?struct\\s+(\\w+)"),
        Pattern.compile("^type\\s+(\\w+)\\s+struct"),
        Pattern.compile("^(?:pub\\s+)?enum\\s+(\\w+)")
    );

    private static final List<String> LINE_COMMENT_PREFIXES = List.of("//", "#", "--");

    private final Language language;

    public GenericParser(Language language) {
        this.language = language == null ? Language.UNKNOWN : language;
    }

    @Override
    public ParserTier tier() {
        return ParserTier.GENERIC;
    }

    @Override
    public ParseResult parse(String filePath, String content) {
        List<String> lines = SourceLines.split(content);
        boolean[] comment = new boolean[lines.size()];
        int comments = 0;
        int blanks = 0;
        boolean inBlock = false;

        for (int i = 0; i < lines.size(); i++) {
            String trimmed = lines.get(i).trim();
            if (trimmed.isEmpty()) {
                blanks++;
            } else if (inBlock) {
                comment[i] = true;
                inBlock = !trimmed.contains("*/");
            } else if (trimmed.startsWith("/*")) {
                comment[i] = true;
                inBlock = !trimmed.substring(2).contains("*/");
            } else if (LINE_COMMENT_PREFIXES.stream().anyMatch(trimmed::startsWith)) {
                comment[i] = true;
            }
            if (comment[i]) {
                comments++;
            }
        }

        List<FunctionInfo> functions = new ArrayList<>();
        List<ClassInfo> classes = new ArrayList<>();
        for (int i = 0; i < lines.size(); i++) {
            String trimmed = lines.get(i).trim();
            if (trimmed.isEmpty() || comment[i]) {
                continue;
            }
            String functionName = SourceLines.firstMatch(FUNCTION_PATTERNS, trimmed);
            if (functionName != null) {
                int end = findBlockEnd(lines, i);
                functions.add(FunctionInfo.of(functionName, i + 1, end, 1,
                    SourceLines.countParameters(trimmed), 0, false));
                continue;
            }
            String className = SourceLines.firstMatch(CLASS_PATTERNS, trimmed);
            if (className != null) {
                classes.add(new ClassInfo(className, i + 1, findBlockEnd(lines, i), 0, 0));
            }
        }

        return new ParseResult(
            filePath,
            language,
            lines.size(),
            lines.size() - comments - blanks,
            comments,
            blanks,
            functions,
            classes,
            SourceLines.extractImports(lines),
            List.of(),
            null,
            ParserTier.GENERIC
        );
    }

    /**
     * Returns the 1-based last line of the block declared at {@code startIndex}.
     */
    static int findBlockEnd(List<String> lines, int startIndex) {
        int braceEnd = SourceLines.findBraceBlockEnd(lines, startIndex);
        if (braceEnd > 0) {
            return braceEnd;
        }
        int baseIndent = SourceLines.indentOf(lines.get(startIndex));
        int last = startIndex;
        for (int i = startIndex + 1; i < lines.size(); i++) {
            String line = lines.get(i);
            if (line.trim().isEmpty()) {
                continue;
            }
            if (SourceLines.indentOf(line) <= baseIndent) {
                break;
            }
            last = i;
        }
        return last + 1;
    }
}
