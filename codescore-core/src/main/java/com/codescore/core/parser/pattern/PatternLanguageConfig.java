package com.codescore.core.parser.pattern;

import com.codescore.core.model.Language;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Regex extraction rules for one language.
 *
 * <p>Function and class patterns are matched against trimmed lines and capture the declared
 * name in group 1. Method and field patterns are matched against raw lines, so they usually
 * start with {@code ^\s+}.
 *
 * @param language language the rules apply to
 * @param functionPatterns function declaration patterns
 * @param classPatterns class, struct or module declaration patterns
 * @param singleLineComment matches a trimmed single-line comment
 * @param blockCommentStart opens a block comment, or {@code null} when the language has none
 * @param blockCommentEnd closes a block comment, or {@code null}
 * @param branchKeywords keywords and operators that add a branch
 * @param loopKeywords keywords that add a loop
 * @param blockStyle how block extent is determined
 * @param blockTerminator closing keyword line for {@link BlockStyle#INDENT} languages such as
 *                        Ruby's {@code end}, or {@code null}
 * @param methodPatterns patterns for methods inside a class body; empty means use
 *                       {@code functionPatterns} on the trimmed line
 * @param fieldPatterns patterns for fields inside a class body
 *
 * @since 1.0.0
 */
public record PatternLanguageConfig(
    Language language,
    List<Pattern> functionPatterns,
    List<Pattern> classPatterns,
    Pattern singleLineComment,
    Pattern blockCommentStart,
    Pattern blockCommentEnd,
    List<String> branchKeywords,
    List<String> loopKeywords,
    BlockStyle blockStyle,
    Pattern blockTerminator,
    List<Pattern> methodPatterns,
    List<Pattern> fieldPatterns
) {
    /**
     * How a function or class body is delimited.
     */
    public enum BlockStyle {
        /** Curly braces; extent follows brace depth. */
        BRACE,
        /** Significant indentation, optionally closed by a terminator keyword line. */
        INDENT
    }

    public PatternLanguageConfig {
        Objects.requireNonNull(language, "language must not be null");
        Objects.requireNonNull(singleLineComment, "singleLineComment must not be null");
        Objects.requireNonNull(blockStyle, "blockStyle must not be null");
        if ((blockCommentStart == null) != (blockCommentEnd == null)) {
            throw new IllegalArgumentException(
                "Block comment delimiters must be given together for " + language.id());
        }
        functionPatterns = functionPatterns == null ? List.of() : List.copyOf(functionPatterns);
        classPatterns = classPatterns == null ? List.of() : List.copyOf(classPatterns);
        branchKeywords = branchKeywords == null ? List.of() : List.copyOf(branchKeywords);
        loopKeywords = loopKeywords == null ? List.of() : List.copyOf(loopKeywords);
        methodPatterns = methodPatterns == null ? List.of() : List.copyOf(methodPatterns);
        fieldPatterns = fieldPatterns == null ? List.of() : List.copyOf(fieldPatterns);
    }

    public boolean hasBlockComments() {
        return blockCommentStart != null;
    }

    public static Builder builder(Language language) {
        return new Builder(language);
    }

    /**
     * Builder for the literal tables in {@link PatternTables}.
     */
    public static final class Builder {
        private final Language language;
        private List<Pattern> functions = List.of();
        private List<Pattern> classes = List.of();
        private Pattern single;
        private Pattern blockStart;
        private Pattern blockEnd;
        private List<String> branches = List.of();
        private List<String> loops = List.of();
        private BlockStyle style = BlockStyle.BRACE;
        private Pattern terminator;
        private List<Pattern> methods = List.of();
        private List<Pattern> fields = List.of();

        private Builder(Language language) {
            this.language = language;
        }

        public Builder functions(String... regexes) {
            this.functions = compile(regexes);
            return this;
        }

        public Builder classes(String... regexes) {
            this.classes = compile(regexes);
            return this;
        }

        public Builder comments(String singleLine, String blockStartRegex, String blockEndRegex) {
            this.single = Pattern.compile(singleLine);
            this.blockStart = blockStartRegex == null ? null : Pattern.compile(blockStartRegex);
            this.blockEnd = blockEndRegex == null ? null : Pattern.compile(blockEndRegex);
            return this;
        }

        public Builder branches(String... keywords) {
            this.branches = List.of(keywords);
            return this;
        }

        public Builder loops(String... keywords) {
            this.loops = List.of(keywords);
            return this;
        }

        public Builder indentation(String terminatorRegex) {
            this.style = BlockStyle.INDENT;
            this.terminator = terminatorRegex == null ? null : Pattern.compile(terminatorRegex);
            return this;
        }

        public Builder methods(String... regexes) {
            this.methods = compile(regexes);
            return this;
        }

        public Builder fields(String... regexes) {
            this.fields = compile(regexes);
            return this;
        }

        public PatternLanguageConfig build() {
            return new PatternLanguageConfig(language, functions, classes, single, blockStart, blockEnd,
                branches, loops, style, terminator, methods, fields);
        }

        private static List<Pattern> compile(String... regexes) {
            return Arrays.stream(regexes).map(Pattern::compile).toList();
        }
    }
}
