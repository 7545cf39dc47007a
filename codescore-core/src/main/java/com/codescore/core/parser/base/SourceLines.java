package com.codescore.core.parser.base;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Line-oriented helpers shared by the pattern and generic parsers.
 *
 * @since 1.0.0
 */
public final class SourceLines {

    private static final Pattern FIRST_PARENTHESES = Pattern.compile("\\(([^)]*)\\)");

    /**
     * Cross-language import statements. Group 1 captures the import target.
     */
    public static final List<Pattern> IMPORT_PATTERNS = List.of(
        Pattern.compile("^import\\s+[\"']([^\"']+)[\"']"),
        Pattern.compile("^import\\s+.*\\s+from\\s+[\"']([^\"']+)[\"']"),
        Pattern.compile("^from\\s+(\\S+)\\s+import"),
        Pattern.compile("^(?:const|let|var)?\\s*\\w*\\s*=?\\s*require\\s*\\(\\s*[\"']([^\"']+)[\"']\\s*\\)"),
        Pattern.compile("^require(?:_relative)?\\s+[\"']([^\"']+)[\"']"),
        Pattern.compile("^#include\\s*[<\"]([^>\"]+)[>\"]"),
        Pattern.compile("^use\\s+([^;\\s]+)"),
        Pattern.compile("^using\\s+([^;\\s]+)"),
        Pattern.compile("^import\\s+([\\w.]+)")
    );

    private SourceLines() {
        // Utility class - no instantiation
    }

    /**
     * Splits content on {@code \n}, keeping trailing empty lines.
     *
     * @param content file text
     * @return lines; never empty (empty content yields one blank line)
     */
    public static List<String> split(String content) {
        return Arrays.asList((content == null ? "" : content).split("\n", -1));
    }

    /**
     * Returns the number of leading whitespace characters.
     */
    public static int indentOf(String line) {
        return line.length() - line.stripLeading().length();
    }

    /**
     * Counts occurrences of a character.
     */
    public static int count(String line, char c) {
        int count = 0;
        for (int i = 0; i < line.length(); i++) {
            if (line.charAt(i) == c) {
                count++;
            }
        }
        return count;
    }

    /**
     * Counts parameters by splitting the first parenthesized group on commas.
     *
     * @param line declaration line
     * @return parameter count; zero for an empty or missing list
     */
    public static int countParameters(String line) {
        Matcher matcher = FIRST_PARENTHESES.matcher(line);
        if (!matcher.find() || matcher.group(1).isBlank()) {
            return 0;
        }
        return matcher.group(1).split(",").length;
    }

    /**
     * Returns group 1 of the first pattern that matches, or {@code null}.
     */
    public static String firstMatch(List<Pattern> patterns, String text) {
        for (Pattern pattern : patterns) {
            Matcher matcher = pattern.matcher(text);
            if (matcher.find() && matcher.groupCount() >= 1 && matcher.group(1) != null) {
                return matcher.group(1);
            }
        }
        return null;
    }

    /**
     * Returns true if any pattern is found in the text.
     */
    public static boolean anyFind(List<Pattern> patterns, String text) {
        for (Pattern pattern : patterns) {
            if (pattern.matcher(text).find()) {
                return true;
            }
        }
        return false;
    }

    /**
     * Extracts import targets from every line using {@link #IMPORT_PATTERNS}.
     */
    public static List<String> extractImports(List<String> lines) {
        List<String> imports = new ArrayList<>();
        for (String line : lines) {
            String target = firstMatch(IMPORT_PATTERNS, line.trim());
            if (target != null && !target.isEmpty()) {
                imports.add(target);
            }
        }
        return imports;
    }

    /**
     * Finds the 1-based end line of a brace-delimited block opening at or after {@code startIndex}.
     *
     * @param lines file lines
     * @param startIndex 0-based index of the declaration line
     * @return 1-based line of the closing brace, or -1 if no brace opens
     */
    public static int findBraceBlockEnd(List<String> lines, int startIndex) {
        int depth = 0;
        boolean started = false;
        for (int i = startIndex; i < lines.size(); i++) {
            String line = lines.get(i);
            int open = count(line, '{');
            int close = count(line, '}');
            if (open > 0) {
                started = true;
            }
            depth += open - close;
            if (started && depth <= 0) {
                return i + 1;
            }
        }
        return started ? lines.size() : -1;
    }
}
