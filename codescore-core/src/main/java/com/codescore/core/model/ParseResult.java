package com.codescore.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.List;
import java.util.Objects;

/**
 * Structural facts extracted from one source file.
 *
 * <p>Created once per file by whichever parser tier serviced it and immutable afterwards.
 * Every metric calculator consumes the same instance.
 *
 * <p><b>Line accounting:</b> {@code codeLines + commentLines + blankLines == totalLines}
 * always holds; the compact constructor rejects results that violate it.
 *
 * <p><b>Raw text:</b> {@code content} is optional. Metrics that scan raw lines (duplication,
 * error handling, structure) fall back to an "insufficient data" or simplified result when it
 * is {@code null}. It is excluded from JSON output.
 *
 * @param filePath path of the analyzed file as supplied by the caller
 * @param language language tag
 * @param totalLines number of lines (content split on {@code \n})
 * @param codeLines lines that are neither blank nor comment
 * @param commentLines lines inside comments
 * @param blankLines whitespace-only lines
 * @param functions functions in source order
 * @param classes classes in source order
 * @param imports import targets in source order
 * @param errors non-fatal parse diagnostics
 * @param content raw file text, or {@code null}
 * @param tier parser tier that produced this result
 *
 * @since 1.0.0
 */
public record ParseResult(
    String filePath,
    Language language,
    int totalLines,
    int codeLines,
    int commentLines,
    int blankLines,
    List<FunctionInfo> functions,
    List<ClassInfo> classes,
    List<String> imports,
    List<String> errors,
    @JsonIgnore String content,
    ParserTier tier
) {
    /**
     * Compact constructor with validation and defaults.
     */
    public ParseResult {
        Objects.requireNonNull(filePath, "filePath must not be null");
        Objects.requireNonNull(tier, "tier must not be null");
        if (language == null) {
            language = Language.UNKNOWN;
        }
        if (totalLines < 0 || codeLines < 0 || commentLines < 0 || blankLines < 0) {
            throw new IllegalArgumentException("Line counts must be non-negative for " + filePath);
        }
        if (codeLines + commentLines + blankLines != totalLines) {
            throw new IllegalArgumentException(String.format(
                "Line counts do not add up for %s: code=%d comment=%d blank=%d total=%d",
                filePath, codeLines, commentLines, blankLines, totalLines));
        }
        functions = functions == null ? List.of() : List.copyOf(functions);
        classes = classes == null ? List.of() : List.copyOf(classes);
        imports = imports == null ? List.of() : List.copyOf(imports);
        errors = errors == null ? List.of() : List.copyOf(errors);
    }

    /**
     * Returns a copy of this result carrying the given raw text.
     *
     * @param text raw file content
     * @return new result with {@code content} set
     */
    public ParseResult withContent(String text) {
        return new ParseResult(filePath, language, totalLines, codeLines, commentLines, blankLines,
            functions, classes, imports, errors, text, tier);
    }

    /**
     * Returns true if raw text is attached.
     */
    public boolean hasContent() {
        return content != null && !content.isEmpty();
    }
}
