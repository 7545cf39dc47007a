package com.codescore.core.model;

import java.util.Objects;

/**
 * One function, method, or anonymous function bound to a name.
 *
 * <p>Line numbers are 1-based and inclusive. {@code complexity} starts at 1 (the base path)
 * and grows with each branch, loop, case label and logical operator in the body.
 * {@code nestingDepth} never includes constructs that belong to a lexically nested function.
 *
 * @param name function name
 * @param startLine first line of the declaration (1-based)
 * @param endLine last line of the declaration (1-based, inclusive)
 * @param lineCount number of lines spanned
 * @param complexity cyclomatic complexity, at least 1
 * @param parameterCount number of declared parameters
 * @param nestingDepth maximum depth of nesting constructs inside the body
 * @param hasDocstring whether a doc comment or docstring is attached
 *
 * @since 1.0.0
 */
public record FunctionInfo(
    String name,
    int startLine,
    int endLine,
    int lineCount,
    int complexity,
    int parameterCount,
    int nestingDepth,
    boolean hasDocstring
) {
    /**
     * Compact constructor with validation.
     */
    public FunctionInfo {
        Objects.requireNonNull(name, "name must not be null");
        if (startLine < 1) {
            throw new IllegalArgumentException("startLine must be >= 1: " + startLine);
        }
        if (endLine < startLine) {
            throw new IllegalArgumentException("endLine " + endLine + " precedes startLine " + startLine);
        }
        if (complexity < 1) {
            complexity = 1;
        }
        if (parameterCount < 0) {
            parameterCount = 0;
        }
        if (nestingDepth < 0) {
            nestingDepth = 0;
        }
    }

    /**
     * Creates a function spanning {@code startLine..endLine} with the line count derived from the span.
     */
    public static FunctionInfo of(String name, int startLine, int endLine, int complexity,
                                  int parameterCount, int nestingDepth, boolean hasDocstring) {
        return new FunctionInfo(name, startLine, endLine, endLine - startLine + 1,
            complexity, parameterCount, nestingDepth, hasDocstring);
    }
}
