package com.codescore.core.model;

/**
 * The extraction strategy that produced a {@link ParseResult}, in decreasing order of precision.
 *
 * @since 1.0.0
 */
public enum ParserTier {

    /** Concrete syntax tree traversal driven by a per-language grammar configuration. */
    AST,

    /** Per-language regular expressions with brace or indentation tracking. */
    PATTERN,

    /** Cross-language keyword patterns; the terminal fallback. */
    GENERIC
}
