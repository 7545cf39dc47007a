package com.codescore.core.parser.ast;

/**
 * Builds a concrete syntax tree for one document.
 *
 * <p>Implementations must be safe for concurrent use.
 *
 * @since 1.0.0
 */
@FunctionalInterface
public interface SyntaxTreeBuilder {

    /**
     * Parses a document and returns its root node.
     *
     * @param content document text
     * @return root node; never {@code null}
     */
    SyntaxNode build(String content);
}
