package com.codescore.core.parser.ast;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Optional;

/**
 * Read-only view of one node in a concrete syntax tree.
 *
 * <p>The AST parser only depends on this view, so traversal rules can be exercised against
 * hand-built trees without loading a native grammar.
 *
 * @since 1.0.0
 */
public interface SyntaxNode {

    /** Grammar node kind, e.g. {@code if_statement}. */
    String kind();

    /** Source text covered by the node. */
    String text();

    /** 0-based first row. */
    int startRow();

    /** 0-based last row. */
    int endRow();

    /** Named children in source order. */
    List<SyntaxNode> namedChildren();

    /** Child stored under a grammar field name (named or anonymous). */
    Optional<SyntaxNode> childByField(String fieldName);

    Optional<SyntaxNode> parent();

    Optional<SyntaxNode> previousNamedSibling();

    /**
     * Finds the first named descendant of the given kind in pre-order, excluding this node.
     *
     * @param kind node kind to search for
     * @return first match, if any
     */
    default Optional<SyntaxNode> firstDescendant(String kind) {
        Deque<SyntaxNode> stack = new ArrayDeque<>();
        List<SyntaxNode> children = namedChildren();
        for (int i = children.size() - 1; i >= 0; i--) {
            stack.push(children.get(i));
        }
        while (!stack.isEmpty()) {
            SyntaxNode node = stack.pop();
            if (kind.equals(node.kind())) {
                return Optional.of(node);
            }
            List<SyntaxNode> nested = node.namedChildren();
            for (int i = nested.size() - 1; i >= 0; i--) {
                stack.push(nested.get(i));
            }
        }
        return Optional.empty();
    }
}
