package com.codescore.core.parser.ast;

import org.treesitter.TSNode;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * {@link SyntaxNode} backed by a tree-sitter {@link TSNode}.
 *
 * <p>Text is sliced from the UTF-8 bytes the tree was parsed from, since tree-sitter
 * offsets are byte offsets.
 */
final class TreeSitterNode implements SyntaxNode {

    private final TSNode node;
    private final byte[] source;
    private List<SyntaxNode> namedChildren;

    TreeSitterNode(TSNode node, byte[] source) {
        this.node = node;
        this.source = source;
    }

    @Override
    public String kind() {
        return node.getType();
    }

    @Override
    public String text() {
        int start = Math.max(0, Math.min(node.getStartByte(), source.length));
        int end = Math.max(start, Math.min(node.getEndByte(), source.length));
        return new String(source, start, end - start, StandardCharsets.UTF_8);
    }

    @Override
    public int startRow() {
        return node.getStartPoint().getRow();
    }

    @Override
    public int endRow() {
        return node.getEndPoint().getRow();
    }

    @Override
    public List<SyntaxNode> namedChildren() {
        if (namedChildren == null) {
            int count = node.getNamedChildCount();
            List<SyntaxNode> children = new ArrayList<>(count);
            for (int i = 0; i < count; i++) {
                TSNode child = node.getNamedChild(i);
                if (child != null && !child.isNull()) {
                    children.add(new TreeSitterNode(child, source));
                }
            }
            namedChildren = List.copyOf(children);
        }
        return namedChildren;
    }

    @Override
    public Optional<SyntaxNode> childByField(String fieldName) {
        return wrap(node.getChildByFieldName(fieldName));
    }

    @Override
    public Optional<SyntaxNode> parent() {
        return wrap(node.getParent());
    }

    @Override
    public Optional<SyntaxNode> previousNamedSibling() {
        return wrap(node.getPrevNamedSibling());
    }

    private Optional<SyntaxNode> wrap(TSNode other) {
        if (other == null || other.isNull()) {
            return Optional.empty();
        }
        return Optional.of(new TreeSitterNode(other, source));
    }

    @Override
    public String toString() {
        return kind() + "[" + (startRow() + 1) + "-" + (endRow() + 1) + "]";
    }
}
