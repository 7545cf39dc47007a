package com.codescore.core.parser.ast;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * In-memory {@link SyntaxNode} for exercising tree traversal without a native grammar.
 */
final class FakeSyntaxNode implements SyntaxNode {

    private final String kind;
    private final String text;
    private final int startRow;
    private final int endRow;
    private final List<SyntaxNode> children = new ArrayList<>();
    private final Map<String, SyntaxNode> fields = new HashMap<>();
    private FakeSyntaxNode parent;

    private FakeSyntaxNode(String kind, String text, int startRow, int endRow) {
        this.kind = kind;
        this.text = text;
        this.startRow = startRow;
        this.endRow = endRow;
    }

    static FakeSyntaxNode node(String kind, int startRow, int endRow) {
        return new FakeSyntaxNode(kind, "", startRow, endRow);
    }

    static FakeSyntaxNode leaf(String kind, String text, int row) {
        return new FakeSyntaxNode(kind, text, row, row);
    }

    FakeSyntaxNode child(FakeSyntaxNode child) {
        child.parent = this;
        children.add(child);
        return this;
    }

    FakeSyntaxNode field(String name, FakeSyntaxNode child) {
        fields.put(name, child);
        return child(child);
    }

    @Override
    public String kind() {
        return kind;
    }

    @Override
    public String text() {
        return text;
    }

    @Override
    public int startRow() {
        return startRow;
    }

    @Override
    public int endRow() {
        return endRow;
    }

    @Override
    public List<SyntaxNode> namedChildren() {
        return children;
    }

    @Override
    public Optional<SyntaxNode> childByField(String fieldName) {
        return Optional.ofNullable(fields.get(fieldName));
    }

    @Override
    public Optional<SyntaxNode> parent() {
        return Optional.ofNullable(parent);
    }

    @Override
    public Optional<SyntaxNode> previousNamedSibling() {
        if (parent == null) {
            return Optional.empty();
        }
        int index = parent.children.indexOf(this);
        return index > 0 ? Optional.of(parent.children.get(index - 1)) : Optional.empty();
    }
}
