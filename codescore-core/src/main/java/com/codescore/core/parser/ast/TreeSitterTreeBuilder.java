package com.codescore.core.parser.ast;

import org.treesitter.TSLanguage;
import org.treesitter.TSParser;
import org.treesitter.TSTree;

import java.nio.charset.StandardCharsets;

/**
 * {@link SyntaxTreeBuilder} backed by the tree-sitter Java binding.
 *
 * <p>{@link TSParser} instances are not thread-safe, so each worker thread keeps its own.
 */
final class TreeSitterTreeBuilder implements SyntaxTreeBuilder {

    private final TSLanguage grammar;
    private final ThreadLocal<TSParser> parsers;

    TreeSitterTreeBuilder(TSLanguage grammar) {
        this.grammar = grammar;
        this.parsers = ThreadLocal.withInitial(this::newParser);
    }

    private TSParser newParser() {
        TSParser parser = new TSParser();
        if (!parser.setLanguage(grammar)) {
            throw new IllegalStateException("Grammar version incompatible with tree-sitter runtime");
        }
        return parser;
    }

    @Override
    public SyntaxNode build(String content) {
        TSTree tree = parsers.get().parseString(null, content);
        if (tree == null) {
            throw new IllegalStateException("tree-sitter returned no tree");
        }
        return new TreeSitterNode(tree.getRootNode(), content.getBytes(StandardCharsets.UTF_8));
    }
}
