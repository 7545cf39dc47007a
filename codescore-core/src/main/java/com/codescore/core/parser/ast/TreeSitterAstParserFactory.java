package com.codescore.core.parser.ast;

import com.codescore.core.model.Language;
import com.codescore.core.parser.GrammarUnavailableException;
import com.codescore.core.parser.SourceParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.treesitter.TSLanguage;

/**
 * Default {@link AstParserFactory}: loads the tree-sitter grammar and verifies it with a
 * smoke parse of an empty document.
 *
 * @since 1.0.0
 */
public class TreeSitterAstParserFactory implements AstParserFactory {

    private static final Logger log = LoggerFactory.getLogger(TreeSitterAstParserFactory.class);

    @Override
    public SourceParser create(Language language, LanguageGrammarConfig config) {
        TSLanguage grammar = TreeSitterGrammars.load(language);
        AstParser parser = new AstParser(language, config, new TreeSitterTreeBuilder(grammar));
        try {
            parser.parse("<smoke-test>", "");
        } catch (RuntimeException | LinkageError e) {
            throw new GrammarUnavailableException(language,
                language.displayName() + " AST parser failed its smoke parse", e);
        }
        log.info("{} AST parser initialized successfully", language.displayName());
        return parser;
    }
}
