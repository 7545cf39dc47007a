package com.codescore.core.parser.ast;

import com.codescore.core.model.Language;
import com.codescore.core.parser.GrammarUnavailableException;
import com.codescore.core.parser.SourceParser;

/**
 * Creates and initializes AST-tier parsers.
 *
 * <p>{@link com.codescore.core.parser.ParserSelector} calls this once per language. A
 * factory either returns a parser that has already completed a smoke parse, or throws.
 *
 * @since 1.0.0
 */
@FunctionalInterface
public interface AstParserFactory {

    /**
     * Creates a ready-to-use AST parser.
     *
     * @param language language to parse
     * @param config grammar configuration for the language
     * @return initialized parser
     * @throws GrammarUnavailableException if the grammar cannot be loaded or initialized
     */
    SourceParser create(Language language, LanguageGrammarConfig config);
}
