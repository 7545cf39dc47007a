package com.codescore.core.parser;

import com.codescore.core.model.Language;

/**
 * Thrown when the AST tier cannot be initialized for a language, for example because the
 * grammar is not on the classpath or its native library fails to load.
 *
 * @since 1.0.0
 */
public class GrammarUnavailableException extends RuntimeException {

    private final Language language;

    public GrammarUnavailableException(Language language, String message) {
        super(message);
        this.language = language;
    }

    public GrammarUnavailableException(Language language, String message, Throwable cause) {
        super(message, cause);
        this.language = language;
    }

    public Language getLanguage() {
        return language;
    }
}
