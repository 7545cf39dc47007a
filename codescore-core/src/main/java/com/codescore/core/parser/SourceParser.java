package com.codescore.core.parser;

import com.codescore.core.model.ParseResult;
import com.codescore.core.model.ParserTier;

/**
 * A strategy that turns raw file text into a {@link ParseResult}.
 *
 * <p>Three implementations exist, one per {@link ParserTier}. Callers never choose between
 * them directly; {@link ParserSelector} decides which one services a language.
 *
 * <p><b>Thread Safety:</b></p>
 * <p>Implementations are shared across worker threads and must be safe for concurrent
 * {@link #parse(String, String)} calls.</p>
 *
 * @see ParserSelector
 * @since 1.0.0
 */
public interface SourceParser {

    /**
     * Parses one file.
     *
     * @param filePath path recorded in the result
     * @param content full file text
     * @return structural facts for the file
     */
    ParseResult parse(String filePath, String content);

    /**
     * Returns the tier this parser implements.
     *
     * @return parser tier
     */
    ParserTier tier();
}
