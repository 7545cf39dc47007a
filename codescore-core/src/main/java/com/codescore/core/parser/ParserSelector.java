package com.codescore.core.parser;

import com.codescore.core.model.Language;
import com.codescore.core.model.ParseResult;
import com.codescore.core.model.ParserTier;
import com.codescore.core.parser.ast.AstParserFactory;
import com.codescore.core.parser.ast.GrammarRegistry;
import com.codescore.core.parser.ast.LanguageGrammarConfig;
import com.codescore.core.parser.ast.TreeSitterAstParserFactory;
import com.codescore.core.parser.generic.GenericParser;
import com.codescore.core.parser.pattern.PatternParser;
import com.codescore.core.parser.pattern.PatternTables;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Chooses and caches the parser that services each language.
 *
 * <p><b>Fallback chain:</b></p>
 * <ol>
 *   <li>A language with a grammar configuration gets an AST parser from the
 *       {@link AstParserFactory}.</li>
 *   <li>If the factory throws, the language is served by the pattern parser for the rest of
 *       the run. The failure is logged once.</li>
 *   <li>If an AST parser throws on a file, the language is demoted to the pattern parser and
 *       the file is re-parsed. Later files of that language never reach the AST parser.</li>
 *   <li>A language with no grammar configuration gets the pattern parser if it has a pattern
 *       table, and the generic parser otherwise.</li>
 * </ol>
 *
 * <p><b>Thread Safety:</b></p>
 * <p>The cache maps each language to a future. The first caller for a language installs the
 * future with {@code putIfAbsent} and runs initialization outside any lock; concurrent callers
 * wait on the same future, so each grammar is loaded at most once.</p>
 *
 * <p><b>Usage Example:</b></p>
 * <pre>{@code
 * ParserSelector selector = new ParserSelector();
 * ParseResult result = selector.parse(Language.GO, "main.go", source);
 * }</pre>
 *
 * @since 1.0.0
 */
public class ParserSelector {

    private static final Logger log = LoggerFactory.getLogger(ParserSelector.class);

    private final AstParserFactory astParserFactory;
    private final ConcurrentMap<Language, CompletableFuture<SourceParser>> cache = new ConcurrentHashMap<>();

    public ParserSelector() {
        this(new TreeSitterAstParserFactory());
    }

    public ParserSelector(AstParserFactory astParserFactory) {
        this.astParserFactory = Objects.requireNonNull(astParserFactory, "astParserFactory must not be null");
    }

    /**
     * Returns the parser for a language, initializing it on first use.
     *
     * @param language language to parse; {@code null} is treated as {@link Language#UNKNOWN}
     * @return cached parser instance
     */
    public SourceParser select(Language language) {
        Language key = language == null ? Language.UNKNOWN : language;
        CompletableFuture<SourceParser> entry = cache.get(key);
        if (entry == null) {
            CompletableFuture<SourceParser> pending = new CompletableFuture<>();
            entry = cache.putIfAbsent(key, pending);
            if (entry == null) {
                entry = pending;
                initialize(key, pending);
            }
        }
        return entry.join();
    }

    /**
     * Parses a file with the selected parser, demoting the language to the pattern parser if
     * the AST parser throws.
     *
     * @param language file language
     * @param filePath path recorded in the result
     * @param content file text
     * @return parse result from the AST parser, or from its fallback
     */
    public ParseResult parse(Language language, String filePath, String content) {
        Language key = language == null ? Language.UNKNOWN : language;
        SourceParser parser = select(key);
        try {
            return parser.parse(filePath, content);
        } catch (RuntimeException e) {
            if (parser.tier() != ParserTier.AST) {
                throw e;
            }
            return demote(key, parser, filePath, e).parse(filePath, content);
        }
    }

    /**
     * Returns the tier currently serving a language, initializing it if needed.
     */
    public ParserTier tierFor(Language language) {
        return select(language).tier();
    }

    private void initialize(Language language, CompletableFuture<SourceParser> pending) {
        try {
            pending.complete(createParser(language));
        } catch (RuntimeException | Error e) {
            // Let a later call retry instead of caching the failure
            cache.remove(language, pending);
            pending.completeExceptionally(e);
            throw e;
        }
    }

    private SourceParser createParser(Language language) {
        Optional<LanguageGrammarConfig> grammar = GrammarRegistry.find(language);
        if (grammar.isEmpty()) {
            log.debug("No grammar configuration for {}", language.id());
            return fallbackFor(language);
        }
        try {
            return astParserFactory.create(language, grammar.get());
        } catch (RuntimeException e) {
            log.warn("{} AST parser unavailable, falling back to pattern parser: {}",
                language.displayName(), e.getMessage());
            return fallbackFor(language);
        }
    }

    private SourceParser demote(Language language, SourceParser failed, String filePath, RuntimeException cause) {
        CompletableFuture<SourceParser> current = cache.get(language);
        if (current != null && current.getNow(null) == failed) {
            SourceParser replacement = fallbackFor(language);
            if (cache.replace(language, current, CompletableFuture.completedFuture(replacement))) {
                log.warn("{} AST parser failed on {}, using pattern parser for the rest of the run: {}",
                    language.displayName(), filePath, cause.getMessage());
                return replacement;
            }
        }
        // Another thread demoted the language first
        return select(language);
    }

    private static SourceParser fallbackFor(Language language) {
        return PatternTables.find(language)
            .<SourceParser>map(PatternParser::new)
            .orElseGet(() -> new GenericParser(language));
    }
}
