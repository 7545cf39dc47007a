package com.codescore.core.parser.ast;

import com.codescore.core.model.Language;
import com.codescore.core.parser.GrammarUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.treesitter.TSLanguage;

import java.util.EnumMap;
import java.util.Map;

/**
 * Locates tree-sitter grammar bindings by class name.
 *
 * <p>Each grammar ships as a separate artifact exposing one {@code org.treesitter.TreeSitterXxx}
 * class. Grammars are instantiated reflectively so that a grammar missing from the classpath,
 * or one whose native library cannot be loaded on this platform, surfaces as a
 * {@link GrammarUnavailableException} instead of a startup failure.
 *
 * @since 1.0.0
 */
public final class TreeSitterGrammars {

    private static final Logger log = LoggerFactory.getLogger(TreeSitterGrammars.class);

    private static final Map<Language, String> GRAMMAR_CLASSES = new EnumMap<>(Map.ofEntries(
        Map.entry(Language.GO, "org.treesitter.TreeSitterGo"),
        Map.entry(Language.JAVASCRIPT, "org.treesitter.TreeSitterJavascript"),
        Map.entry(Language.TYPESCRIPT, "org.treesitter.TreeSitterTypescript"),
        Map.entry(Language.PYTHON, "org.treesitter.TreeSitterPython"),
        Map.entry(Language.JAVA, "org.treesitter.TreeSitterJava"),
        Map.entry(Language.C, "org.treesitter.TreeSitterC"),
        Map.entry(Language.CPP, "org.treesitter.TreeSitterCpp"),
        Map.entry(Language.RUST, "org.treesitter.TreeSitterRust"),
        Map.entry(Language.CSHARP, "org.treesitter.TreeSitterCSharp"),
        Map.entry(Language.PHP, "org.treesitter.TreeSitterPhp"),
        Map.entry(Language.RUBY, "org.treesitter.TreeSitterRuby"),
        Map.entry(Language.SWIFT, "org.treesitter.TreeSitterSwift"),
        Map.entry(Language.SHELL, "org.treesitter.TreeSitterBash")
    ));

    private TreeSitterGrammars() {
        // Utility class - no instantiation
    }

    /**
     * Returns the binding class name for a language, or {@code null} if none is known.
     */
    public static String grammarClassName(Language language) {
        return GRAMMAR_CLASSES.get(language);
    }

    /**
     * Loads the grammar for a language.
     *
     * @param language language to load
     * @return grammar instance
     * @throws GrammarUnavailableException if the binding class is missing or fails to load
     */
    public static TSLanguage load(Language language) {
        String className = GRAMMAR_CLASSES.get(language);
        if (className == null) {
            throw new GrammarUnavailableException(language, "No tree-sitter binding known for " + language.displayName());
        }
        try {
            Class<?> grammarClass = Class.forName(className);
            TSLanguage grammar = (TSLanguage) grammarClass.getDeclaredConstructor().newInstance();
            log.debug("{} grammar loaded from {}", language.displayName(), className);
            return grammar;
        } catch (ClassNotFoundException e) {
            throw new GrammarUnavailableException(language,
                language.displayName() + " grammar not on classpath: " + className, e);
        } catch (ReflectiveOperationException | ClassCastException e) {
            throw new GrammarUnavailableException(language,
                language.displayName() + " grammar failed to initialize", e);
        } catch (LinkageError e) {
            throw new GrammarUnavailableException(language,
                language.displayName() + " grammar native library failed to load: " + e.getMessage(), e);
        }
    }
}
