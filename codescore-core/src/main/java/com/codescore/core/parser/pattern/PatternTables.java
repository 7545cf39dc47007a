package com.codescore.core.parser.pattern;

import com.codescore.core.model.Language;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * Per-language regex tables for the pattern parser.
 *
 * <p>Pure data. Every supported language has an entry; {@link Language#UNKNOWN} does not.
 *
 * @since 1.0.0
 */
public final class PatternTables {

    private static final String SLASH_COMMENT = "^\\s*//";
    private static final String BLOCK_START = "/\\*";
    private static final String BLOCK_END = "\\*/";

    private static final Map<Language, PatternLanguageConfig> TABLES = buildTables();

    private PatternTables() {
        // Utility class - no instantiation
    }

    /**
     * Returns the pattern table for a language.
     */
    public static Optional<PatternLanguageConfig> find(Language language) {
        return Optional.ofNullable(TABLES.get(language));
    }

    public static Map<Language, PatternLanguageConfig> all() {
        return TABLES;
    }

    private static Map<Language, PatternLanguageConfig> buildTables() {
        Map<Language, PatternLanguageConfig> tables = new EnumMap<>(Language.class);

        tables.put(Language.GO, PatternLanguageConfig.builder(Language.GO)
            .functions("^func\\s+(?:\\([^)]+\\)\\s+)?(\\w+)\\s*[\\[(]")
            .classes("^type\\s+(\\w+)\\s+(?:struct|interface)\\s*\\{")
            .comments(SLASH_COMMENT, BLOCK_START, BLOCK_END)
            .branches("if", "else if", "case", "default", "&&", "||")
            .loops("for", "range")
            .methods("^func\\s+\\([^)]+\\)\\s+(\\w+)\\s*\\(")
            .fields("^\\s+\\w+(?:\\s*,\\s*\\w+)*\\s+\\S+")
            .build());

        tables.put(Language.JAVASCRIPT, PatternLanguageConfig.builder(Language.JAVASCRIPT)
            .functions(
                "^(?:export\\s+)?(?:default\\s+)?(?:async\\s+)?function\\s*\\*?\\s*(\\w+)\\s*\\(",
                "^(?:export\\s+)?(?:const|let|var)\\s+(\\w+)\\s*=\\s*(?:async\\s+)?(?:function|\\([^)]*\\)\\s*=>|\\w+\\s*=>)",
                "^(?:static\\s+)?(?:async\\s+)?(\\w+)\\s*\\([^)]*\\)\\s*\\{")
            .classes("^(?:export\\s+)?(?:default\\s+)?class\\s+(\\w+)")
            .comments(SLASH_COMMENT, BLOCK_START, BLOCK_END)
            .branches("if", "else if", "case", "default", "?", "&&", "||", "??")
            .loops("for", "while", "do")
            .methods("^\\s+(?:static\\s+)?(?:async\\s+)?(?:get\\s+|set\\s+)?(\\w+)\\s*\\([^)]*\\)\\s*\\{")
            .fields("^\\s+(?:static\\s+)?#?(\\w+)\\s*[=;]")
            .build());

        tables.put(Language.TYPESCRIPT, PatternLanguageConfig.builder(Language.TYPESCRIPT)
            .functions(
                "^(?:export\\s+)?(?:default\\s+)?(?:async\\s+)?function\\s+(\\w+)\\s*[<(]",
                "^(?:export\\s+)?(?:const|let|var)\\s+(\\w+)\\s*(?::\\s*[^=]+)?\\s*=\\s*(?:async\\s+)?(?:function|\\([^)]*\\)\\s*(?::\\s*[^=]+)?=>|\\w+\\s*=>)",
                "^(?:public|private|protected)?\\s*(?:static\\s+)?(?:async\\s+)?(\\w+)\\s*(?:<[^>]*>)?\\([^)]*\\)\\s*(?::\\s*[^{]+)?\\s*\\{")
            .classes("^(?:export\\s+)?(?:default\\s+)?(?:abstract\\s+)?class\\s+(\\w+)")
            .comments(SLASH_COMMENT, BLOCK_START, BLOCK_END)
            .branches("if", "else if", "case", "default", "?", "&&", "||", "??")
            .loops("for", "while", "do")
            .methods("^\\s+(?:public|private|protected)?\\s*(?:static\\s+)?(?:async\\s+)?(\\w+)\\s*(?:<[^>]*>)?\\([^)]*\\)")
            .fields("^\\s+(?:public|private|protected)?\\s*(?:static\\s+)?(?:readonly\\s+)?(\\w+)\\s*[?!]?\\s*[:;=]")
            .build());

        tables.put(Language.PYTHON, PatternLanguageConfig.builder(Language.PYTHON)
            .functions("^(?:async\\s+)?def\\s+(\\w+)\\s*\\(")
            .classes("^class\\s+(\\w+)")
            .comments("^\\s*#", "^(?:\"\"\"|''')", "(?:\"\"\"|''')$")
            .branches("if", "elif", "else", "and", "or")
            .loops("for", "while")
            .indentation(null)
            .methods("^\\s+(?:async\\s+)?def\\s+(\\w+)\\s*\\(")
            .fields("^\\s+self\\.(\\w+)\\s*(?::[^=]+)?=[^=]")
            .build());

        tables.put(Language.JAVA, PatternLanguageConfig.builder(Language.JAVA)
            .functions("^(?:@\\w+\\s+)*(?:(?:public|private|protected|static|final|abstract|synchronized|default)\\s+)*(?:<[^>]+>\\s+)?(?!(?:record|class|interface|enum)\\s)(?:[\\w.]+(?:<[^>]+>)?(?:\\[\\])*)\\s+(\\w+)\\s*\\(")
            .classes("^(?:(?:public|private|protected|abstract|final|static|sealed)\\s+)*(?:class|interface|enum|record)\\s+(\\w+)")
            .comments(SLASH_COMMENT, BLOCK_START, BLOCK_END)
            .branches("if", "else if", "case", "default", "?", "&&", "||")
            .loops("for", "while", "do")
            .methods("^\\s+(?:@\\w+\\s+)*(?:(?:public|private|protected|static|final|abstract|synchronized|default)\\s+)*(?:<[^>]+>\\s+)?(?!(?:record|class|interface|enum)\\s)(?:[\\w.]+(?:<[^>]+>)?(?:\\[\\])*)\\s+(\\w+)\\s*\\(")
            .fields("^\\s+(?:(?:public|private|protected|static|final|volatile|transient)\\s+)*(?:[\\w.]+(?:<[^>]+>)?(?:\\[\\])*)\\s+(\\w+)\\s*[;=]")
            .build());

        tables.put(Language.C, PatternLanguageConfig.builder(Language.C)
            .functions("^(?:\\w+[\\s*]+)+\\**(\\w+)\\s*\\([^)]*\\)\\s*\\{")
            .classes("^(?:typedef\\s+)?(?:struct|union|enum)\\s+(\\w+)")
            .comments(SLASH_COMMENT, BLOCK_START, BLOCK_END)
            .branches("if", "else if", "case", "default", "?", "&&", "||")
            .loops("for", "while", "do")
            .fields("^\\s+(?:const\\s+)?(?:unsigned\\s+|signed\\s+)?\\w+[\\s*]+(\\w+)(?:\\[[^]]*\\])?\\s*;")
            .build());

        tables.put(Language.CPP, PatternLanguageConfig.builder(Language.CPP)
            .functions("^(?:template\\s*<[^>]+>\\s*)?(?:(?:virtual|static|inline|constexpr|explicit)\\s+)*(?:[\\w:]+(?:<[^>]+>)?[\\s*&]+)+(?:\\w+::)*(~?\\w+)\\s*\\([^)]*\\)\\s*(?:const\\s*)?(?:noexcept\\s*)?(?:override\\s*)?\\{")
            .classes("^(?:template\\s*<[^>]+>\\s*)?(?:class|struct)\\s+(\\w+)\\b(?!\\s*;)")
            .comments(SLASH_COMMENT, BLOCK_START, BLOCK_END)
            .branches("if", "else if", "case", "default", "?", "&&", "||")
            .loops("for", "while", "do")
            .methods("^\\s+(?:(?:virtual|static|inline|constexpr|explicit)\\s+)*(?:[\\w:]+(?:<[^>]+>)?[\\s*&]+)*(~?\\w+)\\s*\\([^)]*\\)\\s*(?:const\\s*)?(?:noexcept\\s*)?(?:override\\s*)?(?:\\{|;|=)")
            .fields("^\\s+(?:(?:static|const|mutable)\\s+)*[\\w:]+(?:<[^>]+>)?[\\s*&]+(\\w+)\\s*(?:=[^=(]+)?;")
            .build());

        tables.put(Language.RUST, PatternLanguageConfig.builder(Language.RUST)
            .functions("^(?:pub(?:\\([^)]*\\))?\\s+)?(?:const\\s+)?(?:async\\s+)?(?:unsafe\\s+)?fn\\s+(\\w+)")
            .classes("^(?:pub(?:\\([^)]*\\))?\\s+)?(?:struct|enum|trait)\\s+(\\w+)")
            .comments(SLASH_COMMENT, BLOCK_START, BLOCK_END)
            .branches("if", "else if", "match", "=>", "&&", "||")
            .loops("for", "while", "loop")
            .methods("^\\s+(?:pub(?:\\([^)]*\\))?\\s+)?(?:async\\s+)?fn\\s+(\\w+)")
            .fields("^\\s+(?:pub(?:\\([^)]*\\))?\\s+)?(\\w+)\\s*:[^:]")
            .build());

        tables.put(Language.CSHARP, PatternLanguageConfig.builder(Language.CSHARP)
            .functions("^(?:\\[[^]]+\\]\\s*)*(?:(?:public|private|protected|internal|static|virtual|override|abstract|sealed|async|extern)\\s+)*(?:[\\w.]+(?:<[^>]+>)?(?:\\[\\])?\\??)\\s+(\\w+)\\s*(?:<[^>]+>)?\\s*\\(")
            .classes("^(?:(?:public|private|protected|internal|abstract|sealed|static|partial)\\s+)*(?:class|struct|interface|record|enum)\\s+(\\w+)")
            .comments(SLASH_COMMENT, BLOCK_START, BLOCK_END)
            .branches("if", "else if", "case", "default", "?", "&&", "||", "??")
            .loops("for", "foreach", "while", "do")
            .methods("^\\s+(?:\\[[^]]+\\]\\s*)*(?:(?:public|private|protected|internal|static|virtual|override|abstract|sealed|async)\\s+)*(?:[\\w.]+(?:<[^>]+>)?(?:\\[\\])?\\??)\\s+(\\w+)\\s*(?:<[^>]+>)?\\s*\\(")
            .fields("^\\s+(?:(?:public|private|protected|internal|static|readonly|const|volatile)\\s+)*(?:[\\w.]+(?:<[^>]+>)?(?:\\[\\])?\\??)\\s+(\\w+)\\s*(?:[;=]|\\{\\s*get)")
            .build());

        tables.put(Language.LUA, PatternLanguageConfig.builder(Language.LUA)
            .functions(
                "^(?:local\\s+)?function\\s+(\\w+(?:[.:]\\w+)*)\\s*\\(",
                "^(?:local\\s+)?([\\w.]+)\\s*=\\s*function\\s*\\(")
            .comments("^\\s*--(?!\\[\\[)", "--\\[\\[", "\\]\\]")
            .branches("if", "elseif", "and", "or")
            .loops("for", "while", "repeat")
            .indentation("^end\\b")
            .build());

        tables.put(Language.PHP, PatternLanguageConfig.builder(Language.PHP)
            .functions("^(?:(?:public|private|protected|static|abstract|final)\\s+)*function\\s+&?(\\w+)\\s*\\(")
            .classes("^(?:(?:abstract|final|readonly)\\s+)*(?:class|interface|trait|enum)\\s+(\\w+)")
            .comments("^\\s*(?://|#(?!\\[))", BLOCK_START, BLOCK_END)
            .branches("if", "elseif", "else if", "case", "default", "?", "&&", "||", "??", "and", "or")
            .loops("for", "foreach", "while", "do")
            .methods("^\\s+(?:(?:public|private|protected|static|abstract|final)\\s+)*function\\s+&?(\\w+)\\s*\\(")
            .fields("^\\s+(?:(?:public|private|protected|static|readonly|var)\\s+)+(?:\\??[\\w\\\\]+\\s+)?\\$(\\w+)")
            .build());

        tables.put(Language.RUBY, PatternLanguageConfig.builder(Language.RUBY)
            .functions("^def\\s+(?:self\\.)?(\\w+[?!=]?)")
            .classes("^(?:class|module)\\s+([A-Z]\\w*)")
            .comments("^\\s*#", "^=begin", "^=end")
            .branches("if", "elsif", "unless", "when", "?", "&&", "||", "and", "or")
            .loops("while", "until", "for", "loop")
            .indentation("^end\\b")
            .methods("^\\s+def\\s+(?:self\\.)?(\\w+[?!=]?)")
            .fields("^\\s+(?:attr_(?:accessor|reader|writer)\\s+:(\\w+)|@(\\w+)\\s*\\|{0,2}=[^=])")
            .build());

        tables.put(Language.SWIFT, PatternLanguageConfig.builder(Language.SWIFT)
            .functions(
                "^(?:@\\w+\\s+)*(?:(?:public|private|fileprivate|internal|open|static|class|override|final|mutating)\\s+)*func\\s+(\\w+)",
                "^(?:(?:public|private|fileprivate|internal|convenience|required|override)\\s+)*(init)\\??\\s*\\(")
            .classes("^(?:(?:public|private|fileprivate|internal|open|final)\\s+)*(?:class|struct|enum|protocol|actor|extension)\\s+(\\w+)")
            .comments(SLASH_COMMENT, BLOCK_START, BLOCK_END)
            .branches("if", "else if", "guard", "case", "default", "?", "&&", "||", "??")
            .loops("for", "while", "repeat")
            .methods(
                "^\\s+(?:@\\w+\\s+)*(?:(?:public|private|fileprivate|internal|open|static|class|override|final|mutating)\\s+)*func\\s+(\\w+)",
                "^\\s+(?:(?:public|private|fileprivate|internal|convenience|required|override)\\s+)*(init)\\??\\s*\\(")
            .fields("^\\s+(?:@\\w+\\s+)*(?:(?:public|private|fileprivate|internal|open|static|lazy|weak|final)\\s+)*(?:var|let)\\s+(\\w+)")
            .build());

        tables.put(Language.SHELL, PatternLanguageConfig.builder(Language.SHELL)
            .functions(
                "^function\\s+([\\w-]+)\\s*(?:\\(\\s*\\))?\\s*\\{?",
                "^([\\w-]+)\\s*\\(\\s*\\)\\s*\\{?")
            .comments("^\\s*#", null, null)
            .branches("if", "elif", "&&", "||")
            .loops("for", "while", "until")
            .build());

        return Collections.unmodifiableMap(tables);
    }
}
