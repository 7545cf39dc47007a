package com.codescore.core.model;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * Programming languages recognized by the analyzer.
 *
 * <p>Each constant carries the identifier used in configuration and reports, a display
 * name for console output, and the file extensions that map to it. {@link #UNKNOWN} is
 * the catch-all for files whose extension is not recognized; such files are still
 * analyzed by the generic parser.
 *
 * <p><b>Usage Example:</b></p>
 * <pre>{@code
 * Language lang = Language.detect("src/server/handler.go");   // GO
 * Language byId = Language.fromId("cpp");                      // CPP
 * }</pre>
 *
 * @since 1.0.0
 */
public enum Language {

    GO("go", "Go", ".go"),
    JAVASCRIPT("javascript", "JavaScript", ".js", ".mjs", ".cjs", ".jsx"),
    TYPESCRIPT("typescript", "TypeScript", ".ts", ".mts", ".cts", ".tsx"),
    PYTHON("python", "Python", ".py", ".pyw"),
    JAVA("java", "Java", ".java"),
    C("c", "C", ".c", ".h"),
    CPP("cpp", "C++", ".cpp", ".cc", ".cxx", ".hpp", ".hxx"),
    RUST("rust", "Rust", ".rs"),
    CSHARP("csharp", "C#", ".cs"),
    LUA("lua", "Lua", ".lua"),
    PHP("php", "PHP", ".php"),
    RUBY("ruby", "Ruby", ".rb"),
    SWIFT("swift", "Swift", ".swift"),
    SHELL("shell", "Shell", ".sh", ".bash"),
    UNKNOWN("unknown", "Unknown");

    private final String id;
    private final String displayName;
    private final List<String> extensions;

    Language(String id, String displayName, String... extensions) {
        this.id = id;
        this.displayName = displayName;
        this.extensions = List.of(extensions);
    }

    public String id() {
        return id;
    }

    public String displayName() {
        return displayName;
    }

    public List<String> extensions() {
        return extensions;
    }

    /**
     * Detects the language of a file from its name.
     *
     * @param fileName file name or path; only the extension is inspected
     * @return detected language, or {@link #UNKNOWN}
     */
    public static Language detect(String fileName) {
        if (fileName == null) {
            return UNKNOWN;
        }
        int dot = fileName.lastIndexOf('.');
        int slash = Math.max(fileName.lastIndexOf('/'), fileName.lastIndexOf('\\'));
        if (dot < 0 || dot < slash) {
            return UNKNOWN;
        }
        String extension = fileName.substring(dot).toLowerCase(Locale.ROOT);
        for (Language language : values()) {
            if (language.extensions.contains(extension)) {
                return language;
            }
        }
        return UNKNOWN;
    }

    /**
     * Resolves a language by its identifier (case-insensitive).
     *
     * @param id language identifier such as {@code "python"}
     * @return matching language, or {@link #UNKNOWN}
     */
    public static Language fromId(String id) {
        if (id == null) {
            return UNKNOWN;
        }
        return Arrays.stream(values())
            .filter(language -> language.id.equalsIgnoreCase(id.trim()))
            .findFirst()
            .orElse(UNKNOWN);
    }

    /**
     * Returns every concrete language (all constants except {@link #UNKNOWN}).
     *
     * @return supported languages in declaration order
     */
    public static List<Language> supported() {
        return Arrays.stream(values())
            .filter(language -> language != UNKNOWN)
            .toList();
    }
}
