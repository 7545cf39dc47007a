package com.codescore.core.analyzer;

import com.codescore.core.model.Language;

import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * A file handed to the analyzer by the discovery layer.
 *
 * @param filePath path reported in results, usually relative to the project root
 * @param language detected language
 * @param content full file text
 * @param skipReason why the file cannot be analyzed, or {@code null} for a readable file
 *
 * @since 1.0.0
 */
public record SourceFile(String filePath, Language language, String content, String skipReason) {

    public SourceFile {
        Objects.requireNonNull(filePath, "filePath must not be null");
        if (language == null) {
            language = Language.UNKNOWN;
        }
        if (content == null) {
            content = "";
        }
    }

    public SourceFile(String filePath, Language language, String content) {
        this(filePath, language, content, null);
    }

    /**
     * Creates a source file, detecting the language from the file extension.
     */
    public static SourceFile of(String filePath, String content) {
        return new SourceFile(filePath, Language.detect(filePath), content);
    }

    /**
     * Creates a placeholder for a file that discovery found but could not read. The analyzer
     * counts it as skipped.
     */
    public static SourceFile unreadable(String filePath, Language language, String reason) {
        return new SourceFile(filePath, language, "", Objects.requireNonNull(reason, "reason must not be null"));
    }

    public boolean isSkipped() {
        return skipReason != null;
    }

    /**
     * Size of the content in kilobytes of UTF-8, rounded to the nearest kilobyte.
     */
    public long sizeInKb() {
        return Math.round(content.getBytes(StandardCharsets.UTF_8).length / 1024.0);
    }
}
