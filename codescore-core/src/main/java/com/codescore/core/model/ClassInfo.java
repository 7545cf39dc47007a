package com.codescore.core.model;

import java.util.Objects;

/**
 * One class, struct, interface, trait or enum declaration.
 *
 * @param name declared name
 * @param startLine first line (1-based)
 * @param endLine last line (1-based, inclusive)
 * @param methodCount methods declared directly in the body
 * @param fieldCount fields declared directly in the body
 *
 * @since 1.0.0
 */
public record ClassInfo(
    String name,
    int startLine,
    int endLine,
    int methodCount,
    int fieldCount
) {
    public ClassInfo {
        Objects.requireNonNull(name, "name must not be null");
        if (endLine < startLine) {
            endLine = startLine;
        }
        if (methodCount < 0) {
            methodCount = 0;
        }
        if (fieldCount < 0) {
            fieldCount = 0;
        }
    }
}
