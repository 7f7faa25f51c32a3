package com.specharvest.core.parser;

import java.util.Objects;

/**
 * A recognized field label and the value that followed it on the same line.
 *
 * @param kind matched label
 * @param inlineValue trimmed text after the label; empty for header labels
 */
public record FieldMatch(
    FieldKind kind,
    String inlineValue
) {
    /**
     * Compact constructor with validation.
     */
    public FieldMatch {
        Objects.requireNonNull(kind, "kind must not be null");
        if (inlineValue == null) {
            inlineValue = "";
        }
    }
}
