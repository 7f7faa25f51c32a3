package com.specharvest.core.model;

import java.util.List;
import java.util.Objects;

/**
 * A heading-delimited section of a document.
 *
 * @param title heading text
 * @param level heading level (1 = outermost)
 * @param children nested sections, requirements and test cases in document order
 */
public record Section(
    String title,
    int level,
    List<SpecNode> children
) implements SpecNode {
    /**
     * Compact constructor with validation.
     */
    public Section {
        Objects.requireNonNull(title, "title must not be null");
        if (level < 1) {
            throw new IllegalArgumentException("level must be positive: " + level);
        }
        children = children == null ? List.of() : List.copyOf(children);
    }

    @Override
    public <R> R accept(SpecNodeVisitor<R> visitor) {
        return visitor.visitSection(this);
    }
}
