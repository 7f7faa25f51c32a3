package com.specharvest.core.model;

import java.util.Objects;

/**
 * A security requirement record.
 *
 * <p>Optional fields are {@code null} when their label never appeared.
 *
 * @param name requirement name
 * @param reference requirement reference (single line)
 * @param description requirement description (may span several lines)
 * @param threatReference threat references (single line)
 */
public record Requirement(
    String name,
    String reference,
    String description,
    String threatReference
) implements SpecNode {
    /**
     * Compact constructor with validation.
     */
    public Requirement {
        Objects.requireNonNull(name, "name must not be null");
    }

    @Override
    public <R> R accept(SpecNodeVisitor<R> visitor) {
        return visitor.visitRequirement(this);
    }
}
