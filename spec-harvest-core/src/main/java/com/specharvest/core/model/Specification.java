package com.specharvest.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Root of an extracted document.
 *
 * <p>Children are normally top-level {@link Section}s. Records that appear before the
 * document's first heading attach directly to the root.
 *
 * @param name document identifier (e.g. "3GPP TS 33.117")
 * @param children top-level nodes in document order
 */
public record Specification(
    String name,
    List<SpecNode> children
) {
    /**
     * Compact constructor with validation.
     */
    public Specification {
        Objects.requireNonNull(name, "name must not be null");
        children = children == null ? List.of() : List.copyOf(children);
    }

    /**
     * Returns the top-level sections, skipping records attached to the root.
     *
     * @return top-level sections
     */
    public List<Section> sections() {
        return children.stream()
            .filter(Section.class::isInstance)
            .map(Section.class::cast)
            .toList();
    }
}
