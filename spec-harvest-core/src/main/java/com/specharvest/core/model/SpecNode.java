package com.specharvest.core.model;

/**
 * A child slot of a {@link Section}: exactly one of {@link Section},
 * {@link Requirement} or {@link TestCase}.
 *
 * <p>Consumers dispatch on the kind through {@link #accept(SpecNodeVisitor)}, so adding a
 * node kind breaks every visitor at compile time.
 */
public sealed interface SpecNode permits Section, Requirement, TestCase {

    /**
     * Dispatches to the visitor method matching this node kind.
     *
     * @param visitor visitor to call
     * @param <R> visitor result type
     * @return the visitor's result
     */
    <R> R accept(SpecNodeVisitor<R> visitor);
}
