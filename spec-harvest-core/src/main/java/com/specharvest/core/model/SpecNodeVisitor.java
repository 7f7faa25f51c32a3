package com.specharvest.core.model;

/**
 * Visitor over the three {@link SpecNode} kinds.
 *
 * @param <R> result type
 */
public interface SpecNodeVisitor<R> {

    R visitSection(Section section);

    R visitRequirement(Requirement requirement);

    R visitTestCase(TestCase testCase);
}
