package com.specharvest.core.model;

import java.util.Objects;

/**
 * A test case record.
 *
 * <p>Optional fields are {@code null} when their label never appeared. Every optional
 * field may span several lines.
 *
 * @param name test name
 * @param purpose test purpose
 * @param preConditions pre-conditions
 * @param executionSteps execution steps
 * @param expectedResults expected results
 * @param evidenceFormat expected format of evidence
 */
public record TestCase(
    String name,
    String purpose,
    String preConditions,
    String executionSteps,
    String expectedResults,
    String evidenceFormat
) implements SpecNode {
    /**
     * Compact constructor with validation.
     */
    public TestCase {
        Objects.requireNonNull(name, "name must not be null");
    }

    @Override
    public <R> R accept(SpecNodeVisitor<R> visitor) {
        return visitor.visitTestCase(this);
    }
}
