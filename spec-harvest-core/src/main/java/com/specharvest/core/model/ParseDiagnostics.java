package com.specharvest.core.model;

import java.util.List;

/**
 * Counters collected while parsing one paragraph stream.
 *
 * <p>None of these indicate a failure: the parser always produces a tree. They exist
 * for troubleshooting documents whose layout drifts from the expected labels.
 *
 * @param paragraphsRead paragraphs received from the stream
 * @param paragraphsSkipped paragraphs that were empty after normalization
 * @param headings sections created
 * @param requirements requirements created
 * @param testCases test cases created
 * @param paragraphsDiscarded paragraphs that matched nothing and had no capture target
 * @param malformedHeadingStyles heading styles whose level could not be read
 * @param warnings first warning messages (max 10)
 */
public record ParseDiagnostics(
    int paragraphsRead,
    int paragraphsSkipped,
    int headings,
    int requirements,
    int testCases,
    int paragraphsDiscarded,
    int malformedHeadingStyles,
    List<String> warnings
) {
    /** Maximum number of warning messages retained. */
    public static final int MAX_WARNINGS = 10;

    /**
     * Compact constructor with defaults.
     */
    public ParseDiagnostics {
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }

    /**
     * Creates diagnostics for an empty stream.
     *
     * @return all-zero diagnostics
     */
    public static ParseDiagnostics empty() {
        return new ParseDiagnostics(0, 0, 0, 0, 0, 0, 0, List.of());
    }

    /**
     * Returns the number of records (requirements and test cases) extracted.
     *
     * @return record count
     */
    public int recordCount() {
        return requirements + testCases;
    }
}
