package com.specharvest.core.model;

import java.util.Objects;

/**
 * Output of one parse: the record tree and the diagnostics gathered while building it.
 *
 * @param specification root of the extracted tree
 * @param diagnostics parse counters
 */
public record ParseResult(
    Specification specification,
    ParseDiagnostics diagnostics
) {
    /**
     * Compact constructor with validation.
     */
    public ParseResult {
        Objects.requireNonNull(specification, "specification must not be null");
        if (diagnostics == null) {
            diagnostics = ParseDiagnostics.empty();
        }
    }
}
