package com.specharvest.core.renderer;

import java.util.Objects;

/**
 * A present field of a record, ready for output.
 *
 * @param elementName structural name (e.g. "ThreatReference")
 * @param displayName human-readable label (e.g. "Threat References")
 * @param value field value, never empty
 */
public record RecordField(
    String elementName,
    String displayName,
    String value
) {
    /**
     * Compact constructor with validation.
     */
    public RecordField {
        Objects.requireNonNull(elementName, "elementName must not be null");
        Objects.requireNonNull(displayName, "displayName must not be null");
        Objects.requireNonNull(value, "value must not be null");
    }
}
