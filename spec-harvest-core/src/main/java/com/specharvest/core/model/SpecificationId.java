package com.specharvest.core.model;

import java.util.Objects;

/**
 * Identifies a 3GPP technical specification to harvest.
 *
 * @param number specification number (e.g. "33.117")
 * @param title short title (e.g. "General Requirements")
 */
public record SpecificationId(
    String number,
    String title
) {
    /**
     * Compact constructor with validation.
     */
    public SpecificationId {
        Objects.requireNonNull(number, "number must not be null");
        if (number.isBlank()) {
            throw new IllegalArgumentException("number must not be blank");
        }
        if (title == null) {
            title = "";
        }
    }

    /**
     * Returns the workspace folder that holds this specification's documents.
     *
     * @return folder name, e.g. "TS 33.117 - General Requirements"
     */
    public String folderName() {
        return title.isBlank() ? "TS " + number : "TS " + number + " - " + title;
    }

    /**
     * Returns the root label used for extracted trees.
     *
     * @return document name, e.g. "3GPP TS 33.117"
     */
    public String documentName() {
        return "3GPP TS " + number;
    }

    @Override
    public String toString() {
        return "TS " + number;
    }
}
