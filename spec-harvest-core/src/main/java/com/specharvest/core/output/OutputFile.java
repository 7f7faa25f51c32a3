package com.specharvest.core.output;

import java.util.Objects;

/**
 * A rendered file awaiting output.
 *
 * @param relativePath path below the output root (e.g. "TS 33.117 - General Requirements/33117-j20.xml")
 * @param content file content
 * @param contentType MIME type of the content
 */
public record OutputFile(
    String relativePath,
    String content,
    String contentType
) {
    /**
     * Compact constructor with validation.
     */
    public OutputFile {
        Objects.requireNonNull(relativePath, "relativePath must not be null");
        Objects.requireNonNull(content, "content must not be null");
    }
}
