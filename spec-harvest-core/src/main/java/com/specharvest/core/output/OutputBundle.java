package com.specharvest.core.output;

import java.util.List;
import java.util.Objects;

/**
 * Files produced for one document, written together.
 *
 * @param files rendered files
 */
public record OutputBundle(
    List<OutputFile> files
) {
    /**
     * Compact constructor with validation.
     */
    public OutputBundle {
        Objects.requireNonNull(files, "files must not be null");
        files = List.copyOf(files);
    }
}
