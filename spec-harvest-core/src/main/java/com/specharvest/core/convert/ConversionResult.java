package com.specharvest.core.convert;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Outcome of converting one legacy document.
 *
 * @param source original file
 * @param converted converted file, null on failure
 * @param success whether conversion succeeded
 * @param message failure reason, null on success
 */
public record ConversionResult(
    Path source,
    Path converted,
    boolean success,
    String message
) {
    /**
     * Compact constructor with validation.
     */
    public ConversionResult {
        Objects.requireNonNull(source, "source must not be null");
    }

    public static ConversionResult converted(Path source, Path converted) {
        return new ConversionResult(source, converted, true, null);
    }

    public static ConversionResult failed(Path source, String message) {
        return new ConversionResult(source, null, false, message);
    }
}
