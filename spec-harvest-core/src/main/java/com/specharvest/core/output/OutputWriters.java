package com.specharvest.core.output;

import java.util.ArrayList;
import java.util.List;
import java.util.ServiceLoader;

/**
 * Discovers {@link OutputWriter} implementations via {@link ServiceLoader}.
 */
public final class OutputWriters {

    private OutputWriters() {
        throw new AssertionError("Utility class should not be instantiated");
    }

    /**
     * Returns all registered writers.
     *
     * @return discovered writers
     */
    public static List<OutputWriter> discover() {
        List<OutputWriter> writers = new ArrayList<>();
        ServiceLoader.load(OutputWriter.class).forEach(writers::add);
        return writers;
    }

    /**
     * Finds a writer by id.
     *
     * @param id writer id
     * @return the writer
     * @throws IllegalStateException if no writer is registered under that id
     */
    public static OutputWriter require(String id) {
        return discover().stream()
            .filter(writer -> writer.getId().equals(id))
            .findFirst()
            .orElseThrow(() -> new IllegalStateException("Output writer not found: " + id));
    }
}
