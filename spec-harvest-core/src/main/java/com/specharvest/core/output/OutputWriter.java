package com.specharvest.core.output;

/**
 * Delivers rendered files to a destination.
 *
 * <p>Writers are discovered via Java Service Provider Interface (SPI). The extraction
 * pipeline uses {@code filesystem}; the CLI's {@code parse} command also offers
 * {@code console}.
 *
 * <p><b>Registration:</b> Register implementations in
 * {@code META-INF/services/com.specharvest.core.output.OutputWriter}
 *
 * @see OutputBundle
 * @see OutputContext
 */
public interface OutputWriter {

    /**
     * Returns unique identifier for this writer (lowercase, e.g. "filesystem").
     *
     * @return writer identifier
     */
    String getId();

    /**
     * Writes every file of the bundle.
     *
     * @param bundle files to write
     * @param context destination and settings
     * @throws IllegalStateException if a file cannot be written
     */
    void write(OutputBundle bundle, OutputContext context);
}
