package com.specharvest.core.output;

import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;

/**
 * Destination and writer settings for one write.
 *
 * @param outputDirectory root that relative paths resolve against
 * @param settings writer-specific settings
 */
public record OutputContext(
    Path outputDirectory,
    Map<String, String> settings
) {
    /**
     * Compact constructor with validation.
     */
    public OutputContext {
        Objects.requireNonNull(outputDirectory, "outputDirectory must not be null");
        settings = settings == null ? Map.of() : Map.copyOf(settings);
    }

    /**
     * Gets a setting with a default.
     *
     * @param key setting key
     * @param defaultValue default value
     * @return setting value or default
     */
    public String getSettingOrDefault(String key, String defaultValue) {
        return settings.getOrDefault(key, defaultValue);
    }
}
