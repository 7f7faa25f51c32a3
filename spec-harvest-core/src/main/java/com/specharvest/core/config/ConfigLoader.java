package com.specharvest.core.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Loads {@link HarvestConfig} from a YAML file with Jackson.
 *
 * <p>A missing, unreadable or invalid file is not an error: a warning is logged and
 * {@link HarvestConfig#defaults()} is returned, so the tool runs without any
 * configuration.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * HarvestConfig config = ConfigLoader.load(Paths.get("spec-harvest.yaml"));
 * List<SpecificationId> ids = config.resolve(List.of("33.117"));
 * }</pre>
 */
public class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    /** Default configuration file name. */
    public static final String DEFAULT_FILE_NAME = "spec-harvest.yaml";

    /**
     * Loads configuration from a YAML file.
     *
     * @param configPath path to {@code spec-harvest.yaml}
     * @return loaded configuration or defaults if unavailable
     */
    public static HarvestConfig load(Path configPath) {
        if (!Files.exists(configPath)) {
            log.debug("Configuration file not found: {}. Using defaults.", configPath);
            return HarvestConfig.defaults();
        }

        if (!Files.isRegularFile(configPath) || !Files.isReadable(configPath)) {
            log.warn("Configuration file is not readable: {}. Using defaults.", configPath);
            return HarvestConfig.defaults();
        }

        try {
            HarvestConfig config = YAML_MAPPER.readValue(configPath.toFile(), HarvestConfig.class);
            if (config == null) {
                log.warn("Configuration file is empty: {}. Using defaults.", configPath);
                return HarvestConfig.defaults();
            }
            log.info("Loaded configuration from: {}", configPath);
            return config;
        } catch (IOException e) {
            log.error("Failed to parse configuration file: {}. Using defaults. Error: {}",
                configPath, e.getMessage());
            return HarvestConfig.defaults();
        }
    }
}
