package com.codescore.core.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Utility for loading CodeScore configuration from YAML files.
 *
 * <p>Uses Jackson to deserialize {@code codescore.yaml} into a {@link RuntimeConfig} record.
 * If the file is missing, unreadable, empty or invalid, returns {@link RuntimeConfig#defaults()}.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * RuntimeConfig config = ConfigLoader.load(Paths.get("codescore.yaml"));
 * int workers = config.concurrency();
 * }</pre>
 */
public final class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    /** Default configuration file name, resolved against the project root. */
    public static final String DEFAULT_FILE_NAME = "codescore.yaml";

    private ConfigLoader() {
        // Utility class - no instantiation
    }

    /**
     * Loads configuration from a YAML file.
     *
     * @param configPath path to {@code codescore.yaml}
     * @return loaded configuration or defaults if unavailable
     */
    public static RuntimeConfig load(Path configPath) {
        if (configPath == null || !Files.exists(configPath)) {
            log.debug("Configuration file not found: {}. Using defaults.", configPath);
            return RuntimeConfig.defaults();
        }

        if (!Files.isRegularFile(configPath) || !Files.isReadable(configPath)) {
            log.warn("Configuration file is not readable: {}. Using defaults.", configPath);
            return RuntimeConfig.defaults();
        }

        try {
            log.debug("Loading configuration from: {}", configPath);
            RuntimeConfig config = YAML_MAPPER.readValue(configPath.toFile(), RuntimeConfig.class);
            if (config == null) {
                log.warn("Configuration file is empty: {}. Using defaults.", configPath);
                return RuntimeConfig.defaults();
            }
            log.info("Loaded configuration from: {}", configPath);
            return config;
        } catch (IOException e) {
            log.warn("Failed to parse configuration file: {}. Using defaults. Error: {}",
                configPath, e.getMessage());
            return RuntimeConfig.defaults();
        }
    }
}
