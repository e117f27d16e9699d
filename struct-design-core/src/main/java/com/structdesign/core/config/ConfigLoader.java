package com.structdesign.core.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Loads {@link DesignSettings} from a YAML file.
 *
 * <p>If the file is missing, unreadable or invalid, logs a warning and returns
 * {@link DesignSettings#defaults()}.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * DesignSettings settings = ConfigLoader.load(Paths.get("structdesign.yaml"));
 * DesignOrchestrator orchestrator = new DesignOrchestrator(settings);
 * }</pre>
 */
public class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    /**
     * Loads settings from a YAML file.
     *
     * @param configPath path to {@code structdesign.yaml}
     * @return loaded settings or defaults if unavailable
     */
    public static DesignSettings load(Path configPath) {
        if (configPath == null || !Files.exists(configPath)) {
            log.warn("Configuration file not found: {}. Using default design settings.", configPath);
            return DesignSettings.defaults();
        }

        if (!Files.isRegularFile(configPath) || !Files.isReadable(configPath)) {
            log.warn("Configuration file is not readable: {}. Using defaults.", configPath);
            return DesignSettings.defaults();
        }

        try {
            log.debug("Loading configuration from: {}", configPath);
            DesignSettings settings = YAML_MAPPER.readValue(configPath.toFile(), DesignSettings.class);
            if (settings == null) {
                log.warn("Configuration file is empty: {}. Using defaults.", configPath);
                return DesignSettings.defaults();
            }
            log.info("Loaded configuration from: {}", configPath);
            return settings;
        } catch (IOException e) {
            log.error("Failed to parse configuration file: {}. Using defaults. Error: {}",
                configPath, e.getMessage());
            return DesignSettings.defaults();
        }
    }
}
