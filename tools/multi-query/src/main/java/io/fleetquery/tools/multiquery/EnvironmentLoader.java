package io.fleetquery.tools.multiquery;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Loads and validates the environments file.
 */
public class EnvironmentLoader {

    private static final Logger log = LoggerFactory.getLogger(EnvironmentLoader.class);

    private final ObjectMapper mapper = new ObjectMapper()
        .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    /**
     * @throws ValidationException if the file is missing, empty, malformed or fails validation
     */
    public EnvironmentConfig load(Path file) {
        if (!Files.isRegularFile(file)) {
            throw new ValidationException("Environment file not found: " + file);
        }

        String json;
        try {
            json = Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Error loading environment file '" + file + "': " + e.getMessage(), e);
        }
        if (json.isBlank()) {
            throw new ValidationException("Environment file is empty");
        }

        EnvironmentConfig config;
        try {
            config = mapper.readValue(json, EnvironmentConfig.class);
        } catch (JsonProcessingException e) {
            throw new ValidationException(
                "Invalid JSON in environment file '" + file + "': " + e.getOriginalMessage(), e);
        }
        if (config == null) {
            throw new ValidationException("Failed to deserialize environment configuration");
        }

        List<String> errors = config.validate();
        if (!errors.isEmpty()) {
            throw new ValidationException(
                "Environment configuration validation failed:\n" + String.join("\n", errors));
        }
        log.debug("Loaded {} environment(s) from {}", config.count(), file);
        return config;
    }
}
