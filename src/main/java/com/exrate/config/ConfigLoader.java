package com.exrate.config;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import io.vertx.core.json.JsonObject;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Map;

/**
 * Loads application.yml from the classpath into a Vert.x JsonObject
 */
@Slf4j
public final class ConfigLoader {

    public static final String DEFAULT_RESOURCE = "application.yml";

    private static final ObjectMapper YAML = new ObjectMapper(new YAMLFactory());
    private static final TypeReference<Map<String, Object>> DOCUMENT = new TypeReference<>() {
    };

    private ConfigLoader() {
    }

    public static JsonObject load() {
        return load(DEFAULT_RESOURCE);
    }

    public static JsonObject load(String resource) {
        try (InputStream is = ConfigLoader.class.getClassLoader().getResourceAsStream(resource)) {
            if (is == null) {
                throw new IllegalStateException(resource + " not found in classpath");
            }
            Map<String, Object> yaml = YAML.readValue(is, DOCUMENT);
            JsonObject config = yaml != null ? new JsonObject(yaml) : new JsonObject();
            log.info("Loaded configuration from {}", resource);
            return config;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + resource, e);
        }
    }
}
