package com.redisgl.server.config;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

/**
 * Reads {@link ServerConfig} from JSON. Unknown keys are ignored and missing keys keep
 * their defaults.
 */
@Slf4j
public class ServerConfigLoader {

    public static final String DEFAULT_RESOURCE = "redisgl-server.json";

    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private ServerConfigLoader() {
    }

    public static ServerConfig load(Path path) {
        try (InputStream in = Files.newInputStream(path)) {
            ServerConfig config = OBJECT_MAPPER.readValue(in, ServerConfig.class).validate();
            log.info("Loaded server configuration from {}", path);
            return config;
        } catch (IOException e) {
            throw new UncheckedIOException("Unable to read server configuration " + path, e);
        }
    }

    /**
     * Loads {@value #DEFAULT_RESOURCE} from the classpath, or returns the defaults when the
     * resource is absent.
     */
    public static ServerConfig loadDefault() {
        return loadResource(DEFAULT_RESOURCE);
    }

    public static ServerConfig loadResource(String resource) {
        ClassLoader classLoader = Thread.currentThread().getContextClassLoader();
        if (classLoader == null) {
            classLoader = ServerConfigLoader.class.getClassLoader();
        }
        try (InputStream in = classLoader.getResourceAsStream(resource)) {
            if (in == null) {
                log.debug("No {} on the classpath, using default server configuration", resource);
                return ServerConfig.defaults();
            }
            return OBJECT_MAPPER.readValue(in, ServerConfig.class).validate();
        } catch (IOException e) {
            throw new UncheckedIOException("Unable to read server configuration resource " + resource, e);
        }
    }

    public static ServerConfig fromJson(String json) {
        try {
            return OBJECT_MAPPER.readValue(json, ServerConfig.class).validate();
        } catch (IOException e) {
            throw new IllegalArgumentException("Invalid server configuration JSON", e);
        }
    }
}
