package com.aqiindia.service.config;

import com.aqiindia.collectors.config.AqiCollectorConfig;
import com.aqiindia.core.model.CollectorConfig;
import com.aqiindia.core.util.JsonUtils;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads the JSON files under the config directory. A file that exists but cannot be parsed stops
 * startup; a missing file means defaults.
 */
public final class ConfigLoader {
    static final String COLLECTORS_FILE = "collectors.json";
    static final String AQI_FILE = "aqi.json";

    private ConfigLoader() {
    }

    public static List<CollectorConfig> loadCollectors(Path configDir) {
        Path path = configDir.resolve(COLLECTORS_FILE);
        if (!Files.exists(path)) {
            return List.of();
        }
        List<CollectorConfig> configs;
        try (InputStream in = Files.newInputStream(path)) {
            configs = JsonUtils.objectMapper().readValue(in, new TypeReference<List<CollectorConfig>>() {
            });
        } catch (IOException e) {
            throw new IllegalStateException("Failed loading collector config from " + path, e);
        }
        for (CollectorConfig config : configs) {
            if (config.intervalSeconds() != null && config.intervalSeconds() < 1) {
                throw new IllegalStateException("intervalSeconds must be positive for " + config.name() + " in " + path);
            }
        }
        return configs;
    }

    /**
     * Expects {@code {"cities": ["Delhi", ...]}}. The interval is left at its default here; it comes
     * from {@code collectors.json} or {@code INGEST_MINUTES}.
     */
    public static AqiCollectorConfig loadAqi(Path configDir) {
        Path path = configDir.resolve(AQI_FILE);
        if (!Files.exists(path)) {
            return new AqiCollectorConfig(null, null);
        }
        JsonNode root;
        try {
            root = JsonUtils.objectMapper().readTree(Files.readString(path));
        } catch (IOException e) {
            throw new IllegalStateException("Failed loading AQI config from " + path, e);
        }
        if (root == null || !root.isObject()) {
            throw new IllegalStateException("AQI config must be a JSON object: " + path);
        }

        List<String> cities = null;
        JsonNode citiesNode = root.get("cities");
        if (citiesNode != null && !citiesNode.isNull()) {
            if (!citiesNode.isArray()) {
                throw new IllegalStateException("cities must be an array in " + path);
            }
            cities = new ArrayList<>();
            for (JsonNode city : citiesNode) {
                cities.add(city.asText());
            }
        }
        return new AqiCollectorConfig(null, cities);
    }
}
