package com.aqiindia.service.config;

import com.aqiindia.collectors.config.AqiCollectorConfig;
import com.aqiindia.service.api.CorsPolicy;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * Process settings resolved from environment variables. Values that cannot be parsed are reported
 * through the warning sink and replaced by their defaults.
 */
public record ServiceSettings(
        int port,
        Path dataDir,
        Path configDir,
        String openAqBaseUrl,
        List<String> allowedOrigins,
        ProviderKind provider,
        Path mockFile,
        List<String> cities,
        Duration ingestInterval
) {
    public static final int DEFAULT_PORT = 8080;
    public static final String DEFAULT_OPENAQ_BASE_URL = "https://api.openaq.org";

    public enum ProviderKind {
        OPENAQ,
        MOCK
    }

    public ServiceSettings {
        Objects.requireNonNull(dataDir, "dataDir is required");
        Objects.requireNonNull(configDir, "configDir is required");
        Objects.requireNonNull(provider, "provider is required");
        allowedOrigins = List.copyOf(allowedOrigins);
        cities = cities == null ? List.of() : List.copyOf(cities);
    }

    public static ServiceSettings fromEnvironment(Map<String, String> env, Consumer<String> warn) {
        int port = parsePort(env.get("PORT"), warn);
        Path dataDir = Path.of(valueOrDefault(env.get("DATA_DIR"), "data"));
        Path configDir = Path.of(valueOrDefault(env.get("CONFIG_DIR"), "config"));
        String baseUrl = valueOrDefault(env.get("OPENAQ_BASE_URL"), DEFAULT_OPENAQ_BASE_URL);

        List<String> origins = CorsPolicy.DEFAULT_ORIGINS;
        String originsRaw = env.get("ALLOWED_ORIGINS");
        if (originsRaw != null && !originsRaw.isBlank()) {
            origins = splitCsv(originsRaw);
        }

        ProviderKind provider = ProviderKind.OPENAQ;
        String providerRaw = env.get("AQI_PROVIDER");
        if (providerRaw != null && !providerRaw.isBlank()) {
            if ("mock".equalsIgnoreCase(providerRaw.trim())) {
                provider = ProviderKind.MOCK;
            } else if (!"openaq".equalsIgnoreCase(providerRaw.trim())) {
                warn.accept("Unknown AQI_PROVIDER=" + providerRaw + ", defaulting to openaq");
            }
        }
        Path mockFile = configDir.resolve("mock-air-quality.json");
        String mockRaw = env.get("AQI_MOCK_FILE");
        if (mockRaw != null && !mockRaw.isBlank()) {
            mockFile = Path.of(mockRaw.trim());
        }

        List<String> cities = AqiCollectorConfig.parseCityList(env.get("CITIES"));
        Duration interval = parseMinutes(env.get("INGEST_MINUTES"), warn);

        return new ServiceSettings(port, dataDir, configDir, baseUrl, origins, provider, mockFile, cities, interval);
    }

    /**
     * Environment overrides win over the file-based config.
     */
    public AqiCollectorConfig applyTo(AqiCollectorConfig fileConfig) {
        AqiCollectorConfig merged = fileConfig;
        if (!cities.isEmpty()) {
            merged = merged.withCities(cities);
        }
        if (ingestInterval != null) {
            merged = merged.withInterval(ingestInterval);
        }
        return merged;
    }

    public Path measurementsFile() {
        return dataDir.resolve("measurements.jsonl");
    }

    private static int parsePort(String raw, Consumer<String> warn) {
        if (raw == null || raw.isBlank()) {
            return DEFAULT_PORT;
        }
        try {
            int port = Integer.parseInt(raw.trim());
            if (port >= 0 && port <= 65535) {
                return port;
            }
        } catch (NumberFormatException e) {
            warn.accept("Unparseable PORT=" + raw + ", defaulting to " + DEFAULT_PORT);
            return DEFAULT_PORT;
        }
        warn.accept("Invalid PORT=" + raw + ", defaulting to " + DEFAULT_PORT);
        return DEFAULT_PORT;
    }

    private static Duration parseMinutes(String raw, Consumer<String> warn) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        try {
            int minutes = Integer.parseInt(raw.trim());
            if (minutes >= 1) {
                return Duration.ofMinutes(minutes);
            }
        } catch (NumberFormatException e) {
            warn.accept("Unparseable INGEST_MINUTES=" + raw + ", using configured interval");
            return null;
        }
        warn.accept("Invalid INGEST_MINUTES=" + raw + ", using configured interval");
        return null;
    }

    private static List<String> splitCsv(String raw) {
        List<String> values = new ArrayList<>();
        for (String part : raw.split(",")) {
            if (!part.isBlank()) {
                values.add(part.trim());
            }
        }
        return values;
    }

    private static String valueOrDefault(String raw, String fallback) {
        return raw == null || raw.isBlank() ? fallback : raw.trim();
    }
}
