package com.aqiindia.collectors.config;

import java.time.Duration;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

public record AqiCollectorConfig(Duration interval, List<String> cities) {
    public static final Duration DEFAULT_INTERVAL = Duration.ofMinutes(10);
    public static final List<String> DEFAULT_CITIES = List.of("Delhi", "Mumbai", "Kolkata", "Bengaluru", "Hyderabad");

    public AqiCollectorConfig {
        interval = interval == null ? DEFAULT_INTERVAL : interval;
        cities = normalizeCities(cities == null ? DEFAULT_CITIES : cities);
    }

    public AqiCollectorConfig withCities(List<String> replacement) {
        return new AqiCollectorConfig(interval, replacement);
    }

    public AqiCollectorConfig withInterval(Duration replacement) {
        return new AqiCollectorConfig(replacement, cities);
    }

    public static List<String> parseCityList(String csv) {
        if (csv == null || csv.isBlank()) {
            return List.of();
        }
        return normalizeCities(List.of(csv.split(",")));
    }

    private static List<String> normalizeCities(List<String> raw) {
        Set<String> normalized = new LinkedHashSet<>();
        for (String city : raw) {
            if (city == null || city.isBlank()) {
                continue;
            }
            normalized.add(city.trim());
        }
        return List.copyOf(normalized);
    }
}
