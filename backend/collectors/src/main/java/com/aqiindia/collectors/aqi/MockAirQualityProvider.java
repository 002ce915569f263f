package com.aqiindia.collectors.aqi;

import com.aqiindia.core.aqi.Measurement;
import com.aqiindia.core.aqi.Pollutant;
import com.aqiindia.core.util.JsonUtils;
import com.fasterxml.jackson.databind.JsonNode;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Serves readings from a JSON fixture instead of a live provider. Concentrations are parsed on each
 * lookup, so a malformed fixture value fails the city that uses it.
 */
public class MockAirQualityProvider implements AirQualityProvider {
    private final Map<String, MockEntry> entries = new ConcurrentHashMap<>();

    public MockAirQualityProvider(Path jsonFile) {
        try (InputStream in = Files.newInputStream(jsonFile)) {
            MockFixture fixture = JsonUtils.objectMapper().readValue(in, MockFixture.class);
            if (fixture.cities() != null) {
                fixture.cities().forEach(entry -> entries.put(key(entry.city()), entry));
            }
        } catch (IOException e) {
            throw new IllegalArgumentException("Failed reading air quality fixture: " + jsonFile, e);
        }
    }

    @Override
    public String source() {
        return "MOCK";
    }

    @Override
    public Optional<ProviderReading> latest(String city) {
        MockEntry entry = entries.get(key(city));
        if (entry == null) {
            throw new IllegalArgumentException("No mock air quality configured for city: " + city);
        }
        List<Measurement> measurements = new ArrayList<>();
        addIfPresent(measurements, Pollutant.PM25, entry.pm25(), entry.observedAt());
        addIfPresent(measurements, Pollutant.PM10, entry.pm10(), entry.observedAt());
        if (measurements.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new ProviderReading(
                entry.city(),
                measurements,
                entry.observedAt(),
                source()
        ));
    }

    private static void addIfPresent(List<Measurement> target, Pollutant pollutant, JsonNode raw, Instant observedAt) {
        OptionalDouble value = ConcentrationValues.fromJson(pollutant, raw);
        if (value.isPresent()) {
            target.add(new Measurement(pollutant, value.getAsDouble(), observedAt));
        }
    }

    private static String key(String city) {
        return city == null ? "" : city.trim().toLowerCase(Locale.ROOT);
    }

    private record MockFixture(List<MockEntry> cities) {
    }

    private record MockEntry(String city, JsonNode pm25, JsonNode pm10, Instant observedAt) {
    }
}
