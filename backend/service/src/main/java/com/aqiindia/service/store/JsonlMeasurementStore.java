package com.aqiindia.service.store;

import com.aqiindia.core.aqi.AqiCategory;
import com.aqiindia.core.model.AirQualitySignal;
import com.aqiindia.core.util.JsonUtils;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Append-only log of measurements, one JSON object per line.
 */
public class JsonlMeasurementStore implements ServiceMeasurementStore {
    private static final ObjectMapper MAPPER = JsonUtils.objectMapper();

    private final Path file;
    private final ReentrantLock lock = new ReentrantLock();

    public JsonlMeasurementStore(Path file) {
        this.file = file;
    }

    @Override
    public void append(AirQualitySignal signal) {
        lock.lock();
        try {
            Files.createDirectories(file.toAbsolutePath().getParent());
            try (BufferedWriter writer = Files.newBufferedWriter(
                    file,
                    StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE,
                    StandardOpenOption.APPEND
            )) {
                writer.write(MAPPER.writeValueAsString(signal));
                writer.newLine();
            }
        } catch (IOException e) {
            throw new IllegalStateException("Failed appending measurement for " + signal.city(), e);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Optional<AirQualitySignal> latest(String city) {
        AirQualitySignal latest = null;
        for (AirQualitySignal signal : readAll()) {
            if (!sameCity(signal.city(), city)) {
                continue;
            }
            // later lines win ties
            if (latest == null || !signal.observedAt().isBefore(latest.observedAt())) {
                latest = signal;
            }
        }
        return Optional.ofNullable(latest);
    }

    @Override
    public List<CityAqiRanking> topCities(int limit) {
        Map<String, AirQualitySignal> worstByCity = new LinkedHashMap<>();
        for (AirQualitySignal signal : readAll()) {
            if (!signal.hasAqi()) {
                continue;
            }
            worstByCity.merge(key(signal.city()), signal, (current, candidate) ->
                    candidate.aqi() > current.aqi() ? candidate : current);
        }
        return worstByCity.values().stream()
                .sorted(Comparator.comparing(AirQualitySignal::aqi).reversed()
                        .thenComparing(signal -> signal.city().toLowerCase(Locale.ROOT)))
                .limit(Math.max(0, limit))
                .map(signal -> new CityAqiRanking(
                        signal.city(),
                        signal.aqi(),
                        AqiCategory.forAqi(signal.aqi()).label(),
                        signal.observedAt()
                ))
                .toList();
    }

    private List<AirQualitySignal> readAll() {
        lock.lock();
        try {
            if (!Files.exists(file)) {
                return List.of();
            }
            List<AirQualitySignal> signals = new ArrayList<>();
            int lineNumber = 0;
            for (String line : Files.readAllLines(file, StandardCharsets.UTF_8)) {
                lineNumber++;
                if (line.isBlank()) {
                    continue;
                }
                try {
                    signals.add(MAPPER.readValue(line, AirQualitySignal.class));
                } catch (IOException | RuntimeException decodeError) {
                    throw new IllegalStateException("Invalid JSONL measurement at line " + lineNumber, decodeError);
                }
            }
            return signals;
        } catch (IOException e) {
            throw new IllegalStateException("Failed reading measurements from " + file, e);
        } finally {
            lock.unlock();
        }
    }

    private static boolean sameCity(String stored, String requested) {
        return requested != null && key(stored).equals(key(requested));
    }

    private static String key(String city) {
        return city.trim().toLowerCase(Locale.ROOT);
    }
}
