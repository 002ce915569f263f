package com.aqiindia.service.store;

import com.aqiindia.core.model.AirQualitySignal;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.ArrayList;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JsonlMeasurementStoreTest {
    private static final Instant T0 = Instant.parse("2026-02-09T18:00:00Z");

    @TempDir
    Path tempDir;

    @Test
    void appendsOneLinePerSignalAndCreatesParentDirectories() throws Exception {
        Path file = tempDir.resolve("nested/data/measurements.jsonl");
        JsonlMeasurementStore store = new JsonlMeasurementStore(file);

        store.append(signal("Delhi", T0, 134, 45.0, 150.0));
        store.append(signal("Mumbai", T0, null, null, null));

        List<String> lines = Files.readAllLines(file);
        assertEquals(2, lines.size());
        assertTrue(lines.get(0).contains("\"city\":\"Delhi\""));
        assertTrue(lines.get(1).contains("\"city\":\"Mumbai\""));
        // absent values are omitted, never written as zero
        assertTrue(!lines.get(1).contains("\"aqi\""));
    }

    @Test
    void latestMatchesCityCaseInsensitivelyAndPrefersNewestObservation() {
        JsonlMeasurementStore store = new JsonlMeasurementStore(tempDir.resolve("m.jsonl"));
        store.append(signal("Delhi", T0.plusSeconds(600), 150, 60.0, null));
        store.append(signal("Delhi", T0, 120, 50.0, null));
        store.append(signal("Kolkata", T0.plusSeconds(1200), 90, 40.0, null));

        AirQualitySignal latest = store.latest("  delhi ").orElseThrow();
        assertEquals(150, latest.aqi());
        assertTrue(store.latest("Chennai").isEmpty());
    }

    @Test
    void latestReturnsNullFieldsForNoDataSignal() {
        JsonlMeasurementStore store = new JsonlMeasurementStore(tempDir.resolve("m.jsonl"));
        store.append(signal("Patna", T0, null, null, null));

        AirQualitySignal latest = store.latest("Patna").orElseThrow();
        assertNull(latest.aqi());
        assertNull(latest.pm25());
        assertNull(latest.pm10());
    }

    @Test
    void topCitiesRanksWorstAqiPerCityAndSkipsCitiesWithoutAqi() {
        JsonlMeasurementStore store = new JsonlMeasurementStore(tempDir.resolve("m.jsonl"));
        store.append(signal("Delhi", T0, 134, 45.0, 150.0));
        store.append(signal("delhi", T0.plusSeconds(60), 301, 120.0, null));
        store.append(signal("Mumbai", T0, 40, null, 40.0));
        store.append(signal("Kolkata", T0, 1331, 600.0, null));
        store.append(signal("Patna", T0, null, null, null));

        List<CityAqiRanking> top = store.topCities(10);
        assertEquals(3, top.size());
        assertEquals("Kolkata", top.get(0).city());
        assertEquals(1331, top.get(0).aqi());
        assertEquals("Severe", top.get(0).category());
        assertEquals(301, top.get(1).aqi());
        assertEquals("Very Poor", top.get(1).category());
        assertEquals("Mumbai", top.get(2).city());

        assertEquals(1, store.topCities(1).size());
    }

    @Test
    void latestBreaksObservationTiesByWriteOrder() {
        JsonlMeasurementStore store = new JsonlMeasurementStore(tempDir.resolve("m.jsonl"));
        store.append(signal("Delhi", T0, 120, 50.0, null));
        store.append(signal("DELHI", T0, 134, 45.0, null));

        assertEquals(134, store.latest("Delhi").orElseThrow().aqi());
    }

    @Test
    void missingFileReadsAsEmpty() {
        JsonlMeasurementStore store = new JsonlMeasurementStore(tempDir.resolve("absent.jsonl"));

        assertTrue(store.latest("Delhi").isEmpty());
        assertTrue(store.topCities(10).isEmpty());
    }

    @Test
    void corruptLineFailsWithLineNumber() throws Exception {
        Path file = tempDir.resolve("m.jsonl");
        JsonlMeasurementStore store = new JsonlMeasurementStore(file);
        store.append(signal("Delhi", T0, 134, 45.0, 150.0));
        Files.writeString(file, Files.readString(file) + "{not json\n");

        IllegalStateException error = assertThrows(IllegalStateException.class, () -> store.latest("Delhi"));
        assertEquals("Invalid JSONL measurement at line 2", error.getMessage());
    }

    @Test
    void concurrentAppendsKeepEveryLineIntact() throws Exception {
        Path file = tempDir.resolve("m.jsonl");
        JsonlMeasurementStore store = new JsonlMeasurementStore(file);
        ExecutorService pool = Executors.newFixedThreadPool(4);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int worker = 0; worker < 4; worker++) {
                String city = "City" + worker;
                futures.add(pool.submit(() -> {
                    for (int i = 0; i < 25; i++) {
                        store.append(signal(city, T0.plusSeconds(i), i, (double) i, null));
                    }
                }));
            }
            for (Future<?> future : futures) {
                future.get();
            }
        } finally {
            pool.shutdownNow();
        }

        assertEquals(100, Files.readAllLines(file).size());
        assertEquals(4, store.topCities(10).size());
        assertEquals(24, store.latest("City2").orElseThrow().aqi());
    }

    private static AirQualitySignal signal(String city, Instant observedAt, Integer aqi, Double pm25, Double pm10) {
        return new AirQualitySignal(city, observedAt, aqi, null, pm25, pm10, null, null, "TEST");
    }
}
