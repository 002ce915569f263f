package com.aqiindia.service.aqi;

import com.aqiindia.collectors.aqi.ProviderReading;
import com.aqiindia.core.aqi.AqiAssessment;
import com.aqiindia.core.aqi.AqiCategory;
import com.aqiindia.core.aqi.InvalidConcentrationException;
import com.aqiindia.core.aqi.Measurement;
import com.aqiindia.core.aqi.Pollutant;
import com.aqiindia.core.model.AirQualitySignal;
import com.aqiindia.service.store.CityAqiRanking;
import com.aqiindia.service.store.JsonlMeasurementStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AirQualityServiceTest {
    private static final Instant NOW = Instant.parse("2026-02-09T20:00:00Z");
    private static final Clock CLOCK = Clock.fixed(NOW, ZoneOffset.UTC);

    @TempDir
    Path tempDir;

    private JsonlMeasurementStore store;
    private final Map<String, ProviderReading> readings = new ConcurrentHashMap<>();
    private final AtomicInteger lookups = new AtomicInteger();
    private AirQualityService service;

    @BeforeEach
    void setUp() {
        store = new JsonlMeasurementStore(tempDir.resolve("measurements.jsonl"));
        service = new AirQualityService(store, city -> {
            lookups.incrementAndGet();
            if ("Broken".equalsIgnoreCase(city)) {
                throw new IllegalStateException("OpenAQ request failed with status 500 for Broken");
            }
            return Optional.ofNullable(readings.get(city));
        }, "TEST", CLOCK);
    }

    @Test
    void fetchesAndPersistsWhenNothingIsStoredThenServesFromStore() throws Exception {
        readings.put("Delhi", reading("Delhi", 45.0, 150.0, Instant.parse("2026-02-09T19:00:00Z")));

        CityAqiStatus fresh = service.cityStatus("Delhi", false);
        assertFalse(fresh.cached());
        assertEquals(134, fresh.aqi());
        assertEquals("Moderate", fresh.category());
        assertEquals("pm10", fresh.dominantPollutant());
        assertEquals(Map.of("pm25", 76, "pm10", 134), fresh.subIndices());
        assertEquals(Instant.parse("2026-02-09T19:00:00Z"), fresh.observedAt());
        assertNull(fresh.message());

        CityAqiStatus cached = service.cityStatus("delhi", false);
        assertTrue(cached.cached());
        assertEquals(134, cached.aqi());
        assertEquals(1, lookups.get());
        assertEquals(1, Files.readAllLines(tempDir.resolve("measurements.jsonl")).size());
    }

    @Test
    void refreshAlwaysQueriesProvider() {
        readings.put("Delhi", reading("Delhi", 45.0, null, null));
        service.cityStatus("Delhi", false);

        readings.put("Delhi", reading("Delhi", 600.0, null, null));
        CityAqiStatus refreshed = service.cityStatus("Delhi", true);

        assertEquals(2, lookups.get());
        assertEquals(1331, refreshed.aqi());
        assertEquals(AqiCategory.SEVERE.label(), refreshed.category());
        assertEquals(NOW, refreshed.observedAt());
        assertEquals(1331, store.latest("Delhi").orElseThrow().aqi());
    }

    @Test
    void missingReadingIsNoDataAndIsPersistedWithNullFields() {
        CityAqiStatus status = service.cityStatus("Chennai", false);

        assertNull(status.aqi());
        assertNull(status.pm25());
        assertNull(status.pm10());
        assertTrue(status.subIndices().isEmpty());
        assertEquals(AirQualityService.NO_DATA_MESSAGE, status.message());
        assertEquals("TEST", status.source());

        AirQualitySignal stored = store.latest("Chennai").orElseThrow();
        assertNull(stored.aqi());
        assertTrue(service.topCities(10).isEmpty());
    }

    @Test
    void providerFailureIsReportedAsUnavailable() {
        ProviderUnavailableException error = assertThrows(
                ProviderUnavailableException.class,
                () -> service.cityStatus("Broken", true)
        );
        assertTrue(error.getMessage().contains("status 500"));
        assertTrue(store.latest("Broken").isEmpty());
    }

    @Test
    void blankCityIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> service.cityStatus("   ", false));
        assertThrows(IllegalArgumentException.class, () -> service.cityStatus(null, false));
    }

    @Test
    void topCitiesValidatesLimit() {
        assertThrows(IllegalArgumentException.class, () -> service.topCities(0));
        assertThrows(IllegalArgumentException.class, () -> service.topCities(AirQualityService.MAX_TOP_CITIES + 1));

        readings.put("Delhi", reading("Delhi", 45.0, 150.0, null));
        readings.put("Mumbai", reading("Mumbai", null, 40.0, null));
        service.cityStatus("Mumbai", false);
        service.cityStatus("Delhi", false);

        assertEquals(List.of("Delhi", "Mumbai"), service.topCities(5).stream().map(CityAqiRanking::city).toList());
    }

    @Test
    void computeTakesWorstPollutant() {
        AqiAssessment assessment = service.compute("45", "150");

        assertEquals(134, assessment.aqi());
        assertEquals(Pollutant.PM10, assessment.dominantPollutant());
        assertEquals(76, assessment.subIndex(Pollutant.PM25).getAsInt());
    }

    @Test
    void computeTreatsBlankAsNoData() {
        AqiAssessment onlyPm10 = service.compute("", "40");
        assertEquals(40, onlyPm10.aqi());
        assertTrue(onlyPm10.subIndex(Pollutant.PM25).isEmpty());

        AqiAssessment none = service.compute(null, " ");
        assertFalse(none.hasData());
        assertTrue(none.overallAqi().isEmpty());
    }

    @Test
    void computeRejectsNonNumericAndNegativeInput() {
        InvalidConcentrationException text = assertThrows(
                InvalidConcentrationException.class,
                () -> service.compute("abc", null)
        );
        assertEquals(Pollutant.PM25, text.pollutant());
        assertThrows(InvalidConcentrationException.class, () -> service.compute(null, "-1"));
    }

    private static ProviderReading reading(String city, Double pm25, Double pm10, Instant observedAt) {
        List<Measurement> measurements = new ArrayList<>();
        if (pm25 != null) {
            measurements.add(new Measurement(Pollutant.PM25, pm25));
        }
        if (pm10 != null) {
            measurements.add(new Measurement(Pollutant.PM10, pm10));
        }
        return new ProviderReading(city, measurements, observedAt, "TEST");
    }
}
