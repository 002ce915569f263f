package com.aqiindia.core.model;

import com.aqiindia.core.aqi.AqiAssessment;
import com.aqiindia.core.aqi.Pollutant;

import java.time.Instant;
import java.util.Objects;

/**
 * One persisted observation for a city. Null fields mean the provider had no value; they are never
 * stored as zero.
 */
public record AirQualitySignal(
        String city,
        Instant observedAt,
        Integer aqi,
        String category,
        Double pm25,
        Double pm10,
        Integer pm25SubIndex,
        Integer pm10SubIndex,
        String source
) {
    public AirQualitySignal {
        Objects.requireNonNull(city, "city is required");
        Objects.requireNonNull(observedAt, "observedAt is required");
    }

    public static AirQualitySignal from(String city, Instant observedAt, AqiAssessment assessment, String source) {
        return new AirQualitySignal(
                city,
                observedAt,
                assessment.aqi(),
                assessment.category() == null ? null : assessment.category().label(),
                assessment.concentrations().get(Pollutant.PM25),
                assessment.concentrations().get(Pollutant.PM10),
                assessment.subIndices().get(Pollutant.PM25),
                assessment.subIndices().get(Pollutant.PM10),
                source
        );
    }

    public boolean hasAqi() {
        return aqi != null;
    }
}
