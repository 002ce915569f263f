package com.aqiindia.collectors.api;

import com.aqiindia.core.model.AirQualitySignal;

import java.util.Optional;

public interface MeasurementStore {
    void append(AirQualitySignal signal);

    /** Most recently observed signal for the city, matched case-insensitively. */
    Optional<AirQualitySignal> latest(String city);
}
