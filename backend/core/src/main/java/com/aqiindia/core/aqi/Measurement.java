package com.aqiindia.core.aqi;

import java.time.Instant;
import java.util.Objects;

public record Measurement(Pollutant pollutant, double concentration, Instant observedAt) {
    public Measurement {
        Objects.requireNonNull(pollutant, "pollutant is required");
        concentration = AqiCalculator.requireValidConcentration(pollutant, concentration);
    }

    public Measurement(Pollutant pollutant, double concentration) {
        this(pollutant, concentration, null);
    }
}
