package com.aqiindia.collectors.aqi;

import com.aqiindia.core.aqi.Measurement;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Latest particulate measurements a provider returned for one city. {@code observedAt} is null when
 * the provider did not say when the values were measured.
 */
public record ProviderReading(
        String city,
        List<Measurement> measurements,
        Instant observedAt,
        String source
) {
    public ProviderReading {
        Objects.requireNonNull(city, "city is required");
        measurements = measurements == null ? List.of() : List.copyOf(measurements);
    }
}
