package com.aqiindia.collectors.aqi;

import java.util.Optional;

public interface AirQualityProvider {
    /** Short upper-case provider name recorded as the source of each signal. */
    String source();

    /**
     * Latest particulate readings for a city, or empty when the provider has no data for it.
     *
     * @throws com.aqiindia.core.aqi.InvalidConcentrationException if the provider reports a value that
     *         is not a usable concentration
     */
    Optional<ProviderReading> latest(String city);
}
