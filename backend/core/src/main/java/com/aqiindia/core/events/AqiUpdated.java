package com.aqiindia.core.events;

import java.time.Instant;

/**
 * Published once per city and ingestion tick. {@code status} is {@code OK} when an AQI was computed
 * and {@code NO_DATA} when the provider had no particulate readings for the city.
 */
public record AqiUpdated(
        Instant timestamp,
        String city,
        Integer aqi,
        String category,
        Double pm25,
        Double pm10,
        String source,
        String status
) implements Event {
    public static final String STATUS_OK = "OK";
    public static final String STATUS_NO_DATA = "NO_DATA";

    @Override
    public String type() {
        return "AqiUpdated";
    }
}
