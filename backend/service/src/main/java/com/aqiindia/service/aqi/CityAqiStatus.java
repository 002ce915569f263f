package com.aqiindia.service.aqi;

import java.time.Instant;
import java.util.Map;

public record CityAqiStatus(
        String city,
        Double pm25,
        Double pm10,
        Integer aqi,
        String category,
        String dominantPollutant,
        Map<String, Integer> subIndices,
        Instant observedAt,
        String source,
        boolean cached,
        String message
) {
}
