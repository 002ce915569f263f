package com.aqiindia.core.aqi;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.OptionalInt;

public record AqiAssessment(
        Map<Pollutant, Double> concentrations,
        Map<Pollutant, Integer> subIndices,
        Integer aqi,
        AqiCategory category,
        Pollutant dominantPollutant
) {
    public AqiAssessment {
        concentrations = Collections.unmodifiableMap(copy(concentrations));
        subIndices = Collections.unmodifiableMap(copy(subIndices));
    }

    public static AqiAssessment noData() {
        return new AqiAssessment(Map.of(), Map.of(), null, null, null);
    }

    public boolean hasData() {
        return aqi != null;
    }

    public OptionalInt overallAqi() {
        return aqi == null ? OptionalInt.empty() : OptionalInt.of(aqi);
    }

    public OptionalDouble concentration(Pollutant pollutant) {
        Double value = concentrations.get(pollutant);
        return value == null ? OptionalDouble.empty() : OptionalDouble.of(value);
    }

    public OptionalInt subIndex(Pollutant pollutant) {
        Integer value = subIndices.get(pollutant);
        return value == null ? OptionalInt.empty() : OptionalInt.of(value);
    }

    private static <V> Map<Pollutant, V> copy(Map<Pollutant, V> source) {
        Map<Pollutant, V> copy = new EnumMap<>(Pollutant.class);
        if (source != null) {
            copy.putAll(source);
        }
        return copy;
    }
}
