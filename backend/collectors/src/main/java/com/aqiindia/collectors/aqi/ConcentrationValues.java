package com.aqiindia.collectors.aqi;

import com.aqiindia.core.aqi.AqiCalculator;
import com.aqiindia.core.aqi.InvalidConcentrationException;
import com.aqiindia.core.aqi.Pollutant;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.OptionalDouble;

/**
 * Reads provider concentration fields, which arrive as JSON numbers, numeric strings or null.
 */
public final class ConcentrationValues {
    private ConcentrationValues() {
    }

    public static OptionalDouble fromJson(Pollutant pollutant, JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return OptionalDouble.empty();
        }
        if (node.isNumber() || node.isTextual()) {
            return AqiCalculator.parseConcentration(pollutant, node.asText());
        }
        throw new InvalidConcentrationException(pollutant, node.toString(), "expected a number");
    }
}
