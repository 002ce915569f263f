package com.aqiindia.service.aqi;

import com.aqiindia.core.aqi.AqiAssessment;
import com.aqiindia.core.aqi.Pollutant;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * JSON shape of an on-demand calculation. Pollutants are keyed by their provider parameter name.
 */
public record AqiView(
        Double pm25,
        Double pm10,
        Map<String, Integer> subIndices,
        Integer aqi,
        String category,
        String dominantPollutant,
        String message
) {
    public static AqiView of(AqiAssessment assessment) {
        return new AqiView(
                assessment.concentrations().get(Pollutant.PM25),
                assessment.concentrations().get(Pollutant.PM10),
                subIndicesByParameter(assessment),
                assessment.aqi(),
                assessment.category() == null ? null : assessment.category().label(),
                assessment.dominantPollutant() == null ? null : assessment.dominantPollutant().parameter(),
                assessment.hasData() ? null : AirQualityService.NO_DATA_MESSAGE
        );
    }

    static Map<String, Integer> subIndicesByParameter(AqiAssessment assessment) {
        Map<String, Integer> byParameter = new LinkedHashMap<>();
        assessment.subIndices().forEach((pollutant, value) -> byParameter.put(pollutant.parameter(), value));
        return byParameter;
    }
}
