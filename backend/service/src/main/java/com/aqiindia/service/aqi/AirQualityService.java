package com.aqiindia.service.aqi;

import com.aqiindia.collectors.aqi.AirQualityProvider;
import com.aqiindia.collectors.aqi.ProviderReading;
import com.aqiindia.core.aqi.AqiAssessment;
import com.aqiindia.core.aqi.AqiCalculator;
import com.aqiindia.core.aqi.Pollutant;
import com.aqiindia.core.model.AirQualitySignal;
import com.aqiindia.service.store.CityAqiRanking;
import com.aqiindia.service.store.ServiceMeasurementStore;

import java.time.Clock;
import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.function.Function;
import java.util.logging.Logger;

public final class AirQualityService {
    public static final String NO_DATA_MESSAGE = "No data available";
    public static final int MAX_TOP_CITIES = 100;

    private static final Logger LOGGER = Logger.getLogger(AirQualityService.class.getName());

    private final ServiceMeasurementStore store;
    private final Function<String, Optional<ProviderReading>> readingLookup;
    private final String providerSource;
    private final Clock clock;

    public AirQualityService(ServiceMeasurementStore store, AirQualityProvider provider, Clock clock) {
        this(store, provider::latest, provider.source(), clock);
    }

    public AirQualityService(
            ServiceMeasurementStore store,
            Function<String, Optional<ProviderReading>> readingLookup,
            String providerSource,
            Clock clock
    ) {
        this.store = store;
        this.readingLookup = readingLookup;
        this.providerSource = providerSource;
        this.clock = clock;
    }

    /**
     * Current status for a city. Uses the latest stored signal unless {@code refresh} is set or nothing
     * is stored yet, in which case the provider is queried and the result persisted.
     */
    public CityAqiStatus cityStatus(String city, boolean refresh) {
        String normalized = city == null ? "" : city.trim();
        if (normalized.isEmpty()) {
            throw new IllegalArgumentException("City must not be blank");
        }
        if (!refresh) {
            Optional<AirQualitySignal> stored = store.latest(normalized);
            if (stored.isPresent()) {
                return fromStored(stored.get());
            }
        }
        return fetchAndStore(normalized);
    }

    public List<CityAqiRanking> topCities(int limit) {
        if (limit < 1 || limit > MAX_TOP_CITIES) {
            throw new IllegalArgumentException("limit must be between 1 and " + MAX_TOP_CITIES);
        }
        return store.topCities(limit);
    }

    public AqiAssessment compute(String pm25Raw, String pm10Raw) {
        Map<Pollutant, Double> concentrations = new EnumMap<>(Pollutant.class);
        putIfPresent(concentrations, Pollutant.PM25, AqiCalculator.parseConcentration(Pollutant.PM25, pm25Raw));
        putIfPresent(concentrations, Pollutant.PM10, AqiCalculator.parseConcentration(Pollutant.PM10, pm10Raw));
        return AqiCalculator.assess(concentrations);
    }

    private CityAqiStatus fetchAndStore(String city) {
        Optional<ProviderReading> reading;
        try {
            reading = readingLookup.apply(city);
        } catch (RuntimeException e) {
            throw new ProviderUnavailableException("Air quality provider failed for " + city + ": " + e.getMessage(), e);
        }
        AqiAssessment assessment = reading
                .map(value -> AqiCalculator.assess(value.measurements()))
                .orElseGet(AqiAssessment::noData);
        Instant observedAt = reading.map(ProviderReading::observedAt).orElse(null);
        if (observedAt == null) {
            observedAt = Instant.now(clock);
        }
        String source = reading.map(ProviderReading::source).orElse(providerSource);
        AirQualitySignal signal = AirQualitySignal.from(city, observedAt, assessment, source);
        store.append(signal);
        if (!assessment.hasData()) {
            LOGGER.info(() -> "No particulate data available for " + city);
        }
        return toStatus(signal, assessment, false);
    }

    private CityAqiStatus fromStored(AirQualitySignal signal) {
        Map<Pollutant, Double> concentrations = new EnumMap<>(Pollutant.class);
        if (signal.pm25() != null) {
            concentrations.put(Pollutant.PM25, signal.pm25());
        }
        if (signal.pm10() != null) {
            concentrations.put(Pollutant.PM10, signal.pm10());
        }
        return toStatus(signal, AqiCalculator.assess(concentrations), true);
    }

    private static CityAqiStatus toStatus(AirQualitySignal signal, AqiAssessment assessment, boolean cached) {
        return new CityAqiStatus(
                signal.city(),
                assessment.concentrations().get(Pollutant.PM25),
                assessment.concentrations().get(Pollutant.PM10),
                assessment.aqi(),
                assessment.category() == null ? null : assessment.category().label(),
                assessment.dominantPollutant() == null ? null : assessment.dominantPollutant().parameter(),
                AqiView.subIndicesByParameter(assessment),
                signal.observedAt(),
                signal.source(),
                cached,
                assessment.hasData() ? null : NO_DATA_MESSAGE
        );
    }

    private static void putIfPresent(Map<Pollutant, Double> target, Pollutant pollutant, OptionalDouble value) {
        if (value.isPresent()) {
            target.put(pollutant, value.getAsDouble());
        }
    }
}
