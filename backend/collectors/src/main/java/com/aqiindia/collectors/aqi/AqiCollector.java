package com.aqiindia.collectors.aqi;

import com.aqiindia.collectors.api.Collector;
import com.aqiindia.collectors.api.CollectorContext;
import com.aqiindia.collectors.api.CollectorResult;
import com.aqiindia.collectors.config.AqiCollectorConfig;
import com.aqiindia.core.aqi.AqiAssessment;
import com.aqiindia.core.aqi.AqiCalculator;
import com.aqiindia.core.events.AlertRaised;
import com.aqiindia.core.events.AqiUpdated;
import com.aqiindia.core.events.CollectorTickCompleted;
import com.aqiindia.core.events.CollectorTickStarted;
import com.aqiindia.core.model.AirQualitySignal;

import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Logger;

/**
 * Polls the provider for every configured city, computes the AQI and persists one signal per city.
 * A failing city raises an alert and does not stop the others. A city that times out is reported
 * as failed and its late result is discarded.
 */
public class AqiCollector implements Collector {
    public static final String CONFIG_KEY = "aqiCollector";
    private static final Logger LOGGER = Logger.getLogger(AqiCollector.class.getName());

    static final int DEFAULT_PARALLELISM = 4;

    private final AirQualityProvider provider;
    private final Duration interval;
    private final Executor executor;

    public AqiCollector(AirQualityProvider provider) {
        this(provider, AqiCollectorConfig.DEFAULT_INTERVAL);
    }

    public AqiCollector(AirQualityProvider provider, Duration interval) {
        this(provider, interval, Executors.newFixedThreadPool(DEFAULT_PARALLELISM, AqiCollector::cityThread));
    }

    public AqiCollector(AirQualityProvider provider, Duration interval, Executor executor) {
        this.provider = Objects.requireNonNull(provider, "provider is required");
        this.interval = Objects.requireNonNull(interval, "interval is required");
        this.executor = Objects.requireNonNull(executor, "executor is required");
    }

    @Override
    public String name() {
        return "aqiCollector";
    }

    @Override
    public Duration interval() {
        return interval;
    }

    @Override
    public CompletableFuture<CollectorResult> poll(CollectorContext ctx) {
        Instant tickStartedAt = ctx.clock().instant();
        ctx.eventBus().publish(new CollectorTickStarted(tickStartedAt, name()));

        AqiCollectorConfig cfg = ctx.requiredConfig(CONFIG_KEY, AqiCollectorConfig.class);
        List<CompletableFuture<CityOutcome>> tasks = cfg.cities().stream()
                .map(city -> {
                    CityAttempt attempt = new CityAttempt(city);
                    return CompletableFuture.supplyAsync(() -> pollCity(attempt, ctx), executor)
                            .orTimeout(ctx.requestTimeout().toMillis(), TimeUnit.MILLISECONDS)
                            .exceptionally(error -> failedOutcome(attempt, ctx, error));
                })
                .toList();

        CompletableFuture<CollectorResult> pipeline = CompletableFuture.allOf(tasks.toArray(CompletableFuture[]::new))
                .thenApply(ignored -> summarize(tasks.stream().map(CompletableFuture::join).toList()));

        return pipeline.handle((result, error) -> {
            long durationMillis = Duration.between(tickStartedAt, ctx.clock().instant()).toMillis();
            if (error != null) {
                ctx.eventBus().publish(new CollectorTickCompleted(ctx.clock().instant(), name(), false, durationMillis));
                return CollectorResult.failure("AQI collector failed: " + rootMessage(error), Map.of("collector", name()));
            }
            ctx.eventBus().publish(new CollectorTickCompleted(
                    ctx.clock().instant(),
                    name(),
                    result.success(),
                    durationMillis
            ));
            return result;
        });
    }

    private CityOutcome pollCity(CityAttempt attempt, CollectorContext ctx) {
        String city = attempt.city();
        Optional<ProviderReading> reading = provider.latest(city);
        AqiAssessment assessment = reading
                .map(value -> AqiCalculator.assess(value.measurements()))
                .orElseGet(AqiAssessment::noData);
        Instant observedAt = reading.map(ProviderReading::observedAt).orElse(null);
        if (observedAt == null) {
            observedAt = ctx.clock().instant();
        }

        AirQualitySignal signal = AirQualitySignal.from(city, observedAt, assessment, provider.source());
        CityOutcome outcome = new CityOutcome(city, true, signal.hasAqi());
        attempt.pending = outcome;
        if (!attempt.claimed.compareAndSet(false, true)) {
            LOGGER.fine(() -> "Discarding late AQI reading for " + city);
            return outcome;
        }
        ctx.measurementStore().append(signal);
        ctx.eventBus().publish(new AqiUpdated(
                ctx.clock().instant(),
                city,
                signal.aqi(),
                signal.category(),
                signal.pm25(),
                signal.pm10(),
                signal.source(),
                signal.hasAqi() ? AqiUpdated.STATUS_OK : AqiUpdated.STATUS_NO_DATA
        ));
        return outcome;
    }

    private CityOutcome failedOutcome(CityAttempt attempt, CollectorContext ctx, Throwable error) {
        String city = attempt.city();
        // the write already started, so the reading counts
        if (!attempt.claimed.compareAndSet(false, true) && unwrap(error) instanceof TimeoutException) {
            return attempt.pending;
        }
        ctx.eventBus().publish(new AlertRaised(
                ctx.clock().instant(),
                "collector",
                "AQI fetch failed for " + city + ": " + rootMessage(error),
                Map.of("collector", name(), "city", city)
        ));
        return new CityOutcome(city, false, false);
    }

    private CollectorResult summarize(List<CityOutcome> outcomes) {
        long successes = outcomes.stream().filter(CityOutcome::success).count();
        long withData = outcomes.stream().filter(CityOutcome::hasAqi).count();

        Map<String, Object> stats = new HashMap<>();
        stats.put("cities", outcomes.stream().map(CityOutcome::city).toList());
        stats.put("successes", successes);
        stats.put("noData", successes - withData);
        stats.put("failures", outcomes.size() - successes);

        if (successes == outcomes.size()) {
            return CollectorResult.success("AQI polling completed", stats);
        }
        return CollectorResult.failure("AQI polling had failures", stats);
    }

    private record CityOutcome(String city, boolean success, boolean hasAqi) {
    }

    private static final class CityAttempt {
        private final String city;
        private final AtomicBoolean claimed = new AtomicBoolean();
        private volatile CityOutcome pending;

        private CityAttempt(String city) {
            this.city = city;
        }

        private String city() {
            return city;
        }
    }

    private static Thread cityThread(Runnable task) {
        Thread thread = new Thread(task, "aqi-city-poller");
        thread.setDaemon(true);
        return thread;
    }

    private static Throwable unwrap(Throwable throwable) {
        Throwable current = throwable;
        while (current instanceof CompletionException && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private static String rootMessage(Throwable throwable) {
        Throwable root = throwable;
        while (root.getCause() != null && (root instanceof CompletionException || root.getMessage() == null)) {
            root = root.getCause();
        }
        return root.getMessage() == null ? root.getClass().getSimpleName() : root.getMessage();
    }
}
