package com.aqiindia.service;

import com.aqiindia.collectors.api.Collector;
import com.aqiindia.collectors.api.CollectorContext;
import com.aqiindia.collectors.aqi.AirQualityProvider;
import com.aqiindia.collectors.aqi.AqiCollector;
import com.aqiindia.collectors.aqi.MockAirQualityProvider;
import com.aqiindia.collectors.config.AqiCollectorConfig;
import com.aqiindia.core.bus.EventBus;
import com.aqiindia.core.model.CollectorConfig;
import com.aqiindia.service.api.ApiServer;
import com.aqiindia.service.api.CollectorStatusTracker;
import com.aqiindia.service.api.CorsPolicy;
import com.aqiindia.service.aqi.AirQualityService;
import com.aqiindia.service.config.ConfigLoader;
import com.aqiindia.service.config.ServiceSettings;
import com.aqiindia.service.openaq.OpenAqClient;
import com.aqiindia.service.runtime.EventLogger;
import com.aqiindia.service.runtime.SchedulerService;
import com.aqiindia.service.store.JsonlMeasurementStore;

import java.io.IOException;
import java.io.InputStream;
import java.net.http.HttpClient;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.logging.LogManager;
import java.util.logging.Logger;

public final class Main {
    private static final Logger LOGGER = Logger.getLogger(Main.class.getName());
    private static final Duration HTTP_TIMEOUT = Duration.ofSeconds(20);
    private static final Duration CITY_TIMEOUT = Duration.ofSeconds(25);

    private Main() {
    }

    public static void main(String[] args) throws InterruptedException {
        configureLogging();
        ServiceSettings settings = ServiceSettings.fromEnvironment(System.getenv(), LOGGER::warning);
        Clock clock = Clock.systemUTC();

        CollectorConfig aqiCollectorEntry = ConfigLoader.loadCollectors(settings.configDir()).stream()
                .filter(cfg -> AqiCollector.CONFIG_KEY.equals(cfg.name()))
                .findFirst()
                .orElse(null);
        AqiCollectorConfig aqiConfig = resolveAqiConfig(settings, aqiCollectorEntry, ConfigLoader.loadAqi(settings.configDir()));
        boolean enabled = aqiCollectorEntry == null || aqiCollectorEntry.enabled();

        EventBus eventBus = new EventBus();
        EventLogger.attach(eventBus);
        CollectorStatusTracker statusTracker = new CollectorStatusTracker(eventBus);
        JsonlMeasurementStore store = new JsonlMeasurementStore(settings.measurementsFile());

        AirQualityProvider provider = createProvider(settings, clock);
        AqiCollector aqiCollector = new AqiCollector(provider, aqiConfig.interval());
        CollectorContext context = new CollectorContext(
                eventBus,
                store,
                clock,
                CITY_TIMEOUT,
                Map.of(AqiCollector.CONFIG_KEY, aqiConfig)
        );

        SchedulerService scheduler = new SchedulerService(
                List.of(new SchedulerService.ScheduledCollector(aqiCollector, aqiCollector.interval(), enabled)),
                context
        );
        AirQualityService airQualityService = new AirQualityService(store, provider, clock);
        List<Collector> collectors = List.of(aqiCollector);
        ApiServer apiServer = new ApiServer(
                settings.port(),
                airQualityService,
                statusTracker,
                collectors,
                new CorsPolicy(settings.allowedOrigins())
        );

        LOGGER.info(() -> "Polling " + aqiConfig.cities() + " every " + aqiConfig.interval().toSeconds()
                + "s from " + provider.source());
        scheduler.start();
        apiServer.start();

        CountDownLatch shutdownLatch = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            scheduler.shutdown();
            apiServer.stop();
            shutdownLatch.countDown();
        }));

        shutdownLatch.await();
    }

    /**
     * Interval precedence: {@code INGEST_MINUTES}, then {@code intervalSeconds} of the collector's
     * {@code collectors.json} entry, then the ten minute default. Cities come from {@code CITIES}
     * or {@code aqi.json}.
     */
    static AqiCollectorConfig resolveAqiConfig(ServiceSettings settings, CollectorConfig collectorEntry, AqiCollectorConfig fileConfig) {
        AqiCollectorConfig merged = fileConfig;
        if (collectorEntry != null && collectorEntry.intervalSeconds() != null) {
            merged = merged.withInterval(Duration.ofSeconds(collectorEntry.intervalSeconds()));
        }
        return settings.applyTo(merged);
    }

    static AirQualityProvider createProvider(ServiceSettings settings, Clock clock) {
        if (settings.provider() == ServiceSettings.ProviderKind.MOCK) {
            LOGGER.info(() -> "Using mock air quality fixture " + settings.mockFile());
            return new MockAirQualityProvider(settings.mockFile());
        }
        HttpClient httpClient = HttpClient.newBuilder()
                .connectTimeout(HTTP_TIMEOUT)
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
        return new OpenAqClient(httpClient, HTTP_TIMEOUT, clock, settings.openAqBaseUrl());
    }

    private static void configureLogging() {
        try (InputStream in = Main.class.getResourceAsStream("/logging.properties")) {
            if (in != null) {
                LogManager.getLogManager().readConfiguration(in);
            }
        } catch (IOException e) {
            throw new IllegalStateException("Failed reading logging.properties", e);
        }
    }
}
