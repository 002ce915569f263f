package com.aqiindia.service.runtime;

import com.aqiindia.collectors.api.Collector;
import com.aqiindia.collectors.api.CollectorContext;
import com.aqiindia.collectors.api.CollectorResult;
import com.aqiindia.core.events.AlertRaised;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

public class SchedulerService {
    private static final Logger LOGGER = Logger.getLogger(SchedulerService.class.getName());

    private final List<ScheduledCollector> collectors;
    private final CollectorContext context;
    private final long minIntervalMillis;
    private final ScheduledExecutorService timerExecutor = Executors.newSingleThreadScheduledExecutor();
    private final ExecutorService collectorExecutor;

    public SchedulerService(List<ScheduledCollector> collectors, CollectorContext context) {
        this(collectors, context, 100);
    }

    SchedulerService(List<ScheduledCollector> collectors, CollectorContext context, long minIntervalMillis) {
        this.collectors = List.copyOf(collectors);
        this.context = context;
        this.minIntervalMillis = minIntervalMillis;
        this.collectorExecutor = Executors.newFixedThreadPool(Math.max(1, this.collectors.size()));
    }

    public void start() {
        for (ScheduledCollector scheduled : collectors) {
            if (!scheduled.enabled()) {
                LOGGER.info(() -> "Collector " + scheduled.collector().name() + " is disabled");
                continue;
            }
            long intervalMillis = Math.max(minIntervalMillis, scheduled.interval().toMillis());
            timerExecutor.scheduleAtFixedRate(
                    () -> collectorExecutor.submit(() -> runCollectorSafely(scheduled.collector())),
                    0,
                    intervalMillis,
                    TimeUnit.MILLISECONDS
            );
            LOGGER.info(() -> "Scheduled " + scheduled.collector().name() + " every " + intervalMillis + " ms");
        }
    }

    public List<CollectorResult> runOnceAllCollectors() {
        List<CompletableFuture<CollectorResult>> tasks = new ArrayList<>();
        for (ScheduledCollector scheduled : collectors) {
            if (!scheduled.enabled()) {
                continue;
            }
            tasks.add(CompletableFuture.supplyAsync(() -> runCollectorSafely(scheduled.collector()), collectorExecutor));
        }
        List<CollectorResult> results = new ArrayList<>();
        for (CompletableFuture<CollectorResult> task : tasks) {
            results.add(task.join());
        }
        return results;
    }

    public void shutdown() {
        timerExecutor.shutdown();
        collectorExecutor.shutdown();
        try {
            timerExecutor.awaitTermination(5, TimeUnit.SECONDS);
            collectorExecutor.awaitTermination(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private CollectorResult runCollectorSafely(Collector collector) {
        try {
            CollectorResult result = collector.poll(context).join();
            LOGGER.fine(() -> collector.name() + " finished: " + result.message() + " " + result.stats());
            return result;
        } catch (Exception ex) {
            LOGGER.log(Level.WARNING, "Collector run failed: " + collector.name(), ex);
            context.eventBus().publish(new AlertRaised(
                    context.clock().instant(),
                    "collector",
                    "Collector run failed: " + collector.name() + " - " + ex.getMessage(),
                    Map.of("collector", collector.name())
            ));
            return CollectorResult.failure(
                    "Collector run failed: " + collector.name(),
                    Map.of("collector", collector.name())
            );
        }
    }

    public record ScheduledCollector(Collector collector, Duration interval, boolean enabled) {
        public ScheduledCollector {
            Objects.requireNonNull(collector, "collector is required");
            Objects.requireNonNull(interval, "interval is required");
        }
    }
}
