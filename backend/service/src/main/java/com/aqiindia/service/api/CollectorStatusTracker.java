package com.aqiindia.service.api;

import com.aqiindia.core.bus.EventBus;
import com.aqiindia.core.events.AlertRaised;
import com.aqiindia.core.events.AqiUpdated;
import com.aqiindia.core.events.CollectorTickCompleted;
import com.aqiindia.core.events.CollectorTickStarted;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.LongAdder;

public final class CollectorStatusTracker {
    private final ConcurrentHashMap<String, CollectorStatus> collectorStatuses = new ConcurrentHashMap<>();
    private final LongAdder aqiUpdates = new LongAdder();
    private final LongAdder noDataUpdates = new LongAdder();

    public CollectorStatusTracker(EventBus eventBus) {
        eventBus.subscribe(CollectorTickStarted.class, this::onTickStarted);
        eventBus.subscribe(CollectorTickCompleted.class, this::onTickCompleted);
        eventBus.subscribe(AlertRaised.class, this::onAlertRaised);
        eventBus.subscribe(AqiUpdated.class, this::onAqiUpdated);
    }

    private CollectorStatusTracker() {
    }

    public static CollectorStatusTracker empty() {
        return new CollectorStatusTracker();
    }

    public Map<String, Object> collectorsSnapshot() {
        Map<String, Object> collectors = new HashMap<>();
        for (Map.Entry<String, CollectorStatus> entry : collectorStatuses.entrySet()) {
            collectors.put(entry.getKey(), entry.getValue().toMap());
        }
        return collectors;
    }

    public Map<String, Object> statusSnapshot() {
        Map<String, Object> snapshot = new HashMap<>();
        snapshot.put("collectors", collectorsSnapshot());
        snapshot.put("aqiUpdatesTotal", aqiUpdates.longValue());
        snapshot.put("noDataUpdatesTotal", noDataUpdates.longValue());
        return snapshot;
    }

    private void onTickStarted(CollectorTickStarted event) {
        collectorStatuses.compute(event.collectorName(), (name, current) -> {
            CollectorStatus status = current == null ? CollectorStatus.empty() : current;
            return status.withLastRunAt(event.timestamp());
        });
    }

    private void onTickCompleted(CollectorTickCompleted event) {
        collectorStatuses.compute(event.collectorName(), (name, current) -> {
            CollectorStatus status = current == null ? CollectorStatus.empty() : current;
            return status.withCompletion(event.timestamp(), event.durationMillis(), event.success());
        });
    }

    private void onAlertRaised(AlertRaised event) {
        if (!"collector".equalsIgnoreCase(event.category()) || event.details() == null) {
            return;
        }
        Object collector = event.details().get("collector");
        if (!(collector instanceof String collectorName) || collectorName.isBlank()) {
            return;
        }
        collectorStatuses.compute(collectorName, (name, current) -> {
            CollectorStatus status = current == null ? CollectorStatus.empty() : current;
            return status.withLastErrorMessage(event.message());
        });
    }

    private void onAqiUpdated(AqiUpdated event) {
        aqiUpdates.increment();
        if (AqiUpdated.STATUS_NO_DATA.equals(event.status())) {
            noDataUpdates.increment();
        }
    }

    private record CollectorStatus(
            Instant lastRunAt,
            Long lastDurationMillis,
            Boolean lastSuccess,
            String lastErrorMessage
    ) {
        private static CollectorStatus empty() {
            return new CollectorStatus(null, null, null, null);
        }

        private CollectorStatus withLastRunAt(Instant runAt) {
            return new CollectorStatus(runAt, lastDurationMillis, lastSuccess, lastErrorMessage);
        }

        private CollectorStatus withCompletion(Instant runAt, long durationMillis, boolean success) {
            return new CollectorStatus(runAt, durationMillis, success, success ? null : lastErrorMessage);
        }

        private CollectorStatus withLastErrorMessage(String message) {
            return new CollectorStatus(lastRunAt, lastDurationMillis, lastSuccess, message);
        }

        private Map<String, Object> toMap() {
            Map<String, Object> map = new HashMap<>();
            map.put("lastRunAt", lastRunAt == null ? null : lastRunAt.toString());
            map.put("lastDurationMillis", lastDurationMillis);
            map.put("lastSuccess", lastSuccess);
            map.put("lastErrorMessage", lastErrorMessage);
            return map;
        }
    }
}
