package com.aqiindia.service.runtime;

import com.aqiindia.core.bus.EventBus;
import com.aqiindia.core.events.AlertRaised;
import com.aqiindia.core.events.AqiUpdated;
import com.aqiindia.core.events.CollectorTickCompleted;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Writes bus traffic to the service log: alerts at WARNING, AQI updates at INFO, tick timings at FINE.
 */
public final class EventLogger {
    private final Logger logger;

    public EventLogger(Logger logger) {
        this.logger = logger;
    }

    public static EventLogger attach(EventBus eventBus) {
        EventLogger eventLogger = new EventLogger(Logger.getLogger(EventLogger.class.getName()));
        eventBus.subscribe(AlertRaised.class, eventLogger::onAlert);
        eventBus.subscribe(AqiUpdated.class, eventLogger::onAqiUpdated);
        eventBus.subscribe(CollectorTickCompleted.class, eventLogger::onTickCompleted);
        return eventLogger;
    }

    void onAlert(AlertRaised alert) {
        logger.log(Level.WARNING, "[{0}] {1}", new Object[]{alert.category(), alert.message()});
    }

    void onAqiUpdated(AqiUpdated update) {
        if (AqiUpdated.STATUS_NO_DATA.equals(update.status())) {
            logger.log(Level.INFO, "{0}: no particulate data from {1}", new Object[]{update.city(), update.source()});
            return;
        }
        logger.log(Level.INFO, "{0}: AQI {1} ({2}) pm25={3} pm10={4}",
                new Object[]{update.city(), update.aqi(), update.category(), update.pm25(), update.pm10()});
    }

    void onTickCompleted(CollectorTickCompleted tick) {
        logger.log(Level.FINE, "{0} tick completed success={1} in {2} ms",
                new Object[]{tick.collectorName(), tick.success(), tick.durationMillis()});
    }
}
