package com.aqiindia.core.bus;

import com.aqiindia.core.events.AqiUpdated;
import com.aqiindia.core.events.CollectorTickStarted;
import com.aqiindia.core.events.Event;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;

class EventBusTest {
    private static final Instant T0 = Instant.parse("2026-01-01T00:00:00Z");

    @Test
    void publishNotifiesEverySubscriberOfTheType() {
        EventBus bus = new EventBus();
        AtomicInteger hitsA = new AtomicInteger();
        AtomicInteger hitsB = new AtomicInteger();

        bus.subscribe(CollectorTickStarted.class, event -> hitsA.incrementAndGet());
        bus.subscribe(CollectorTickStarted.class, event -> hitsB.incrementAndGet());

        bus.publish(new CollectorTickStarted(T0, "aqiCollector"));

        assertEquals(1, hitsA.get());
        assertEquals(1, hitsB.get());
    }

    @Test
    void publishRoutesByTypeAndDeliversToSupertypeSubscribers() {
        EventBus bus = new EventBus();
        AtomicInteger tickHits = new AtomicInteger();
        AtomicInteger aqiHits = new AtomicInteger();
        AtomicInteger allHits = new AtomicInteger();

        bus.subscribe(CollectorTickStarted.class, event -> tickHits.incrementAndGet());
        bus.subscribe(AqiUpdated.class, event -> aqiHits.incrementAndGet());
        bus.subscribe(Event.class, event -> allHits.incrementAndGet());

        bus.publish(new CollectorTickStarted(T0, "aqiCollector"));
        bus.publish(new AqiUpdated(T0, "Delhi", 180, "Moderate", 80.0, null, "OPENAQ", AqiUpdated.STATUS_OK));

        assertEquals(1, tickHits.get());
        assertEquals(1, aqiHits.get());
        assertEquals(2, allHits.get());
    }

    @Test
    void unsubscribeHandleStopsDelivery() {
        EventBus bus = new EventBus();
        AtomicInteger hits = new AtomicInteger();
        Runnable unsubscribe = bus.subscribe(CollectorTickStarted.class, event -> hits.incrementAndGet());

        bus.publish(new CollectorTickStarted(T0, "aqiCollector"));
        unsubscribe.run();
        bus.publish(new CollectorTickStarted(T0, "aqiCollector"));

        assertEquals(1, hits.get());
        assertEquals(0, bus.subscriberCount());
    }

    @Test
    void publishContinuesWhenHandlerThrows() {
        AtomicReference<Exception> capturedError = new AtomicReference<>();
        EventBus bus = new EventBus((event, error) -> capturedError.set(error));
        AtomicInteger safeHits = new AtomicInteger();

        bus.subscribe(CollectorTickStarted.class, event -> {
            throw new RuntimeException("boom");
        });
        bus.subscribe(CollectorTickStarted.class, event -> safeHits.incrementAndGet());

        bus.publish(new CollectorTickStarted(T0, "aqiCollector"));

        assertEquals(1, safeHits.get());
        assertNotNull(capturedError.get());
        assertEquals("boom", capturedError.get().getMessage());
    }
}
