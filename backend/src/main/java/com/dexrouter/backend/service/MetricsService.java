package com.dexrouter.backend.service;

import com.dexrouter.backend.model.Venue;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.function.Supplier;

@Service
@Slf4j
@RequiredArgsConstructor
public class MetricsService {

    private final MeterRegistry meterRegistry;

    private Counter ordersSubmittedCounter;
    private Counter ordersConfirmedCounter;
    private Counter ordersFailedCounter;
    private Counter statusEventsCounter;

    @PostConstruct
    void init() {
        ordersSubmittedCounter = Counter.builder("orders_submitted_total").register(meterRegistry);
        ordersConfirmedCounter = Counter.builder("orders_confirmed_total").register(meterRegistry);
        ordersFailedCounter = Counter.builder("orders_failed_total").register(meterRegistry);
        statusEventsCounter = Counter.builder("status_events_published_total").register(meterRegistry);
    }

    public void incrementOrdersSubmitted() {
        if (ordersSubmittedCounter != null) {
            ordersSubmittedCounter.increment();
        }
    }

    public void recordOrderConfirmed() {
        if (ordersConfirmedCounter != null) {
            ordersConfirmedCounter.increment();
        }
    }

    public void recordOrderFailed() {
        if (ordersFailedCounter != null) {
            ordersFailedCounter.increment();
        }
    }

    public void recordStatusEventPublished() {
        if (statusEventsCounter != null) {
            statusEventsCounter.increment();
        }
    }

    public void recordAttemptFailure(String reason) {
        Counter.builder("order_attempt_failures_total")
                .tag("reason", reason == null ? "unknown" : reason)
                .register(meterRegistry)
                .increment();
    }

    public void recordVenueSelected(Venue venue) {
        Counter.builder("venue_selected_total")
                .tag("venue", venue.wireName())
                .register(meterRegistry)
                .increment();
    }

    public void registerQueueGauge(String name, Supplier<Number> value) {
        Gauge.builder(name, value).register(meterRegistry);
    }
}
