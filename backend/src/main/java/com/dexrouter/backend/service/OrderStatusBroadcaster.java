package com.dexrouter.backend.service;

import com.dexrouter.backend.dto.OrderStatusEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.function.Supplier;

/**
 * Pushes order status to whoever is currently subscribed to that order.
 * <p>
 * Delivery is best effort: an event reaches the subscriber only if one is attached and open when the
 * event is published. Nothing is buffered for late subscribers; they get a snapshot of the stored order
 * on attach instead. A second subscriber for the same order replaces the first, which is closed.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class OrderStatusBroadcaster {

    private final StatusSubscriberRegistry registry;
    private final MetricsService metricsService;

    public void publish(OrderStatusEvent event) {
        metricsService.recordStatusEventPublished();
        registry.deliver(event.orderId(), channel -> send(channel, event) && !event.isTerminal())
                .ifPresent(StatusChannel::close);
    }

    /**
     * Attaches {@code channel} to the order and sends it the snapshot first. A channel attached to an order
     * that is already terminal receives the snapshot and is closed straight away.
     */
    public void attach(String orderId, StatusChannel channel, Supplier<OrderStatusEvent> snapshot) {
        boolean[] retained = new boolean[1];
        registry.attach(orderId, channel, attached -> {
            OrderStatusEvent current = snapshot.get();
            retained[0] = send(attached, current) && !current.isTerminal();
            return retained[0];
        }).ifPresent(replaced -> {
            log.info("Subscriber replaced orderId={}", orderId);
            replaced.close();
        });
        if (!retained[0]) {
            channel.close();
        }
    }

    public void detach(String orderId, StatusChannel channel) {
        if (registry.detach(orderId, channel)) {
            log.debug("Subscriber detached orderId={}", orderId);
        }
    }

    public void detachAll(StatusChannel channel) {
        registry.detachAll(channel);
    }

    private boolean send(StatusChannel channel, OrderStatusEvent event) {
        if (!channel.isOpen()) {
            return false;
        }
        try {
            channel.send(event);
            return true;
        } catch (IOException | RuntimeException ex) {
            log.warn("Status delivery failed orderId={} status={} error={}", event.orderId(), event.status(), ex.getMessage());
            return false;
        }
    }
}
