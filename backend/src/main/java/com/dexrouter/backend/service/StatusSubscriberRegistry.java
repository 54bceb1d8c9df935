package com.dexrouter.backend.service;

import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Predicate;

/**
 * Order id to its single live subscriber. Attach and deliver for one order id are serialized on that
 * order's own monitor, so a subscriber's snapshot is always sent before any live event for the same order.
 * Sends for different orders never wait on each other.
 */
@Component
public class StatusSubscriberRegistry {

    private final ConcurrentHashMap<String, Subscription> subscriptions = new ConcurrentHashMap<>();

    /**
     * Installs {@code channel} as the order's subscriber, replacing any previous one.
     *
     * @param primer runs under the order's lock right after install; returning false drops the channel again
     * @return the replaced channel, for the caller to close
     */
    public Optional<StatusChannel> attach(String orderId, StatusChannel channel, Predicate<StatusChannel> primer) {
        while (true) {
            Subscription subscription = subscriptions.computeIfAbsent(orderId, id -> new Subscription());
            synchronized (subscription) {
                if (subscription.retired) {
                    continue;
                }
                StatusChannel previous = subscription.channel;
                subscription.channel = channel;
                if (!primer.test(channel)) {
                    retire(orderId, subscription);
                }
                return previous != null && previous != channel ? Optional.of(previous) : Optional.empty();
            }
        }
    }

    /**
     * Hands the order's subscriber, if any, to {@code delivery} under the order's lock.
     *
     * @param delivery returns false to drop the subscriber afterwards
     * @return the subscriber that was dropped, for the caller to close
     */
    public Optional<StatusChannel> deliver(String orderId, Predicate<StatusChannel> delivery) {
        while (true) {
            Subscription subscription = subscriptions.get(orderId);
            if (subscription == null) {
                return Optional.empty();
            }
            synchronized (subscription) {
                if (subscription.retired) {
                    continue;
                }
                StatusChannel channel = subscription.channel;
                if (channel == null || delivery.test(channel)) {
                    return Optional.empty();
                }
                retire(orderId, subscription);
                return Optional.of(channel);
            }
        }
    }

    /**
     * Removes the subscription only if {@code channel} is still the current one.
     */
    public boolean detach(String orderId, StatusChannel channel) {
        Subscription subscription = subscriptions.get(orderId);
        if (subscription == null) {
            return false;
        }
        synchronized (subscription) {
            if (subscription.retired || subscription.channel != channel) {
                return false;
            }
            retire(orderId, subscription);
            return true;
        }
    }

    public void detachAll(StatusChannel channel) {
        List<String> orderIds = subscriptions.entrySet().stream()
                .filter(entry -> entry.getValue().channel == channel)
                .map(Map.Entry::getKey)
                .toList();
        orderIds.forEach(orderId -> detach(orderId, channel));
    }

    public boolean isAttached(String orderId) {
        Subscription subscription = subscriptions.get(orderId);
        return subscription != null && subscription.channel != null;
    }

    public int size() {
        return (int) subscriptions.values().stream()
                .filter(subscription -> subscription.channel != null)
                .count();
    }

    // Caller holds the subscription's monitor
    private void retire(String orderId, Subscription subscription) {
        subscription.channel = null;
        subscription.retired = true;
        subscriptions.remove(orderId, subscription);
    }

    /**
     * Per-order slot. Once retired it is out of the map and every waiter looks the order up again.
     */
    private static final class Subscription {
        private volatile StatusChannel channel;
        private volatile boolean retired;
    }
}
