package com.dexrouter.backend.service.queue;

/**
 * Runs one execution attempt for an order and reports what the queue should do next.
 */
@FunctionalInterface
public interface OrderJobProcessor {

    AttemptResult process(String orderId);

    /**
     * Called when {@link #process} threw on the order's last allowed attempt, so the order still has to be
     * moved to its terminal failed status.
     */
    default void abandon(String orderId, String error, int attempts) {
    }
}
