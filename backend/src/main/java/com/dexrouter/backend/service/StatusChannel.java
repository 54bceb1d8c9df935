package com.dexrouter.backend.service;

import com.dexrouter.backend.dto.OrderStatusEvent;

import java.io.IOException;

/**
 * Delivery end of one order subscription. Transport-specific: a WebSocket session, a test sink, a queue.
 */
public interface StatusChannel {

    boolean isOpen();

    void send(OrderStatusEvent event) throws IOException;

    /**
     * Ends the subscription. Called when the order reaches a terminal status or another subscriber takes over.
     */
    void close();
}
