package com.dexrouter.backend.dto;

import com.dexrouter.backend.model.OrderStatus;
import com.dexrouter.backend.model.SwapOrder;
import com.dexrouter.backend.model.Venue;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Status frame pushed to an order's subscriber. {@code type} is {@code snapshot} for the frame sent on attach
 * and {@code status_update} for live transitions.
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record OrderStatusEvent(String type, String orderId, OrderStatus status, Instant timestamp,
                               Map<String, Object> data) {

    public static final String STATUS_UPDATE = "status_update";
    public static final String SNAPSHOT = "snapshot";

    public static OrderStatusEvent of(String orderId, OrderStatus status) {
        return new OrderStatusEvent(STATUS_UPDATE, orderId, status, Instant.now(), Map.of());
    }

    public static OrderStatusEvent routing(String orderId, Venue venue, BigDecimal raydiumPrice,
                                           BigDecimal meteoraPrice, String reason) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("selectedVenue", venue);
        data.put("raydiumPrice", raydiumPrice);
        data.put("meteoraPrice", meteoraPrice);
        data.put("reason", reason);
        return new OrderStatusEvent(STATUS_UPDATE, orderId, OrderStatus.ROUTING, Instant.now(), data);
    }

    public static OrderStatusEvent confirmed(String orderId, String settlementRef, double executedPrice,
                                             double actualOutput) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("settlementRef", settlementRef);
        data.put("executedPrice", executedPrice);
        data.put("actualOutput", actualOutput);
        return new OrderStatusEvent(STATUS_UPDATE, orderId, OrderStatus.CONFIRMED, Instant.now(), data);
    }

    public static OrderStatusEvent failed(String orderId, String error, int retryCount) {
        return new OrderStatusEvent(STATUS_UPDATE, orderId, OrderStatus.FAILED, Instant.now(),
                errorData(error, retryCount));
    }

    public static OrderStatusEvent retrying(String orderId, String error, int retryCount) {
        return new OrderStatusEvent(STATUS_UPDATE, orderId, OrderStatus.PENDING, Instant.now(),
                errorData(error, retryCount));
    }

    /**
     * Current state of a stored order, for a subscriber that attaches mid-flight.
     */
    public static OrderStatusEvent snapshot(SwapOrder order) {
        Map<String, Object> data = new LinkedHashMap<>();
        putIfPresent(data, "selectedVenue", order.getSelectedVenue());
        putIfPresent(data, "raydiumPrice", order.getRaydiumPrice());
        putIfPresent(data, "meteoraPrice", order.getMeteoraPrice());
        putIfPresent(data, "executedPrice", order.getExecutedPrice());
        putIfPresent(data, "settlementRef", order.getSettlementRef());
        putIfPresent(data, "error", order.getLastError());
        data.put("retryCount", order.getRetryCount());
        return new OrderStatusEvent(SNAPSHOT, order.getId(), order.getStatus(), Instant.now(),
                Collections.unmodifiableMap(data));
    }

    public boolean isTerminal() {
        return status != null && status.isTerminal();
    }

    private static Map<String, Object> errorData(String error, int retryCount) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("error", error);
        data.put("retryCount", retryCount);
        return data;
    }

    private static void putIfPresent(Map<String, Object> data, String key, Object value) {
        if (value != null) {
            data.put(key, value);
        }
    }
}
