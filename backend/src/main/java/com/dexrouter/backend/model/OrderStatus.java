package com.dexrouter.backend.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Swap order lifecycle.
 * An attempt walks PENDING -> ROUTING -> BUILDING -> SUBMITTED -> CONFIRMED; any non-terminal
 * state may fall back to PENDING (retry scheduled) or move to FAILED (retries exhausted).
 */
public enum OrderStatus {
    PENDING,     // Queued, or waiting for a retry
    ROUTING,     // Comparing venue quotes
    BUILDING,    // Constructing the transaction
    SUBMITTED,   // Sent to the venue for settlement
    CONFIRMED,   // Settled
    FAILED;      // Retries exhausted

    public boolean isTerminal() {
        return this == CONFIRMED || this == FAILED;
    }

    public boolean canTransitionTo(OrderStatus target) {
        if (target == null) return false;
        if (isTerminal()) return false;
        if (this == target) return true;

        return switch (this) {
            case PENDING -> target == ROUTING || target == FAILED;
            case ROUTING -> target == BUILDING || target == PENDING || target == FAILED;
            case BUILDING -> target == SUBMITTED || target == PENDING || target == FAILED;
            case SUBMITTED -> target == CONFIRMED || target == PENDING || target == FAILED;
            default -> false;
        };
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static OrderStatus fromString(String status) {
        if (status == null || status.isBlank()) {
            return null;
        }
        return valueOf(status.trim().toUpperCase(Locale.ROOT));
    }
}
