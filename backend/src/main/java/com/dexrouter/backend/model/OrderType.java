package com.dexrouter.backend.model;

import com.fasterxml.jackson.annotation.JsonCreator;

import java.util.Locale;

/**
 * Only market orders execute; the other kinds are accepted by the type system but rejected on submission.
 */
public enum OrderType {
    MARKET,
    LIMIT,
    SNIPER;

    @JsonCreator
    public static OrderType fromString(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
