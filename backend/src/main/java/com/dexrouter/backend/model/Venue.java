package com.dexrouter.backend.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum Venue {
    RAYDIUM("Raydium"),
    METEORA("Meteora");

    private final String displayName;

    Venue(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
