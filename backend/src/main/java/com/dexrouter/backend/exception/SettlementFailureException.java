package com.dexrouter.backend.exception;

import com.dexrouter.backend.model.Venue;

/**
 * Settlement was declined by the venue. Retryable.
 */
public class SettlementFailureException extends RuntimeException {
    private final Venue venue;

    public SettlementFailureException(Venue venue, String message) {
        super(message);
        this.venue = venue;
    }

    public Venue getVenue() {
        return venue;
    }
}
