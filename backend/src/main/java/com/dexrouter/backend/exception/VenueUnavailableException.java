package com.dexrouter.backend.exception;

import com.dexrouter.backend.model.Venue;

/**
 * A venue did not return a quote in time, or returned an error. Retryable.
 */
public class VenueUnavailableException extends RuntimeException {
    private final Venue venue;

    public VenueUnavailableException(Venue venue, String message) {
        super(message);
        this.venue = venue;
    }

    public VenueUnavailableException(Venue venue, String message, Throwable cause) {
        super(message, cause);
        this.venue = venue;
    }

    public Venue getVenue() {
        return venue;
    }
}
