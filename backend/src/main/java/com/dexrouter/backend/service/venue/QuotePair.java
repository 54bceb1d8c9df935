package com.dexrouter.backend.service.venue;

import com.dexrouter.backend.model.Venue;

public record QuotePair(Quote raydium, Quote meteora) {

    public Quote forVenue(Venue venue) {
        return venue == Venue.RAYDIUM ? raydium : meteora;
    }
}
