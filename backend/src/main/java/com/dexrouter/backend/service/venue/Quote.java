package com.dexrouter.backend.service.venue;

import com.dexrouter.backend.model.Venue;

/**
 * One venue's offer for a swap. Never persisted on its own.
 */
public record Quote(Venue venue, double price, double fee, double estimatedOutput, double liquidity) {

    public static Quote of(Venue venue, double amount, double price, double fee, double liquidity) {
        return new Quote(venue, price, fee, amount * price * (1 - fee), liquidity);
    }
}
