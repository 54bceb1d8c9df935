package com.dexrouter.backend.service.venue;

import com.dexrouter.backend.model.Venue;

import java.util.concurrent.CompletableFuture;

/**
 * A liquidity venue that prices swaps. Implementations may be slow or fail; callers bound the wait.
 */
public interface QuoteSource {

    Venue venue();

    CompletableFuture<Quote> quote(String assetIn, String assetOut, double amount);
}
