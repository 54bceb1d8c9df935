package com.dexrouter.backend.service.venue;

import com.dexrouter.backend.config.RouterProperties;
import com.dexrouter.backend.model.Venue;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.Random;

/**
 * Simulated venue: prices drift randomly around a shared reference price and the answer arrives after a
 * fixed network latency.
 */
public class MockQuoteSource implements QuoteSource {

    private final Venue venue;
    private final RouterProperties.Profile profile;
    private final double basePrice;
    private final long latencyMillis;
    private final Random random;
    private final Executor executor;

    public MockQuoteSource(Venue venue, RouterProperties.Profile profile, double basePrice, long latencyMillis,
                           Random random, Executor executor) {
        this.venue = venue;
        this.profile = profile;
        this.basePrice = basePrice;
        this.latencyMillis = latencyMillis;
        this.random = random;
        this.executor = executor;
    }

    @Override
    public Venue venue() {
        return venue;
    }

    @Override
    public CompletableFuture<Quote> quote(String assetIn, String assetOut, double amount) {
        Executor delayed = CompletableFuture.delayedExecutor(latencyMillis, TimeUnit.MILLISECONDS, executor);
        return CompletableFuture.supplyAsync(() -> price(amount), delayed);
    }

    Quote price(double amount) {
        double variance = between(profile.getPriceVarianceMin(), profile.getPriceVarianceMax());
        double liquidity = between(profile.getLiquidityMin(), profile.getLiquidityMax());
        return Quote.of(venue, amount, basePrice * variance, profile.getFee(), liquidity);
    }

    private double between(double min, double max) {
        if (max <= min) {
            return min;
        }
        return min + random.nextDouble() * (max - min);
    }
}
