package com.dexrouter.backend.service.venue;

import com.dexrouter.backend.config.RouterProperties;
import lombok.extern.slf4j.Slf4j;

import java.util.Random;
import java.util.concurrent.TimeUnit;

/**
 * Simulated settlement. Sleeps for the configured build and confirmation times, declines a fixed share of
 * transactions and fills the rest at the quoted price moved by a random offset within the slippage tolerance.
 */
@Slf4j
public class MockSettlementGateway implements SettlementGateway {

    private static final String REFERENCE_ALPHABET = "123456789ABCDEFGHJKLMNPQRSTUVWXYZabcdefghijkmnopqrstuvwxyz";
    private static final int REFERENCE_LENGTH = 88;

    private final RouterProperties.Settlement settings;
    private final Random random;

    public MockSettlementGateway(RouterProperties.Settlement settings, Random random) {
        this.settings = settings;
        this.random = random;
    }

    @Override
    public void buildTransaction(SettlementRequest request) {
        pause(settings.getBuildDelayMs());
    }

    @Override
    public SettlementResult settle(SettlementRequest request) {
        long spread = Math.max(0, settings.getMaxLatencyMs() - settings.getMinLatencyMs());
        pause(settings.getMinLatencyMs() + (spread > 0 ? (long) (random.nextDouble() * spread) : 0));

        if (random.nextDouble() < settings.getFailureRate()) {
            return SettlementResult.declined(
                    request.venue().wireName() + " network timeout - transaction failed to confirm");
        }

        double tolerance = request.slippage();
        double offset = -tolerance + random.nextDouble() * 2 * tolerance;
        double executedPrice = request.quotedPrice() * (1 + offset);
        double actualOutput = request.amount() * executedPrice * (1 - request.fee());
        return SettlementResult.settled(nextReference(), executedPrice, actualOutput);
    }

    private String nextReference() {
        StringBuilder reference = new StringBuilder(REFERENCE_LENGTH);
        for (int i = 0; i < REFERENCE_LENGTH; i++) {
            reference.append(REFERENCE_ALPHABET.charAt(random.nextInt(REFERENCE_ALPHABET.length())));
        }
        return reference.toString();
    }

    private void pause(long millis) {
        if (millis <= 0) {
            return;
        }
        try {
            TimeUnit.MILLISECONDS.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Settlement interrupted", e);
        }
    }
}
