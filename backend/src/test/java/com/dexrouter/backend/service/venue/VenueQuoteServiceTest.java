package com.dexrouter.backend.service.venue;

import com.dexrouter.backend.exception.VenueUnavailableException;
import com.dexrouter.backend.model.Venue;
import io.github.resilience4j.timelimiter.TimeLimiter;
import io.github.resilience4j.timelimiter.TimeLimiterConfig;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.function.Supplier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class VenueQuoteServiceTest {

    private final ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor();
    private final TimeLimiter timeLimiter = TimeLimiter.of("test", TimeLimiterConfig.custom()
            .timeoutDuration(Duration.ofMillis(100))
            .build());

    @AfterEach
    void tearDown() {
        scheduler.shutdownNow();
    }

    @Test
    void fetchesBothVenues() {
        VenueQuoteService service = service(
                () -> CompletableFuture.completedFuture(Quote.of(Venue.RAYDIUM, 2, 100, 0.003, 1e6)),
                () -> CompletableFuture.completedFuture(Quote.of(Venue.METEORA, 2, 99, 0.002, 2e6)));

        QuotePair pair = service.fetchQuotes("SOL", "USDC", 2);

        assertThat(pair.raydium().price()).isEqualTo(100);
        assertThat(pair.meteora().price()).isEqualTo(99);
        assertThat(pair.forVenue(Venue.METEORA).liquidity()).isEqualTo(2e6);
    }

    @Test
    void slowVenueTimesOut() {
        VenueQuoteService service = service(
                () -> CompletableFuture.completedFuture(Quote.of(Venue.RAYDIUM, 2, 100, 0.003, 1e6)),
                CompletableFuture::new);

        assertThatThrownBy(() -> service.fetchQuotes("SOL", "USDC", 2))
                .isInstanceOf(VenueUnavailableException.class)
                .hasMessage("Meteora quote timed out after 100ms")
                .satisfies(ex -> assertThat(((VenueUnavailableException) ex).getVenue()).isEqualTo(Venue.METEORA));
    }

    @Test
    void venueErrorIsWrapped() {
        VenueQuoteService service = service(
                () -> CompletableFuture.failedFuture(new IllegalStateException("pool drained")),
                () -> CompletableFuture.completedFuture(Quote.of(Venue.METEORA, 2, 99, 0.002, 2e6)));

        assertThatThrownBy(() -> service.fetchQuotes("SOL", "USDC", 2))
                .isInstanceOf(VenueUnavailableException.class)
                .hasMessage("Raydium quote failed: pool drained");
    }

    @Test
    void missingSourceIsUnavailable() {
        VenueQuoteService service = new VenueQuoteService(
                List.of(new StubSource(Venue.RAYDIUM, () -> CompletableFuture.completedFuture(
                        Quote.of(Venue.RAYDIUM, 2, 100, 0.003, 1e6)))),
                timeLimiter, scheduler);

        assertThatThrownBy(() -> service.fetchQuotes("SOL", "USDC", 2))
                .isInstanceOf(VenueUnavailableException.class)
                .hasMessageContaining("Meteora quote source is not configured");
    }

    private VenueQuoteService service(Supplier<CompletableFuture<Quote>> raydium,
                                      Supplier<CompletableFuture<Quote>> meteora) {
        return new VenueQuoteService(
                List.of(new StubSource(Venue.RAYDIUM, raydium), new StubSource(Venue.METEORA, meteora)),
                timeLimiter, scheduler);
    }

    private static final class StubSource implements QuoteSource {
        private final Venue venue;
        private final Supplier<CompletableFuture<Quote>> answer;

        private StubSource(Venue venue, Supplier<CompletableFuture<Quote>> answer) {
            this.venue = venue;
            this.answer = answer;
        }

        @Override
        public Venue venue() {
            return venue;
        }

        @Override
        public CompletableFuture<Quote> quote(String assetIn, String assetOut, double amount) {
            return answer.get();
        }
    }
}
