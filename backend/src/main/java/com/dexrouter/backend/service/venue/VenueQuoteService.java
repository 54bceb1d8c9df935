package com.dexrouter.backend.service.venue;

import com.dexrouter.backend.exception.VenueUnavailableException;
import com.dexrouter.backend.model.Venue;
import io.github.resilience4j.timelimiter.TimeLimiter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeoutException;

/**
 * Asks both venues for a quote at the same time and waits for both, each bounded by the quote timeout.
 */
@Service
@Slf4j
public class VenueQuoteService {

    private final Map<Venue, QuoteSource> sources = new EnumMap<>(Venue.class);
    private final TimeLimiter quoteTimeLimiter;
    private final ScheduledExecutorService timeoutScheduler;

    public VenueQuoteService(List<QuoteSource> quoteSources,
                             TimeLimiter quoteTimeLimiter,
                             @Qualifier("quoteTimeoutScheduler") ScheduledExecutorService timeoutScheduler) {
        for (QuoteSource source : quoteSources) {
            sources.put(source.venue(), source);
        }
        this.quoteTimeLimiter = quoteTimeLimiter;
        this.timeoutScheduler = timeoutScheduler;
    }

    public QuotePair fetchQuotes(String assetIn, String assetOut, double amount) {
        CompletableFuture<Quote> raydium = requestQuote(Venue.RAYDIUM, assetIn, assetOut, amount);
        CompletableFuture<Quote> meteora = requestQuote(Venue.METEORA, assetIn, assetOut, amount);
        QuotePair pair = new QuotePair(await(Venue.RAYDIUM, raydium), await(Venue.METEORA, meteora));
        log.debug("Quotes received pair={}/{} raydium={} meteora={}",
                assetIn, assetOut, pair.raydium().price(), pair.meteora().price());
        return pair;
    }

    private CompletableFuture<Quote> requestQuote(Venue venue, String assetIn, String assetOut, double amount) {
        QuoteSource source = sources.get(venue);
        if (source == null) {
            return CompletableFuture.failedFuture(
                    new VenueUnavailableException(venue, venue.getDisplayName() + " quote source is not configured"));
        }
        return quoteTimeLimiter.executeCompletionStage(timeoutScheduler, () -> {
            try {
                return source.quote(assetIn, assetOut, amount);
            } catch (RuntimeException ex) {
                return CompletableFuture.<Quote>failedFuture(ex);
            }
        }).toCompletableFuture();
    }

    private Quote await(Venue venue, CompletableFuture<Quote> future) {
        try {
            Quote quote = future.join();
            if (quote == null) {
                throw new VenueUnavailableException(venue, venue.getDisplayName() + " returned no quote");
            }
            return quote;
        } catch (CompletionException ex) {
            Throwable cause = ex.getCause() != null ? ex.getCause() : ex;
            if (cause instanceof VenueUnavailableException unavailable) {
                throw unavailable;
            }
            if (cause instanceof TimeoutException) {
                throw new VenueUnavailableException(venue, venue.getDisplayName() + " quote timed out after "
                        + quoteTimeLimiter.getTimeLimiterConfig().getTimeoutDuration().toMillis() + "ms", cause);
            }
            throw new VenueUnavailableException(venue, venue.getDisplayName() + " quote failed: " + cause.getMessage(), cause);
        }
    }
}
