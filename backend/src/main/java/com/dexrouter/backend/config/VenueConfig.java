package com.dexrouter.backend.config;

import com.dexrouter.backend.model.Venue;
import com.dexrouter.backend.service.venue.MockQuoteSource;
import com.dexrouter.backend.service.venue.MockSettlementGateway;
import com.dexrouter.backend.service.venue.QuoteSource;
import com.dexrouter.backend.service.venue.SettlementGateway;
import io.github.resilience4j.timelimiter.TimeLimiter;
import io.github.resilience4j.timelimiter.TimeLimiterConfig;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.security.SecureRandom;
import java.time.Duration;
import java.util.Random;
import java.util.concurrent.Executor;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;

@Configuration
public class VenueConfig {

    @Bean
    public QuoteSource raydiumQuoteSource(RouterProperties properties,
                                          @Qualifier("quoteExecutor") Executor quoteExecutor) {
        RouterProperties.VenueSettings venue = properties.getVenue();
        return new MockQuoteSource(Venue.RAYDIUM, venue.getRaydium(), venue.getBasePrice(),
                venue.getQuoteLatencyMs(), new SecureRandom(), quoteExecutor);
    }

    @Bean
    public QuoteSource meteoraQuoteSource(RouterProperties properties,
                                          @Qualifier("quoteExecutor") Executor quoteExecutor) {
        RouterProperties.VenueSettings venue = properties.getVenue();
        return new MockQuoteSource(Venue.METEORA, venue.getMeteora(), venue.getBasePrice(),
                venue.getQuoteLatencyMs(), new SecureRandom(), quoteExecutor);
    }

    @Bean
    public SettlementGateway settlementGateway(RouterProperties properties) {
        return new MockSettlementGateway(properties.getSettlement(), new Random());
    }

    @Bean
    public TimeLimiter quoteTimeLimiter(RouterProperties properties) {
        TimeLimiterConfig config = TimeLimiterConfig.custom()
                .timeoutDuration(Duration.ofMillis(properties.getVenue().getQuoteTimeoutMs()))
                .cancelRunningFuture(true)
                .build();
        return TimeLimiter.of("venue-quote", config);
    }

    @Bean(name = "quoteTimeoutScheduler", destroyMethod = "shutdownNow")
    public ScheduledExecutorService quoteTimeoutScheduler() {
        return Executors.newSingleThreadScheduledExecutor(r -> {
            Thread thread = new Thread(r, "quote-timeout");
            thread.setDaemon(true);
            return thread;
        });
    }
}
