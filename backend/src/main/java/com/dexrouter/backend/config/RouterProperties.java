package com.dexrouter.backend.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.List;

@Configuration
@ConfigurationProperties(prefix = "router")
@Data
@Validated
public class RouterProperties {

    @Valid
    private Queue queue = new Queue();

    @Valid
    private VenueSettings venue = new VenueSettings();

    @Valid
    private Settlement settlement = new Settlement();

    private Websocket websocket = new Websocket();

    @Data
    public static class Queue {
        @Min(1)
        private int concurrency = 10;

        @Min(1)
        private int maxOrdersPerMinute = 100;

        // Length of the admission window; one minute outside of tests
        @Min(1)
        private long rateWindowMs = 60_000;

        @Min(1)
        private int maxRetries = 3;

        @Min(1)
        private long retryDelayMs = 1_000;

        @Min(0)
        private int retainCompleted = 100;

        @Min(0)
        private int retainFailed = 500;
    }

    @Data
    public static class VenueSettings {
        @Positive
        private double basePrice = 50_000.0;

        @Min(1)
        private long quoteTimeoutMs = 5_000;

        @Min(0)
        private long quoteLatencyMs = 200;

        @DecimalMin(value = "0.0", inclusive = false)
        @DecimalMax("1.0")
        private double defaultSlippage = 0.01;

        private Profile raydium = new Profile(0.003, 0.98, 1.02, 1_000_000, 10_000_000);

        private Profile meteora = new Profile(0.002, 0.97, 1.02, 500_000, 8_000_000);
    }

    @Data
    public static class Profile {
        private double fee;
        private double priceVarianceMin;
        private double priceVarianceMax;
        private double liquidityMin;
        private double liquidityMax;

        public Profile() {
        }

        public Profile(double fee, double priceVarianceMin, double priceVarianceMax,
                       double liquidityMin, double liquidityMax) {
            this.fee = fee;
            this.priceVarianceMin = priceVarianceMin;
            this.priceVarianceMax = priceVarianceMax;
            this.liquidityMin = liquidityMin;
            this.liquidityMax = liquidityMax;
        }
    }

    @Data
    public static class Settlement {
        @Min(0)
        private long buildDelayMs = 500;

        @Min(0)
        private long minLatencyMs = 2_000;

        @Min(0)
        private long maxLatencyMs = 3_000;

        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double failureRate = 0.05;
    }

    @Data
    public static class Websocket {
        private List<String> allowedOrigins = new ArrayList<>();
    }
}
