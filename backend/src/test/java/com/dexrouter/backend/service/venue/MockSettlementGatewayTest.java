package com.dexrouter.backend.service.venue;

import com.dexrouter.backend.config.RouterProperties;
import com.dexrouter.backend.model.Venue;
import org.junit.jupiter.api.Test;

import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class MockSettlementGatewayTest {

    private static RouterProperties.Settlement instantSettlement(double failureRate) {
        RouterProperties.Settlement settings = new RouterProperties.Settlement();
        settings.setBuildDelayMs(0);
        settings.setMinLatencyMs(0);
        settings.setMaxLatencyMs(0);
        settings.setFailureRate(failureRate);
        return settings;
    }

    @Test
    void fillsWithinSlippageToleranceAndIssuesReference() {
        MockSettlementGateway gateway = new MockSettlementGateway(instantSettlement(0.0), new Random(3));
        SettlementRequest request = new SettlementRequest("order-1", Venue.RAYDIUM, 1.5, 100.0, 0.003, 0.01);

        for (int i = 0; i < 200; i++) {
            SettlementResult result = gateway.settle(request);
            assertThat(result.success()).isTrue();
            assertThat(result.executedPrice()).isBetween(99.0, 101.0);
            assertThat(result.actualOutput()).isCloseTo(1.5 * result.executedPrice() * 0.997, within(1e-9));
            assertThat(result.reference()).hasSize(88).matches("[1-9A-HJ-NP-Za-km-z]+");
        }
    }

    @Test
    void declinesWithVenueSpecificError() {
        MockSettlementGateway gateway = new MockSettlementGateway(instantSettlement(1.0), new Random(3));

        SettlementResult result = gateway.settle(new SettlementRequest("order-2", Venue.METEORA, 1, 100, 0.002, 0.01));

        assertThat(result.success()).isFalse();
        assertThat(result.reference()).isNull();
        assertThat(result.error()).isEqualTo("meteora network timeout - transaction failed to confirm");
    }
}
