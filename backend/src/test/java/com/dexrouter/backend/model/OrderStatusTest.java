package com.dexrouter.backend.model;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class OrderStatusTest {

    @Test
    void attemptWalksForwardThroughEveryStage() {
        assertThat(OrderStatus.PENDING.canTransitionTo(OrderStatus.ROUTING)).isTrue();
        assertThat(OrderStatus.ROUTING.canTransitionTo(OrderStatus.BUILDING)).isTrue();
        assertThat(OrderStatus.BUILDING.canTransitionTo(OrderStatus.SUBMITTED)).isTrue();
        assertThat(OrderStatus.SUBMITTED.canTransitionTo(OrderStatus.CONFIRMED)).isTrue();
    }

    @Test
    void stagesCannotBeSkipped() {
        assertThat(OrderStatus.PENDING.canTransitionTo(OrderStatus.SUBMITTED)).isFalse();
        assertThat(OrderStatus.ROUTING.canTransitionTo(OrderStatus.CONFIRMED)).isFalse();
        assertThat(OrderStatus.PENDING.canTransitionTo(OrderStatus.CONFIRMED)).isFalse();
    }

    @Test
    void inFlightStatusesMayFallBackToPendingOrFail() {
        for (OrderStatus status : new OrderStatus[]{OrderStatus.ROUTING, OrderStatus.BUILDING, OrderStatus.SUBMITTED}) {
            assertThat(status.canTransitionTo(OrderStatus.PENDING)).as(status.name()).isTrue();
            assertThat(status.canTransitionTo(OrderStatus.FAILED)).as(status.name()).isTrue();
        }
        assertThat(OrderStatus.PENDING.canTransitionTo(OrderStatus.FAILED)).isTrue();
    }

    @Test
    void terminalStatusesAreFinal() {
        for (OrderStatus target : OrderStatus.values()) {
            assertThat(OrderStatus.CONFIRMED.canTransitionTo(target)).isFalse();
            assertThat(OrderStatus.FAILED.canTransitionTo(target)).isFalse();
        }
        assertThat(OrderStatus.CONFIRMED.isTerminal()).isTrue();
        assertThat(OrderStatus.FAILED.isTerminal()).isTrue();
        assertThat(OrderStatus.SUBMITTED.isTerminal()).isFalse();
    }

    @Test
    void wireNamesAreLowercase() {
        assertThat(OrderStatus.SUBMITTED.wireName()).isEqualTo("submitted");
        assertThat(OrderStatus.fromString(" Confirmed ")).isEqualTo(OrderStatus.CONFIRMED);
        assertThat(OrderStatus.fromString("")).isNull();
    }

    @Test
    void orderRejectsInvalidTransition() {
        SwapOrder order = SwapOrder.builder()
                .id("order-1")
                .assetIn("SOL")
                .assetOut("USDC")
                .amount(BigDecimal.ONE)
                .slippage(new BigDecimal("0.01"))
                .createdAt(Instant.now())
                .updatedAt(Instant.now())
                .build();

        assertThatThrownBy(() -> order.transitionTo(OrderStatus.CONFIRMED))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("PENDING -> CONFIRMED");

        order.transitionTo(OrderStatus.ROUTING);
        assertThat(order.getStatus()).isEqualTo(OrderStatus.ROUTING);
    }
}
