package com.dexrouter.backend.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.time.Instant;

@Entity
@Table(name = "swap_orders")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Slf4j
public class SwapOrder {

    @Id
    @Column(length = 36)
    private String id;

    @Column(name = "asset_in", nullable = false, length = 50)
    private String assetIn;

    @Column(name = "asset_out", nullable = false, length = 50)
    private String assetOut;

    @Column(nullable = false, precision = 20, scale = 8)
    private BigDecimal amount;

    @Column(nullable = false, precision = 5, scale = 4)
    private BigDecimal slippage;

    @Enumerated(EnumType.STRING)
    @Column(name = "order_type", nullable = false, length = 20)
    @Builder.Default
    private OrderType orderType = OrderType.MARKET;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    @Builder.Default
    private OrderStatus status = OrderStatus.PENDING;

    @Enumerated(EnumType.STRING)
    @Column(name = "selected_venue", length = 20)
    private Venue selectedVenue;

    @Column(name = "raydium_price", precision = 20, scale = 8)
    private BigDecimal raydiumPrice;

    @Column(name = "meteora_price", precision = 20, scale = 8)
    private BigDecimal meteoraPrice;

    @Column(name = "executed_price", precision = 20, scale = 8)
    private BigDecimal executedPrice;

    @Column(name = "settlement_ref", length = 100)
    private String settlementRef;

    @Column(name = "last_error", length = 2000)
    private String lastError;

    @Column(name = "retry_count", nullable = false)
    private int retryCount;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    /**
     * Moves the order to a new status.
     * @throws IllegalStateException if the lifecycle does not allow the move
     */
    public void transitionTo(OrderStatus newStatus) {
        if (!status.canTransitionTo(newStatus)) {
            throw new IllegalStateException(
                String.format("Invalid status transition: %s -> %s for order %s", status, newStatus, id)
            );
        }
        if (status == newStatus) {
            return;
        }
        OrderStatus previous = this.status;
        this.status = newStatus;
        this.updatedAt = Instant.now();
        log.debug("Order status transition orderId={} from={} to={}", id, previous, newStatus);
    }

    public BigDecimal quotedPriceFor(Venue venue) {
        if (venue == null) {
            return null;
        }
        return venue == Venue.RAYDIUM ? raydiumPrice : meteoraPrice;
    }
}
