package com.dexrouter.backend.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Append-only record of one routing phase. A retry that routes again writes a new row.
 */
@Entity
@Table(name = "routing_decisions")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RoutingDecision {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "order_id", nullable = false, length = 36)
    private String orderId;

    @Column(name = "raydium_price", nullable = false, precision = 20, scale = 8)
    private BigDecimal raydiumPrice;

    @Column(name = "raydium_fee", nullable = false, precision = 5, scale = 4)
    private BigDecimal raydiumFee;

    @Column(name = "raydium_output", nullable = false, precision = 24, scale = 8)
    private BigDecimal raydiumOutput;

    @Column(name = "raydium_liquidity", nullable = false, precision = 24, scale = 2)
    private BigDecimal raydiumLiquidity;

    @Column(name = "meteora_price", nullable = false, precision = 20, scale = 8)
    private BigDecimal meteoraPrice;

    @Column(name = "meteora_fee", nullable = false, precision = 5, scale = 4)
    private BigDecimal meteoraFee;

    @Column(name = "meteora_output", nullable = false, precision = 24, scale = 8)
    private BigDecimal meteoraOutput;

    @Column(name = "meteora_liquidity", nullable = false, precision = 24, scale = 2)
    private BigDecimal meteoraLiquidity;

    @Enumerated(EnumType.STRING)
    @Column(name = "selected_venue", nullable = false, length = 20)
    private Venue selectedVenue;

    @Column(nullable = false, length = 2000)
    private String reason;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;
}
