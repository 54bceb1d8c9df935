package com.dexrouter.backend.service;

import com.dexrouter.backend.exception.NotFoundException;
import com.dexrouter.backend.model.OrderStatus;
import com.dexrouter.backend.model.RoutingDecision;
import com.dexrouter.backend.model.SwapOrder;
import com.dexrouter.backend.repository.RoutingDecisionRepository;
import com.dexrouter.backend.repository.SwapOrderRepository;
import com.dexrouter.backend.service.venue.Quote;
import com.dexrouter.backend.service.venue.QuotePair;
import com.dexrouter.backend.service.venue.VenueSelection;
import com.dexrouter.backend.util.PriceUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;

/**
 * Persists order lifecycle changes. Every method is one transaction on one order and refuses to touch an
 * order that is already terminal.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class OrderStateMachine {

    private static final int MAX_ERROR_LENGTH = 2000;

    private final SwapOrderRepository orderRepository;
    private final RoutingDecisionRepository routingDecisionRepository;

    @Transactional
    public SwapOrder transition(String orderId, OrderStatus target) {
        SwapOrder order = load(orderId);
        OrderStatus current = order.getStatus();
        order.transitionTo(target);
        SwapOrder saved = orderRepository.save(order);
        log.info("Order status orderId={} from={} to={}", orderId, current, target);
        return saved;
    }

    /**
     * Appends the routing decision and copies the selected venue and both quoted prices onto the order.
     */
    @Transactional
    public SwapOrder recordRouting(String orderId, QuotePair quotes, VenueSelection selection) {
        SwapOrder order = load(orderId);
        if (order.getStatus() != OrderStatus.ROUTING) {
            throw new IllegalStateException("Order " + orderId + " is not routing but " + order.getStatus());
        }
        Quote raydium = quotes.raydium();
        Quote meteora = quotes.meteora();
        Instant now = Instant.now();

        routingDecisionRepository.save(RoutingDecision.builder()
                .orderId(orderId)
                .raydiumPrice(PriceUtils.price(raydium.price()))
                .raydiumFee(PriceUtils.fee(raydium.fee()))
                .raydiumOutput(PriceUtils.price(raydium.estimatedOutput()))
                .raydiumLiquidity(PriceUtils.liquidity(raydium.liquidity()))
                .meteoraPrice(PriceUtils.price(meteora.price()))
                .meteoraFee(PriceUtils.fee(meteora.fee()))
                .meteoraOutput(PriceUtils.price(meteora.estimatedOutput()))
                .meteoraLiquidity(PriceUtils.liquidity(meteora.liquidity()))
                .selectedVenue(selection.venue())
                .reason(PriceUtils.truncate(selection.reason(), MAX_ERROR_LENGTH))
                .createdAt(now)
                .build());

        order.setSelectedVenue(selection.venue());
        order.setRaydiumPrice(PriceUtils.price(raydium.price()));
        order.setMeteoraPrice(PriceUtils.price(meteora.price()));
        order.setUpdatedAt(now);
        return orderRepository.save(order);
    }

    @Transactional
    public SwapOrder confirm(String orderId, double executedPrice, String settlementRef) {
        SwapOrder order = load(orderId);
        order.transitionTo(OrderStatus.CONFIRMED);
        order.setExecutedPrice(PriceUtils.price(executedPrice));
        order.setSettlementRef(settlementRef);
        order.setLastError(null);
        SwapOrder saved = orderRepository.save(order);
        log.info("Order confirmed orderId={} venue={} executedPrice={} ref={}",
                orderId, order.getSelectedVenue(), saved.getExecutedPrice(), settlementRef);
        return saved;
    }

    /**
     * Puts the order back to pending after a failed attempt; the scheduler re-admits it later.
     */
    @Transactional
    public SwapOrder scheduleRetry(String orderId, String error, int retryCount) {
        SwapOrder order = load(orderId);
        order.transitionTo(OrderStatus.PENDING);
        order.setLastError(PriceUtils.truncate(error, MAX_ERROR_LENGTH));
        order.setRetryCount(retryCount);
        order.setUpdatedAt(Instant.now());
        return orderRepository.save(order);
    }

    @Transactional
    public SwapOrder fail(String orderId, String error, int retryCount) {
        SwapOrder order = load(orderId);
        order.transitionTo(OrderStatus.FAILED);
        order.setLastError(PriceUtils.truncate(error, MAX_ERROR_LENGTH));
        order.setRetryCount(retryCount);
        order.setUpdatedAt(Instant.now());
        SwapOrder saved = orderRepository.save(order);
        log.warn("Order failed orderId={} retryCount={} error={}", orderId, retryCount, error);
        return saved;
    }

    private SwapOrder load(String orderId) {
        return orderRepository.findById(orderId)
                .orElseThrow(() -> new NotFoundException("Order not found: " + orderId));
    }
}
