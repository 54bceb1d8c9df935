package com.dexrouter.backend.service;

import com.dexrouter.backend.config.RouterProperties;
import com.dexrouter.backend.dto.OrderStatusEvent;
import com.dexrouter.backend.exception.SettlementFailureException;
import com.dexrouter.backend.exception.VenueUnavailableException;
import com.dexrouter.backend.model.OrderStatus;
import com.dexrouter.backend.model.SwapOrder;
import com.dexrouter.backend.model.Venue;
import com.dexrouter.backend.service.queue.AttemptResult;
import com.dexrouter.backend.service.queue.OrderJobProcessor;
import com.dexrouter.backend.service.venue.Quote;
import com.dexrouter.backend.service.venue.QuotePair;
import com.dexrouter.backend.service.venue.SettlementGateway;
import com.dexrouter.backend.service.venue.SettlementRequest;
import com.dexrouter.backend.service.venue.SettlementResult;
import com.dexrouter.backend.service.venue.VenueQuoteService;
import com.dexrouter.backend.service.venue.VenueSelection;
import com.dexrouter.backend.service.venue.VenueSelector;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Drives one execution attempt of an order: routing, building, settlement. Each step is persisted before
 * the matching status event is published and before the next step starts. Any failure inside the attempt
 * becomes a retry or, once {@code maxRetries} attempts have failed, the terminal failed status.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class OrderExecutionEngine implements OrderJobProcessor {

    private final OrderService orderService;
    private final OrderStateMachine stateMachine;
    private final VenueQuoteService venueQuoteService;
    private final VenueSelector venueSelector;
    private final SettlementGateway settlementGateway;
    private final OrderStatusBroadcaster broadcaster;
    private final MetricsService metricsService;
    private final RouterProperties properties;

    @Override
    public AttemptResult process(String orderId) {
        MDC.put("orderId", orderId);
        try {
            Optional<SwapOrder> stored = orderService.find(orderId);
            if (stored.isEmpty()) {
                log.warn("Order vanished before execution orderId={}", orderId);
                return AttemptResult.skipped("Order not found");
            }
            SwapOrder order = stored.get();
            if (order.getStatus().isTerminal()) {
                log.info("Order already {} orderId={}, nothing to do", order.getStatus(), orderId);
                return AttemptResult.skipped("Order already " + order.getStatus().wireName());
            }
            try {
                execute(order);
                metricsService.recordOrderConfirmed();
                return AttemptResult.confirmed(order.getRetryCount());
            } catch (RuntimeException ex) {
                return handleFailure(orderId, ex);
            }
        } finally {
            MDC.remove("orderId");
        }
    }

    @Override
    public void abandon(String orderId, String error, int attempts) {
        MDC.put("orderId", orderId);
        try {
            SwapOrder current = orderService.get(orderId);
            if (current.getStatus().isTerminal()) {
                return;
            }
            int retryCount = Math.max(attempts, current.getRetryCount());
            stateMachine.fail(orderId, error, retryCount);
            metricsService.recordOrderFailed();
            broadcaster.publish(OrderStatusEvent.failed(orderId, error, retryCount));
        } finally {
            MDC.remove("orderId");
        }
    }

    private void execute(SwapOrder order) {
        String orderId = order.getId();
        double amount = order.getAmount().doubleValue();
        log.info("Executing order orderId={} amount={} {}->{} attempt={}",
                orderId, order.getAmount(), order.getAssetIn(), order.getAssetOut(), order.getRetryCount() + 1);

        stateMachine.transition(orderId, OrderStatus.ROUTING);
        QuotePair quotes = venueQuoteService.fetchQuotes(order.getAssetIn(), order.getAssetOut(), amount);
        VenueSelection selection = venueSelector.select(quotes);
        SwapOrder routed = stateMachine.recordRouting(orderId, quotes, selection);
        metricsService.recordVenueSelected(selection.venue());
        log.info("Routed orderId={} venue={} reason={}", orderId, selection.venue(), selection.reason());
        broadcaster.publish(OrderStatusEvent.routing(orderId, selection.venue(),
                routed.getRaydiumPrice(), routed.getMeteoraPrice(), selection.reason()));

        Venue venue = selection.venue();
        Quote chosen = quotes.forVenue(venue);
        SettlementRequest request = new SettlementRequest(orderId, venue, amount, chosen.price(), chosen.fee(),
                order.getSlippage().doubleValue());

        stateMachine.transition(orderId, OrderStatus.BUILDING);
        broadcaster.publish(OrderStatusEvent.of(orderId, OrderStatus.BUILDING));
        settlementGateway.buildTransaction(request);

        stateMachine.transition(orderId, OrderStatus.SUBMITTED);
        broadcaster.publish(OrderStatusEvent.of(orderId, OrderStatus.SUBMITTED));
        SettlementResult result = settlementGateway.settle(request);
        if (!result.success()) {
            throw new SettlementFailureException(venue,
                    result.error() != null ? result.error() : "Swap execution failed");
        }

        stateMachine.confirm(orderId, result.executedPrice(), result.reference());
        broadcaster.publish(OrderStatusEvent.confirmed(orderId, result.reference(), result.executedPrice(),
                result.actualOutput()));
    }

    private AttemptResult handleFailure(String orderId, RuntimeException ex) {
        String error = describe(ex);
        metricsService.recordAttemptFailure(reason(ex));
        if (ex instanceof VenueUnavailableException || ex instanceof SettlementFailureException) {
            log.warn("Attempt failed orderId={} error={}", orderId, error);
        } else {
            log.error("Attempt failed unexpectedly orderId={}", orderId, ex);
        }

        SwapOrder current = orderService.get(orderId);
        int retryCount = current.getRetryCount() + 1;
        int maxRetries = properties.getQueue().getMaxRetries();

        if (retryCount >= maxRetries) {
            stateMachine.fail(orderId, error, retryCount);
            metricsService.recordOrderFailed();
            broadcaster.publish(OrderStatusEvent.failed(orderId, error, retryCount));
            return AttemptResult.failed(retryCount, error);
        }
        stateMachine.scheduleRetry(orderId, error, retryCount);
        broadcaster.publish(OrderStatusEvent.retrying(orderId, error, retryCount));
        return AttemptResult.retry(retryCount, error);
    }

    private String describe(RuntimeException ex) {
        String message = ex.getMessage();
        return message == null || message.isBlank() ? ex.getClass().getSimpleName() : message;
    }

    private String reason(RuntimeException ex) {
        if (ex instanceof VenueUnavailableException) {
            return "venue_unavailable";
        }
        if (ex instanceof SettlementFailureException) {
            return "settlement_failure";
        }
        return "internal_error";
    }
}
