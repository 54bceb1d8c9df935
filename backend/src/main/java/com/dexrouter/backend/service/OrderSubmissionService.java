package com.dexrouter.backend.service;

import com.dexrouter.backend.config.RouterProperties;
import com.dexrouter.backend.dto.OrderStatusEvent;
import com.dexrouter.backend.dto.SubmitOrderRequest;
import com.dexrouter.backend.dto.SubmitOrderResponse;
import com.dexrouter.backend.exception.BadRequestException;
import com.dexrouter.backend.exception.NotFoundException;
import com.dexrouter.backend.model.OrderType;
import com.dexrouter.backend.model.SwapOrder;
import com.dexrouter.backend.service.queue.OrderQueueService;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.Comparator;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Entry point for clients, whatever the transport: accepts orders, queues them and attaches status
 * subscribers.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class OrderSubmissionService {

    public static final String STATUS_STREAM_PATH = "/ws/orders";

    private final OrderService orderService;
    private final OrderQueueService orderQueueService;
    private final OrderStatusBroadcaster broadcaster;
    private final MetricsService metricsService;
    private final Validator validator;
    private final RouterProperties properties;

    /**
     * Validates and queues an order. Returns as soon as the order is stored.
     */
    public SubmitOrderResponse submit(SubmitOrderRequest request) {
        SwapOrder order = accept(request);
        dispatch(order.getId());
        return toResponse(order);
    }

    /**
     * Validates and stores an order without queuing it, so the caller can attach a subscriber first.
     */
    public SwapOrder accept(SubmitOrderRequest request) {
        validate(request);
        BigDecimal slippage = request.getSlippage() != null
                ? request.getSlippage()
                : BigDecimal.valueOf(properties.getVenue().getDefaultSlippage());
        OrderType orderType = request.getOrderType() != null ? request.getOrderType() : OrderType.MARKET;
        SwapOrder order = orderService.create(request.getAssetIn().trim(), request.getAssetOut().trim(),
                request.getAmount(), slippage, orderType);
        metricsService.incrementOrdersSubmitted();
        log.info("Order accepted orderId={} amount={} {}->{} slippage={}",
                order.getId(), order.getAmount(), order.getAssetIn(), order.getAssetOut(), order.getSlippage());
        return order;
    }

    public void dispatch(String orderId) {
        orderQueueService.enqueue(orderId);
    }

    /**
     * Makes {@code channel} the order's subscriber. It receives the current status straight away, then live
     * transitions until the order is terminal.
     *
     * @throws NotFoundException if the order does not exist
     */
    public void subscribe(String orderId, StatusChannel channel) {
        orderService.get(orderId);
        broadcaster.attach(orderId, channel, () -> OrderStatusEvent.snapshot(orderService.get(orderId)));
    }

    /**
     * Attaches {@code channel} to an order that was just accepted on it. The first frame is a regular
     * status update for the stored status rather than a snapshot.
     */
    public void stream(SwapOrder order, StatusChannel channel) {
        broadcaster.attach(order.getId(), channel, () -> OrderStatusEvent.of(order.getId(), order.getStatus()));
    }

    public void unsubscribe(String orderId, StatusChannel channel) {
        broadcaster.detach(orderId, channel);
    }

    public void detachAll(StatusChannel channel) {
        broadcaster.detachAll(channel);
    }

    public SubmitOrderResponse toResponse(SwapOrder order) {
        return new SubmitOrderResponse(order.getId(), order.getStatus(),
                STATUS_STREAM_PATH + "?orderId=" + order.getId());
    }

    private void validate(SubmitOrderRequest request) {
        if (request == null) {
            throw new BadRequestException("Missing required fields: assetIn, assetOut, amount");
        }
        Set<ConstraintViolation<SubmitOrderRequest>> violations = validator.validate(request);
        if (!violations.isEmpty()) {
            String message = violations.stream()
                    .sorted(Comparator.comparing(violation -> violation.getPropertyPath().toString()))
                    .map(violation -> violation.getPropertyPath() + " " + violation.getMessage())
                    .collect(Collectors.joining(", "));
            throw new BadRequestException("Invalid order: " + message);
        }
        if (request.getAssetIn().trim().equalsIgnoreCase(request.getAssetOut().trim())) {
            throw new BadRequestException("Invalid order: assetIn and assetOut must differ");
        }
        if (request.getOrderType() != null && request.getOrderType() != OrderType.MARKET) {
            throw new BadRequestException("Unsupported order type: " + request.getOrderType()
                    + ", only MARKET orders are executed");
        }
    }
}
