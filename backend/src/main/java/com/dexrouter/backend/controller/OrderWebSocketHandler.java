package com.dexrouter.backend.controller;

import com.dexrouter.backend.dto.SubmitOrderRequest;
import com.dexrouter.backend.exception.BadRequestException;
import com.dexrouter.backend.exception.NotFoundException;
import com.dexrouter.backend.model.SwapOrder;
import com.dexrouter.backend.service.OrderSubmissionService;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;
import org.springframework.web.socket.handler.TextWebSocketHandler;
import org.springframework.web.util.UriComponentsBuilder;

import java.io.IOException;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Order status stream at {@code /ws/orders}. A connection carries one order: either one it submits with
 * {@code submit_order}, or an existing one named by {@code ?orderId=} or a {@code subscribe} message.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class OrderWebSocketHandler extends TextWebSocketHandler {

    static final String CHANNEL_ATTRIBUTE = "statusChannel";
    static final String ORDER_ATTRIBUTE = "orderId";

    private static final int SEND_TIME_LIMIT_MS = 5_000;
    private static final int BUFFER_SIZE_LIMIT = 64 * 1024;

    private final OrderSubmissionService submissionService;
    private final ObjectMapper objectMapper;

    @Override
    public void afterConnectionEstablished(WebSocketSession session) throws Exception {
        WebSocketSession concurrent = new ConcurrentWebSocketSessionDecorator(session, SEND_TIME_LIMIT_MS, BUFFER_SIZE_LIMIT);
        WebSocketStatusChannel channel = new WebSocketStatusChannel(concurrent, objectMapper);
        session.getAttributes().put(CHANNEL_ATTRIBUTE, channel);
        log.debug("WebSocket connected sessionId={}", session.getId());

        String orderId = session.getUri() == null ? null
                : UriComponentsBuilder.fromUri(session.getUri()).build().getQueryParams().getFirst("orderId");
        if (orderId != null && !orderId.isBlank()) {
            subscribe(session, channel, orderId);
        }
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) throws Exception {
        WebSocketStatusChannel channel = channel(session);
        JsonNode frame;
        try {
            frame = objectMapper.readTree(message.getPayload());
        } catch (JsonProcessingException ex) {
            sendError(channel, "Malformed message");
            return;
        }
        String type = frame.path("type").asText("");
        switch (type) {
            case "submit_order" -> submit(session, channel, frame.path("order"));
            case "subscribe" -> subscribe(session, channel, frame.path("orderId").asText(""));
            default -> sendError(channel, "Unknown message type: " + type);
        }
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        log.warn("WebSocket transport error sessionId={} orderId={} error={}",
                session.getId(), session.getAttributes().get(ORDER_ATTRIBUTE), exception.getMessage());
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        WebSocketStatusChannel channel = (WebSocketStatusChannel) session.getAttributes().get(CHANNEL_ATTRIBUTE);
        if (channel != null) {
            submissionService.detachAll(channel);
        }
        log.debug("WebSocket closed sessionId={} orderId={} status={}",
                session.getId(), session.getAttributes().get(ORDER_ATTRIBUTE), status);
    }

    private void submit(WebSocketSession session, WebSocketStatusChannel channel, JsonNode orderNode) throws IOException {
        if (alreadyBound(session, channel)) {
            return;
        }
        if (orderNode.isMissingNode() || !orderNode.isObject()) {
            sendError(channel, "Missing required fields: assetIn, assetOut, amount");
            channel.close();
            return;
        }
        SwapOrder order;
        try {
            SubmitOrderRequest request = objectMapper.treeToValue(orderNode, SubmitOrderRequest.class);
            order = submissionService.accept(request);
        } catch (JsonProcessingException ex) {
            sendError(channel, "Invalid order: " + ex.getOriginalMessage());
            channel.close();
            return;
        } catch (BadRequestException ex) {
            sendError(channel, ex.getMessage());
            channel.close();
            return;
        }
        session.getAttributes().put(ORDER_ATTRIBUTE, order.getId());

        Map<String, Object> accepted = new LinkedHashMap<>();
        accepted.put("type", "order_accepted");
        accepted.put("orderId", order.getId());
        accepted.put("timestamp", Instant.now());
        channel.sendFrame(accepted);

        submissionService.stream(order, channel);
        submissionService.dispatch(order.getId());
        log.info("Order submitted over WebSocket orderId={} sessionId={}", order.getId(), session.getId());
    }

    private void subscribe(WebSocketSession session, WebSocketStatusChannel channel, String orderId) throws IOException {
        if (alreadyBound(session, channel)) {
            return;
        }
        if (orderId.isBlank()) {
            sendError(channel, "Missing orderId");
            return;
        }
        try {
            session.getAttributes().put(ORDER_ATTRIBUTE, orderId);
            submissionService.subscribe(orderId, channel);
        } catch (NotFoundException ex) {
            session.getAttributes().remove(ORDER_ATTRIBUTE);
            sendError(channel, ex.getMessage());
            channel.close();
        }
    }

    private boolean alreadyBound(WebSocketSession session, WebSocketStatusChannel channel) throws IOException {
        Object bound = session.getAttributes().get(ORDER_ATTRIBUTE);
        if (bound == null) {
            return false;
        }
        sendError(channel, "Connection already carries order " + bound);
        return true;
    }

    private void sendError(WebSocketStatusChannel channel, String error) throws IOException {
        if (!channel.isOpen()) {
            return;
        }
        Map<String, Object> frame = new LinkedHashMap<>();
        frame.put("type", "error");
        frame.put("error", error);
        channel.sendFrame(frame);
    }

    private WebSocketStatusChannel channel(WebSocketSession session) {
        return (WebSocketStatusChannel) session.getAttributes().get(CHANNEL_ATTRIBUTE);
    }
}
