package com.dexrouter.backend.controller;

import com.dexrouter.backend.dto.OrderStatusEvent;
import com.dexrouter.backend.service.StatusChannel;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

import java.io.IOException;

/**
 * Status channel backed by one WebSocket session. The session is expected to be a
 * {@link org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator} since queue workers and
 * the handler thread both write to it.
 */
@Slf4j
class WebSocketStatusChannel implements StatusChannel {

    private final WebSocketSession session;
    private final ObjectMapper objectMapper;

    WebSocketStatusChannel(WebSocketSession session, ObjectMapper objectMapper) {
        this.session = session;
        this.objectMapper = objectMapper;
    }

    @Override
    public boolean isOpen() {
        return session.isOpen();
    }

    @Override
    public void send(OrderStatusEvent event) throws IOException {
        sendFrame(event);
    }

    void sendFrame(Object frame) throws IOException {
        session.sendMessage(new TextMessage(objectMapper.writeValueAsString(frame)));
    }

    @Override
    public void close() {
        if (!session.isOpen()) {
            return;
        }
        try {
            session.close(CloseStatus.NORMAL);
        } catch (IOException ex) {
            log.debug("WebSocket close failed sessionId={} error={}", session.getId(), ex.getMessage());
        }
    }

    String sessionId() {
        return session.getId();
    }
}
