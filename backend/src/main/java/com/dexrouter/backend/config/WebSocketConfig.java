package com.dexrouter.backend.config;

import com.dexrouter.backend.controller.OrderWebSocketHandler;
import com.dexrouter.backend.service.OrderSubmissionService;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.env.Environment;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;

import java.util.List;

@Configuration
@EnableWebSocket
@RequiredArgsConstructor
public class WebSocketConfig implements WebSocketConfigurer {

    private final OrderWebSocketHandler orderWebSocketHandler;
    private final RouterProperties properties;
    private final Environment environment;

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        registry.addHandler(orderWebSocketHandler, OrderSubmissionService.STATUS_STREAM_PATH)
                .setAllowedOrigins(resolveAllowedOrigins().toArray(new String[0]));
    }

    private boolean isProd() {
        for (String profile : environment.getActiveProfiles()) {
            if ("prod".equalsIgnoreCase(profile) || "production".equalsIgnoreCase(profile)) {
                return true;
            }
        }
        return false;
    }

    private List<String> resolveAllowedOrigins() {
        List<String> configured = properties.getWebsocket().getAllowedOrigins();
        if (configured == null || configured.isEmpty()) {
            return isProd() ? List.of() : List.of("*");
        }
        return configured;
    }
}
