package com.dexrouter.backend.config;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.UUID;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Tags every HTTP request, WebSocket handshakes included, with a request id and, when the request names
 * an order, that order's id. Both end up in the MDC so router log lines and error bodies can be joined.
 */
@Component
@Slf4j
public class RequestCorrelationFilter extends OncePerRequestFilter {

    static final String REQUEST_ID_HEADER = "X-Request-Id";
    static final String CORRELATION_ID_HEADER = "X-Correlation-Id";

    private static final Pattern ORDER_PATH = Pattern.compile("^/api/orders/([^/]+)(?:/routing)?/?$");
    private static final String ORDER_ID_PARAM = "orderId";

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {
        String requestId = orGenerate(request.getHeader(REQUEST_ID_HEADER));
        String correlationId = orDefault(request.getHeader(CORRELATION_ID_HEADER), requestId);
        String orderId = orderIdOf(request);

        MDC.put("requestId", requestId);
        MDC.put("correlationId", correlationId);
        if (orderId != null) {
            MDC.put("orderId", orderId);
        }
        response.setHeader(REQUEST_ID_HEADER, requestId);
        response.setHeader(CORRELATION_ID_HEADER, correlationId);
        long started = System.nanoTime();
        try {
            filterChain.doFilter(request, response);
        } finally {
            log.debug("{} {} status={} tookMs={}", request.getMethod(), request.getRequestURI(),
                    response.getStatus(), (System.nanoTime() - started) / 1_000_000);
            MDC.remove("requestId");
            MDC.remove("correlationId");
            MDC.remove("orderId");
        }
    }

    /**
     * Order id from {@code /api/orders/{id}} and {@code /api/orders/{id}/routing}, or from the status
     * stream's {@code ?orderId=} query parameter.
     */
    static String orderIdOf(HttpServletRequest request) {
        Matcher matcher = ORDER_PATH.matcher(request.getRequestURI());
        if (matcher.matches()) {
            return matcher.group(1);
        }
        String param = request.getParameter(ORDER_ID_PARAM);
        return param == null || param.isBlank() ? null : param.trim();
    }

    private static String orGenerate(String value) {
        return orDefault(value, UUID.randomUUID().toString());
    }

    private static String orDefault(String value, String fallback) {
        return value == null || value.isBlank() ? fallback : value;
    }
}
