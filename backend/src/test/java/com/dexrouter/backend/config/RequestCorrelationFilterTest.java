package com.dexrouter.backend.config;

import jakarta.servlet.ServletRequest;
import jakarta.servlet.ServletResponse;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import org.springframework.mock.web.MockFilterChain;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class RequestCorrelationFilterTest {

    private final RequestCorrelationFilter filter = new RequestCorrelationFilter();

    private Map<String, String> runCapturingMdc(MockHttpServletRequest request, MockHttpServletResponse response)
            throws Exception {
        Map<String, String> seen = new HashMap<>();
        MockFilterChain chain = new MockFilterChain() {
            @Override
            public void doFilter(ServletRequest req, ServletResponse res) {
                seen.put("requestId", MDC.get("requestId"));
                seen.put("correlationId", MDC.get("correlationId"));
                seen.put("orderId", MDC.get("orderId"));
            }
        };
        filter.doFilter(request, response, chain);
        return seen;
    }

    @Test
    void orderPathPutsOrderIdInMdcForTheRequestOnly() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/api/orders/7f3c/routing");
        request.addHeader(RequestCorrelationFilter.REQUEST_ID_HEADER, "req-1");
        MockHttpServletResponse response = new MockHttpServletResponse();

        Map<String, String> seen = runCapturingMdc(request, response);

        assertThat(seen).containsEntry("orderId", "7f3c")
                .containsEntry("requestId", "req-1")
                .containsEntry("correlationId", "req-1");
        assertThat(response.getHeader(RequestCorrelationFilter.REQUEST_ID_HEADER)).isEqualTo("req-1");
        assertThat(MDC.get("orderId")).isNull();
        assertThat(MDC.get("requestId")).isNull();
    }

    @Test
    void statusStreamHandshakeUsesQueryParameter() {
        MockHttpServletRequest stream = new MockHttpServletRequest("GET", "/ws/orders");
        stream.setParameter("orderId", "abc-123");
        assertThat(RequestCorrelationFilter.orderIdOf(stream)).isEqualTo("abc-123");
        assertThat(RequestCorrelationFilter.orderIdOf(new MockHttpServletRequest("GET", "/api/orders"))).isNull();
    }

    @Test
    void requestWithoutOrderGetsGeneratedIds() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/api/queue/metrics");
        MockHttpServletResponse response = new MockHttpServletResponse();

        Map<String, String> seen = runCapturingMdc(request, response);

        assertThat(seen.get("orderId")).isNull();
        assertThat(seen.get("requestId")).isNotBlank();
        assertThat(response.getHeader(RequestCorrelationFilter.CORRELATION_ID_HEADER)).isEqualTo(seen.get("requestId"));
    }
}
