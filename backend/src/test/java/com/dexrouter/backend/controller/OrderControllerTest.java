package com.dexrouter.backend.controller;

import com.dexrouter.backend.model.OrderStatus;
import com.dexrouter.backend.model.SwapOrder;
import com.dexrouter.backend.repository.SwapOrderRepository;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

import java.math.BigDecimal;
import java.time.Duration;

import static com.dexrouter.backend.support.TestWaits.awaitCondition;
import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.anyOf;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.notNullValue;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
class OrderControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private SwapOrderRepository orderRepository;

    private String submit(String body) throws Exception {
        MvcResult result = mockMvc.perform(post("/api/orders")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.status").value("pending"))
                .andReturn();
        JsonNode json = objectMapper.readTree(result.getResponse().getContentAsString());
        return json.get("orderId").asText();
    }

    private SwapOrder awaitTerminal(String orderId) {
        awaitCondition(Duration.ofSeconds(10), () -> orderRepository.findById(orderId)
                .map(order -> order.getStatus().isTerminal())
                .orElse(false));
        return orderRepository.findById(orderId).orElseThrow();
    }

    @Test
    void marketOrderIsRoutedAndConfirmed() throws Exception {
        String orderId = submit("""
                {"assetIn":"SOL","assetOut":"USDC","amount":1.5,"slippage":0.01}
                """);

        SwapOrder order = awaitTerminal(orderId);

        assertThat(order.getStatus()).isEqualTo(OrderStatus.CONFIRMED);
        assertThat(order.getSelectedVenue()).isNotNull();
        assertThat(order.getSettlementRef()).hasSize(88);
        BigDecimal quoted = order.quotedPriceFor(order.getSelectedVenue());
        assertThat(order.getExecutedPrice().doubleValue())
                .isBetween(quoted.doubleValue() * 0.99 - 1e-6, quoted.doubleValue() * 1.01 + 1e-6);

        mockMvc.perform(get("/api/orders/{id}", orderId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.id").value(orderId))
                .andExpect(jsonPath("$.status").value("confirmed"))
                .andExpect(jsonPath("$.selectedVenue").value(anyOf(equalTo("raydium"), equalTo("meteora"))))
                .andExpect(jsonPath("$.retryCount").value(0));

        mockMvc.perform(get("/api/orders/{id}/routing", orderId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.orderId").value(orderId))
                .andExpect(jsonPath("$.decisions", hasSize(1)))
                .andExpect(jsonPath("$.decisions[0].reason", notNullValue()));
    }

    @Test
    void legacyFieldNamesAreAccepted() throws Exception {
        String orderId = submit("""
                {"tokenIn":"SOL","tokenOut":"USDC","amount":2,"type":"market"}
                """);

        assertThat(orderRepository.findById(orderId)).get()
                .extracting(SwapOrder::getAssetIn)
                .isEqualTo("SOL");
    }

    @Test
    void sameAssetOnBothSidesIsBadRequest() throws Exception {
        mockMvc.perform(post("/api/orders")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"assetIn\":\"SOL\",\"assetOut\":\"SOL\",\"amount\":1}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.status").value(400))
                .andExpect(jsonPath("$.message").value("Invalid order: assetIn and assetOut must differ"));
    }

    @Test
    void missingAmountIsBadRequest() throws Exception {
        mockMvc.perform(post("/api/orders")
                        .contentType(MediaType.APPLICATION_JSON)
                        .header("X-Request-Id", "req-42")
                        .content("{\"assetIn\":\"SOL\",\"assetOut\":\"USDC\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(header().string("X-Request-Id", "req-42"))
                .andExpect(jsonPath("$.requestId").value("req-42"))
                .andExpect(jsonPath("$.details[0].field").value("amount"));
    }

    @Test
    void limitOrdersAreNotExecuted() throws Exception {
        mockMvc.perform(post("/api/orders")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"assetIn\":\"SOL\",\"assetOut\":\"USDC\",\"amount\":1,\"orderType\":\"LIMIT\"}"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void amountFinerThanStoredScaleIsBadRequest() throws Exception {
        long before = orderRepository.count();

        mockMvc.perform(post("/api/orders")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"assetIn\":\"SOL\",\"assetOut\":\"USDC\",\"amount\":0.000000001}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.details[0].field").value("amount"));

        assertThat(orderRepository.count()).isEqualTo(before);
    }

    @Test
    void amountWiderThanStoredPrecisionIsBadRequest() throws Exception {
        mockMvc.perform(post("/api/orders")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"assetIn\":\"SOL\",\"assetOut\":\"USDC\",\"amount\":10000000000000}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.status").value(400))
                .andExpect(jsonPath("$.details[0].field").value("amount"));
    }

    @Test
    void slippageFinerThanStoredScaleIsBadRequest() throws Exception {
        mockMvc.perform(post("/api/orders")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"assetIn\":\"SOL\",\"assetOut\":\"USDC\",\"amount\":1,\"slippage\":0.00001}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.details[0].field").value("slippage"));
    }

    @Test
    void largestStorableAmountIsAccepted() throws Exception {
        String orderId = submit("""
                {"assetIn":"SOL","assetOut":"USDC","amount":999999999999.12345678,"slippage":0.0001}
                """);

        assertThat(orderRepository.findById(orderId).orElseThrow().getAmount())
                .isEqualByComparingTo("999999999999.12345678");
    }

    @Test
    void unknownOrderIsNotFound() throws Exception {
        mockMvc.perform(get("/api/orders/{id}", "does-not-exist"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.message").value("Order not found: does-not-exist"));

        mockMvc.perform(get("/api/orders/{id}/routing", "does-not-exist"))
                .andExpect(status().isNotFound());
    }

    @Test
    void listIsPagedAndCapped() throws Exception {
        submit("{\"assetIn\":\"SOL\",\"assetOut\":\"USDC\",\"amount\":1}");

        mockMvc.perform(get("/api/orders").param("page", "0").param("size", "500"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.size").value(100))
                .andExpect(jsonPath("$.page").value(0))
                .andExpect(jsonPath("$.orders", notNullValue()));
    }

    @Test
    void queueMetricsAndHealthAreServed() throws Exception {
        mockMvc.perform(get("/api/queue/metrics"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.waiting", notNullValue()))
                .andExpect(jsonPath("$.active", notNullValue()))
                .andExpect(jsonPath("$.completed", notNullValue()))
                .andExpect(jsonPath("$.failed", notNullValue()));

        mockMvc.perform(get("/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("healthy"))
                .andExpect(jsonPath("$.timestamp", notNullValue()))
                .andExpect(jsonPath("$.queue.delayed", notNullValue()));
    }
}
