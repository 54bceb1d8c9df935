package com.dexrouter.backend.service;

import com.dexrouter.backend.config.RouterProperties;
import com.dexrouter.backend.dto.SubmitOrderRequest;
import com.dexrouter.backend.dto.SubmitOrderResponse;
import com.dexrouter.backend.exception.BadRequestException;
import com.dexrouter.backend.exception.NotFoundException;
import com.dexrouter.backend.model.OrderStatus;
import com.dexrouter.backend.model.OrderType;
import com.dexrouter.backend.model.SwapOrder;
import com.dexrouter.backend.service.queue.OrderQueueService;
import jakarta.validation.Validation;
import jakarta.validation.Validator;
import jakarta.validation.ValidatorFactory;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class OrderSubmissionServiceTest {

    private static ValidatorFactory validatorFactory;
    private static Validator validator;

    private OrderService orderService;
    private OrderQueueService orderQueueService;
    private OrderStatusBroadcaster broadcaster;
    private OrderSubmissionService service;

    @BeforeAll
    static void initValidator() {
        validatorFactory = Validation.buildDefaultValidatorFactory();
        validator = validatorFactory.getValidator();
    }

    @AfterAll
    static void closeValidator() {
        validatorFactory.close();
    }

    @BeforeEach
    void setUp() {
        orderService = mock(OrderService.class);
        orderQueueService = mock(OrderQueueService.class);
        broadcaster = mock(OrderStatusBroadcaster.class);
        service = new OrderSubmissionService(orderService, orderQueueService, broadcaster,
                mock(MetricsService.class), validator, new RouterProperties());
    }

    private static SubmitOrderRequest.SubmitOrderRequestBuilder validRequest() {
        return SubmitOrderRequest.builder()
                .assetIn("SOL")
                .assetOut("USDC")
                .amount(new BigDecimal("1.5"));
    }

    private static SwapOrder stored(String id) {
        return SwapOrder.builder()
                .id(id)
                .assetIn("SOL")
                .assetOut("USDC")
                .amount(new BigDecimal("1.5"))
                .slippage(new BigDecimal("0.01"))
                .status(OrderStatus.PENDING)
                .createdAt(Instant.now())
                .updatedAt(Instant.now())
                .build();
    }

    @Test
    void validOrderIsStoredWithDefaultsAndQueued() {
        when(orderService.create(any(), any(), any(), any(), any())).thenReturn(stored("order-1"));

        SubmitOrderResponse response = service.submit(validRequest().build());

        verify(orderService).create("SOL", "USDC", new BigDecimal("1.5"), BigDecimal.valueOf(0.01), OrderType.MARKET);
        verify(orderQueueService).enqueue("order-1");
        assertThat(response.orderId()).isEqualTo("order-1");
        assertThat(response.status()).isEqualTo(OrderStatus.PENDING);
        assertThat(response.statusStream()).isEqualTo("/ws/orders?orderId=order-1");
    }

    @Test
    void explicitSlippageIsKept() {
        when(orderService.create(any(), any(), any(), any(), any())).thenReturn(stored("order-2"));

        service.submit(validRequest().slippage(new BigDecimal("0.005")).build());

        verify(orderService).create(eq("SOL"), eq("USDC"), any(), eq(new BigDecimal("0.005")), eq(OrderType.MARKET));
    }

    @Test
    void identicalAssetsAreRejected() {
        assertThatThrownBy(() -> service.submit(validRequest().assetOut("sol").build()))
                .isInstanceOf(BadRequestException.class)
                .hasMessageContaining("must differ");
        verifyNoInteractions(orderService, orderQueueService);
    }

    @Test
    void nonPositiveAmountIsRejected() {
        assertThatThrownBy(() -> service.submit(validRequest().amount(BigDecimal.ZERO).build()))
                .isInstanceOf(BadRequestException.class)
                .hasMessageContaining("amount");
        verifyNoInteractions(orderService, orderQueueService);
    }

    @Test
    void missingAssetIsRejected() {
        assertThatThrownBy(() -> service.submit(validRequest().assetIn(" ").build()))
                .isInstanceOf(BadRequestException.class)
                .hasMessageContaining("assetIn");
    }

    @Test
    void slippageAboveOneIsRejected() {
        assertThatThrownBy(() -> service.submit(validRequest().slippage(new BigDecimal("1.5")).build()))
                .isInstanceOf(BadRequestException.class)
                .hasMessageContaining("slippage");
    }

    @Test
    void onlyMarketOrdersAreAccepted() {
        assertThatThrownBy(() -> service.submit(validRequest().orderType(OrderType.LIMIT).build()))
                .isInstanceOf(BadRequestException.class)
                .hasMessageContaining("only MARKET");
        verifyNoInteractions(orderService, orderQueueService);
    }

    @Test
    void subscribingToUnknownOrderFails() {
        when(orderService.get("missing")).thenThrow(new NotFoundException("Order not found: missing"));

        assertThatThrownBy(() -> service.subscribe("missing", mock(StatusChannel.class)))
                .isInstanceOf(NotFoundException.class);
        verifyNoInteractions(broadcaster);
    }

    @Test
    void subscribingAttachesWithSnapshot() {
        StatusChannel channel = mock(StatusChannel.class);
        when(orderService.get("order-3")).thenReturn(stored("order-3"));

        service.subscribe("order-3", channel);

        verify(broadcaster).attach(eq("order-3"), eq(channel), any());
    }
}
