package com.dexrouter.backend.controller;

import com.dexrouter.backend.dto.OrderPageResponse;
import com.dexrouter.backend.dto.RoutingHistoryResponse;
import com.dexrouter.backend.dto.SubmitOrderRequest;
import com.dexrouter.backend.dto.SubmitOrderResponse;
import com.dexrouter.backend.model.SwapOrder;
import com.dexrouter.backend.service.OrderService;
import com.dexrouter.backend.service.OrderSubmissionService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@Slf4j
@RestController
@RequestMapping("/api/orders")
@RequiredArgsConstructor
@Tag(name = "Orders")
public class OrderController {

    private final OrderSubmissionService submissionService;
    private final OrderService orderService;

    @PostMapping
    @Operation(summary = "Submit a market swap order")
    public ResponseEntity<SubmitOrderResponse> submit(@Valid @RequestBody SubmitOrderRequest request) {
        log.info("Submitting order {} {} -> {}", request.getAmount(), request.getAssetIn(), request.getAssetOut());
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(submissionService.submit(request));
    }

    @GetMapping("/{orderId}")
    @Operation(summary = "Get order")
    public SwapOrder get(@PathVariable String orderId) {
        return orderService.get(orderId);
    }

    @GetMapping
    @Operation(summary = "List orders, newest first")
    public OrderPageResponse list(@RequestParam(defaultValue = "0") int page,
                                  @RequestParam(defaultValue = "20") int size) {
        Page<SwapOrder> result = orderService.page(page, size);
        return new OrderPageResponse(result.getContent(), result.getNumber(), result.getSize(), result.getTotalElements());
    }

    @GetMapping("/{orderId}/routing")
    @Operation(summary = "Routing decisions for an order, newest first")
    public RoutingHistoryResponse routing(@PathVariable String orderId) {
        return new RoutingHistoryResponse(orderId, orderService.routingHistory(orderId));
    }
}
