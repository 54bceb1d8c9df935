package com.dexrouter.backend.service;

import com.dexrouter.backend.exception.NotFoundException;
import com.dexrouter.backend.model.OrderStatus;
import com.dexrouter.backend.model.OrderType;
import com.dexrouter.backend.model.RoutingDecision;
import com.dexrouter.backend.model.SwapOrder;
import com.dexrouter.backend.repository.RoutingDecisionRepository;
import com.dexrouter.backend.repository.SwapOrderRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Reads and creates order records. Status changes go through {@link OrderStateMachine}.
 */
@Service
@RequiredArgsConstructor
public class OrderService {

    public static final int MAX_PAGE_SIZE = 100;

    private final SwapOrderRepository orderRepository;
    private final RoutingDecisionRepository routingDecisionRepository;

    @Transactional
    public SwapOrder create(String assetIn, String assetOut, BigDecimal amount, BigDecimal slippage, OrderType orderType) {
        Instant now = Instant.now();
        SwapOrder order = SwapOrder.builder()
                .id(UUID.randomUUID().toString())
                .assetIn(assetIn)
                .assetOut(assetOut)
                .amount(amount)
                .slippage(slippage)
                .orderType(orderType)
                .status(OrderStatus.PENDING)
                .retryCount(0)
                .createdAt(now)
                .updatedAt(now)
                .build();
        return orderRepository.save(order);
    }

    @Transactional(readOnly = true)
    public Optional<SwapOrder> find(String orderId) {
        if (orderId == null || orderId.isBlank()) {
            return Optional.empty();
        }
        return orderRepository.findById(orderId);
    }

    @Transactional(readOnly = true)
    public SwapOrder get(String orderId) {
        return find(orderId).orElseThrow(() -> new NotFoundException("Order not found: " + orderId));
    }

    @Transactional(readOnly = true)
    public Page<SwapOrder> page(int page, int size) {
        int boundedSize = Math.max(1, Math.min(size, MAX_PAGE_SIZE));
        return orderRepository.findAllByOrderByCreatedAtDesc(PageRequest.of(Math.max(0, page), boundedSize));
    }

    @Transactional(readOnly = true)
    public List<RoutingDecision> routingHistory(String orderId) {
        get(orderId);
        return routingDecisionRepository.findByOrderIdOrderByCreatedAtDescIdDesc(orderId);
    }
}
