package com.dexrouter.backend.service;

import com.dexrouter.backend.model.OrderStatus;
import com.dexrouter.backend.model.SwapOrder;
import com.dexrouter.backend.repository.SwapOrderRepository;
import com.dexrouter.backend.service.queue.OrderQueueService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

import java.util.EnumSet;
import java.util.List;

/**
 * Requeues orders left in flight by a previous run. Such orders go back to {@code pending} first, so the
 * next attempt starts from routing like any retry.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class OrderRecoveryService {

    private static final EnumSet<OrderStatus> IN_FLIGHT = EnumSet.of(
            OrderStatus.PENDING, OrderStatus.ROUTING, OrderStatus.BUILDING, OrderStatus.SUBMITTED);

    private final SwapOrderRepository orderRepository;
    private final OrderStateMachine stateMachine;
    private final OrderQueueService orderQueueService;

    @Value("${router.recovery.enabled:true}")
    private boolean enabled;

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        if (!enabled) {
            return;
        }
        try {
            int recovered = recover();
            if (recovered > 0) {
                log.info("Requeued {} in-flight orders from a previous run", recovered);
            }
        } catch (Exception e) {
            log.error("Order recovery failed on startup", e);
        }
    }

    public int recover() {
        List<SwapOrder> orders = orderRepository.findByStatusInOrderByCreatedAtAsc(IN_FLIGHT);
        for (SwapOrder order : orders) {
            if (order.getStatus() != OrderStatus.PENDING) {
                stateMachine.transition(order.getId(), OrderStatus.PENDING);
            }
            orderQueueService.enqueue(order.getId(), order.getRetryCount());
        }
        return orders.size();
    }
}
