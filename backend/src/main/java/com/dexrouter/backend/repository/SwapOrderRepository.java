package com.dexrouter.backend.repository;

import com.dexrouter.backend.model.OrderStatus;
import com.dexrouter.backend.model.SwapOrder;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;

@Repository
public interface SwapOrderRepository extends JpaRepository<SwapOrder, String> {
    Page<SwapOrder> findAllByOrderByCreatedAtDesc(Pageable pageable);

    long countByStatus(OrderStatus status);

    List<SwapOrder> findByStatusInOrderByCreatedAtAsc(Collection<OrderStatus> statuses);
}
