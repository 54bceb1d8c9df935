package com.dexrouter.backend.repository;

import com.dexrouter.backend.model.RoutingDecision;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface RoutingDecisionRepository extends JpaRepository<RoutingDecision, Long> {
    List<RoutingDecision> findByOrderIdOrderByCreatedAtDescIdDesc(String orderId);

    long countByOrderId(String orderId);
}
