package com.dexrouter.backend.dto;

import com.dexrouter.backend.model.RoutingDecision;

import java.util.List;

public record RoutingHistoryResponse(String orderId, List<RoutingDecision> decisions) {
}
