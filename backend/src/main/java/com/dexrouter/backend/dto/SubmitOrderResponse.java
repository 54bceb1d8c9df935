package com.dexrouter.backend.dto;

import com.dexrouter.backend.model.OrderStatus;

public record SubmitOrderResponse(String orderId, OrderStatus status, String statusStream) {
}
