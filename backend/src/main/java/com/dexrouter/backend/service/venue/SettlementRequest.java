package com.dexrouter.backend.service.venue;

import com.dexrouter.backend.model.Venue;

public record SettlementRequest(String orderId, Venue venue, double amount, double quotedPrice,
                                double fee, double slippage) {
}
