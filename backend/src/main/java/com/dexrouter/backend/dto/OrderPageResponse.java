package com.dexrouter.backend.dto;

import com.dexrouter.backend.model.SwapOrder;

import java.util.List;

public record OrderPageResponse(List<SwapOrder> orders, int page, int size, long total) {
}
