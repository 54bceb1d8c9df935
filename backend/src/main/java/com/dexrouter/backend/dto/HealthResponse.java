package com.dexrouter.backend.dto;

import com.dexrouter.backend.service.queue.QueueMetrics;

import java.time.Instant;

public record HealthResponse(String status, Instant timestamp, QueueMetrics queue) {
}
