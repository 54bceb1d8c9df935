package com.dexrouter.backend.service.queue;

public record QueueMetrics(int waiting, int delayed, int active, long completed, long failed) {
}
