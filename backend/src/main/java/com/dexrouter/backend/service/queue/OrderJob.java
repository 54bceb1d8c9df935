package com.dexrouter.backend.service.queue;

import lombok.Getter;

import java.time.Instant;

/**
 * Queue entry for one order. The same instance carries the order through every retry.
 */
@Getter
public class OrderJob {

    private final String orderId;
    private final Instant enqueuedAt;
    private volatile JobState state;
    private volatile int attempts;
    private volatile Instant lastAttemptAt;
    private volatile Instant nextAttemptAt;
    private volatile Instant finishedAt;
    private volatile String lastError;

    OrderJob(String orderId, int priorAttempts) {
        this.orderId = orderId;
        this.enqueuedAt = Instant.now();
        this.state = JobState.WAITING;
        this.attempts = priorAttempts;
    }

    void markWaiting() {
        state = JobState.WAITING;
        nextAttemptAt = null;
    }

    void markActive() {
        state = JobState.ACTIVE;
        attempts++;
        lastAttemptAt = Instant.now();
    }

    void markDelayed(Instant nextAttemptAt, String error) {
        state = JobState.DELAYED;
        this.nextAttemptAt = nextAttemptAt;
        this.lastError = error;
    }

    void markCompleted() {
        state = JobState.COMPLETED;
        finishedAt = Instant.now();
    }

    void markFailed(String error) {
        state = JobState.FAILED;
        lastError = error;
        finishedAt = Instant.now();
    }
}
