package com.dexrouter.backend.service.queue;

public record AttemptResult(AttemptOutcome outcome, int retryCount, String error) {

    public static AttemptResult confirmed(int retryCount) {
        return new AttemptResult(AttemptOutcome.CONFIRMED, retryCount, null);
    }

    public static AttemptResult retry(int retryCount, String error) {
        return new AttemptResult(AttemptOutcome.RETRY, retryCount, error);
    }

    public static AttemptResult failed(int retryCount, String error) {
        return new AttemptResult(AttemptOutcome.FAILED, retryCount, error);
    }

    public static AttemptResult skipped(String reason) {
        return new AttemptResult(AttemptOutcome.SKIPPED, 0, reason);
    }
}
