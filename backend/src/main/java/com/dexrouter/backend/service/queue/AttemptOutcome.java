package com.dexrouter.backend.service.queue;

public enum AttemptOutcome {
    CONFIRMED,  // Terminal success
    RETRY,      // Failed, another attempt is due after backoff
    FAILED,     // Retries exhausted, terminal
    SKIPPED     // Order was already terminal or is gone; nothing was done
}
