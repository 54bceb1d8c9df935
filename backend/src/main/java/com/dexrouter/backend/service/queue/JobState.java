package com.dexrouter.backend.service.queue;

public enum JobState {
    WAITING,
    DELAYED,
    ACTIVE,
    COMPLETED,
    FAILED
}
