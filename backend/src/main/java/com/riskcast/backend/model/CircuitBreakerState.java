package com.riskcast.backend.model;

import java.time.Duration;
import java.time.Instant;

public record CircuitBreakerState(
        State state,
        int failureCount,
        Instant lastFailureAt,
        Instant openedAt,
        int failureThreshold,
        Duration recoveryTimeout,
        int halfOpenMaxCalls
) {
    public enum State {
        CLOSED,
        OPEN,
        HALF_OPEN
    }
}
