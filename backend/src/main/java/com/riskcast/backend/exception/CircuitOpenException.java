package com.riskcast.backend.exception;

import lombok.Getter;

import java.time.Instant;

@Getter
public class CircuitOpenException extends RiskEngineException {

    private final Instant retryAfter;

    public CircuitOpenException(String message, Instant retryAfter) {
        super(ErrorCode.CIRCUIT_OPEN, Stage.BREAKER, message);
        this.retryAfter = retryAfter;
    }
}
