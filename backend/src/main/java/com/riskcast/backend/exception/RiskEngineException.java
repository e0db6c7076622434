package com.riskcast.backend.exception;

import lombok.Getter;

@Getter
public abstract class RiskEngineException extends RuntimeException {

    private final ErrorCode errorCode;
    private final Stage stage;

    protected RiskEngineException(ErrorCode errorCode, Stage stage, String message) {
        super(message);
        this.errorCode = errorCode;
        this.stage = stage;
    }

    protected RiskEngineException(ErrorCode errorCode, Stage stage, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
        this.stage = stage;
    }

    /**
     * Whether this failure should be recorded against the model circuit breaker.
     */
    public boolean countsAsModelFailure() {
        return false;
    }
}
