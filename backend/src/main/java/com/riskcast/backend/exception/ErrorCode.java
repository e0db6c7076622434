package com.riskcast.backend.exception;

public enum ErrorCode {
    VALIDATION_INPUT,
    RESOURCE_EXHAUSTED,
    TIMEOUT,
    CIRCUIT_OPEN,
    MODEL_INVOCATION,
    CACHE_BACKEND,
    VALIDATION_TARGET_NOT_MET,
    CANCELLED
}
