package com.riskcast.backend.exception;

public class CacheBackendException extends RiskEngineException {
    public CacheBackendException(String message, Throwable cause) {
        super(ErrorCode.CACHE_BACKEND, Stage.CACHE, message, cause);
    }
}
