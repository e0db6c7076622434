package com.riskcast.backend.exception;

/**
 * Pipeline stage an engine error originated from, attached for observability.
 */
public enum Stage {
    VALIDATION,
    ADMISSION,
    CACHE,
    BREAKER,
    ROUTER,
    MODEL,
    HARNESS
}
