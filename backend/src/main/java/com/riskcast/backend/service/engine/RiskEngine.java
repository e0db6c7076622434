package com.riskcast.backend.service.engine;

import com.riskcast.backend.model.CircuitBreakerState;
import com.riskcast.backend.model.EnsembleResult;
import com.riskcast.backend.model.RiskAssessmentRequest;

public interface RiskEngine {

    /**
     * Scores the request across its horizons. Blocks the calling thread; interrupting it cancels the call.
     *
     * @throws com.riskcast.backend.exception.RiskEngineException typed by failing stage
     */
    EnsembleResult assess(RiskAssessmentRequest request);

    /**
     * Recomputes a cached entry on the calling background thread. Skipped, returning false, unless the
     * breaker is closed.
     */
    boolean refresh(String key, RiskAssessmentRequest normalizedRequest);

    CircuitBreakerState breakerState();

    void resetBreaker();
}
