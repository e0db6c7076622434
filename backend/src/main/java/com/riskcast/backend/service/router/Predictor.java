package com.riskcast.backend.service.router;

import com.riskcast.backend.model.HorizonResult;
import com.riskcast.backend.model.RiskAssessmentRequest;

/**
 * One model strategy for a single horizon. Implementations throw
 * {@link com.riskcast.backend.exception.ModelInvocationException} only when no model could produce a score.
 */
public interface Predictor {

    HorizonResult predict(RiskAssessmentRequest request, int horizon, HorizonWeights weights);
}
