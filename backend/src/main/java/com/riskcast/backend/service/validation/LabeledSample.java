package com.riskcast.backend.service.validation;

import com.riskcast.backend.model.RiskAssessmentRequest;

import java.util.Map;

/**
 * A business with its realized risk score per horizon (months).
 */
public record LabeledSample(String businessId, RiskAssessmentRequest request, Map<Integer, Double> actualScores) {

    public LabeledSample {
        actualScores = Map.copyOf(actualScores);
    }
}
