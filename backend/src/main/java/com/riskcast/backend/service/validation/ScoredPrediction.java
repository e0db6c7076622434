package com.riskcast.backend.service.validation;

import com.riskcast.backend.model.RiskLevel;

record ScoredPrediction(double predicted, double actual, double confidence) {

    boolean levelMatches() {
        return RiskLevel.fromScore(predicted) == RiskLevel.fromScore(actual);
    }
}
