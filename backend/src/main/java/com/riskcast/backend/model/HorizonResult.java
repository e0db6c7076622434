package com.riskcast.backend.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome for one forecast horizon. A failed entry carries only the error code and message; the score
 * fields are null so that a failure can never be mistaken for a prediction.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record HorizonResult(
        int horizon,
        boolean failed,
        String errorCode,
        String errorMessage,
        Double score,
        RiskLevel level,
        Double confidence,
        ModelUsed modelUsed,
        Map<String, Double> weights,
        boolean degraded,
        UncertaintyBounds uncertainty,
        ModelComparison comparison,
        List<ModelPrediction> predictions
) {

    public static HorizonResult success(int horizon, double score, double confidence, ModelUsed modelUsed,
                                        Map<String, Double> weights, boolean degraded,
                                        UncertaintyBounds uncertainty, ModelComparison comparison,
                                        List<ModelPrediction> predictions) {
        return new HorizonResult(horizon, false, null, null, score, RiskLevel.fromScore(score), confidence,
                modelUsed, Collections.unmodifiableMap(new LinkedHashMap<>(weights)), degraded, uncertainty, comparison, List.copyOf(predictions));
    }

    public static HorizonResult failure(int horizon, String errorCode, String errorMessage) {
        return new HorizonResult(horizon, true, errorCode, errorMessage, null, null, null, null, null, false, null,
                null, null);
    }
}
