package com.riskcast.backend.model;

public record ModelPrediction(
        int horizon,
        double predictedScore,
        RiskLevel predictedLevel,
        double confidenceScore,
        String modelId,
        String modelVersion,
        long latencyMicros
) {
    public static ModelPrediction of(int horizon, double score, double confidence, String modelId, String modelVersion,
                                     long latencyMicros) {
        return new ModelPrediction(horizon, score, RiskLevel.fromScore(score), confidence, modelId, modelVersion,
                latencyMicros);
    }
}
