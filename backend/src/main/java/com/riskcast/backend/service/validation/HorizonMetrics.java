package com.riskcast.backend.service.validation;

public record HorizonMetrics(
        int horizon,
        int sampleCount,
        double accuracy,
        double mae,
        double rmse,
        double r2,
        double meanConfidence,
        double calibrationError
) {
}
