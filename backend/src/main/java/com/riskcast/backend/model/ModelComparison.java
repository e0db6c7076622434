package com.riskcast.backend.model;

public record ModelComparison(
        Double shortScore,
        Double shortConfidence,
        Double longScore,
        Double longConfidence,
        double ensembleScore,
        String bestModel,
        double scoreDifference,
        double confidenceDifference,
        double agreement
) {
}
