package com.riskcast.backend.service.validation;

public record CalibrationBucket(
        String name,
        double lowerBound,
        double upperBound,
        int count,
        double meanConfidence,
        double realizedAccuracy
) {

    public double gap() {
        return Math.abs(meanConfidence - realizedAccuracy);
    }
}
