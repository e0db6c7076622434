package com.riskcast.backend.model;

public enum RiskLevel {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL;

    public static RiskLevel fromScore(double score) {
        if (score < 0.3) {
            return LOW;
        }
        if (score < 0.6) {
            return MEDIUM;
        }
        if (score < 0.8) {
            return HIGH;
        }
        return CRITICAL;
    }
}
