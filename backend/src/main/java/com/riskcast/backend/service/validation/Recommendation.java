package com.riskcast.backend.service.validation;

public record Recommendation(
        int rank,
        Priority priority,
        Integer horizon,
        String metric,
        double observed,
        double target,
        double gap,
        String action
) {

    public enum Priority {
        HIGH,
        MEDIUM,
        LOW
    }

    Recommendation withRank(int value) {
        return new Recommendation(value, priority, horizon, metric, observed, target, gap, action);
    }
}
