package com.riskcast.backend.dto;

public record ModelInfo(
        String slot,
        String modelId,
        String version,
        boolean loaded,
        long calls,
        long failures,
        double meanLatencyMs,
        double maxLatencyMs
) {
}
