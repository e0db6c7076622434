package com.riskcast.backend.model;

import java.time.Instant;
import java.util.Map;

public record EnsembleResult(
        String fingerprint,
        Map<Integer, HorizonResult> horizons,
        boolean degraded,
        long weightsVersion,
        ConfidenceSummary confidence,
        Instant generatedAt
) {

    public EnsembleResult withFingerprint(String value) {
        return new EnsembleResult(value, horizons, degraded, weightsVersion, confidence, generatedAt);
    }

    public HorizonResult horizon(int months) {
        return horizons.get(months);
    }

    public boolean anyHorizonFailed() {
        return horizons.values().stream().anyMatch(HorizonResult::failed);
    }

    public boolean allHorizonsFailed() {
        return !horizons.isEmpty() && horizons.values().stream().allMatch(HorizonResult::failed);
    }
}
