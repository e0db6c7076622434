package com.riskcast.backend.service.validation;

import java.time.Instant;
import java.util.List;
import java.util.Map;

public record ValidationResult(
        String runId,
        Instant completedAt,
        int foldCount,
        long randomSeed,
        int sampleCount,
        Map<Integer, HorizonMetrics> horizonMetrics,
        CalibrationReport calibration,
        List<FoldResult> foldResults,
        Map<Integer, HorizonModelComparison> modelComparison,
        List<Recommendation> recommendations,
        boolean targetAchieved,
        List<String> failedTargets
) {
}
