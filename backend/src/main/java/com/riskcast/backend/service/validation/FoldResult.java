package com.riskcast.backend.service.validation;

import java.util.Map;

public record FoldResult(
        int fold,
        int trainSize,
        int testSize,
        Map<Integer, Double> fittedShortWeights,
        Map<Integer, HorizonMetrics> metrics
) {
}
