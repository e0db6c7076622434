package com.riskcast.backend.model;

import java.util.List;

public record ConfidenceSummary(
        double overallConfidence,
        List<Integer> lowConfidenceHorizons,
        List<Integer> highConfidenceHorizons,
        double agreement
) {
}
