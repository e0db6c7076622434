package com.riskcast.backend.dto;

import com.riskcast.backend.model.RiskAssessmentRequest;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;

import java.util.List;

public record BenchmarkRequest(
        @NotEmpty List<RiskAssessmentRequest> requests,
        @Min(1) @Max(100_000) Integer iterations,
        @Min(0) Integer warmupIterations,
        @Min(1) @Max(1_000) Integer concurrency,
        Long p95TargetMs,
        Long p99TargetMs
) {
}
