package com.riskcast.backend.service.benchmark;

import java.util.List;

public record BenchmarkResult(
        String name,
        int iterations,
        int warmupIterations,
        int concurrency,
        int successCount,
        int failureCount,
        double wallTimeMs,
        double throughputPerSecond,
        LatencyStats latency,
        List<SlaCheck> slaChecks,
        boolean slaMet,
        List<String> sampleErrors
) {
}
