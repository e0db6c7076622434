package com.riskcast.backend.service.benchmark;

import lombok.Builder;

import java.util.List;

/**
 * {@code concurrency == 1} runs iterations sequentially on a single worker.
 */
@Builder
public record BenchmarkConfig(String name, int iterations, int warmupIterations, int concurrency,
                              List<SlaTarget> slaTargets) {

    public BenchmarkConfig {
        if (iterations < 1) {
            throw new IllegalArgumentException("iterations must be positive");
        }
        if (warmupIterations < 0 || concurrency < 1) {
            throw new IllegalArgumentException("warmupIterations must be >= 0 and concurrency >= 1");
        }
        name = name == null ? "benchmark" : name;
        slaTargets = slaTargets == null ? List.of() : List.copyOf(slaTargets);
    }
}
