package com.riskcast.backend.controller;

import com.riskcast.backend.config.ValidationProperties;
import com.riskcast.backend.dto.BenchmarkRequest;
import com.riskcast.backend.service.benchmark.BenchmarkConfig;
import com.riskcast.backend.service.benchmark.BenchmarkResult;
import com.riskcast.backend.service.benchmark.BenchmarkRunner;
import com.riskcast.backend.service.benchmark.SlaTarget;
import com.riskcast.backend.service.engine.RiskEngine;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Duration;
import java.util.List;

@RestController
@RequestMapping("/api/v1/benchmark")
@RequiredArgsConstructor
public class BenchmarkController {

    private final BenchmarkRunner benchmarkRunner;
    private final RiskEngine riskEngine;
    private final ValidationProperties validationProperties;

    @PostMapping("/engine")
    public BenchmarkResult benchmarkEngine(@Valid @RequestBody BenchmarkRequest request) {
        ValidationProperties.Benchmark defaults = validationProperties.getBenchmark();
        Duration p95 = request.p95TargetMs() == null ? defaults.getP95Target() : Duration.ofMillis(request.p95TargetMs());
        Duration p99 = request.p99TargetMs() == null ? defaults.getP99Target() : Duration.ofMillis(request.p99TargetMs());
        BenchmarkConfig config = BenchmarkConfig.builder()
                .name("engine")
                .iterations(request.iterations() == null ? defaults.getIterations() : request.iterations())
                .warmupIterations(request.warmupIterations() == null ? defaults.getWarmupIterations() : request.warmupIterations())
                .concurrency(request.concurrency() == null ? defaults.getConcurrency() : request.concurrency())
                .slaTargets(List.of(new SlaTarget(95, p95), new SlaTarget(99, p99)))
                .build();
        return benchmarkRunner.benchmarkEngine(riskEngine, request.requests(), config);
    }
}
