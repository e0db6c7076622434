package com.riskcast.backend.service.benchmark;

import com.riskcast.backend.exception.ResourceExhaustedException;
import com.riskcast.backend.model.RiskAssessmentRequest;
import com.riskcast.backend.service.engine.RiskEngine;
import com.riskcast.backend.support.TestRequests;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class BenchmarkRunnerTest {

    private final BenchmarkRunner runner = new BenchmarkRunner();

    @Test
    void concurrentSleepingTargetMeetsLatencyAndThroughputBounds() {
        BenchmarkConfig config = BenchmarkConfig.builder()
                .name("sleep")
                .iterations(1000)
                .warmupIterations(0)
                .concurrency(10)
                .slaTargets(List.of(new SlaTarget(95, Duration.ofMillis(500)), new SlaTarget(99, Duration.ofMillis(5))))
                .build();

        BenchmarkResult result = runner.run(config, iteration -> Thread.sleep(50));

        assertThat(result.successCount()).isEqualTo(1000);
        assertThat(result.failureCount()).isZero();
        assertThat(result.latency().p50Ms()).isGreaterThanOrEqualTo(49.0);
        assertThat(result.latency().p95Ms()).isGreaterThanOrEqualTo(result.latency().p50Ms());
        assertThat(result.latency().p99Ms()).isGreaterThanOrEqualTo(result.latency().p95Ms());
        // 100 rounds of 50ms on 10 workers, so about concurrency / latency = 200 calls per second
        assertThat(result.wallTimeMs()).isBetween(4_750.0, 6_700.0);
        assertThat(result.throughputPerSecond()).isBetween(150.0, 210.0);
        assertThat(result.slaChecks()).extracting(SlaCheck::passed).containsExactly(true, false);
        assertThat(result.slaMet()).isFalse();
    }

    @Test
    void failuresAreCountedAndSampled() {
        AtomicInteger calls = new AtomicInteger();
        BenchmarkConfig config = BenchmarkConfig.builder().iterations(30).warmupIterations(5).concurrency(3).build();

        BenchmarkResult result = runner.run(config, iteration -> {
            calls.incrementAndGet();
            if (iteration % 3 == 0) {
                throw new IllegalStateException("failed iteration " + iteration);
            }
        });

        assertThat(calls.get()).isEqualTo(35);
        assertThat(result.successCount()).isEqualTo(20);
        assertThat(result.failureCount()).isEqualTo(10);
        assertThat(result.sampleErrors()).hasSize(10).allMatch(error -> error.startsWith("IllegalStateException"));
        assertThat(result.slaMet()).isTrue();
    }

    @Test
    void allFailuresLeaveSlaUnmet() {
        BenchmarkConfig config = BenchmarkConfig.builder()
                .iterations(5)
                .concurrency(1)
                .slaTargets(List.of(new SlaTarget(99, Duration.ofSeconds(1))))
                .build();

        BenchmarkResult result = runner.run(config, iteration -> {
            throw new ResourceExhaustedException("full");
        });

        assertThat(result.successCount()).isZero();
        assertThat(result.latency()).isEqualTo(LatencyStats.EMPTY);
        assertThat(result.slaMet()).isFalse();
    }

    @Test
    void engineBenchmarkCyclesRequests() {
        RiskEngine engine = mock(RiskEngine.class);
        RiskAssessmentRequest first = TestRequests.request(3);
        RiskAssessmentRequest second = TestRequests.request(12);
        when(engine.assess(any())).thenReturn(null);

        BenchmarkResult result = runner.benchmarkEngine(engine, List.of(first, second),
                BenchmarkConfig.builder().iterations(10).concurrency(2).build());

        assertThat(result.successCount()).isEqualTo(10);
        verify(engine, times(5)).assess(first);
        verify(engine, times(5)).assess(second);
        assertThatThrownBy(() -> runner.benchmarkEngine(engine, List.of(), BenchmarkConfig.builder().iterations(1).concurrency(1).build()))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void percentilesUseNearestRank() {
        long[] sorted = new long[100];
        for (int i = 0; i < sorted.length; i++) {
            sorted[i] = (i + 1) * 1_000_000L;
        }

        LatencyStats stats = LatencyStats.fromSorted(sorted);

        assertThat(stats.p50Ms()).isEqualTo(50.0);
        assertThat(stats.p95Ms()).isEqualTo(95.0);
        assertThat(stats.p99Ms()).isEqualTo(99.0);
        assertThat(stats.minMs()).isEqualTo(1.0);
        assertThat(stats.maxMs()).isEqualTo(100.0);
        assertThat(stats.avgMs()).isEqualTo(50.5);
        assertThat(LatencyStats.percentile(new long[]{7}, 99)).isEqualTo(7);
    }
}
