package com.riskcast.backend.service.benchmark;

import com.riskcast.backend.model.RiskAssessmentRequest;
import com.riskcast.backend.service.engine.RiskEngine;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Latency and throughput measurement against an arbitrary target. Each run gets its own worker pool.
 */
@Slf4j
@Component
public class BenchmarkRunner {

    private static final int MAX_SAMPLE_ERRORS = 10;

    public BenchmarkResult run(BenchmarkConfig config, BenchmarkTarget target) {
        if (config.warmupIterations() > 0) {
            execute(config.warmupIterations(), config.concurrency(), target, "benchmark-warmup-");
        }
        Measurement measurement = execute(config.iterations(), config.concurrency(), target, "benchmark-");

        long[] successes = measurement.successLatencies();
        Arrays.sort(successes);
        LatencyStats stats = LatencyStats.fromSorted(successes);
        double wallSeconds = measurement.wallNanos() / 1_000_000_000.0;
        double throughput = wallSeconds > 0 ? successes.length / wallSeconds : 0.0;

        List<SlaCheck> checks = new ArrayList<>();
        for (SlaTarget sla : config.slaTargets()) {
            double actualMs = successes.length == 0 ? Double.POSITIVE_INFINITY
                    : LatencyStats.percentile(successes, sla.percentile()) / 1_000_000.0;
            double targetMs = sla.maxLatency().toNanos() / 1_000_000.0;
            checks.add(new SlaCheck(sla.percentile(), targetMs, actualMs, actualMs <= targetMs));
        }
        boolean slaMet = checks.stream().allMatch(SlaCheck::passed);

        BenchmarkResult result = new BenchmarkResult(config.name(), config.iterations(), config.warmupIterations(),
                config.concurrency(), successes.length, measurement.failures(), measurement.wallNanos() / 1_000_000.0,
                throughput, stats, checks, slaMet, measurement.sampleErrors());
        log.info("Benchmark {}: {} ok / {} failed, p50={}ms p95={}ms p99={}ms, {}/s, slaMet={}", config.name(),
                result.successCount(), result.failureCount(), round(stats.p50Ms()), round(stats.p95Ms()),
                round(stats.p99Ms()), round(throughput), slaMet);
        return result;
    }

    /**
     * Drives the engine with {@code requests}, cycling through them.
     */
    public BenchmarkResult benchmarkEngine(RiskEngine engine, List<RiskAssessmentRequest> requests,
                                           BenchmarkConfig config) {
        if (requests.isEmpty()) {
            throw new IllegalArgumentException("At least one request is required");
        }
        return run(config, iteration -> engine.assess(requests.get(iteration % requests.size())));
    }

    private record Measurement(long[] successLatencies, int failures, long wallNanos, List<String> sampleErrors) {
    }

    private Measurement execute(int iterations, int concurrency, BenchmarkTarget target, String threadPrefix) {
        long[] latencies = new long[iterations];
        boolean[] succeeded = new boolean[iterations];
        AtomicInteger next = new AtomicInteger();
        AtomicInteger failures = new AtomicInteger();
        List<String> errors = Collections.synchronizedList(new ArrayList<>());

        int workers = Math.min(concurrency, iterations);
        ExecutorService pool = Executors.newFixedThreadPool(workers, new CustomizableThreadFactory(threadPrefix));
        CountDownLatch ready = new CountDownLatch(workers);
        CountDownLatch go = new CountDownLatch(1);
        CountDownLatch done = new CountDownLatch(workers);
        for (int w = 0; w < workers; w++) {
            pool.execute(() -> {
                ready.countDown();
                try {
                    go.await();
                    int iteration;
                    while ((iteration = next.getAndIncrement()) < iterations) {
                        long started = System.nanoTime();
                        try {
                            target.invoke(iteration);
                            latencies[iteration] = System.nanoTime() - started;
                            succeeded[iteration] = true;
                        } catch (InterruptedException e) {
                            Thread.currentThread().interrupt();
                            return;
                        } catch (Exception e) {
                            failures.incrementAndGet();
                            if (errors.size() < MAX_SAMPLE_ERRORS) {
                                errors.add(e.getClass().getSimpleName() + ": " + e.getMessage());
                            }
                        }
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                } finally {
                    done.countDown();
                }
            });
        }

        long wallNanos;
        try {
            ready.await();
            long started = System.nanoTime();
            go.countDown();
            done.await();
            wallNanos = System.nanoTime() - started;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            pool.shutdownNow();
            throw new IllegalStateException("Benchmark interrupted", e);
        } finally {
            pool.shutdown();
        }
        awaitTermination(pool);

        long[] successLatencies = new long[iterations];
        int count = 0;
        for (int i = 0; i < iterations; i++) {
            if (succeeded[i]) {
                successLatencies[count++] = latencies[i];
            }
        }
        return new Measurement(Arrays.copyOf(successLatencies, count), failures.get(), wallNanos, List.copyOf(errors));
    }

    private void awaitTermination(ExecutorService pool) {
        try {
            if (!pool.awaitTermination(5, TimeUnit.SECONDS)) {
                pool.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            pool.shutdownNow();
        }
    }

    private static double round(double value) {
        return Math.round(value * 100.0) / 100.0;
    }
}
