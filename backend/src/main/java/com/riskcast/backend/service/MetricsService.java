package com.riskcast.backend.service;

import com.riskcast.backend.exception.ErrorCode;
import com.riskcast.backend.model.CircuitBreakerState;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.FunctionCounter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.function.ToDoubleFunction;

@Service
@Slf4j
@RequiredArgsConstructor
public class MetricsService {

    private final MeterRegistry meterRegistry;

    public void recordCacheLookup(String tier, boolean hit) {
        Counter.builder("riskcast_cache_requests_total")
                .tag("tier", tier)
                .tag("result", hit ? "hit" : "miss")
                .register(meterRegistry)
                .increment();
    }

    public <T> void bindCacheEvictions(String tier, T source, ToDoubleFunction<T> evictions) {
        FunctionCounter.builder("riskcast_cache_evictions_total", source, evictions)
                .tag("tier", tier)
                .register(meterRegistry);
    }

    public <T> void bindCacheSize(String tier, T source, ToDoubleFunction<T> size) {
        Gauge.builder("riskcast_cache_size", source, size)
                .tag("tier", tier)
                .register(meterRegistry);
    }

    public void recordCacheBackendFailure(String operation) {
        Counter.builder("riskcast_cache_backend_errors_total")
                .tag("operation", operation)
                .register(meterRegistry)
                .increment();
    }

    public void recordBreakerTransition(CircuitBreakerState.State from, CircuitBreakerState.State to) {
        Counter.builder("riskcast_breaker_transitions_total")
                .tag("from", from.name())
                .tag("to", to.name())
                .register(meterRegistry)
                .increment();
    }

    public void recordHorizonLatency(int horizon, String modelUsed, long nanos) {
        Timer.builder("riskcast_horizon_latency")
                .tag("horizon", String.valueOf(horizon))
                .tag("model_used", modelUsed)
                .publishPercentileHistogram()
                .register(meterRegistry)
                .record(Duration.ofNanos(nanos));
    }

    public void recordModelLatency(String modelId, long nanos) {
        Timer.builder("riskcast_model_latency")
                .tag("model", modelId == null ? "unknown" : modelId)
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(meterRegistry)
                .record(Duration.ofNanos(nanos));
    }

    public ModelLatency modelLatency(String modelId) {
        Timer timer = meterRegistry.find("riskcast_model_latency").tag("model", modelId).timer();
        long failures = (long) counterValue("riskcast_model_failures_total", "model", modelId);
        if (timer == null) {
            return new ModelLatency(0, failures, 0.0, 0.0);
        }
        return new ModelLatency(timer.count(), failures, timer.mean(TimeUnit.MILLISECONDS),
                timer.max(TimeUnit.MILLISECONDS));
    }

    public record ModelLatency(long calls, long failures, double meanMs, double maxMs) {
    }

    public void recordModelFailure(String modelId) {
        Counter.builder("riskcast_model_failures_total")
                .tag("model", modelId == null ? "unknown" : modelId)
                .register(meterRegistry)
                .increment();
    }

    public void recordDegradedHorizon(int horizon) {
        Counter.builder("riskcast_degraded_horizons_total")
                .tag("horizon", String.valueOf(horizon))
                .register(meterRegistry)
                .increment();
    }

    public void recordAssessment(String outcome, long nanos) {
        Timer.builder("riskcast_assess_latency")
                .tag("outcome", outcome)
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(meterRegistry)
                .record(Duration.ofNanos(nanos));
    }

    public void recordEngineError(ErrorCode code) {
        Counter.builder("riskcast_engine_errors_total")
                .tag("code", code.name())
                .register(meterRegistry)
                .increment();
    }

    public void recordValidation(boolean passed) {
        Counter.builder("riskcast_validation_runs_total")
                .tag("result", passed ? "pass" : "fail")
                .register(meterRegistry)
                .increment();
    }

    public void recordPrefetch(int refreshed, int failed) {
        Counter.builder("riskcast_prefetch_refreshed_total").register(meterRegistry).increment(refreshed);
        Counter.builder("riskcast_prefetch_failed_total").register(meterRegistry).increment(failed);
    }

    public void recordBackgroundTaskFailure(String task) {
        Counter.builder("riskcast_background_task_failures_total")
                .tag("task", task)
                .register(meterRegistry)
                .increment();
    }

    public double counterValue(String name, String... tags) {
        Counter counter = meterRegistry.find(name).tags(tags).counter();
        return counter == null ? 0.0 : counter.count();
    }
}
