package com.riskcast.backend.service.engine;

import com.riskcast.backend.config.EngineProperties;
import com.riskcast.backend.exception.CircuitOpenException;
import com.riskcast.backend.exception.EngineTimeoutException;
import com.riskcast.backend.exception.ModelInvocationException;
import com.riskcast.backend.exception.RequestCancelledException;
import com.riskcast.backend.exception.ResourceExhaustedException;
import com.riskcast.backend.exception.RiskEngineException;
import com.riskcast.backend.exception.Stage;
import com.riskcast.backend.model.CircuitBreakerState;
import com.riskcast.backend.model.EnsembleResult;
import com.riskcast.backend.model.RiskAssessmentRequest;
import com.riskcast.backend.service.MetricsService;
import com.riskcast.backend.service.cache.ResultCache;
import com.riskcast.backend.service.model.ModelRegistry;
import com.riskcast.backend.service.router.ModelEnsembleRouter;
import io.github.resilience4j.bulkhead.Bulkhead;
import io.github.resilience4j.bulkhead.BulkheadConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * Admission, cache lookup, single-flight and circuit breaking in front of the ensemble router. All mutable
 * state belongs to the instance.
 */
@Slf4j
@Service
public class DefaultRiskEngine implements RiskEngine {

    private final RequestNormalizer normalizer;
    private final ResultCache resultCache;
    private final ModelEnsembleRouter router;
    private final ModelRegistry modelRegistry;
    private final AsyncTaskExecutor predictionExecutor;
    private final MetricsService metricsService;
    private final EngineProperties properties;
    private final Clock clock;
    private final Bulkhead bulkhead;
    private final ModelCircuitBreaker breaker;
    private final ConcurrentHashMap<String, InFlightCall> inFlight = new ConcurrentHashMap<>();

    public DefaultRiskEngine(RequestNormalizer normalizer,
                             ResultCache resultCache,
                             ModelEnsembleRouter router,
                             ModelRegistry modelRegistry,
                             @Qualifier("predictionExecutor") AsyncTaskExecutor predictionExecutor,
                             MetricsService metricsService,
                             EngineProperties properties,
                             Clock clock) {
        this.normalizer = normalizer;
        this.resultCache = resultCache;
        this.router = router;
        this.modelRegistry = modelRegistry;
        this.predictionExecutor = predictionExecutor;
        this.metricsService = metricsService;
        this.properties = properties;
        this.clock = clock;
        this.bulkhead = Bulkhead.of("risk-engine", BulkheadConfig.custom()
                .maxConcurrentCalls(properties.getMaxConcurrentRequests())
                .maxWaitDuration(Duration.ZERO)
                .build());
        EngineProperties.CircuitBreaker breakerProperties = properties.getCircuitBreaker();
        this.breaker = new ModelCircuitBreaker(breakerProperties.getFailureThreshold(),
                breakerProperties.getRecoveryTimeout(), breakerProperties.getHalfOpenMaxCalls(), clock,
                metricsService::recordBreakerTransition);
    }

    @Override
    public EnsembleResult assess(RiskAssessmentRequest request) {
        long started = System.nanoTime();
        String outcome = "error";
        try {
            RiskAssessmentRequest normalized = normalizer.normalize(request);
            if (!bulkhead.tryAcquirePermission()) {
                throw new ResourceExhaustedException("Concurrency limit of "
                        + properties.getMaxConcurrentRequests() + " requests reached");
            }
            try {
                Instant deadline = clock.instant().plus(properties.getRequestTimeout());
                String key = RequestFingerprint.of(normalized, modelRegistry.versionTag());
                Optional<EnsembleResult> cached = resultCache.get(key);
                if (cached.isPresent()) {
                    outcome = "cache_hit";
                    return cached.get();
                }
                EnsembleResult result = joinFlight(key, normalized, deadline);
                outcome = result.degraded() ? "degraded" : "computed";
                return result;
            } finally {
                bulkhead.onComplete();
            }
        } catch (RiskEngineException e) {
            metricsService.recordEngineError(e.getErrorCode());
            throw e;
        } finally {
            metricsService.recordAssessment(outcome, System.nanoTime() - started);
        }
    }

    private EnsembleResult joinFlight(String key, RiskAssessmentRequest request, Instant deadline) {
        InFlightCall fresh = new InFlightCall(key);
        InFlightCall call = inFlight.compute(key, (k, existing) -> {
            if (existing != null && existing.tryJoin()) {
                return existing;
            }
            fresh.tryJoin();
            return fresh;
        });
        if (call == fresh) {
            settleOrStart(fresh, request, deadline);
        } else {
            log.debug("Joined in-flight prediction {}", key);
        }
        return await(call, deadline);
    }

    /**
     * A flight that finished between this caller's cache miss and its registration has already stored its
     * result, so the cache is read once more before any work is queued. An open breaker settles the call on
     * this thread without touching the prediction pool.
     */
    private void settleOrStart(InFlightCall call, RiskAssessmentRequest request, Instant deadline) {
        Optional<EnsembleResult> settled = resultCache.get(call.key());
        if (settled.isPresent()) {
            inFlight.remove(call.key(), call);
            call.complete(settled.get());
            return;
        }
        try {
            breaker.rejectIfOpen();
        } catch (CircuitOpenException e) {
            inFlight.remove(call.key(), call);
            call.fail(e);
            return;
        }
        start(call, request, deadline);
    }

    private void start(InFlightCall call, RiskAssessmentRequest request, Instant deadline) {
        try {
            Future<?> task = predictionExecutor.submit(() -> runFlight(call, request, deadline));
            call.attach(task);
        } catch (RejectedExecutionException e) {
            inFlight.remove(call.key(), call);
            call.fail(new ResourceExhaustedException("Prediction workers saturated", e));
        }
    }

    private EnsembleResult await(InFlightCall call, Instant deadline) {
        RiskEngineException abandonReason = null;
        try {
            long waitNanos = Math.max(0L, Duration.between(clock.instant(), deadline).toNanos())
                    + properties.getTimeoutGrace().toNanos();
            return call.promise().get(waitNanos, TimeUnit.NANOSECONDS);
        } catch (ExecutionException e) {
            throw asEngineException(e.getCause());
        } catch (TimeoutException e) {
            abandonReason = new EngineTimeoutException(Stage.ROUTER,
                    "Prediction exceeded " + properties.getRequestTimeout().toMillis() + "ms");
            throw abandonReason;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            abandonReason = new RequestCancelledException(Stage.ROUTER, "Caller cancelled the prediction");
            throw abandonReason;
        } catch (CancellationException e) {
            throw new RequestCancelledException(Stage.ROUTER, "Prediction was cancelled");
        } finally {
            if (call.leave() && abandonReason != null && call.abandon(abandonReason)) {
                inFlight.remove(call.key(), call);
                log.debug("Abandoned in-flight prediction {}: {}", call.key(), abandonReason.getMessage());
            }
        }
    }

    private void runFlight(InFlightCall call, RiskAssessmentRequest request, Instant deadline) {
        try {
            ModelCircuitBreaker.Permit permit;
            try {
                permit = breaker.acquirePermission();
            } catch (CircuitOpenException e) {
                call.fail(e);
                return;
            }
            call.complete(compute(call.key(), request, () -> router.predict(request, deadline), permit, call));
        } catch (RiskEngineException e) {
            call.fail(e);
        } finally {
            inFlight.remove(call.key(), call);
        }
    }

    private EnsembleResult compute(String key, RiskAssessmentRequest request, Supplier<EnsembleResult> prediction,
                                   ModelCircuitBreaker.Permit permit, InFlightCall call) {
        EnsembleResult result;
        try {
            result = prediction.get().withFingerprint(key);
        } catch (RequestCancelledException e) {
            RiskEngineException reason = call == null ? null : call.abandonReason();
            if (reason != null && reason.countsAsModelFailure()) {
                breaker.onFailure(permit, reason);
                throw reason;
            }
            breaker.release(permit);
            throw e;
        } catch (RiskEngineException e) {
            if (e.countsAsModelFailure()) {
                breaker.onFailure(permit, e);
            } else {
                breaker.release(permit);
            }
            throw e;
        } catch (RuntimeException e) {
            ModelInvocationException failure = new ModelInvocationException(null,
                    "Unexpected router failure: " + e.getMessage(), e);
            breaker.onFailure(permit, failure);
            throw failure;
        }
        breaker.onSuccess(permit);
        store(key, request, result);
        return result;
    }

    private void store(String key, RiskAssessmentRequest request, EnsembleResult result) {
        if (result.anyHorizonFailed()) {
            log.debug("Not caching {}: some horizons failed", key);
            return;
        }
        Duration ttl = result.degraded() ? properties.getDegradedCacheTtl() : properties.getCacheTtl();
        Set<String> tags = Set.of(
                "business:" + request.businessName().toLowerCase(Locale.ROOT),
                "model:" + modelRegistry.versionTag());
        try {
            resultCache.set(key, result, ttl, request, tags);
        } catch (RuntimeException e) {
            log.warn("Failed to cache prediction {}: {}", key, e.getMessage());
        }
    }

    @Override
    public boolean refresh(String key, RiskAssessmentRequest normalizedRequest) {
        if (breaker.state() != CircuitBreakerState.State.CLOSED) {
            return false;
        }
        ModelCircuitBreaker.Permit permit;
        try {
            permit = breaker.acquirePermission();
        } catch (CircuitOpenException e) {
            return false;
        }
        Instant deadline = clock.instant().plus(properties.getRequestTimeout());
        compute(key, normalizedRequest, () -> router.predictInline(normalizedRequest, deadline), permit, null);
        return true;
    }

    @Override
    public CircuitBreakerState breakerState() {
        return breaker.snapshot();
    }

    @Override
    public void resetBreaker() {
        log.info("Model circuit breaker reset by operator");
        breaker.reset();
    }

    int inFlightCount() {
        return inFlight.size();
    }

    private RiskEngineException asEngineException(Throwable cause) {
        if (cause instanceof RiskEngineException engineException) {
            return engineException;
        }
        return new ModelInvocationException(null, "Prediction failed: " + cause, cause);
    }
}
