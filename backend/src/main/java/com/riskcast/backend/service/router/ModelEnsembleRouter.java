package com.riskcast.backend.service.router;

import com.riskcast.backend.config.RouterProperties;
import com.riskcast.backend.exception.EngineTimeoutException;
import com.riskcast.backend.exception.ModelInvocationException;
import com.riskcast.backend.exception.RequestCancelledException;
import com.riskcast.backend.exception.ResourceExhaustedException;
import com.riskcast.backend.exception.RiskEngineException;
import com.riskcast.backend.exception.Stage;
import com.riskcast.backend.model.ConfidenceSummary;
import com.riskcast.backend.model.EnsembleResult;
import com.riskcast.backend.model.HorizonResult;
import com.riskcast.backend.model.RiskAssessmentRequest;
import com.riskcast.backend.service.MetricsService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Routes each requested horizon to a model strategy and fans the horizons out concurrently. All horizon
 * tasks are joined, or cancelled, before {@link #predict} returns.
 */
@Slf4j
@Service
public class ModelEnsembleRouter {

    private final RoutingPolicy routingPolicy;
    private final RouterProperties properties;
    private final AsyncTaskExecutor horizonExecutor;
    private final MetricsService metricsService;
    private final Clock clock;
    private final Map<RoutingPolicy.Route, Predictor> predictors = new EnumMap<>(RoutingPolicy.Route.class);
    private final AtomicReference<EnsembleWeights> weights = new AtomicReference<>(EnsembleWeights.initial());

    public ModelEnsembleRouter(ModelInvoker modelInvoker,
                               RoutingPolicy routingPolicy,
                               RouterProperties properties,
                               @Qualifier("horizonExecutor") AsyncTaskExecutor horizonExecutor,
                               MetricsService metricsService,
                               Clock clock) {
        this.routingPolicy = routingPolicy;
        this.properties = properties;
        this.horizonExecutor = horizonExecutor;
        this.metricsService = metricsService;
        this.clock = clock;
        HorizonResultAssembler assembler = new HorizonResultAssembler(properties);
        predictors.put(RoutingPolicy.Route.SHORT_ONLY, new SingleModelPredictor(ModelSlot.SHORT, modelInvoker, assembler));
        predictors.put(RoutingPolicy.Route.LONG_ONLY, new SingleModelPredictor(ModelSlot.LONG, modelInvoker, assembler));
        predictors.put(RoutingPolicy.Route.LONG_WITH_FALLBACK, new LongWithFallbackPredictor(modelInvoker, assembler));
        predictors.put(RoutingPolicy.Route.BLEND, new BlendingPredictor(modelInvoker, assembler));
    }

    public EnsembleResult predict(RiskAssessmentRequest request, Instant deadline) {
        EnsembleWeights snapshot = weights.get();
        Map<Integer, Future<HorizonResult>> pending = new LinkedHashMap<>();
        try {
            for (Integer horizon : request.predictionHorizons()) {
                pending.put(horizon, horizonExecutor.submit(() -> predictHorizon(request, horizon, snapshot)));
            }
        } catch (RejectedExecutionException e) {
            cancelAll(pending);
            throw new ResourceExhaustedException(Stage.ROUTER, "Horizon workers saturated", e);
        }

        Map<Integer, HorizonResult> results = new LinkedHashMap<>();
        List<ModelInvocationException> failures = new ArrayList<>();
        try {
            for (Map.Entry<Integer, Future<HorizonResult>> entry : pending.entrySet()) {
                int horizon = entry.getKey();
                try {
                    results.put(horizon, entry.getValue().get(remainingNanos(deadline), TimeUnit.NANOSECONDS));
                } catch (ExecutionException e) {
                    recordFailure(horizon, e.getCause(), results, failures);
                }
            }
        } catch (TimeoutException e) {
            cancelAll(pending);
            throw new EngineTimeoutException(Stage.ROUTER, "Deadline exceeded while waiting for horizon predictions");
        } catch (InterruptedException e) {
            cancelAll(pending);
            Thread.currentThread().interrupt();
            throw new RequestCancelledException(Stage.ROUTER, "Prediction interrupted");
        } catch (CancellationException e) {
            cancelAll(pending);
            throw new RequestCancelledException(Stage.ROUTER, "Horizon prediction cancelled");
        } catch (RuntimeException e) {
            cancelAll(pending);
            throw e;
        }

        return assemble(results, failures, snapshot);
    }

    /**
     * Evaluates the horizons one after another on the calling thread. Used for background refreshes so they
     * never take threads from the request-serving horizon pool.
     */
    public EnsembleResult predictInline(RiskAssessmentRequest request, Instant deadline) {
        EnsembleWeights snapshot = weights.get();
        Map<Integer, HorizonResult> results = new LinkedHashMap<>();
        List<ModelInvocationException> failures = new ArrayList<>();
        for (Integer horizon : request.predictionHorizons()) {
            if (Thread.currentThread().isInterrupted()) {
                throw new RequestCancelledException(Stage.ROUTER, "Prediction interrupted");
            }
            if (remainingNanos(deadline) == 0L) {
                throw new EngineTimeoutException(Stage.ROUTER, "Deadline exceeded before horizon " + horizon);
            }
            try {
                results.put(horizon, predictHorizon(request, horizon, snapshot));
            } catch (RuntimeException e) {
                recordFailure(horizon, e, results, failures);
            }
        }
        return assemble(results, failures, snapshot);
    }

    private void recordFailure(int horizon, Throwable cause, Map<Integer, HorizonResult> results,
                               List<ModelInvocationException> failures) {
        ModelInvocationException failure;
        if (cause instanceof ModelInvocationException invocationFailure) {
            failure = invocationFailure;
        } else if (cause instanceof RiskEngineException engineException) {
            throw engineException;
        } else {
            failure = new ModelInvocationException(null, "Horizon " + horizon + " failed unexpectedly", cause);
        }
        failures.add(failure);
        results.put(horizon, HorizonResult.failure(horizon, failure.getErrorCode().name(), failure.getMessage()));
    }

    private EnsembleResult assemble(Map<Integer, HorizonResult> results, List<ModelInvocationException> failures,
                                    EnsembleWeights snapshot) {
        if (!results.isEmpty() && failures.size() == results.size()) {
            ModelInvocationException first = failures.get(0);
            ModelInvocationException all = new ModelInvocationException(first.getModelId(),
                    "All " + results.size() + " horizons failed: " + first.getMessage(), first);
            failures.stream().skip(1).forEach(all::addSuppressed);
            throw all;
        }

        boolean degraded = results.values().stream().anyMatch(r -> r.failed() || r.degraded());
        return new EnsembleResult(null, Collections.unmodifiableMap(results), degraded, snapshot.version(), summarize(results),
                clock.instant());
    }

    private HorizonResult predictHorizon(RiskAssessmentRequest request, int horizon, EnsembleWeights snapshot) {
        long started = System.nanoTime();
        RoutingPolicy.Route route = routingPolicy.route(request.modelType(), horizon);
        HorizonResult result = predictors.get(route).predict(request, horizon, snapshot.forHorizon(horizon));
        metricsService.recordHorizonLatency(horizon, result.modelUsed().wireName(), System.nanoTime() - started);
        if (result.degraded()) {
            metricsService.recordDegradedHorizon(horizon);
        }
        return result;
    }

    private ConfidenceSummary summarize(Map<Integer, HorizonResult> results) {
        List<HorizonResult> served = results.values().stream().filter(r -> !r.failed()).toList();
        double overall = served.stream().mapToDouble(HorizonResult::confidence).average().orElse(0.0);
        List<Integer> low = served.stream()
                .filter(r -> r.confidence() < properties.getLowConfidenceThreshold())
                .map(HorizonResult::horizon)
                .toList();
        List<Integer> high = served.stream()
                .filter(r -> r.confidence() > properties.getHighConfidenceThreshold())
                .map(HorizonResult::horizon)
                .toList();
        double agreement = served.stream()
                .filter(r -> r.comparison() != null)
                .mapToDouble(r -> r.comparison().agreement())
                .average()
                .orElse(1.0);
        return new ConfidenceSummary(overall, low, high, agreement);
    }

    private long remainingNanos(Instant deadline) {
        return Math.max(0L, Duration.between(clock.instant(), deadline).toNanos());
    }

    private void cancelAll(Map<Integer, Future<HorizonResult>> pending) {
        pending.values().forEach(future -> future.cancel(true));
    }

    public EnsembleWeights currentWeights() {
        return weights.get();
    }

    /**
     * Atomically installs per-horizon overrides; in-flight requests keep the snapshot they started with.
     */
    public EnsembleWeights updateWeights(Map<Integer, HorizonWeights> overrides) {
        EnsembleWeights updated = weights.updateAndGet(current -> current.withOverrides(overrides));
        log.info("Ensemble weights updated to version {} for horizons {}", updated.version(), overrides.keySet());
        return updated;
    }
}
