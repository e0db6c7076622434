package com.riskcast.backend.service.router;

import com.riskcast.backend.config.RouterProperties;
import com.riskcast.backend.exception.EngineTimeoutException;
import com.riskcast.backend.exception.ModelInvocationException;
import com.riskcast.backend.exception.ResourceExhaustedException;
import com.riskcast.backend.exception.Stage;
import com.riskcast.backend.model.EnsembleResult;
import com.riskcast.backend.model.HorizonResult;
import com.riskcast.backend.model.ModelPrediction;
import com.riskcast.backend.model.ModelType;
import com.riskcast.backend.model.ModelUsed;
import com.riskcast.backend.model.RiskAssessmentRequest;
import com.riskcast.backend.service.MetricsService;
import com.riskcast.backend.support.TestExecutors;
import com.riskcast.backend.support.TestRequests;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class ModelEnsembleRouterTest {

    private final RouterProperties properties = new RouterProperties();
    private final ModelInvoker invoker = mock(ModelInvoker.class);
    private ThreadPoolTaskExecutor executor;
    private ModelEnsembleRouter router;

    @BeforeEach
    void setUp() {
        executor = TestExecutors.pool("horizon-test-", 4);
        router = new ModelEnsembleRouter(invoker, new RoutingPolicy(properties), properties, executor,
                new MetricsService(new SimpleMeterRegistry()), Clock.systemUTC());
    }

    @AfterEach
    void tearDown() {
        executor.shutdown();
    }

    @Test
    void shortHorizonUsesOnlyShortModel() {
        stub(ModelSlot.SHORT, 0.2, 0.9);

        EnsembleResult result = router.predict(TestRequests.request(3), deadline());

        HorizonResult horizon = result.horizon(3);
        assertThat(horizon.modelUsed()).isEqualTo(ModelUsed.SHORT);
        assertThat(horizon.score()).isEqualTo(0.2);
        assertThat(horizon.weights()).containsExactly(Map.entry("short", 1.0));
        assertThat(horizon.degraded()).isFalse();
        assertThat(result.degraded()).isFalse();
        verify(invoker, never()).invoke(eq(ModelSlot.LONG), any(), anyInt());
    }

    @Test
    void longHorizonFallsBackToShortWithPenalty() {
        stub(ModelSlot.SHORT, 0.4, 0.9);
        when(invoker.invoke(eq(ModelSlot.LONG), any(), anyInt()))
                .thenThrow(new ModelInvocationException("sequence-long", "model offline"));

        EnsembleResult result = router.predict(TestRequests.request(12), deadline());

        HorizonResult horizon = result.horizon(12);
        assertThat(horizon.failed()).isFalse();
        assertThat(horizon.modelUsed()).isEqualTo(ModelUsed.SHORT_FALLBACK);
        assertThat(horizon.degraded()).isTrue();
        assertThat(horizon.confidence()).isCloseTo(0.72, within(1e-9));
        assertThat(horizon.score()).isEqualTo(0.4);
        assertThat(result.degraded()).isTrue();
    }

    @Test
    void middleHorizonBlendsBothModels() {
        stub(ModelSlot.SHORT, 0.2, 0.8);
        stub(ModelSlot.LONG, 0.6, 0.6);
        RiskAssessmentRequest request = TestRequests.base()
                .predictionHorizons(List.of(4))
                .includeUncertainty(true)
                .build();

        HorizonResult horizon = router.predict(request, deadline()).horizon(4);

        assertThat(horizon.modelUsed()).isEqualTo(ModelUsed.ENSEMBLE);
        assertThat(horizon.score()).isCloseTo(0.4, within(1e-9));
        // mean 0.7, penalty 0.5 * 0.4 = 0.2
        assertThat(horizon.confidence()).isCloseTo(0.56, within(1e-9));
        assertThat(horizon.comparison().scoreDifference()).isCloseTo(0.4, within(1e-9));
        assertThat(horizon.uncertainty().lower()).isLessThanOrEqualTo(horizon.score());
        assertThat(horizon.uncertainty().upper()).isGreaterThanOrEqualTo(horizon.score());
    }

    @Test
    void updatedWeightsApplyToLaterRequests() {
        stub(ModelSlot.SHORT, 0.2, 0.8);
        stub(ModelSlot.LONG, 0.6, 0.8);
        RiskAssessmentRequest request = TestRequests.base()
                .predictionHorizons(List.of(4))
                .modelType(ModelType.ENSEMBLE)
                .build();

        EnsembleWeights updated = router.updateWeights(Map.of(4, new HorizonWeights(3, 1)));
        EnsembleResult result = router.predict(request, deadline());

        assertThat(updated.version()).isEqualTo(2L);
        assertThat(result.weightsVersion()).isEqualTo(2L);
        assertThat(result.horizon(4).score()).isCloseTo(0.3, within(1e-9));
        assertThat(result.horizon(4).weights()).containsEntry("short", 0.75);
    }

    @Test
    void partialFailureKeepsOtherHorizons() {
        when(invoker.invoke(eq(ModelSlot.SHORT), any(), eq(1))).thenReturn(prediction(ModelSlot.SHORT, 1, 0.1, 0.9));
        when(invoker.invoke(eq(ModelSlot.SHORT), any(), eq(2)))
                .thenThrow(new ModelInvocationException("tree-short", "bad features"));

        EnsembleResult result = router.predict(TestRequests.request(1, 2), deadline());

        assertThat(result.horizons().keySet()).containsExactly(1, 2);
        assertThat(result.horizon(1).failed()).isFalse();
        assertThat(result.horizon(2).failed()).isTrue();
        assertThat(result.horizon(2).score()).isNull();
        assertThat(result.horizon(2).errorCode()).isEqualTo("MODEL_INVOCATION");
        assertThat(result.degraded()).isTrue();
        assertThat(result.anyHorizonFailed()).isTrue();
    }

    @Test
    void allHorizonsFailingRaisesModelInvocation() {
        when(invoker.invoke(any(), any(), anyInt())).thenThrow(new ModelInvocationException("tree-short", "down"));

        assertThatThrownBy(() -> router.predict(TestRequests.request(1, 2), deadline()))
                .isInstanceOf(ModelInvocationException.class)
                .hasMessageContaining("All 2 horizons failed");
    }

    @Test
    void slowModelHitsDeadline() {
        when(invoker.invoke(any(), any(), anyInt())).thenAnswer(invocation -> {
            Thread.sleep(2_000);
            return prediction(ModelSlot.SHORT, 3, 0.2, 0.9);
        });

        assertThatThrownBy(() -> router.predict(TestRequests.request(3),
                Instant.now().plus(Duration.ofMillis(50))))
                .isInstanceOf(EngineTimeoutException.class);
    }

    @Test
    void confidenceSummaryListsLowAndHighHorizons() {
        when(invoker.invoke(eq(ModelSlot.SHORT), any(), eq(1))).thenReturn(prediction(ModelSlot.SHORT, 1, 0.1, 0.95));
        when(invoker.invoke(eq(ModelSlot.SHORT), any(), eq(2))).thenReturn(prediction(ModelSlot.SHORT, 2, 0.1, 0.4));

        EnsembleResult result = router.predict(TestRequests.request(1, 2), deadline());

        assertThat(result.confidence().highConfidenceHorizons()).containsExactly(1);
        assertThat(result.confidence().lowConfidenceHorizons()).containsExactly(2);
        assertThat(result.confidence().overallConfidence()).isCloseTo(0.675, within(1e-9));
    }

    @Test
    void saturatedHorizonPoolIsResourceExhaustion() throws Exception {
        ThreadPoolTaskExecutor saturated = new ThreadPoolTaskExecutor();
        saturated.setCorePoolSize(1);
        saturated.setMaxPoolSize(1);
        saturated.setQueueCapacity(0);
        saturated.setThreadNamePrefix("horizon-saturated-");
        saturated.initialize();
        CountDownLatch release = new CountDownLatch(1);
        CountDownLatch busy = new CountDownLatch(1);
        saturated.execute(() -> {
            busy.countDown();
            try {
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });
        try {
            assertThat(busy.await(5, TimeUnit.SECONDS)).isTrue();
            ModelEnsembleRouter saturatedRouter = new ModelEnsembleRouter(invoker, new RoutingPolicy(properties),
                    properties, saturated, new MetricsService(new SimpleMeterRegistry()), Clock.systemUTC());

            assertThatThrownBy(() -> saturatedRouter.predict(TestRequests.request(3), deadline()))
                    .isInstanceOfSatisfying(ResourceExhaustedException.class, e -> {
                        assertThat(e.getStage()).isEqualTo(Stage.ROUTER);
                        assertThat(e.countsAsModelFailure()).isFalse();
                    });
            verify(invoker, never()).invoke(any(), any(), anyInt());
        } finally {
            release.countDown();
            saturated.shutdown();
        }
    }

    @Test
    void inlinePredictionRunsOnCallingThread() {
        AsyncTaskExecutor unusable = mock(AsyncTaskExecutor.class);
        ModelEnsembleRouter inlineRouter = new ModelEnsembleRouter(invoker, new RoutingPolicy(properties), properties,
                unusable, new MetricsService(new SimpleMeterRegistry()), Clock.systemUTC());
        Set<String> threads = ConcurrentHashMap.newKeySet();
        when(invoker.invoke(eq(ModelSlot.SHORT), any(), anyInt())).thenAnswer(invocation -> {
            threads.add(Thread.currentThread().getName());
            return prediction(ModelSlot.SHORT, invocation.getArgument(2), 0.3, 0.9);
        });
        when(invoker.invoke(eq(ModelSlot.LONG), any(), anyInt()))
                .thenThrow(new ModelInvocationException("sequence-long", "model offline"));

        EnsembleResult result = inlineRouter.predictInline(TestRequests.request(2, 3, 12), deadline());

        assertThat(result.horizons().keySet()).containsExactly(2, 3, 12);
        assertThat(result.horizon(12).modelUsed()).isEqualTo(ModelUsed.SHORT_FALLBACK);
        assertThat(threads).containsExactly(Thread.currentThread().getName());
        verifyNoInteractions(unusable);
    }

    @Test
    void inlinePredictionStopsAtPassedDeadline() {
        stub(ModelSlot.SHORT, 0.3, 0.9);

        assertThatThrownBy(() -> router.predictInline(TestRequests.request(3), Instant.now().minusSeconds(1)))
                .isInstanceOf(EngineTimeoutException.class);
        verify(invoker, never()).invoke(any(), any(), anyInt());
    }

    private void stub(ModelSlot slot, double score, double confidence) {
        when(invoker.invoke(eq(slot), any(), anyInt())).thenAnswer(invocation ->
                prediction(slot, invocation.getArgument(2), score, confidence));
    }

    private static ModelPrediction prediction(ModelSlot slot, int horizon, double score, double confidence) {
        return ModelPrediction.of(horizon, score, confidence, slot.label() + "-model", "v1", 10);
    }

    private static Instant deadline() {
        return Instant.now().plus(Duration.ofSeconds(5));
    }
}
