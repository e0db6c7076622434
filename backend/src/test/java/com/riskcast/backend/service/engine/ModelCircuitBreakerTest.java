package com.riskcast.backend.service.engine;

import com.riskcast.backend.exception.CircuitOpenException;
import com.riskcast.backend.model.CircuitBreakerState.State;
import com.riskcast.backend.support.MutableClock;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ModelCircuitBreakerTest {

    private final MutableClock clock = new MutableClock(Instant.parse("2026-01-01T00:00:00Z"));
    private final List<String> transitions = new ArrayList<>();
    private final ModelCircuitBreaker breaker = new ModelCircuitBreaker(3, Duration.ofSeconds(30), 2, clock,
            (from, to) -> transitions.add(from + "->" + to));

    @Test
    void successResetsConsecutiveFailureCount() {
        fail(2);
        breaker.onSuccess(breaker.acquirePermission());
        fail(2);

        assertThat(breaker.state()).isEqualTo(State.CLOSED);
        assertThat(breaker.snapshot().failureCount()).isEqualTo(2);
    }

    @Test
    void opensAtThresholdAndRejectsUntilRecoveryTimeout() {
        fail(3);

        assertThat(breaker.state()).isEqualTo(State.OPEN);
        clock.advance(Duration.ofSeconds(29));
        assertThatThrownBy(breaker::acquirePermission).isInstanceOf(CircuitOpenException.class);
        assertThat(transitions).containsExactly("CLOSED->OPEN");
    }

    @Test
    void halfOpenClosesOnlyAfterAllProbesSucceed() {
        openAndWait();

        ModelCircuitBreaker.Permit first = breaker.acquirePermission();
        ModelCircuitBreaker.Permit second = breaker.acquirePermission();
        assertThat(first.probe()).isTrue();
        assertThatThrownBy(breaker::acquirePermission).isInstanceOf(CircuitOpenException.class);

        breaker.onSuccess(first);
        assertThat(breaker.state()).isEqualTo(State.HALF_OPEN);
        breaker.onSuccess(second);

        assertThat(breaker.state()).isEqualTo(State.CLOSED);
        assertThat(transitions).containsExactly("CLOSED->OPEN", "OPEN->HALF_OPEN", "HALF_OPEN->CLOSED");
    }

    @Test
    void failedProbeReopens() {
        openAndWait();

        breaker.onFailure(breaker.acquirePermission(), new RuntimeException("still broken"));

        assertThat(breaker.state()).isEqualTo(State.OPEN);
        assertThat(breaker.snapshot().openedAt()).isEqualTo(clock.instant());
    }

    @Test
    void releasedProbeCanBeReissued() {
        openAndWait();
        ModelCircuitBreaker.Permit first = breaker.acquirePermission();
        ModelCircuitBreaker.Permit second = breaker.acquirePermission();

        breaker.release(first);
        ModelCircuitBreaker.Permit replacement = breaker.acquirePermission();
        breaker.onSuccess(second);
        breaker.onSuccess(replacement);

        assertThat(breaker.state()).isEqualTo(State.CLOSED);
    }

    @Test
    void staleOutcomesAreIgnored() {
        ModelCircuitBreaker.Permit slow = breaker.acquirePermission();
        fail(3);
        assertThat(breaker.state()).isEqualTo(State.OPEN);

        breaker.onSuccess(slow);

        assertThat(breaker.state()).isEqualTo(State.OPEN);
    }

    @Test
    void resetClosesImmediately() {
        fail(3);

        breaker.reset();

        assertThat(breaker.state()).isEqualTo(State.CLOSED);
        assertThat(breaker.acquirePermission().probe()).isFalse();
    }

    private void openAndWait() {
        fail(3);
        clock.advance(Duration.ofSeconds(30));
    }

    private void fail(int times) {
        for (int i = 0; i < times; i++) {
            breaker.onFailure(breaker.acquirePermission(), new RuntimeException("boom"));
        }
    }
}
