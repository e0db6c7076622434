package com.riskcast.backend.service.engine;

import com.riskcast.backend.exception.CircuitOpenException;
import com.riskcast.backend.model.CircuitBreakerState;
import com.riskcast.backend.model.CircuitBreakerState.State;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.function.BiConsumer;

/**
 * Guards the model path. CLOSED counts consecutive failures; OPEN rejects until the recovery timeout
 * passes; HALF_OPEN hands out exactly {@code halfOpenMaxCalls} probe permits and closes only when all of
 * them succeed.
 *
 * <p>Outcomes are reported against the {@link Permit} they were issued under. An outcome from a permit
 * issued before the last transition is ignored, so a slow call admitted while CLOSED cannot close a
 * breaker that has since opened.
 */
@Slf4j
public class ModelCircuitBreaker {

    public record Permit(long generation, boolean probe) {
    }

    private final int failureThreshold;
    private final Duration recoveryTimeout;
    private final int halfOpenMaxCalls;
    private final Clock clock;
    private final BiConsumer<State, State> transitionListener;

    private State state = State.CLOSED;
    private long generation;
    private int failureCount;
    private Instant lastFailureAt;
    private Instant openedAt;
    private int probesIssued;
    private int probesSucceeded;

    public ModelCircuitBreaker(int failureThreshold, Duration recoveryTimeout, int halfOpenMaxCalls, Clock clock,
                               BiConsumer<State, State> transitionListener) {
        if (failureThreshold < 1 || halfOpenMaxCalls < 1) {
            throw new IllegalArgumentException("failureThreshold and halfOpenMaxCalls must be positive");
        }
        this.failureThreshold = failureThreshold;
        this.recoveryTimeout = recoveryTimeout;
        this.halfOpenMaxCalls = halfOpenMaxCalls;
        this.clock = clock;
        this.transitionListener = transitionListener;
    }

    /**
     * @throws CircuitOpenException when the breaker is open or all half-open probes are taken
     */
    public synchronized Permit acquirePermission() {
        if (state == State.OPEN) {
            Instant retryAt = openedAt.plus(recoveryTimeout);
            if (clock.instant().isBefore(retryAt)) {
                throw new CircuitOpenException("Model circuit breaker is open", retryAt);
            }
            transitionTo(State.HALF_OPEN);
        }
        if (state == State.HALF_OPEN) {
            if (probesIssued >= halfOpenMaxCalls) {
                throw new CircuitOpenException("Model circuit breaker is half-open and all probes are in flight",
                        clock.instant().plus(recoveryTimeout));
            }
            probesIssued++;
            return new Permit(generation, true);
        }
        return new Permit(generation, false);
    }

    /**
     * Fails fast while the breaker is open and its recovery timeout has not passed. Takes no permit and
     * never transitions, so callers can check before handing work to a pool.
     *
     * @throws CircuitOpenException when the breaker is still open
     */
    public synchronized void rejectIfOpen() {
        if (state == State.OPEN) {
            Instant retryAt = openedAt.plus(recoveryTimeout);
            if (clock.instant().isBefore(retryAt)) {
                throw new CircuitOpenException("Model circuit breaker is open", retryAt);
            }
        }
    }

    public synchronized void onSuccess(Permit permit) {
        if (permit.generation() != generation) {
            return;
        }
        if (state == State.CLOSED) {
            failureCount = 0;
        } else if (state == State.HALF_OPEN) {
            probesSucceeded++;
            if (probesSucceeded >= halfOpenMaxCalls) {
                transitionTo(State.CLOSED);
            }
        }
    }

    public synchronized void onFailure(Permit permit, Throwable cause) {
        lastFailureAt = clock.instant();
        if (permit.generation() != generation) {
            return;
        }
        if (state == State.CLOSED) {
            failureCount++;
            if (failureCount >= failureThreshold) {
                log.warn("⛔ Model circuit breaker opening after {} consecutive failures, last: {}", failureCount,
                        cause == null ? "unknown" : cause.getMessage());
                transitionTo(State.OPEN);
            }
        } else if (state == State.HALF_OPEN) {
            failureCount++;
            log.warn("⛔ Half-open probe failed, reopening model circuit breaker: {}",
                    cause == null ? "unknown" : cause.getMessage());
            transitionTo(State.OPEN);
        }
    }

    /**
     * Returns a permit without recording an outcome, as for a cancelled call.
     */
    public synchronized void release(Permit permit) {
        if (permit.generation() == generation && permit.probe() && state == State.HALF_OPEN && probesIssued > 0) {
            probesIssued--;
        }
    }

    public synchronized void reset() {
        if (state != State.CLOSED) {
            transitionTo(State.CLOSED);
        }
        failureCount = 0;
    }

    public synchronized State state() {
        return state;
    }

    public synchronized CircuitBreakerState snapshot() {
        return new CircuitBreakerState(state, failureCount, lastFailureAt, openedAt, failureThreshold,
                recoveryTimeout, halfOpenMaxCalls);
    }

    private void transitionTo(State next) {
        State previous = state;
        state = next;
        generation++;
        probesIssued = 0;
        probesSucceeded = 0;
        if (next == State.OPEN) {
            openedAt = clock.instant();
        } else if (next == State.CLOSED) {
            failureCount = 0;
            openedAt = null;
        }
        log.info("Model circuit breaker {} -> {}", previous, next);
        transitionListener.accept(previous, next);
    }
}
