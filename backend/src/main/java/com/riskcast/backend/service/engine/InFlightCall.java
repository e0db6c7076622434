package com.riskcast.backend.service.engine;

import com.riskcast.backend.exception.RiskEngineException;
import com.riskcast.backend.model.EnsembleResult;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Future;

/**
 * One upstream computation shared by every caller that asked for the same fingerprint while it ran.
 */
final class InFlightCall {

    private final String key;
    private final CompletableFuture<EnsembleResult> promise = new CompletableFuture<>();
    private int waiters;
    private Future<?> task;
    private RiskEngineException abandonReason;

    InFlightCall(String key) {
        this.key = key;
    }

    String key() {
        return key;
    }

    CompletableFuture<EnsembleResult> promise() {
        return promise;
    }

    /**
     * Registers a waiter unless the call has already settled.
     */
    synchronized boolean tryJoin() {
        if (promise.isDone()) {
            return false;
        }
        waiters++;
        return true;
    }

    /**
     * @return true when the caller was the last waiter
     */
    synchronized boolean leave() {
        waiters--;
        return waiters == 0;
    }

    synchronized void attach(Future<?> upstream) {
        this.task = upstream;
        if (abandonReason != null) {
            upstream.cancel(true);
        }
    }

    /**
     * Settles the call with {@code reason} and interrupts the upstream task. Only takes effect while nobody
     * is waiting.
     */
    synchronized boolean abandon(RiskEngineException reason) {
        if (waiters > 0 || promise.isDone()) {
            return false;
        }
        abandonReason = reason;
        promise.completeExceptionally(reason);
        if (task != null) {
            task.cancel(true);
        }
        return true;
    }

    synchronized RiskEngineException abandonReason() {
        return abandonReason;
    }

    void complete(EnsembleResult result) {
        promise.complete(result);
    }

    void fail(RiskEngineException error) {
        promise.completeExceptionally(error);
    }

    synchronized int waiters() {
        return waiters;
    }
}
