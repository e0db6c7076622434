package com.riskcast.backend.service.benchmark;

@FunctionalInterface
public interface BenchmarkTarget {

    /**
     * One measured call. Throwing marks the iteration as failed.
     */
    void invoke(int iteration) throws Exception;
}
