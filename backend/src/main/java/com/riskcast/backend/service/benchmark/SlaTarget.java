package com.riskcast.backend.service.benchmark;

import java.time.Duration;

public record SlaTarget(double percentile, Duration maxLatency) {

    public SlaTarget {
        if (percentile <= 0 || percentile > 100) {
            throw new IllegalArgumentException("percentile must be in (0, 100]");
        }
    }
}
