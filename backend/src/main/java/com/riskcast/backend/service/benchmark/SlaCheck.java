package com.riskcast.backend.service.benchmark;

public record SlaCheck(double percentile, double targetMs, double actualMs, boolean passed) {
}
