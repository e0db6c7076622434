package com.riskcast.backend.model;

public record UncertaintyBounds(double lower, double upper) {

    public static UncertaintyBounds around(double score, double halfWidth) {
        double width = Math.max(0.0, halfWidth);
        return new UncertaintyBounds(Math.max(0.0, score - width), Math.min(1.0, score + width));
    }

    public double width() {
        return upper - lower;
    }
}
