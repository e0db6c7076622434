package com.riskcast.backend.service.router;

public record HorizonWeights(double shortWeight, double longWeight) {

    public static final HorizonWeights EQUAL = new HorizonWeights(0.5, 0.5);

    public HorizonWeights {
        if (!Double.isFinite(shortWeight) || !Double.isFinite(longWeight) || shortWeight < 0 || longWeight < 0) {
            throw new IllegalArgumentException("Weights must be finite and non-negative");
        }
        if (shortWeight + longWeight <= 0) {
            throw new IllegalArgumentException("At least one weight must be positive");
        }
    }

    public HorizonWeights normalized() {
        double total = shortWeight + longWeight;
        return new HorizonWeights(shortWeight / total, longWeight / total);
    }
}
