package com.riskcast.backend.service.router;

public final class BlendMath {

    private BlendMath() {
    }

    public static double blend(double shortScore, double longScore, HorizonWeights weights) {
        HorizonWeights normalized = weights.normalized();
        double blended = normalized.shortWeight() * shortScore + normalized.longWeight() * longScore;
        // floating point can land a hair outside the convex hull
        return Math.max(Math.min(shortScore, longScore), Math.min(Math.max(shortScore, longScore), blended));
    }

    public static double disagreementPenalty(double shortScore, double longScore, double factor, double maxPenalty) {
        return Math.min(maxPenalty, factor * Math.abs(shortScore - longScore));
    }

    public static double blendConfidence(double shortConfidence, double longConfidence, double penalty) {
        return clamp((shortConfidence + longConfidence) / 2.0 * (1.0 - penalty));
    }

    public static double uncertaintyHalfWidth(double confidence, double spread, double scale) {
        return clamp((1.0 - confidence) * scale + spread / 2.0);
    }

    public static double clamp(double value) {
        return Math.max(0.0, Math.min(1.0, value));
    }
}
