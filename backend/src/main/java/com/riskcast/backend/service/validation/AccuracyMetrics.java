package com.riskcast.backend.service.validation;

import java.util.ArrayList;
import java.util.List;

final class AccuracyMetrics {

    private AccuracyMetrics() {
    }

    static HorizonMetrics compute(int horizon, List<ScoredPrediction> predictions, double calibrationCutoff) {
        int n = predictions.size();
        if (n == 0) {
            return new HorizonMetrics(horizon, 0, 0.0, 0.0, 0.0, 0.0, 0.0, 0.0);
        }
        double absError = 0.0;
        double squaredError = 0.0;
        double actualSum = 0.0;
        double confidenceSum = 0.0;
        int correct = 0;
        for (ScoredPrediction p : predictions) {
            double error = p.predicted() - p.actual();
            absError += Math.abs(error);
            squaredError += error * error;
            actualSum += p.actual();
            confidenceSum += p.confidence();
            if (p.levelMatches()) {
                correct++;
            }
        }
        double actualMean = actualSum / n;
        double totalVariance = 0.0;
        for (ScoredPrediction p : predictions) {
            double deviation = p.actual() - actualMean;
            totalVariance += deviation * deviation;
        }
        double r2 = totalVariance == 0.0 ? 0.0 : 1.0 - squaredError / totalVariance;
        return new HorizonMetrics(horizon, n, (double) correct / n, absError / n, Math.sqrt(squaredError / n), r2,
                confidenceSum / n, calibrate(predictions, calibrationCutoff).calibrationError());
    }

    static double mae(List<ScoredPrediction> predictions) {
        return predictions.stream().mapToDouble(p -> Math.abs(p.predicted() - p.actual())).average().orElse(0.0);
    }

    /**
     * Two buckets split at {@code cutoff}; the error is the count-weighted mean gap between stated
     * confidence and realized accuracy.
     */
    static CalibrationReport calibrate(List<ScoredPrediction> predictions, double cutoff) {
        List<ScoredPrediction> low = new ArrayList<>();
        List<ScoredPrediction> high = new ArrayList<>();
        for (ScoredPrediction p : predictions) {
            (p.confidence() < cutoff ? low : high).add(p);
        }
        List<CalibrationBucket> buckets = List.of(
                bucket("low", 0.0, cutoff, low),
                bucket("high", cutoff, 1.0, high));
        int total = predictions.size();
        double error = 0.0;
        if (total > 0) {
            for (CalibrationBucket bucket : buckets) {
                error += bucket.count() * bucket.gap();
            }
            error /= total;
        }
        return new CalibrationReport(buckets, error);
    }

    private static CalibrationBucket bucket(String name, double lower, double upper, List<ScoredPrediction> members) {
        if (members.isEmpty()) {
            return new CalibrationBucket(name, lower, upper, 0, 0.0, 0.0);
        }
        double meanConfidence = members.stream().mapToDouble(ScoredPrediction::confidence).average().orElse(0.0);
        double accuracy = members.stream().filter(ScoredPrediction::levelMatches).count() / (double) members.size();
        return new CalibrationBucket(name, lower, upper, members.size(), meanConfidence, accuracy);
    }
}
