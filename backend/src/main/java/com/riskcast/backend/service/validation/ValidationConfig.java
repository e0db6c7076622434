package com.riskcast.backend.service.validation;

import com.riskcast.backend.config.ValidationProperties;

import java.util.List;
import java.util.Map;
import java.util.TreeMap;

public record ValidationConfig(
        List<Integer> horizons,
        int folds,
        long randomSeed,
        double calibrationCutoff,
        ValidationTarget defaultTarget,
        Map<Integer, ValidationTarget> horizonTargets,
        List<LabeledSample> dataset
) {

    public ValidationConfig {
        if (folds < 2) {
            throw new IllegalArgumentException("At least two folds are required");
        }
        if (dataset.size() < folds) {
            throw new IllegalArgumentException("Dataset of " + dataset.size() + " samples cannot fill " + folds + " folds");
        }
        horizons = List.copyOf(horizons);
        horizonTargets = Map.copyOf(horizonTargets);
        dataset = List.copyOf(dataset);
    }

    public static ValidationConfig fromProperties(ValidationProperties properties, List<LabeledSample> dataset) {
        Map<Integer, ValidationTarget> targets = new TreeMap<>();
        properties.getHorizonTargets().forEach((horizon, target) -> targets.put(horizon, ValidationTarget.from(target)));
        return new ValidationConfig(properties.getHorizons(), properties.getFolds(), properties.getRandomSeed(),
                properties.getCalibrationCutoff(), ValidationTarget.from(properties.getDefaultTarget()), targets, dataset);
    }

    public ValidationTarget targetFor(int horizon) {
        return horizonTargets.getOrDefault(horizon, defaultTarget);
    }
}
