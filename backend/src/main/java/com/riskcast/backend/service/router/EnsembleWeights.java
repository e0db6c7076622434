package com.riskcast.backend.service.router;

import java.util.Map;
import java.util.TreeMap;

/**
 * Immutable, versioned blend weights. Updates produce a new instance with a higher version.
 */
public record EnsembleWeights(long version, HorizonWeights defaults, Map<Integer, HorizonWeights> overrides) {

    public EnsembleWeights {
        overrides = Map.copyOf(overrides);
    }

    public static EnsembleWeights initial() {
        return new EnsembleWeights(1L, HorizonWeights.EQUAL, Map.of());
    }

    public HorizonWeights forHorizon(int horizon) {
        return overrides.getOrDefault(horizon, defaults);
    }

    public EnsembleWeights withOverrides(Map<Integer, HorizonWeights> updates) {
        Map<Integer, HorizonWeights> merged = new TreeMap<>(overrides);
        updates.forEach((horizon, weights) -> merged.put(horizon, weights.normalized()));
        return new EnsembleWeights(version + 1, defaults, merged);
    }
}
