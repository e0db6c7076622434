package com.riskcast.backend.service.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Weights of a single-layer Elman network. Input at each step is the feature vector followed by the
 * fraction of the horizon elapsed, so {@code inputSize} is {@code FeatureVector.SIZE + 1}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SequenceArtifact(
        String modelId,
        String version,
        int inputSize,
        int hiddenSize,
        double[][] inputWeights,
        double[][] recurrentWeights,
        double[] hiddenBias,
        double[] outputWeights,
        double outputBias,
        double baseConfidence,
        double horizonConfidenceDecay,
        double minConfidence
) {
}
