package com.riskcast.backend.service.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record TreeEnsembleArtifact(
        String modelId,
        String version,
        int featureCount,
        double baseMargin,
        double learningRate,
        double baseConfidence,
        double horizonConfidenceDecay,
        double marginConfidenceWeight,
        List<Tree> trees
) {

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Tree(List<Node> nodes) {
    }

    /**
     * Split node when {@code leaf} is null: {@code value < threshold} goes left.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Node(Integer feature, Double threshold, Integer left, Integer right, Double leaf) {
        boolean isLeaf() {
            return leaf != null;
        }
    }
}
