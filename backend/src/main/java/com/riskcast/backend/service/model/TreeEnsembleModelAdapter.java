package com.riskcast.backend.service.model;

import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.List;

/**
 * Gradient-boosted regression trees with a logistic link.
 */
public class TreeEnsembleModelAdapter extends AbstractJsonModelAdapter<TreeEnsembleArtifact> {

    public static final String DEFAULT_MODEL_ID = "tree-ensemble-short";

    public TreeEnsembleModelAdapter(ObjectMapper objectMapper) {
        super(objectMapper, TreeEnsembleArtifact.class, DEFAULT_MODEL_ID);
    }

    @Override
    protected void validate(TreeEnsembleArtifact artifact) {
        if (artifact.featureCount() != FeatureVector.SIZE) {
            throw new IllegalArgumentException("Tree artifact expects " + artifact.featureCount()
                    + " features, extractor produces " + FeatureVector.SIZE);
        }
        if (artifact.trees() == null || artifact.trees().isEmpty()) {
            throw new IllegalArgumentException("Tree artifact has no trees");
        }
        for (TreeEnsembleArtifact.Tree tree : artifact.trees()) {
            List<TreeEnsembleArtifact.Node> nodes = tree.nodes();
            if (nodes == null || nodes.isEmpty()) {
                throw new IllegalArgumentException("Tree artifact contains an empty tree");
            }
            for (TreeEnsembleArtifact.Node node : nodes) {
                if (node.isLeaf()) {
                    continue;
                }
                if (node.feature() == null || node.threshold() == null || node.left() == null || node.right() == null
                        || node.feature() < 0 || node.feature() >= FeatureVector.SIZE
                        || node.left() < 0 || node.left() >= nodes.size()
                        || node.right() < 0 || node.right() >= nodes.size()) {
                    throw new IllegalArgumentException("Malformed split node " + node);
                }
            }
        }
    }

    @Override
    protected ModelOutput evaluate(TreeEnsembleArtifact artifact, FeatureVector features) {
        double margin = artifact.baseMargin();
        for (TreeEnsembleArtifact.Tree tree : artifact.trees()) {
            checkInterrupted();
            margin += artifact.learningRate() * leafValue(tree.nodes(), features);
        }
        double score = sigmoid(margin);
        double confidence = artifact.baseConfidence()
                - artifact.horizonConfidenceDecay() * features.horizonMonths()
                + artifact.marginConfidenceWeight() * Math.abs(2.0 * score - 1.0);
        return new ModelOutput(score, clamp(confidence));
    }

    private double leafValue(List<TreeEnsembleArtifact.Node> nodes, FeatureVector features) {
        TreeEnsembleArtifact.Node node = nodes.get(0);
        int depth = 0;
        while (!node.isLeaf()) {
            if (++depth > nodes.size()) {
                throw new IllegalStateException("Cycle detected in tree");
            }
            int next = features.get(node.feature()) < node.threshold() ? node.left() : node.right();
            node = nodes.get(next);
        }
        return node.leaf();
    }

    @Override
    protected String artifactModelId(TreeEnsembleArtifact artifact) {
        return artifact.modelId();
    }

    @Override
    protected String artifactVersion(TreeEnsembleArtifact artifact) {
        return artifact.version();
    }
}
