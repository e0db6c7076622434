package com.riskcast.backend.service.model;

import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Recurrent model unrolled one step per forecast month.
 */
public class SequenceModelAdapter extends AbstractJsonModelAdapter<SequenceArtifact> {

    public static final String DEFAULT_MODEL_ID = "sequence-long";

    public SequenceModelAdapter(ObjectMapper objectMapper) {
        super(objectMapper, SequenceArtifact.class, DEFAULT_MODEL_ID);
    }

    @Override
    protected void validate(SequenceArtifact artifact) {
        int input = artifact.inputSize();
        int hidden = artifact.hiddenSize();
        if (input != FeatureVector.SIZE + 1) {
            throw new IllegalArgumentException("Sequence artifact expects input size " + input
                    + ", extractor produces " + (FeatureVector.SIZE + 1));
        }
        requireMatrix(artifact.inputWeights(), hidden, input, "inputWeights");
        requireMatrix(artifact.recurrentWeights(), hidden, hidden, "recurrentWeights");
        if (artifact.hiddenBias() == null || artifact.hiddenBias().length != hidden) {
            throw new IllegalArgumentException("hiddenBias must have " + hidden + " entries");
        }
        if (artifact.outputWeights() == null || artifact.outputWeights().length != hidden) {
            throw new IllegalArgumentException("outputWeights must have " + hidden + " entries");
        }
    }

    private void requireMatrix(double[][] matrix, int rows, int columns, String name) {
        if (matrix == null || matrix.length != rows) {
            throw new IllegalArgumentException(name + " must have " + rows + " rows");
        }
        for (double[] row : matrix) {
            if (row == null || row.length != columns) {
                throw new IllegalArgumentException(name + " rows must have " + columns + " columns");
            }
        }
    }

    @Override
    protected ModelOutput evaluate(SequenceArtifact artifact, FeatureVector features) {
        int steps = Math.max(1, features.horizonMonths());
        int hiddenSize = artifact.hiddenSize();
        double[] base = features.toArray();
        double[] input = new double[artifact.inputSize()];
        System.arraycopy(base, 0, input, 0, base.length);

        double[] hidden = new double[hiddenSize];
        double[] next = new double[hiddenSize];
        for (int step = 0; step < steps; step++) {
            checkInterrupted();
            input[input.length - 1] = (step + 1) / (double) steps;
            for (int i = 0; i < hiddenSize; i++) {
                double sum = artifact.hiddenBias()[i];
                double[] inputRow = artifact.inputWeights()[i];
                for (int j = 0; j < input.length; j++) {
                    sum += inputRow[j] * input[j];
                }
                double[] recurrentRow = artifact.recurrentWeights()[i];
                for (int j = 0; j < hiddenSize; j++) {
                    sum += recurrentRow[j] * hidden[j];
                }
                next[i] = Math.tanh(sum);
            }
            double[] swap = hidden;
            hidden = next;
            next = swap;
        }

        double output = artifact.outputBias();
        for (int i = 0; i < hiddenSize; i++) {
            output += artifact.outputWeights()[i] * hidden[i];
        }
        double score = sigmoid(output);
        double confidence = Math.max(artifact.minConfidence(),
                artifact.baseConfidence() - artifact.horizonConfidenceDecay() * steps);
        return new ModelOutput(score, clamp(confidence));
    }

    @Override
    protected String artifactModelId(SequenceArtifact artifact) {
        return artifact.modelId();
    }

    @Override
    protected String artifactVersion(SequenceArtifact artifact) {
        return artifact.version();
    }
}
