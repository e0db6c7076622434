package com.riskcast.backend.service.model;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.riskcast.backend.exception.ModelInvocationException;
import com.riskcast.backend.exception.RequestCancelledException;
import com.riskcast.backend.exception.Stage;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

@Slf4j
public abstract class AbstractJsonModelAdapter<A> implements ModelAdapter {

    private final ObjectMapper objectMapper;
    private final Class<A> artifactType;
    private final String defaultModelId;
    private volatile A artifact;

    protected AbstractJsonModelAdapter(ObjectMapper objectMapper, Class<A> artifactType, String defaultModelId) {
        this.objectMapper = objectMapper;
        this.artifactType = artifactType;
        this.defaultModelId = defaultModelId;
    }

    @Override
    public void loadModel(Path path) throws IOException {
        try (InputStream input = Files.newInputStream(path)) {
            loadModel(input);
        }
    }

    @Override
    public void loadModel(InputStream input) throws IOException {
        A loaded = objectMapper.readValue(input, artifactType);
        validate(loaded);
        this.artifact = loaded;
        log.info("Loaded model artifact id={} version={}", modelId(), version());
    }

    @Override
    public ModelOutput predict(FeatureVector features) {
        A current = artifact;
        if (current == null) {
            throw new ModelInvocationException(defaultModelId, "Model " + defaultModelId + " is not loaded");
        }
        ModelOutput output;
        try {
            output = evaluate(current, features);
        } catch (ModelInvocationException | RequestCancelledException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new ModelInvocationException(modelId(), "Model evaluation failed: " + e.getMessage(), e);
        }
        if (!isUnitInterval(output.score()) || !isUnitInterval(output.confidence())) {
            throw new ModelInvocationException(modelId(), "Model produced out-of-range output " + output);
        }
        return output;
    }

    @Override
    public String modelId() {
        A current = artifact;
        return current == null ? defaultModelId : artifactModelId(current);
    }

    @Override
    public String version() {
        A current = artifact;
        return current == null ? "unloaded" : artifactVersion(current);
    }

    @Override
    public boolean isLoaded() {
        return artifact != null;
    }

    protected abstract void validate(A artifact);

    protected abstract ModelOutput evaluate(A artifact, FeatureVector features);

    protected abstract String artifactModelId(A artifact);

    protected abstract String artifactVersion(A artifact);

    protected static void checkInterrupted() {
        if (Thread.currentThread().isInterrupted()) {
            throw new RequestCancelledException(Stage.MODEL, "Model evaluation interrupted");
        }
    }

    protected static double sigmoid(double value) {
        return 1.0 / (1.0 + Math.exp(-value));
    }

    protected static double clamp(double value) {
        return Math.max(0.0, Math.min(1.0, value));
    }

    private static boolean isUnitInterval(double value) {
        return !Double.isNaN(value) && value >= 0.0 && value <= 1.0;
    }
}
