package com.riskcast.backend.service.model;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;

/**
 * A loaded scoring model. Implementations must be safe for concurrent {@link #predict} calls and should
 * check the calling thread's interrupt flag during long evaluations.
 */
public interface ModelAdapter {

    void loadModel(Path path) throws IOException;

    void loadModel(InputStream input) throws IOException;

    /**
     * @throws com.riskcast.backend.exception.ModelInvocationException when the model is not loaded or
     *                                                                 evaluation fails
     */
    ModelOutput predict(FeatureVector features);

    String modelId();

    String version();

    boolean isLoaded();
}
