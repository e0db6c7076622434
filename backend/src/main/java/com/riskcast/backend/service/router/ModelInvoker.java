package com.riskcast.backend.service.router;

import com.riskcast.backend.exception.ModelInvocationException;
import com.riskcast.backend.exception.RiskEngineException;
import com.riskcast.backend.model.ModelPrediction;
import com.riskcast.backend.model.RiskAssessmentRequest;
import com.riskcast.backend.service.MetricsService;
import com.riskcast.backend.service.model.FeatureExtractor;
import com.riskcast.backend.service.model.ModelAdapter;
import com.riskcast.backend.service.model.ModelOutput;
import com.riskcast.backend.service.model.ModelRegistry;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

@Component
@RequiredArgsConstructor
public class ModelInvoker {

    private final ModelRegistry modelRegistry;
    private final FeatureExtractor featureExtractor;
    private final MetricsService metricsService;

    public ModelPrediction invoke(ModelSlot slot, RiskAssessmentRequest request, int horizon) {
        ModelAdapter adapter = slot == ModelSlot.SHORT ? modelRegistry.shortModel() : modelRegistry.longModel();
        long started = System.nanoTime();
        try {
            ModelOutput output = adapter.predict(featureExtractor.extract(request, horizon));
            long elapsed = System.nanoTime() - started;
            metricsService.recordModelLatency(adapter.modelId(), elapsed);
            long micros = TimeUnit.NANOSECONDS.toMicros(elapsed);
            return ModelPrediction.of(horizon, output.score(), output.confidence(), adapter.modelId(),
                    adapter.version(), micros);
        } catch (ModelInvocationException e) {
            metricsService.recordModelFailure(adapter.modelId());
            throw e;
        } catch (RiskEngineException e) {
            throw e;
        } catch (RuntimeException e) {
            metricsService.recordModelFailure(adapter.modelId());
            throw new ModelInvocationException(adapter.modelId(), "Model call failed: " + e.getMessage(), e);
        }
    }
}
