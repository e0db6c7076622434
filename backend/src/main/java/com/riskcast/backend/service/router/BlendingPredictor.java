package com.riskcast.backend.service.router;

import com.riskcast.backend.exception.ModelInvocationException;
import com.riskcast.backend.model.HorizonResult;
import com.riskcast.backend.model.ModelPrediction;
import com.riskcast.backend.model.RiskAssessmentRequest;
import lombok.extern.slf4j.Slf4j;

@Slf4j
class BlendingPredictor implements Predictor {

    private final ModelInvoker invoker;
    private final HorizonResultAssembler assembler;

    BlendingPredictor(ModelInvoker invoker, HorizonResultAssembler assembler) {
        this.invoker = invoker;
        this.assembler = assembler;
    }

    @Override
    public HorizonResult predict(RiskAssessmentRequest request, int horizon, HorizonWeights weights) {
        ModelPrediction shortPrediction = null;
        ModelPrediction longPrediction = null;
        ModelInvocationException shortFailure = null;
        ModelInvocationException longFailure = null;
        try {
            shortPrediction = invoker.invoke(ModelSlot.SHORT, request, horizon);
        } catch (ModelInvocationException e) {
            shortFailure = e;
        }
        try {
            longPrediction = invoker.invoke(ModelSlot.LONG, request, horizon);
        } catch (ModelInvocationException e) {
            longFailure = e;
        }

        if (shortPrediction != null && longPrediction != null) {
            return assembler.blended(request, horizon, shortPrediction, longPrediction, weights);
        }
        if (shortPrediction != null) {
            log.warn("Long-horizon model failed for horizon {}, serving short model only: {}", horizon,
                    longFailure.getMessage());
            return assembler.fallback(request, horizon, ModelSlot.SHORT, shortPrediction);
        }
        if (longPrediction != null) {
            log.warn("Short-horizon model failed for horizon {}, serving long model only: {}", horizon,
                    shortFailure.getMessage());
            return assembler.fallback(request, horizon, ModelSlot.LONG, longPrediction);
        }
        ModelInvocationException failure = new ModelInvocationException(longFailure.getModelId(),
                "All models failed for horizon " + horizon, longFailure);
        failure.addSuppressed(shortFailure);
        throw failure;
    }
}
