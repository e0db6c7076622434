package com.riskcast.backend.service.router;

import com.riskcast.backend.exception.ModelInvocationException;
import com.riskcast.backend.model.HorizonResult;
import com.riskcast.backend.model.ModelPrediction;
import com.riskcast.backend.model.RiskAssessmentRequest;
import lombok.extern.slf4j.Slf4j;

@Slf4j
class LongWithFallbackPredictor implements Predictor {

    private final ModelInvoker invoker;
    private final HorizonResultAssembler assembler;

    LongWithFallbackPredictor(ModelInvoker invoker, HorizonResultAssembler assembler) {
        this.invoker = invoker;
        this.assembler = assembler;
    }

    @Override
    public HorizonResult predict(RiskAssessmentRequest request, int horizon, HorizonWeights weights) {
        ModelPrediction longPrediction;
        try {
            longPrediction = invoker.invoke(ModelSlot.LONG, request, horizon);
        } catch (ModelInvocationException longFailure) {
            log.warn("Long-horizon model failed for horizon {}, degrading to short model: {}", horizon,
                    longFailure.getMessage());
            try {
                return assembler.fallback(request, horizon, ModelSlot.SHORT,
                        invoker.invoke(ModelSlot.SHORT, request, horizon));
            } catch (ModelInvocationException shortFailure) {
                shortFailure.addSuppressed(longFailure);
                throw shortFailure;
            }
        }
        ModelPrediction peer = null;
        if (request.includeModelComparison()) {
            try {
                peer = invoker.invoke(ModelSlot.SHORT, request, horizon);
            } catch (ModelInvocationException e) {
                log.debug("Comparison model short unavailable for horizon {}: {}", horizon, e.getMessage());
            }
        }
        return assembler.single(request, horizon, ModelSlot.LONG, longPrediction, peer);
    }
}
