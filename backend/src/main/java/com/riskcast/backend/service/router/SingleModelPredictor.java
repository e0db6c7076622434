package com.riskcast.backend.service.router;

import com.riskcast.backend.exception.ModelInvocationException;
import com.riskcast.backend.model.HorizonResult;
import com.riskcast.backend.model.ModelPrediction;
import com.riskcast.backend.model.RiskAssessmentRequest;
import lombok.extern.slf4j.Slf4j;

/**
 * Serves one model and never falls back. When a comparison is requested the other model runs too, but
 * its failure does not affect the served score.
 */
@Slf4j
class SingleModelPredictor implements Predictor {

    private final ModelSlot slot;
    private final ModelInvoker invoker;
    private final HorizonResultAssembler assembler;

    SingleModelPredictor(ModelSlot slot, ModelInvoker invoker, HorizonResultAssembler assembler) {
        this.slot = slot;
        this.invoker = invoker;
        this.assembler = assembler;
    }

    @Override
    public HorizonResult predict(RiskAssessmentRequest request, int horizon, HorizonWeights weights) {
        ModelPrediction prediction = invoker.invoke(slot, request, horizon);
        ModelPrediction peer = null;
        if (request.includeModelComparison()) {
            try {
                peer = invoker.invoke(slot.other(), request, horizon);
            } catch (ModelInvocationException e) {
                log.debug("Comparison model {} unavailable for horizon {}: {}", slot.other().label(), horizon,
                        e.getMessage());
            }
        }
        return assembler.single(request, horizon, slot, prediction, peer);
    }
}
