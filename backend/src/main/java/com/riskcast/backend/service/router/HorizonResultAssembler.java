package com.riskcast.backend.service.router;

import com.riskcast.backend.config.RouterProperties;
import com.riskcast.backend.model.HorizonResult;
import com.riskcast.backend.model.ModelComparison;
import com.riskcast.backend.model.ModelPrediction;
import com.riskcast.backend.model.ModelUsed;
import com.riskcast.backend.model.RiskAssessmentRequest;
import com.riskcast.backend.model.UncertaintyBounds;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

class HorizonResultAssembler {

    private final RouterProperties properties;

    HorizonResultAssembler(RouterProperties properties) {
        this.properties = properties;
    }

    HorizonResult single(RiskAssessmentRequest request, int horizon, ModelSlot slot, ModelPrediction prediction,
                         ModelPrediction peer) {
        ModelUsed used = slot == ModelSlot.SHORT ? ModelUsed.SHORT : ModelUsed.LONG;
        double score = prediction.predictedScore();
        double confidence = prediction.confidenceScore();
        ModelComparison comparison = request.includeModelComparison()
                ? compare(slot == ModelSlot.SHORT ? prediction : peer, slot == ModelSlot.SHORT ? peer : prediction, score)
                : null;
        return HorizonResult.success(horizon, score, confidence, used, Map.of(slot.label(), 1.0), false,
                uncertainty(request, confidence, 0.0, score), comparison, predictions(prediction, peer));
    }

    HorizonResult fallback(RiskAssessmentRequest request, int horizon, ModelSlot survivor, ModelPrediction prediction) {
        ModelUsed used = survivor == ModelSlot.SHORT ? ModelUsed.SHORT_FALLBACK : ModelUsed.LONG_FALLBACK;
        double score = prediction.predictedScore();
        double confidence = BlendMath.clamp(prediction.confidenceScore() * (1.0 - properties.getDegradedConfidencePenalty()));
        ModelComparison comparison = request.includeModelComparison()
                ? compare(survivor == ModelSlot.SHORT ? prediction : null, survivor == ModelSlot.LONG ? prediction : null, score)
                : null;
        return HorizonResult.success(horizon, score, confidence, used, Map.of(survivor.label(), 1.0), true,
                uncertainty(request, confidence, 0.0, score), comparison, List.of(prediction));
    }

    HorizonResult blended(RiskAssessmentRequest request, int horizon, ModelPrediction shortPrediction,
                          ModelPrediction longPrediction, HorizonWeights weights) {
        double shortScore = shortPrediction.predictedScore();
        double longScore = longPrediction.predictedScore();
        double score = BlendMath.blend(shortScore, longScore, weights);
        double penalty = BlendMath.disagreementPenalty(shortScore, longScore,
                properties.getDisagreementPenaltyFactor(), properties.getMaxDisagreementPenalty());
        double confidence = BlendMath.blendConfidence(shortPrediction.confidenceScore(),
                longPrediction.confidenceScore(), penalty);
        HorizonWeights normalized = weights.normalized();
        Map<String, Double> weightMap = new LinkedHashMap<>();
        weightMap.put(ModelSlot.SHORT.label(), normalized.shortWeight());
        weightMap.put(ModelSlot.LONG.label(), normalized.longWeight());
        double spread = Math.abs(shortScore - longScore);
        return HorizonResult.success(horizon, score, confidence, ModelUsed.ENSEMBLE, weightMap, false,
                uncertainty(request, confidence, spread, score), compare(shortPrediction, longPrediction, score),
                predictions(shortPrediction, longPrediction));
    }

    private UncertaintyBounds uncertainty(RiskAssessmentRequest request, double confidence, double spread, double score) {
        if (!request.includeUncertainty()) {
            return null;
        }
        return UncertaintyBounds.around(score,
                BlendMath.uncertaintyHalfWidth(confidence, spread, properties.getUncertaintyScale()));
    }

    static ModelComparison compare(ModelPrediction shortPrediction, ModelPrediction longPrediction, double ensembleScore) {
        if (shortPrediction == null && longPrediction == null) {
            return null;
        }
        Double shortScore = shortPrediction == null ? null : shortPrediction.predictedScore();
        Double shortConfidence = shortPrediction == null ? null : shortPrediction.confidenceScore();
        Double longScore = longPrediction == null ? null : longPrediction.predictedScore();
        Double longConfidence = longPrediction == null ? null : longPrediction.confidenceScore();

        String best;
        double scoreDifference = 0.0;
        double confidenceDifference = 0.0;
        if (shortPrediction != null && longPrediction != null) {
            best = longConfidence > shortConfidence ? ModelSlot.LONG.label() : ModelSlot.SHORT.label();
            scoreDifference = Math.abs(shortScore - longScore);
            confidenceDifference = Math.abs(shortConfidence - longConfidence);
        } else {
            best = shortPrediction != null ? ModelSlot.SHORT.label() : ModelSlot.LONG.label();
        }
        return new ModelComparison(shortScore, shortConfidence, longScore, longConfidence, ensembleScore, best,
                scoreDifference, confidenceDifference, 1.0 - scoreDifference);
    }

    private static List<ModelPrediction> predictions(ModelPrediction first, ModelPrediction second) {
        List<ModelPrediction> list = new ArrayList<>(2);
        if (first != null) {
            list.add(first);
        }
        if (second != null) {
            list.add(second);
        }
        return list;
    }
}
