package com.riskcast.backend.service.validation;

import com.riskcast.backend.config.RouterProperties;
import com.riskcast.backend.config.ValidationProperties;
import com.riskcast.backend.exception.ModelInvocationException;
import com.riskcast.backend.exception.ValidationTargetNotMetException;
import com.riskcast.backend.model.ModelPrediction;
import com.riskcast.backend.model.ModelType;
import com.riskcast.backend.service.MetricsService;
import com.riskcast.backend.service.router.BlendMath;
import com.riskcast.backend.service.router.EnsembleWeights;
import com.riskcast.backend.service.router.HorizonWeights;
import com.riskcast.backend.service.router.ModelEnsembleRouter;
import com.riskcast.backend.service.router.ModelInvoker;
import com.riskcast.backend.service.router.ModelSlot;
import com.riskcast.backend.service.router.RoutingPolicy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.TreeMap;
import java.util.UUID;

/**
 * Offline k-fold validation of the served predictions: per-horizon accuracy, confidence calibration,
 * ensemble-versus-single-model comparison, and target enforcement.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ValidationHarness {

    private static final double WEIGHT_STEP = 0.05;

    private final ModelInvoker modelInvoker;
    private final RoutingPolicy routingPolicy;
    private final ModelEnsembleRouter router;
    private final RouterProperties routerProperties;
    private final ValidationProperties validationProperties;
    private final SyntheticDatasetGenerator datasetGenerator;
    private final ValidationHistoryStore historyStore;
    private final MetricsService metricsService;
    private final Clock clock;

    /** Both models' raw predictions for one sample and horizon. */
    private record PairedPrediction(ModelPrediction shortModel, ModelPrediction longModel, double actual) {
    }

    public ValidationResult validateSynthetic() {
        List<LabeledSample> dataset = datasetGenerator.generate(validationProperties.getDatasetSize(),
                validationProperties.getRandomSeed(), validationProperties.getHorizons());
        return validateModel(ValidationConfig.fromProperties(validationProperties, dataset));
    }

    public ValidationResult validateModel(ValidationConfig config) {
        long started = System.nanoTime();
        Map<Integer, List<PairedPrediction>> paired = scoreDataset(config);

        List<Integer> order = new ArrayList<>(config.dataset().size());
        for (int i = 0; i < config.dataset().size(); i++) {
            order.add(i);
        }
        Collections.shuffle(order, new Random(config.randomSeed()));
        int[] foldOf = new int[order.size()];
        for (int position = 0; position < order.size(); position++) {
            foldOf[order.get(position)] = position * config.folds() / order.size();
        }

        Map<Integer, List<ScoredPrediction>> served = new TreeMap<>();
        Map<Integer, List<ScoredPrediction>> shortOnly = new TreeMap<>();
        Map<Integer, List<ScoredPrediction>> longOnly = new TreeMap<>();
        Map<Integer, List<ScoredPrediction>> blended = new TreeMap<>();
        Map<Integer, List<Double>> fittedWeights = new TreeMap<>();
        List<FoldResult> foldResults = new ArrayList<>();

        for (int fold = 0; fold < config.folds(); fold++) {
            Map<Integer, Double> foldWeights = new TreeMap<>();
            Map<Integer, HorizonMetrics> foldMetrics = new TreeMap<>();
            int trainSize = 0;
            int testSize = 0;
            for (int horizon : config.horizons()) {
                List<PairedPrediction> train = new ArrayList<>();
                List<PairedPrediction> test = new ArrayList<>();
                List<PairedPrediction> all = paired.get(horizon);
                for (int sample = 0; sample < all.size(); sample++) {
                    PairedPrediction prediction = all.get(sample);
                    if (prediction == null) {
                        continue;
                    }
                    (foldOf[sample] == fold ? test : train).add(prediction);
                }
                trainSize = Math.max(trainSize, train.size());
                testSize = Math.max(testSize, test.size());

                double shortWeight = fitShortWeight(train);
                HorizonWeights weights = new HorizonWeights(shortWeight, 1.0 - shortWeight);
                foldWeights.put(horizon, shortWeight);
                fittedWeights.computeIfAbsent(horizon, h -> new ArrayList<>()).add(shortWeight);

                List<ScoredPrediction> foldServed = new ArrayList<>(test.size());
                for (PairedPrediction p : test) {
                    ScoredPrediction blend = blend(p, weights);
                    foldServed.add(serve(horizon, p, blend));
                    blended.computeIfAbsent(horizon, h -> new ArrayList<>()).add(blend);
                    shortOnly.computeIfAbsent(horizon, h -> new ArrayList<>()).add(single(p.shortModel(), p.actual()));
                    longOnly.computeIfAbsent(horizon, h -> new ArrayList<>()).add(single(p.longModel(), p.actual()));
                }
                served.computeIfAbsent(horizon, h -> new ArrayList<>()).addAll(foldServed);
                foldMetrics.put(horizon, AccuracyMetrics.compute(horizon, foldServed, config.calibrationCutoff()));
            }
            foldResults.add(new FoldResult(fold, trainSize, testSize, foldWeights, foldMetrics));
        }

        Map<Integer, HorizonMetrics> horizonMetrics = new TreeMap<>();
        Map<Integer, CalibrationReport> horizonCalibration = new TreeMap<>();
        Map<Integer, HorizonModelComparison> comparisons = new TreeMap<>();
        List<ScoredPrediction> pooled = new ArrayList<>();
        for (int horizon : config.horizons()) {
            List<ScoredPrediction> predictions = served.getOrDefault(horizon, List.of());
            pooled.addAll(predictions);
            horizonMetrics.put(horizon, AccuracyMetrics.compute(horizon, predictions, config.calibrationCutoff()));
            horizonCalibration.put(horizon, AccuracyMetrics.calibrate(predictions, config.calibrationCutoff()));
            double recommendedShort = fittedWeights.getOrDefault(horizon, List.of(0.5)).stream()
                    .mapToDouble(Double::doubleValue).average().orElse(0.5);
            comparisons.put(horizon, compare(horizon, shortOnly.getOrDefault(horizon, List.of()),
                    longOnly.getOrDefault(horizon, List.of()), blended.getOrDefault(horizon, List.of()),
                    recommendedShort, config.calibrationCutoff()));
        }
        CalibrationReport calibration = AccuracyMetrics.calibrate(pooled, config.calibrationCutoff());

        List<String> failedTargets = new ArrayList<>();
        List<Recommendation> recommendations = recommend(config, horizonMetrics, horizonCalibration, comparisons,
                failedTargets);
        boolean achieved = failedTargets.isEmpty();

        ValidationResult result = new ValidationResult(UUID.randomUUID().toString(), clock.instant(), config.folds(),
                config.randomSeed(), config.dataset().size(), horizonMetrics, calibration, foldResults, comparisons,
                recommendations, achieved, failedTargets);
        metricsService.recordValidation(achieved);
        log.info("Validation run {} finished in {}ms: targetAchieved={} failed={}", result.runId(),
                (System.nanoTime() - started) / 1_000_000, achieved, failedTargets);
        persist(result);
        return result;
    }

    private Map<Integer, List<PairedPrediction>> scoreDataset(ValidationConfig config) {
        Map<Integer, List<PairedPrediction>> paired = new TreeMap<>();
        for (int horizon : config.horizons()) {
            List<PairedPrediction> predictions = new ArrayList<>(config.dataset().size());
            int scored = 0;
            for (LabeledSample sample : config.dataset()) {
                Double actual = sample.actualScores().get(horizon);
                PairedPrediction prediction = null;
                if (actual != null) {
                    try {
                        prediction = new PairedPrediction(
                                modelInvoker.invoke(ModelSlot.SHORT, sample.request(), horizon),
                                modelInvoker.invoke(ModelSlot.LONG, sample.request(), horizon),
                                actual);
                        scored++;
                    } catch (ModelInvocationException e) {
                        log.debug("Skipping sample {} at horizon {}: {}", sample.businessId(), horizon, e.getMessage());
                    }
                }
                predictions.add(prediction);
            }
            if (scored == 0) {
                throw new ModelInvocationException(null, "No sample could be scored for horizon " + horizon);
            }
            paired.put(horizon, predictions);
        }
        return paired;
    }

    /**
     * Grid search over the short-model weight minimizing blended MAE; ties go to the weight nearest 0.5.
     */
    private double fitShortWeight(List<PairedPrediction> train) {
        if (train.isEmpty()) {
            return 0.5;
        }
        double bestWeight = 0.5;
        double bestMae = Double.MAX_VALUE;
        int steps = (int) Math.round(1.0 / WEIGHT_STEP);
        for (int step = 0; step <= steps; step++) {
            double weight = step * WEIGHT_STEP;
            HorizonWeights weights = new HorizonWeights(weight, 1.0 - weight);
            double error = 0.0;
            for (PairedPrediction p : train) {
                error += Math.abs(BlendMath.blend(p.shortModel().predictedScore(), p.longModel().predictedScore(),
                        weights) - p.actual());
            }
            double mae = error / train.size();
            boolean better = mae < bestMae - 1e-12;
            boolean tieCloserToEven = Math.abs(mae - bestMae) <= 1e-12
                    && Math.abs(weight - 0.5) < Math.abs(bestWeight - 0.5);
            if (better || tieCloserToEven) {
                bestMae = mae;
                bestWeight = weight;
            }
        }
        return bestWeight;
    }

    private ScoredPrediction blend(PairedPrediction p, HorizonWeights weights) {
        double shortScore = p.shortModel().predictedScore();
        double longScore = p.longModel().predictedScore();
        double penalty = BlendMath.disagreementPenalty(shortScore, longScore,
                routerProperties.getDisagreementPenaltyFactor(), routerProperties.getMaxDisagreementPenalty());
        double confidence = BlendMath.blendConfidence(p.shortModel().confidenceScore(),
                p.longModel().confidenceScore(), penalty);
        return new ScoredPrediction(BlendMath.blend(shortScore, longScore, weights), p.actual(), confidence);
    }

    private ScoredPrediction serve(int horizon, PairedPrediction p, ScoredPrediction blend) {
        return switch (routingPolicy.route(ModelType.AUTO, horizon)) {
            case SHORT_ONLY -> single(p.shortModel(), p.actual());
            case LONG_ONLY, LONG_WITH_FALLBACK -> single(p.longModel(), p.actual());
            case BLEND -> blend;
        };
    }

    private static ScoredPrediction single(ModelPrediction prediction, double actual) {
        return new ScoredPrediction(prediction.predictedScore(), actual, prediction.confidenceScore());
    }

    private HorizonModelComparison compare(int horizon, List<ScoredPrediction> shortOnly, List<ScoredPrediction> longOnly,
                                           List<ScoredPrediction> blended, double recommendedShortWeight,
                                           double cutoff) {
        HorizonMetrics shortMetrics = AccuracyMetrics.compute(horizon, shortOnly, cutoff);
        HorizonMetrics longMetrics = AccuracyMetrics.compute(horizon, longOnly, cutoff);
        HorizonMetrics ensembleMetrics = AccuracyMetrics.compute(horizon, blended, cutoff);
        double overShort = shortMetrics.mae() - ensembleMetrics.mae();
        double overLong = longMetrics.mae() - ensembleMetrics.mae();
        return new HorizonModelComparison(horizon, shortMetrics.mae(), longMetrics.mae(), ensembleMetrics.mae(),
                shortMetrics.accuracy(), longMetrics.accuracy(), ensembleMetrics.accuracy(), overShort, overLong,
                overShort > 0, overLong > 0, recommendedShortWeight, 1.0 - recommendedShortWeight);
    }

    private List<Recommendation> recommend(ValidationConfig config,
                                           Map<Integer, HorizonMetrics> metrics,
                                           Map<Integer, CalibrationReport> calibration,
                                           Map<Integer, HorizonModelComparison> comparisons,
                                           List<String> failedTargets) {
        List<Recommendation> failing = new ArrayList<>();
        List<Recommendation> advisory = new ArrayList<>();
        for (int horizon : config.horizons()) {
            ValidationTarget target = config.targetFor(horizon);
            HorizonMetrics m = metrics.get(horizon);
            HorizonModelComparison comparison = comparisons.get(horizon);
            String servedModel = servedModelLabel(horizon);

            if (m.accuracy() < target.minAccuracy()) {
                failedTargets.add("h" + horizon + ".accuracy");
                failing.add(recommendation(horizon, "accuracy", m.accuracy(), target.minAccuracy(),
                        relativeGap(target.minAccuracy() - m.accuracy(), target.minAccuracy()),
                        String.format("Accuracy %.3f at %d months is below %.3f; retrain or reweight the %s model for this horizon",
                                m.accuracy(), horizon, target.minAccuracy(), servedModel)));
            }
            if (m.mae() > target.maxMae()) {
                failedTargets.add("h" + horizon + ".mae");
                failing.add(recommendation(horizon, "mae", m.mae(), target.maxMae(),
                        relativeGap(m.mae() - target.maxMae(), target.maxMae()),
                        String.format("MAE %.4f at %d months exceeds %.4f; apply the fitted short-model weight %.2f",
                                m.mae(), horizon, target.maxMae(), comparison.recommendedShortWeight())));
            }
            if (m.calibrationError() > target.maxCalibrationError()) {
                failedTargets.add("h" + horizon + ".calibration");
                CalibrationBucket worst = calibration.get(horizon).buckets().stream()
                        .filter(bucket -> bucket.count() > 0)
                        .max(Comparator.comparingDouble(CalibrationBucket::gap))
                        .orElseThrow();
                String direction = worst.meanConfidence() > worst.realizedAccuracy() ? "overstates" : "understates";
                failing.add(recommendation(horizon, "calibration_error", m.calibrationError(),
                        target.maxCalibrationError(),
                        relativeGap(m.calibrationError() - target.maxCalibrationError(), target.maxCalibrationError()),
                        String.format("Stated confidence %s realized accuracy by %.3f in the %s bucket at %d months; rescale %s model confidence",
                                direction, worst.gap(), worst.name(), horizon, servedModel)));
            }
            if (!comparison.ensembleBeatsShort() || !comparison.ensembleBeatsLong()) {
                boolean shortBetter = comparison.shortMae() <= comparison.longMae();
                double deficit = Math.max(-comparison.maeImprovementOverShort(), -comparison.maeImprovementOverLong());
                advisory.add(recommendation(horizon, "model_comparison", comparison.ensembleMae(),
                        shortBetter ? comparison.shortMae() : comparison.longMae(), Math.max(0.0, deficit),
                        String.format("Ensemble does not beat the %s model at %d months; shift blend weight toward it",
                                shortBetter ? "short" : "long", horizon)));
            }
        }
        failing.sort(Comparator.comparingDouble(Recommendation::gap).reversed());
        advisory.sort(Comparator.comparingDouble(Recommendation::gap).reversed());
        List<Recommendation> ranked = new ArrayList<>(failing.size() + advisory.size());
        for (Recommendation recommendation : failing) {
            ranked.add(recommendation.withRank(ranked.size() + 1));
        }
        for (Recommendation recommendation : advisory) {
            ranked.add(recommendation.withRank(ranked.size() + 1));
        }
        return ranked;
    }

    private Recommendation recommendation(int horizon, String metric, double observed, double target, double gap,
                                          String action) {
        Recommendation.Priority priority = gap > 0.2 ? Recommendation.Priority.HIGH
                : gap > 0.05 ? Recommendation.Priority.MEDIUM
                : Recommendation.Priority.LOW;
        if ("model_comparison".equals(metric)) {
            priority = Recommendation.Priority.LOW;
        }
        return new Recommendation(0, priority, horizon, metric, observed, target, gap, action);
    }

    private static double relativeGap(double shortfall, double target) {
        return target > 0 ? shortfall / target : shortfall;
    }

    private String servedModelLabel(int horizon) {
        return switch (routingPolicy.route(ModelType.AUTO, horizon)) {
            case SHORT_ONLY -> "short";
            case LONG_ONLY, LONG_WITH_FALLBACK -> "long";
            case BLEND -> "ensemble";
        };
    }

    private void persist(ValidationResult result) {
        try {
            historyStore.append(result);
        } catch (RuntimeException e) {
            log.error("Failed to persist validation run {}", result.runId(), e);
        }
    }

    /**
     * Installs the fold-averaged blend weights from {@code result} on the live router.
     */
    public EnsembleWeights applyRecommendedWeights(ValidationResult result) {
        Map<Integer, HorizonWeights> overrides = new LinkedHashMap<>();
        result.modelComparison().forEach((horizon, comparison) -> overrides.put(horizon,
                new HorizonWeights(comparison.recommendedShortWeight(), comparison.recommendedLongWeight())));
        return router.updateWeights(overrides);
    }

    /**
     * @throws ValidationTargetNotMetException when any horizon misses a target
     */
    public void requireTargets(ValidationResult result) {
        if (!result.targetAchieved()) {
            throw new ValidationTargetNotMetException("Validation run " + result.runId() + " missed "
                    + result.failedTargets().size() + " target(s)", result.failedTargets());
        }
    }

    public List<ValidationResult> history(int limit) {
        return historyStore.recent(limit);
    }
}
