package com.riskcast.backend.service.validation;

import com.riskcast.backend.model.ModelType;
import com.riskcast.backend.model.RiskAssessmentRequest;
import com.riskcast.backend.service.model.FeatureExtractor;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

/**
 * Seeded population of businesses with realized risk per horizon: a weighted base risk, a
 * volatility-driven drift that grows with the horizon, and horizon-scaled noise.
 */
@Component
@RequiredArgsConstructor
public class SyntheticDatasetGenerator {

    private static final List<String> INDUSTRIES = List.of(
            "technology", "software", "fintech", "crypto", "healthcare", "retail", "hospitality",
            "construction", "manufacturing", "real_estate", "energy", "education");
    private static final List<String> COUNTRIES = List.of(
            "US", "GB", "DE", "FR", "CA", "AU", "SG", "IN", "BR", "MX", "ZA", "NG");

    private final FeatureExtractor featureExtractor;

    public List<LabeledSample> generate(int size, long seed, List<Integer> horizons) {
        Random random = new Random(seed);
        List<LabeledSample> samples = new ArrayList<>(size);
        for (int i = 0; i < size; i++) {
            RiskAssessmentRequest request = randomBusiness(random, i, horizons);
            double[] features = featureExtractor.extract(request, horizons.get(0)).toArray();
            double base = baseRisk(features);
            double drift = 0.08 * (features[8] - 0.4) + 0.04 * (features[5] - 0.5);
            Map<Integer, Double> labels = new LinkedHashMap<>();
            for (Integer horizon : horizons) {
                double noise = random.nextGaussian() * (0.02 + 0.004 * horizon);
                labels.put(horizon, clamp(base + drift * horizon / 12.0 + noise));
            }
            samples.add(new LabeledSample("synthetic-" + i, request, labels));
        }
        return samples;
    }

    private RiskAssessmentRequest randomBusiness(Random random, int index, List<Integer> horizons) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("business_age_years", round(random.nextDouble() * 40.0));
        metadata.put("employee_count", (int) Math.round(Math.exp(random.nextGaussian() * 1.5 + 3.0)));
        metadata.put("revenue_growth", round(random.nextGaussian() * 0.2 + 0.05));
        metadata.put("profit_margin", round(random.nextGaussian() * 0.1 + 0.05));
        metadata.put("debt_to_equity", round(random.nextDouble() * 3.0));
        metadata.put("cash_flow", round(random.nextDouble()));
        metadata.put("credit_score", Math.max(300, Math.min(850, (int) Math.round(random.nextGaussian() * 70 + 680))));
        metadata.put("market_volatility", round(0.05 + random.nextDouble() * 0.45));

        boolean hasWebsite = random.nextDouble() < 0.8;
        return RiskAssessmentRequest.builder()
                .businessName("Synthetic Business " + index)
                .businessAddress(random.nextDouble() < 0.9 ? index + " Market Street" : null)
                .industry(INDUSTRIES.get(random.nextInt(INDUSTRIES.size())))
                .country(COUNTRIES.get(random.nextInt(COUNTRIES.size())))
                .phone(random.nextDouble() < 0.85 ? "+1555" + (1_000_000 + index) : null)
                .email(random.nextDouble() < 0.9 ? "contact" + index + "@example.com" : null)
                .website(hasWebsite ? "https://business" + index + ".example.com" : null)
                .predictionHorizons(horizons)
                .modelType(ModelType.AUTO)
                .metadata(metadata)
                .build();
    }

    private double baseRisk(double[] f) {
        return 0.20 * f[0]
                + 0.15 * f[1]
                + 0.05 * (1.0 - f[2])
                + 0.05 * (1.0 - f[3])
                + 0.05 * (1.0 - f[4])
                + 0.15 * f[5]
                + 0.10 * (1.0 - f[6])
                + 0.15 * (1.0 - f[7])
                + 0.10 * f[8];
    }

    private static double round(double value) {
        return Math.round(value * 1000.0) / 1000.0;
    }

    private static double clamp(double value) {
        return Math.max(0.0, Math.min(1.0, value));
    }
}
