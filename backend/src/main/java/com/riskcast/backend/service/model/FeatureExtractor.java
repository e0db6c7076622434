package com.riskcast.backend.service.model;

import com.riskcast.backend.model.RiskAssessmentRequest;
import org.springframework.stereotype.Component;

import java.util.Map;

@Component
public class FeatureExtractor {

    private static final double DEFAULT_INDUSTRY_RISK = 0.5;
    private static final double DEFAULT_COUNTRY_RISK = 0.5;

    private static final Map<String, Double> INDUSTRY_RISK = Map.ofEntries(
            Map.entry("technology", 0.40),
            Map.entry("software", 0.35),
            Map.entry("fintech", 0.65),
            Map.entry("crypto", 0.90),
            Map.entry("gambling", 0.85),
            Map.entry("healthcare", 0.45),
            Map.entry("retail", 0.50),
            Map.entry("hospitality", 0.60),
            Map.entry("construction", 0.60),
            Map.entry("manufacturing", 0.45),
            Map.entry("real_estate", 0.55),
            Map.entry("energy", 0.50),
            Map.entry("agriculture", 0.50),
            Map.entry("education", 0.30),
            Map.entry("government", 0.15)
    );

    private static final Map<String, Double> COUNTRY_RISK = Map.ofEntries(
            Map.entry("US", 0.20),
            Map.entry("GB", 0.20),
            Map.entry("DE", 0.15),
            Map.entry("FR", 0.20),
            Map.entry("NL", 0.15),
            Map.entry("CH", 0.10),
            Map.entry("CA", 0.15),
            Map.entry("AU", 0.15),
            Map.entry("JP", 0.15),
            Map.entry("SG", 0.15),
            Map.entry("IN", 0.45),
            Map.entry("BR", 0.50),
            Map.entry("MX", 0.50),
            Map.entry("ZA", 0.55),
            Map.entry("NG", 0.75),
            Map.entry("RU", 0.85),
            Map.entry("IR", 0.95),
            Map.entry("KP", 0.99)
    );

    public FeatureVector extract(RiskAssessmentRequest request, int horizonMonths) {
        double[] values = new double[FeatureVector.SIZE];
        values[0] = INDUSTRY_RISK.getOrDefault(request.industry(), DEFAULT_INDUSTRY_RISK);
        values[1] = COUNTRY_RISK.getOrDefault(request.country(), DEFAULT_COUNTRY_RISK);
        values[2] = clamp(request.metadataNumber("business_age_years", 5.0) / 50.0);
        values[3] = clamp((request.metadataNumber("revenue_growth", 0.05) + 0.5));
        values[4] = clamp((request.metadataNumber("profit_margin", 0.05) + 0.2) / 0.4);
        values[5] = clamp(request.metadataNumber("debt_to_equity", 1.0) / 2.0);
        values[6] = clamp(request.metadataNumber("cash_flow", 0.5));
        values[7] = clamp(request.metadataNumber("credit_score", 650.0) / 850.0);
        values[8] = clamp(request.metadataNumber("market_volatility", 0.2) / 0.5);
        values[9] = contactCompleteness(request);
        values[10] = clamp(Math.log10(1.0 + Math.max(0.0, request.metadataNumber("employee_count", 10.0))) / 5.0);
        values[FeatureVector.HORIZON_INDEX] = clamp(horizonMonths / FeatureVector.MAX_HORIZON_MONTHS);
        return new FeatureVector(values);
    }

    private double contactCompleteness(RiskAssessmentRequest request) {
        int present = 0;
        present += isPresent(request.businessAddress()) ? 1 : 0;
        present += isPresent(request.phone()) ? 1 : 0;
        present += isPresent(request.email()) ? 1 : 0;
        present += isPresent(request.website()) ? 1 : 0;
        return present / 4.0;
    }

    private boolean isPresent(String value) {
        return value != null && !value.isBlank();
    }

    private double clamp(double value) {
        if (Double.isNaN(value)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, value));
    }
}
