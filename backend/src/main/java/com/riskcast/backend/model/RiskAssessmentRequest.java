package com.riskcast.backend.model;

import lombok.Builder;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Builder(toBuilder = true)
public record RiskAssessmentRequest(
        String businessName,
        String businessAddress,
        String industry,
        String country,
        String phone,
        String email,
        String website,
        List<Integer> predictionHorizons,
        ModelType modelType,
        boolean includeModelComparison,
        boolean includeUncertainty,
        Map<String, Object> metadata
) {
    public RiskAssessmentRequest {
        predictionHorizons = predictionHorizons == null
                ? List.of()
                : Collections.unmodifiableList(new ArrayList<>(predictionHorizons));
        metadata = metadata == null ? Map.of() : withoutNullValues(metadata);
        modelType = modelType == null ? ModelType.AUTO : modelType;
    }

    private static Map<String, Object> withoutNullValues(Map<String, Object> source) {
        Map<String, Object> copy = new LinkedHashMap<>();
        source.forEach((key, value) -> {
            if (key != null && value != null) {
                copy.put(key, value);
            }
        });
        return Collections.unmodifiableMap(copy);
    }

    public double metadataNumber(String key, double fallback) {
        Object value = metadata.get(key);
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        if (value instanceof String text) {
            try {
                return Double.parseDouble(text.trim());
            } catch (NumberFormatException ignored) {
                return fallback;
            }
        }
        return fallback;
    }
}
