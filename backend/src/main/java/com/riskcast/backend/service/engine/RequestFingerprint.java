package com.riskcast.backend.service.engine;

import com.riskcast.backend.model.RiskAssessmentRequest;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Map;
import java.util.TreeMap;

/**
 * Cache and single-flight key for a normalized request. Equal requests under the same model versions
 * always produce the same key.
 */
public final class RequestFingerprint {

    public static final String KEY_PREFIX = "risk:";

    private RequestFingerprint() {
    }

    public static String of(RiskAssessmentRequest request, String modelVersionTag) {
        StringBuilder canonical = new StringBuilder(256)
                .append("name=").append(nullSafe(request.businessName())).append('\u001f')
                .append("address=").append(nullSafe(request.businessAddress())).append('\u001f')
                .append("industry=").append(nullSafe(request.industry())).append('\u001f')
                .append("country=").append(nullSafe(request.country())).append('\u001f')
                .append("phone=").append(nullSafe(request.phone())).append('\u001f')
                .append("email=").append(nullSafe(request.email())).append('\u001f')
                .append("website=").append(nullSafe(request.website())).append('\u001f')
                .append("horizons=").append(request.predictionHorizons()).append('\u001f')
                .append("model=").append(request.modelType().wireName()).append('\u001f')
                .append("comparison=").append(request.includeModelComparison()).append('\u001f')
                .append("uncertainty=").append(request.includeUncertainty()).append('\u001f')
                .append("metadata=").append(stringKeys(request.metadata())).append('\u001f')
                .append("versions=").append(modelVersionTag);
        return KEY_PREFIX + sha256Hex(canonical.toString());
    }

    private static Map<String, String> stringKeys(Map<String, Object> metadata) {
        Map<String, String> copy = new TreeMap<>();
        metadata.forEach((key, value) -> copy.put(key, String.valueOf(value)));
        return copy;
    }

    private static String nullSafe(String value) {
        return value == null ? "" : value;
    }

    private static String sha256Hex(String value) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(value.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
