package com.riskcast.backend.service.cache;

import com.riskcast.backend.model.RiskAssessmentRequest;

import java.util.Set;

/**
 * Envelope stored in the shared tier so another instance can rebuild an L1 entry with the same deadline.
 */
public record CachedPayload(String result, RiskAssessmentRequest request, Set<String> tags, long expiresAtEpochMillis) {
}
