package com.riskcast.backend.service.cache;

import com.riskcast.backend.model.RiskAssessmentRequest;

import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;

/**
 * L1 entry. The payload is the serialized result; the request is kept so the prefetcher can recompute it.
 */
public final class CacheEntry {

    private final String key;
    private final String payload;
    private final RiskAssessmentRequest request;
    private final Set<String> tags;
    private final long expiresAtNanos;
    private final AtomicLong accessCount = new AtomicLong();

    public CacheEntry(String key, String payload, RiskAssessmentRequest request, Set<String> tags, long expiresAtNanos) {
        this.key = key;
        this.payload = payload;
        this.request = request;
        this.tags = Set.copyOf(tags);
        this.expiresAtNanos = expiresAtNanos;
    }

    public String key() {
        return key;
    }

    public String payload() {
        return payload;
    }

    public RiskAssessmentRequest request() {
        return request;
    }

    public Set<String> tags() {
        return tags;
    }

    public long expiresAtNanos() {
        return expiresAtNanos;
    }

    public long accessCount() {
        return accessCount.get();
    }

    long recordAccess() {
        return accessCount.incrementAndGet();
    }
}
