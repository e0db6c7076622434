package com.riskcast.backend.service.cache;

public record CacheStats(TierStats local, TierStats shared, String sharedBackend, boolean sharedHealthy) {
}
