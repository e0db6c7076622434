package com.riskcast.backend.service.cache;

public record TierStats(long hits, long misses, long evictions, long size) {

    public double hitRate() {
        long total = hits + misses;
        return total == 0 ? 0.0 : (double) hits / total;
    }
}
