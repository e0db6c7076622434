package com.riskcast.backend.service.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.github.benmanes.caffeine.cache.RemovalCause;
import com.github.benmanes.caffeine.cache.Ticker;

import java.util.List;
import java.util.function.Predicate;
import java.util.concurrent.atomic.LongAdder;

/**
 * Bounded in-process tier. Each entry expires at its own deadline, measured on the cache's ticker.
 */
public class LocalResultCache {

    private final Cache<String, CacheEntry> cache;
    private final Ticker ticker;
    private final LongAdder hits = new LongAdder();
    private final LongAdder misses = new LongAdder();
    private final LongAdder evictions = new LongAdder();

    public LocalResultCache(long maximumSize, Ticker ticker) {
        this.ticker = ticker;
        this.cache = Caffeine.newBuilder()
                .maximumSize(maximumSize)
                .ticker(ticker)
                .executor(Runnable::run)
                .expireAfter(new Expiry<String, CacheEntry>() {
                    @Override
                    public long expireAfterCreate(String key, CacheEntry entry, long currentTime) {
                        return Math.max(0L, entry.expiresAtNanos() - currentTime);
                    }

                    @Override
                    public long expireAfterUpdate(String key, CacheEntry entry, long currentTime, long currentDuration) {
                        return Math.max(0L, entry.expiresAtNanos() - currentTime);
                    }

                    @Override
                    public long expireAfterRead(String key, CacheEntry entry, long currentTime, long currentDuration) {
                        return currentDuration;
                    }
                })
                .removalListener((String key, CacheEntry entry, RemovalCause cause) -> {
                    if (cause.wasEvicted()) {
                        evictions.increment();
                    }
                })
                .build();
    }

    public CacheEntry get(String key) {
        CacheEntry entry = cache.getIfPresent(key);
        if (entry == null) {
            misses.increment();
            return null;
        }
        hits.increment();
        entry.recordAccess();
        return entry;
    }

    public void put(CacheEntry entry) {
        cache.put(entry.key(), entry);
    }

    public long invalidateMatching(Predicate<String> keyMatcher) {
        long removed = 0;
        for (String key : List.copyOf(cache.asMap().keySet())) {
            if (keyMatcher.test(key) && cache.asMap().remove(key) != null) {
                removed++;
            }
        }
        return removed;
    }

    public long invalidateTag(String tag) {
        return invalidateMatching(key -> {
            CacheEntry entry = cache.getIfPresent(key);
            return entry != null && entry.tags().contains(tag);
        });
    }

    public List<CacheEntry> entries() {
        return List.copyOf(cache.asMap().values());
    }

    public long remainingNanos(CacheEntry entry) {
        return entry.expiresAtNanos() - ticker.read();
    }

    public long now() {
        return ticker.read();
    }

    public void sweep() {
        cache.cleanUp();
    }

    public TierStats stats() {
        return new TierStats(hits.sum(), misses.sum(), evictions.sum(), cache.estimatedSize());
    }
}
