package com.riskcast.backend.service.cache;

import com.github.benmanes.caffeine.cache.Ticker;
import com.riskcast.backend.config.CacheProperties;
import com.riskcast.backend.exception.CacheBackendException;
import com.riskcast.backend.model.EnsembleResult;
import com.riskcast.backend.model.RiskAssessmentRequest;
import com.riskcast.backend.service.MetricsService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.io.UncheckedIOException;
import java.time.Clock;
import java.time.Duration;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.LongAdder;

/**
 * Two-tier result cache. L1 is authoritative for this instance; L2 failures are logged and treated as
 * misses.
 */
@Slf4j
@Component
public class ResultCache {

    public static final String LOCAL_TIER = "l1";
    public static final String SHARED_TIER = "l2";

    private final LocalResultCache local;
    private final SharedCacheBackend shared;
    private final EnsembleResultCodec codec;
    private final MetricsService metricsService;
    private final Clock clock;
    private final LongAdder sharedHits = new LongAdder();
    private final LongAdder sharedMisses = new LongAdder();

    @Autowired
    public ResultCache(CacheProperties properties, SharedCacheBackend shared, EnsembleResultCodec codec,
                       MetricsService metricsService, Clock clock) {
        this(new LocalResultCache(properties.getLocal().getMaxSize(), Ticker.systemTicker()), shared, codec,
                metricsService, clock);
    }

    public ResultCache(LocalResultCache local, SharedCacheBackend shared, EnsembleResultCodec codec,
                       MetricsService metricsService, Clock clock) {
        this.local = local;
        this.shared = shared;
        this.codec = codec;
        this.metricsService = metricsService;
        this.clock = clock;
        metricsService.bindCacheEvictions(LOCAL_TIER, local, l -> l.stats().evictions());
        metricsService.bindCacheSize(LOCAL_TIER, local, l -> l.stats().size());
    }

    public Optional<EnsembleResult> get(String key) {
        CacheEntry entry = local.get(key);
        if (entry != null) {
            metricsService.recordCacheLookup(LOCAL_TIER, true);
            return Optional.of(codec.decodeResult(entry.payload()));
        }
        metricsService.recordCacheLookup(LOCAL_TIER, false);

        Optional<CachedPayload> remote = readShared(key);
        long remainingMillis = remote.map(payload -> payload.expiresAtEpochMillis() - clock.millis()).orElse(0L);
        if (remote.isEmpty() || remainingMillis <= 0) {
            sharedMisses.increment();
            metricsService.recordCacheLookup(SHARED_TIER, false);
            return Optional.empty();
        }
        sharedHits.increment();
        metricsService.recordCacheLookup(SHARED_TIER, true);
        CachedPayload payload = remote.get();
        local.put(new CacheEntry(key, payload.result(), payload.request(), payload.tags(),
                local.now() + Duration.ofMillis(remainingMillis).toNanos()));
        return Optional.of(codec.decodeResult(payload.result()));
    }

    private Optional<CachedPayload> readShared(String key) {
        try {
            return shared.get(key).map(codec::decodePayload);
        } catch (CacheBackendException e) {
            log.warn("Shared cache read failed, treating as miss: {}", e.getMessage());
            metricsService.recordCacheBackendFailure("get");
            return Optional.empty();
        } catch (UncheckedIOException e) {
            log.warn("Discarding unreadable shared cache entry {}: {}", key, e.getMessage());
            return Optional.empty();
        }
    }

    public void set(String key, EnsembleResult value, Duration ttl, RiskAssessmentRequest request, Set<String> tags) {
        String payload = codec.encodeResult(value);
        local.put(new CacheEntry(key, payload, request, tags, local.now() + ttl.toNanos()));
        try {
            shared.set(key, codec.encodePayload(new CachedPayload(payload, request, tags,
                    clock.millis() + ttl.toMillis())), ttl, tags);
        } catch (CacheBackendException e) {
            log.warn("Shared cache write failed for {}, keeping local copy only: {}", key, e.getMessage());
            metricsService.recordCacheBackendFailure("set");
        }
    }

    public long invalidate(String pattern) {
        long removed = local.invalidateMatching(GlobPattern.matcher(pattern));
        try {
            removed += shared.deleteByPattern(pattern);
        } catch (CacheBackendException e) {
            log.warn("Shared cache invalidation failed for pattern {}: {}", pattern, e.getMessage());
            metricsService.recordCacheBackendFailure("delete");
        }
        log.info("Invalidated {} cache entries matching {}", removed, pattern);
        return removed;
    }

    public long invalidateTag(String tag) {
        long removed = local.invalidateTag(tag);
        try {
            removed += shared.deleteByTag(tag);
        } catch (CacheBackendException e) {
            log.warn("Shared cache invalidation failed for tag {}: {}", tag, e.getMessage());
            metricsService.recordCacheBackendFailure("delete");
        }
        log.info("Invalidated {} cache entries tagged {}", removed, tag);
        return removed;
    }

    /**
     * Popular L1 entries that will expire within {@code refreshAhead}, most accessed first.
     */
    public List<CacheEntry> prefetchCandidates(long minAccessCount, Duration refreshAhead, int maxItems) {
        long horizon = refreshAhead.toNanos();
        return local.entries().stream()
                .filter(entry -> entry.accessCount() >= minAccessCount)
                .filter(entry -> {
                    long remaining = local.remainingNanos(entry);
                    return remaining > 0 && remaining < horizon;
                })
                .sorted(Comparator.comparingLong(CacheEntry::accessCount).reversed())
                .limit(maxItems)
                .toList();
    }

    @Scheduled(fixedDelayString = "${riskcast.cache.local.sweep-interval-ms:30000}")
    public void sweep() {
        local.sweep();
    }

    public CacheStats stats() {
        boolean healthy;
        try {
            healthy = shared.isHealthy();
        } catch (RuntimeException e) {
            log.debug("Shared cache health check failed: {}", e.getMessage());
            healthy = false;
        }
        TierStats sharedStats = new TierStats(sharedHits.sum(), sharedMisses.sum(), 0, -1);
        return new CacheStats(local.stats(), sharedStats, shared.name(), healthy);
    }
}
