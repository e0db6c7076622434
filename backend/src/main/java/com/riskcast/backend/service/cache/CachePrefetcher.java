package com.riskcast.backend.service.cache;

import com.riskcast.backend.config.CacheProperties;
import com.riskcast.backend.model.CircuitBreakerState;
import com.riskcast.backend.service.MetricsService;
import com.riskcast.backend.service.ScheduledTaskGuard;
import com.riskcast.backend.service.engine.RiskEngine;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Re-warms popular entries shortly before they expire. Runs on the background scheduler only.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CachePrefetcher {

    public record PrefetchReport(int candidates, int refreshed, int skipped, int failed) {
    }

    private final ResultCache resultCache;
    private final RiskEngine riskEngine;
    private final CacheProperties cacheProperties;
    private final MetricsService metricsService;
    private final ScheduledTaskGuard scheduledTaskGuard;

    @Scheduled(fixedDelayString = "${riskcast.cache.prefetch.interval-ms:60000}",
            initialDelayString = "${riskcast.cache.prefetch.interval-ms:60000}")
    public void scheduledPrefetch() {
        if (!cacheProperties.getPrefetch().isEnabled()) {
            return;
        }
        scheduledTaskGuard.run("cache-prefetch", this::prefetchOnce);
    }

    public PrefetchReport prefetchOnce() {
        CacheProperties.Prefetch settings = cacheProperties.getPrefetch();
        if (riskEngine.breakerState().state() != CircuitBreakerState.State.CLOSED) {
            log.info("Skipping cache prefetch while the model circuit breaker is not closed");
            return new PrefetchReport(0, 0, 0, 0);
        }
        List<CacheEntry> candidates = resultCache.prefetchCandidates(settings.getPopularityThreshold(),
                settings.getRefreshAhead(), settings.getMaxItems());
        int refreshed = 0;
        int skipped = 0;
        int failed = 0;
        for (CacheEntry entry : candidates) {
            if (Thread.currentThread().isInterrupted()) {
                break;
            }
            try {
                if (riskEngine.refresh(entry.key(), entry.request())) {
                    refreshed++;
                } else {
                    skipped++;
                }
            } catch (RuntimeException e) {
                failed++;
                log.warn("Prefetch of {} failed: {}", entry.key(), e.getMessage());
            }
        }
        metricsService.recordPrefetch(refreshed, failed);
        if (!candidates.isEmpty()) {
            log.info("Cache prefetch refreshed={} skipped={} failed={} of {}", refreshed, skipped, failed,
                    candidates.size());
        }
        return new PrefetchReport(candidates.size(), refreshed, skipped, failed);
    }
}
