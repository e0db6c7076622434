package com.riskcast.backend.service.cache;

import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.util.Comparator;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.BiPredicate;
import java.util.function.Predicate;

/**
 * Process-local stand-in for the shared tier, used when no Redis is configured.
 */
@Slf4j
public class InMemorySharedCacheBackend implements SharedCacheBackend {

    private record Stored(String value, long expiresAtMillis, Set<String> tags) {
    }

    private final Map<String, Stored> entries = new ConcurrentHashMap<>();
    private final Clock clock;
    private final long maxEntries;

    public InMemorySharedCacheBackend(Clock clock, long maxEntries) {
        this.clock = clock;
        this.maxEntries = maxEntries;
    }

    @Override
    public Optional<String> get(String key) {
        Stored stored = entries.get(key);
        if (stored == null) {
            return Optional.empty();
        }
        if (stored.expiresAtMillis() <= clock.millis()) {
            entries.remove(key, stored);
            return Optional.empty();
        }
        return Optional.of(stored.value());
    }

    @Override
    public void set(String key, String value, Duration ttl, Set<String> tags) {
        if (entries.size() >= maxEntries && !entries.containsKey(key)) {
            makeRoom();
        }
        entries.put(key, new Stored(value, clock.millis() + ttl.toMillis(), Set.copyOf(tags)));
    }

    private void makeRoom() {
        long now = clock.millis();
        entries.entrySet().removeIf(entry -> entry.getValue().expiresAtMillis() <= now);
        if (entries.size() >= maxEntries) {
            entries.entrySet().stream()
                    .min(Comparator.comparingLong(entry -> entry.getValue().expiresAtMillis()))
                    .ifPresent(oldest -> entries.remove(oldest.getKey()));
        }
    }

    @Override
    public long deleteByPattern(String pattern) {
        Predicate<String> matcher = GlobPattern.matcher(pattern);
        return removeWhere((key, stored) -> matcher.test(key));
    }

    @Override
    public long deleteByTag(String tag) {
        return removeWhere((key, stored) -> stored.tags().contains(tag));
    }

    private long removeWhere(BiPredicate<String, Stored> condition) {
        long removed = 0;
        for (Map.Entry<String, Stored> entry : entries.entrySet()) {
            if (condition.test(entry.getKey(), entry.getValue()) && entries.remove(entry.getKey(), entry.getValue())) {
                removed++;
            }
        }
        return removed;
    }

    @Override
    public boolean isHealthy() {
        return true;
    }

    @Override
    public String name() {
        return "in-memory";
    }
}
