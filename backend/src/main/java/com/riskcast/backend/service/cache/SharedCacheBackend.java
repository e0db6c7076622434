package com.riskcast.backend.service.cache;

import java.time.Duration;
import java.util.Optional;
import java.util.Set;

/**
 * Shared, TTL-capable key/value tier. Every operation may throw
 * {@link com.riskcast.backend.exception.CacheBackendException}; callers treat that as a miss.
 */
public interface SharedCacheBackend {

    Optional<String> get(String key);

    void set(String key, String value, Duration ttl, Set<String> tags);

    long deleteByPattern(String pattern);

    long deleteByTag(String tag);

    boolean isHealthy();

    String name();
}
