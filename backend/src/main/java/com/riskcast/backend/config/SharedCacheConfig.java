package com.riskcast.backend.config;

import com.riskcast.backend.service.cache.InMemorySharedCacheBackend;
import com.riskcast.backend.service.cache.RedisSharedCacheBackend;
import com.riskcast.backend.service.cache.SharedCacheBackend;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Clock;

@Slf4j
@Configuration
public class SharedCacheConfig {

    @Bean
    public SharedCacheBackend sharedCacheBackend(CacheProperties cacheProperties,
                                                 ObjectProvider<StringRedisTemplate> redisTemplate,
                                                 Clock clock) {
        CacheProperties.Shared shared = cacheProperties.getShared();
        StringRedisTemplate template = shared.isEnabled() ? redisTemplate.getIfAvailable() : null;
        if (template != null) {
            log.info("✅ Shared result cache backed by Redis (prefix {})", shared.getKeyPrefix());
            return new RedisSharedCacheBackend(template, shared.getKeyPrefix());
        }
        if (shared.isEnabled()) {
            log.warn("Shared cache enabled but no Redis template available; using in-memory shared tier");
        } else {
            log.info("Shared result cache disabled; using in-memory shared tier");
        }
        return new InMemorySharedCacheBackend(clock, shared.getMaxInMemoryEntries());
    }
}
