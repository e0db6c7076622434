package com.riskcast.backend.service.cache;

import com.riskcast.backend.exception.CacheBackendException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.connection.RedisConnection;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Duration;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

@Slf4j
public class RedisSharedCacheBackend implements SharedCacheBackend {

    private static final String TAG_SEGMENT = "tag:";

    private final StringRedisTemplate redisTemplate;
    private final String keyPrefix;

    public RedisSharedCacheBackend(StringRedisTemplate redisTemplate, String keyPrefix) {
        this.redisTemplate = redisTemplate;
        this.keyPrefix = keyPrefix;
    }

    @Override
    public Optional<String> get(String key) {
        try {
            return Optional.ofNullable(redisTemplate.opsForValue().get(keyPrefix + key));
        } catch (DataAccessException e) {
            throw new CacheBackendException("Redis GET failed for " + key, e);
        }
    }

    @Override
    public void set(String key, String value, Duration ttl, Set<String> tags) {
        try {
            redisTemplate.opsForValue().set(keyPrefix + key, value, ttl);
            for (String tag : tags) {
                String tagKey = tagKey(tag);
                redisTemplate.opsForSet().add(tagKey, key);
                Long current = redisTemplate.getExpire(tagKey, TimeUnit.SECONDS);
                if (current == null || current < ttl.toSeconds()) {
                    redisTemplate.expire(tagKey, ttl);
                }
            }
        } catch (DataAccessException e) {
            throw new CacheBackendException("Redis SET failed for " + key, e);
        }
    }

    @Override
    public long deleteByPattern(String pattern) {
        try {
            Set<String> keys = redisTemplate.keys(keyPrefix + pattern);
            if (keys == null || keys.isEmpty()) {
                return 0;
            }
            Long deleted = redisTemplate.delete(keys);
            return deleted == null ? 0 : deleted;
        } catch (DataAccessException e) {
            throw new CacheBackendException("Redis pattern delete failed for " + pattern, e);
        }
    }

    @Override
    public long deleteByTag(String tag) {
        try {
            String tagKey = tagKey(tag);
            Set<String> members = redisTemplate.opsForSet().members(tagKey);
            long deleted = 0;
            if (members != null && !members.isEmpty()) {
                Long count = redisTemplate.delete(members.stream().map(member -> keyPrefix + member)
                        .collect(Collectors.toSet()));
                deleted = count == null ? 0 : count;
            }
            redisTemplate.delete(tagKey);
            return deleted;
        } catch (DataAccessException e) {
            throw new CacheBackendException("Redis tag delete failed for " + tag, e);
        }
    }

    @Override
    public boolean isHealthy() {
        try (RedisConnection connection = redisTemplate.getRequiredConnectionFactory().getConnection()) {
            return "PONG".equalsIgnoreCase(connection.ping());
        } catch (RuntimeException e) {
            log.debug("Redis health check failed: {}", e.getMessage());
            return false;
        }
    }

    @Override
    public String name() {
        return "redis";
    }

    private String tagKey(String tag) {
        return keyPrefix + TAG_SEGMENT + tag;
    }
}
