package com.riskcast.backend.service.cache;

import com.riskcast.backend.support.MutableClock;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class InMemorySharedCacheBackendTest {

    private final MutableClock clock = new MutableClock(Instant.parse("2026-02-01T00:00:00Z"));

    @Test
    void honoursTtl() {
        InMemorySharedCacheBackend backend = new InMemorySharedCacheBackend(clock, 10);
        backend.set("risk:a", "payload", Duration.ofSeconds(10), Set.of());

        assertThat(backend.get("risk:a")).contains("payload");
        clock.advance(Duration.ofSeconds(10));
        assertThat(backend.get("risk:a")).isEmpty();
    }

    @Test
    void dropsSoonestExpiringEntryWhenFull() {
        InMemorySharedCacheBackend backend = new InMemorySharedCacheBackend(clock, 2);
        backend.set("risk:a", "a", Duration.ofSeconds(10), Set.of());
        backend.set("risk:b", "b", Duration.ofSeconds(60), Set.of());
        backend.set("risk:c", "c", Duration.ofSeconds(60), Set.of());

        assertThat(backend.get("risk:a")).isEmpty();
        assertThat(backend.get("risk:b")).contains("b");
        assertThat(backend.get("risk:c")).contains("c");
    }

    @Test
    void deletesByPatternAndTag() {
        InMemorySharedCacheBackend backend = new InMemorySharedCacheBackend(clock, 10);
        backend.set("risk:a1", "1", Duration.ofMinutes(1), Set.of("model:v1"));
        backend.set("risk:a2", "2", Duration.ofMinutes(1), Set.of("model:v2"));
        backend.set("risk:b1", "3", Duration.ofMinutes(1), Set.of("model:v1"));

        assertThat(backend.deleteByTag("model:v1")).isEqualTo(2);
        assertThat(backend.deleteByPattern("risk:*")).isEqualTo(1);
        assertThat(backend.isHealthy()).isTrue();
    }
}
