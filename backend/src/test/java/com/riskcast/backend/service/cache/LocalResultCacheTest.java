package com.riskcast.backend.service.cache;

import com.riskcast.backend.support.FakeTicker;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class LocalResultCacheTest {

    private final FakeTicker ticker = new FakeTicker();

    @Test
    void entriesExpireAtTheirOwnDeadline() {
        LocalResultCache cache = new LocalResultCache(10, ticker);
        cache.put(entry("risk:short", Duration.ofSeconds(30)));
        cache.put(entry("risk:long", Duration.ofMinutes(5)));

        ticker.advance(Duration.ofSeconds(31));

        assertThat(cache.get("risk:short")).isNull();
        assertThat(cache.get("risk:long")).isNotNull();
        assertThat(cache.stats().hits()).isEqualTo(1);
        assertThat(cache.stats().misses()).isEqualTo(1);
    }

    @Test
    void readsDoNotExtendLifetime() {
        LocalResultCache cache = new LocalResultCache(10, ticker);
        cache.put(entry("risk:a", Duration.ofSeconds(30)));

        ticker.advance(Duration.ofSeconds(20));
        assertThat(cache.get("risk:a")).isNotNull();
        ticker.advance(Duration.ofSeconds(11));

        assertThat(cache.get("risk:a")).isNull();
    }

    @Test
    void sizeBoundEvictsAndCounts() {
        LocalResultCache cache = new LocalResultCache(2, ticker);
        for (int i = 0; i < 10; i++) {
            cache.put(entry("risk:" + i, Duration.ofMinutes(5)));
        }
        cache.sweep();

        assertThat(cache.stats().size()).isLessThanOrEqualTo(2);
        assertThat(cache.stats().evictions()).isGreaterThanOrEqualTo(8);
    }

    @Test
    void globAndTagInvalidation() {
        LocalResultCache cache = new LocalResultCache(10, ticker);
        cache.put(new CacheEntry("risk:ab", "{}", null, Set.of("business:acme"), Duration.ofMinutes(1).toNanos()));
        cache.put(new CacheEntry("risk:ac", "{}", null, Set.of(), Duration.ofMinutes(1).toNanos()));
        cache.put(new CacheEntry("other:ab", "{}", null, Set.of("business:acme"), Duration.ofMinutes(1).toNanos()));

        assertThat(cache.invalidateMatching(GlobPattern.matcher("risk:a?"))).isEqualTo(2);
        assertThat(cache.invalidateTag("business:acme")).isEqualTo(1);
        assertThat(cache.entries()).isEmpty();
    }

    @Test
    void globTreatsRegexCharactersLiterally() {
        assertThat(GlobPattern.matcher("risk:a.b*").test("risk:a.bcd")).isTrue();
        assertThat(GlobPattern.matcher("risk:a.b*").test("risk:axbcd")).isFalse();
    }

    private CacheEntry entry(String key, Duration ttl) {
        return new CacheEntry(key, "{}", null, Set.of(), ticker.read() + ttl.toNanos());
    }
}
