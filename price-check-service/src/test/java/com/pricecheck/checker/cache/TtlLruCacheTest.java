package com.pricecheck.checker.cache;

import com.pricecheck.checker.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Locale;

import static org.junit.jupiter.api.Assertions.*;

class TtlLruCacheTest {

    private MutableClock clock;
    private TtlLruCache<List<String>> cache;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2024-03-01T10:00:00Z");
        cache = new TtlLruCache<>("test", 3, Duration.ofMinutes(10), clock);
    }

    @Nested
    @DisplayName("get / put")
    class GetPutTests {

        @Test
        @DisplayName("stored value is returned until it expires")
        void putThenGet() {
            cache.put("woolworths", "milk 2l", "2000", List.of("A2 Milk 2L"));

            assertEquals(List.of("A2 Milk 2L"), cache.get("woolworths", "milk 2l", "2000"));
        }

        @Test
        @DisplayName("unknown key → null")
        void missReturnsNull() {
            assertNull(cache.get("woolworths", "bread", "2000"));
            assertFalse(cache.lookup("woolworths", "bread", "2000").hit());
        }

        @Test
        @DisplayName("query case and whitespace, location padding share one entry")
        void keyNormalization() {
            cache.put("woolworths", "  Milk   2L ", " 2000 ", List.of("x"));

            assertEquals(List.of("x"), cache.get("woolworths", "milk 2l", "2000"));
            assertEquals(1, cache.size());
        }

        @Test
        @DisplayName("different sources do not collide")
        void sourcesSeparate() {
            cache.put("woolworths", "milk", "2000", List.of("w"));
            cache.put("coles", "milk", "2000", List.of("c"));

            assertEquals(List.of("w"), cache.get("woolworths", "milk", "2000"));
            assertEquals(List.of("c"), cache.get("coles", "milk", "2000"));
        }

        @Test
        @DisplayName("colons inside a part do not make distinct keys collide")
        void colonsInParts() {
            cache.put("a", "b:c", "d", List.of("first"));
            cache.put("a", "b", "c:d", List.of("second"));

            assertNotEquals(TtlLruCache.key("a", "b:c", "d"), TtlLruCache.key("a", "b", "c:d"));
            assertEquals(List.of("first"), cache.get("a", "b:c", "d"));
            assertEquals(List.of("second"), cache.get("a", "b", "c:d"));
            assertEquals(2, cache.size());
        }

        @Test
        @DisplayName("query lower-casing ignores the default locale")
        void turkishDefaultLocale() {
            Locale previous = Locale.getDefault();
            Locale.setDefault(new Locale("tr", "TR"));
            try {
                cache.put("woolworths", "MILK", "2000", List.of("x"));
            } finally {
                Locale.setDefault(previous);
            }

            assertEquals(List.of("x"), cache.get("woolworths", "milk", "2000"));
        }

        @Test
        @DisplayName("empty list and null are cached states, reported as hits")
        void emptyAndNullAreHits() {
            cache.put("woolworths", "unobtainium", "2000", List.of());
            cache.put("woolworths", "nothing", "2000", null);

            CacheLookup<List<String>> empty = cache.lookup("woolworths", "unobtainium", "2000");
            CacheLookup<List<String>> nul   = cache.lookup("woolworths", "nothing", "2000");

            assertTrue(empty.hit());
            assertEquals(List.of(), empty.value());
            assertTrue(nul.hit());
            assertNull(nul.value());
        }
    }

    @Nested
    @DisplayName("expiry")
    class ExpiryTests {

        @Test
        @DisplayName("entry is gone once the default TTL has elapsed")
        void expiresAfterTtl() {
            cache.put("woolworths", "milk", "2000", List.of("x"));

            clock.advance(Duration.ofMinutes(9).plusSeconds(59));
            assertNotNull(cache.get("woolworths", "milk", "2000"));

            clock.advance(Duration.ofSeconds(1));
            assertNull(cache.get("woolworths", "milk", "2000"));
            assertEquals(0, cache.size());
        }

        @Test
        @DisplayName("per-entry TTL overrides the default")
        void customTtl() {
            cache.put("woolworths", "milk", "2000", List.of("x"), Duration.ofSeconds(30));

            clock.advance(Duration.ofSeconds(31));
            assertNull(cache.get("woolworths", "milk", "2000"));
        }

        @Test
        @DisplayName("zero TTL stores an already-expired entry")
        void zeroTtl() {
            cache.put("woolworths", "milk", "2000", List.of("x"), Duration.ZERO);

            assertFalse(cache.lookup("woolworths", "milk", "2000").hit());
        }

        @Test
        @DisplayName("stats count expired but unswept entries")
        void statsCountExpired() {
            cache.put("woolworths", "milk", "2000", List.of("x"), Duration.ofSeconds(5));
            cache.put("woolworths", "bread", "2000", List.of("y"));
            clock.advance(Duration.ofSeconds(10));

            CacheStats stats = cache.stats();
            assertEquals(2, stats.size());
            assertEquals(1, stats.expiredItems());
            assertEquals(3, stats.maxSize());
            assertEquals(600, stats.defaultTtlSeconds());
        }

        @Test
        @DisplayName("every 100th put sweeps expired entries")
        void periodicSweep() {
            TtlLruCache<String> big = new TtlLruCache<>("big", 1000, Duration.ofMinutes(10), clock);
            big.put("s", "short-lived", "2000", "v", Duration.ofSeconds(1));
            clock.advance(Duration.ofSeconds(5));

            for (int i = 1; i < TtlLruCache.SWEEP_EVERY - 1; i++) {
                big.put("s", "q" + i, "2000", "v");
            }
            assertEquals(TtlLruCache.SWEEP_EVERY - 1, big.size());

            big.put("s", "q-last", "2000", "v");
            assertEquals(TtlLruCache.SWEEP_EVERY - 1, big.size());
        }
    }

    @Nested
    @DisplayName("LRU eviction")
    class EvictionTests {

        @Test
        @DisplayName("inserting beyond maxSize evicts the least recently used entry")
        void evictsLeastRecentlyUsed() {
            cache.put("s", "a", "2000", List.of("a"));
            cache.put("s", "b", "2000", List.of("b"));
            cache.put("s", "c", "2000", List.of("c"));

            cache.get("s", "a", "2000");
            cache.put("s", "d", "2000", List.of("d"));

            assertEquals(3, cache.size());
            assertNull(cache.get("s", "b", "2000"));
            assertNotNull(cache.get("s", "a", "2000"));
            assertNotNull(cache.get("s", "c", "2000"));
            assertNotNull(cache.get("s", "d", "2000"));
            assertEquals(1, cache.stats().evictions());
        }

        @Test
        @DisplayName("re-putting an existing key refreshes its recency")
        void putRefreshesRecency() {
            cache.put("s", "a", "2000", List.of("a"));
            cache.put("s", "b", "2000", List.of("b"));
            cache.put("s", "c", "2000", List.of("c"));

            cache.put("s", "a", "2000", List.of("a2"));
            cache.put("s", "d", "2000", List.of("d"));

            assertEquals(List.of("a2"), cache.get("s", "a", "2000"));
            assertNull(cache.get("s", "b", "2000"));
        }

        @Test
        @DisplayName("clear empties the cache")
        void clear() {
            cache.put("s", "a", "2000", List.of("a"));
            cache.clear();

            assertEquals(0, cache.size());
            assertNull(cache.get("s", "a", "2000"));
        }

        @Test
        @DisplayName("hits and misses are counted")
        void hitMissCounters() {
            cache.put("s", "a", "2000", List.of("a"));
            cache.get("s", "a", "2000");
            cache.get("s", "zzz", "2000");

            CacheStats stats = cache.stats();
            assertEquals(1, stats.hits());
            assertEquals(1, stats.misses());
        }
    }
}
