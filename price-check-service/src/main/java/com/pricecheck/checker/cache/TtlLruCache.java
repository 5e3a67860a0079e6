package com.pricecheck.checker.cache;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * In-memory TTL + LRU cache keyed by (source, query, location).
 *
 * <p><strong>Fetch once, serve many:</strong> avoids repeating identical retailer searches.
 * Queries are lower-cased, trimmed and whitespace-collapsed, locations trimmed, so
 * {@code "  Milk 2L "} and {@code "milk 2l"} share an entry.
 *
 * <p>Recency is kept by an access-ordered {@link LinkedHashMap} (most recently used at the
 * tail); both a hit and a put refresh it. After every insert the least recently used entries
 * are evicted until at most {@code maxSize} remain. Expired entries are removed when read
 * and swept in bulk on every {@value #SWEEP_EVERY}th put.
 *
 * <p>All access is serialized on a single lock; the compound get-then-evict and
 * insert-then-trim sequences are atomic with respect to each other.
 */
public class TtlLruCache<V> {

    private static final Logger log = LoggerFactory.getLogger(TtlLruCache.class);

    static final int SWEEP_EVERY = 100;

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private static final char KEY_SEPARATOR = '\u0000';

    private final String name;
    private final int maxSize;
    private final Duration defaultTtl;
    private final Clock clock;

    private final Object lock = new Object();
    private final LinkedHashMap<String, CacheEntry<V>> store = new LinkedHashMap<>(16, 0.75f, true);

    private long putCount;
    private long hits;
    private long misses;
    private long evictions;

    public TtlLruCache(String name, int maxSize, Duration defaultTtl, Clock clock) {
        if (maxSize < 1) {
            throw new IllegalArgumentException("maxSize must be positive, got " + maxSize);
        }
        this.name       = name;
        this.maxSize    = maxSize;
        this.defaultTtl = defaultTtl;
        this.clock      = clock;
    }

    public static String key(String source, String query, String location) {
        String normalizedQuery    = query == null ? "" : WHITESPACE.matcher(query.toLowerCase(Locale.ROOT).trim()).replaceAll(" ");
        String normalizedLocation = location == null ? "" : location.trim();
        return source + KEY_SEPARATOR + normalizedQuery + KEY_SEPARATOR + normalizedLocation;
    }

    /**
     * Returns the cached value, or {@code null} on a miss. Use {@link #lookup} when a cached
     * {@code null} must be told apart from a miss.
     */
    public V get(String source, String query, String location) {
        return lookup(source, query, location).value();
    }

    public CacheLookup<V> lookup(String source, String query, String location) {
        String key = key(source, query, location);
        synchronized (lock) {
            CacheEntry<V> entry = store.get(key);
            if (entry == null) {
                misses++;
                return CacheLookup.miss();
            }
            if (entry.isExpired(clock.instant())) {
                store.remove(key);
                misses++;
                return CacheLookup.miss();
            }
            hits++;
            return CacheLookup.hit(entry);
        }
    }

    public void put(String source, String query, String location, V value) {
        put(source, query, location, value, defaultTtl);
    }

    /**
     * Stores {@code value} for {@code ttl}. A zero or negative TTL stores an entry that is
     * already expired.
     */
    public void put(String source, String query, String location, V value, Duration ttl) {
        String key = key(source, query, location);
        Instant now = clock.instant();
        CacheEntry<V> entry = new CacheEntry<>(key, value, now, now.plus(ttl));
        synchronized (lock) {
            putCount++;
            if (putCount % SWEEP_EVERY == 0) {
                sweepExpired(now);
            }
            store.put(key, entry);
            enforceSizeLimit();
        }
    }

    public void clear() {
        synchronized (lock) {
            int cleared = store.size();
            store.clear();
            log.info("CACHE_CLEARED cache={} entries={}", name, cleared);
        }
    }

    public int size() {
        synchronized (lock) {
            return store.size();
        }
    }

    public CacheStats stats() {
        synchronized (lock) {
            Instant now = clock.instant();
            int expired = (int) store.values().stream().filter(e -> e.isExpired(now)).count();
            return new CacheStats(store.size(), maxSize, expired, defaultTtl.toSeconds(), hits, misses, evictions);
        }
    }

    // ── caller holds lock ───────────────────────────────────────────────────

    private void sweepExpired(Instant now) {
        int removed = 0;
        Iterator<CacheEntry<V>> it = store.values().iterator();
        while (it.hasNext()) {
            if (it.next().isExpired(now)) {
                it.remove();
                removed++;
            }
        }
        if (removed > 0) {
            log.debug("CACHE_SWEEP cache={} removed={} remaining={}", name, removed, store.size());
        }
    }

    private void enforceSizeLimit() {
        Iterator<Map.Entry<String, CacheEntry<V>>> it = store.entrySet().iterator();
        while (store.size() > maxSize && it.hasNext()) {
            Map.Entry<String, CacheEntry<V>> eldest = it.next();
            it.remove();
            evictions++;
            log.debug("CACHE_EVICT cache={} key={}", name, eldest.getKey());
        }
    }
}
