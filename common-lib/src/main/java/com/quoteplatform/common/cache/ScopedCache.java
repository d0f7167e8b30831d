package com.quoteplatform.common.cache;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * TTL key-value cache owned by exactly one service instance.
 *
 * <p>Expiry is the only eviction policy: an entry is returned while {@code now < expiresAt} and is
 * removed lazily the first time a lookup finds it expired, by {@link #evictExpired()}, or by
 * {@link #clear()}. Size is bounded by the owner's key space, not by the cache.
 *
 * <p>Thread-safe via {@link ConcurrentHashMap}. Entries are immutable and replaced whole,
 * so a concurrent reader sees either the previous entry or the new one, never a mix.
 */
public class ScopedCache {

    private static final Logger log = LoggerFactory.getLogger(ScopedCache.class);

    private final String owner;
    private final Clock clock;
    private final ConcurrentHashMap<String, CacheEntry> store = new ConcurrentHashMap<>();

    private final AtomicLong hits      = new AtomicLong();
    private final AtomicLong misses    = new AtomicLong();
    private final AtomicLong evictions = new AtomicLong();

    public ScopedCache(String owner, Clock clock) {
        this.owner = owner;
        this.clock = clock;
    }

    /**
     * Returns the live value for {@code key}, or {@code null} if absent or expired.
     * An expired entry found here is evicted before returning.
     */
    @SuppressWarnings("unchecked")
    public <T> T get(String key) {
        CacheEntry entry = store.get(key);
        if (entry == null) {
            misses.incrementAndGet();
            return null;
        }
        if (entry.isExpired(clock.instant())) {
            // only drop the entry we inspected; a concurrent set may already have replaced it
            if (store.remove(key, entry)) {
                evictions.incrementAndGet();
            }
            misses.incrementAndGet();
            return null;
        }
        hits.incrementAndGet();
        return (T) entry.value();
    }

    /**
     * Stores {@code value} under {@code key} for {@code ttl}. A zero TTL stores nothing.
     */
    public void set(String key, Object value, Duration ttl) {
        if (value == null || ttl.isZero() || ttl.isNegative()) {
            return;
        }
        Instant expiresAt = clock.instant().plus(ttl);
        store.put(key, new CacheEntry(key, value, expiresAt));
        log.debug("CACHE_STORE owner={} key={} ttlSeconds={}", owner, key, ttl.toSeconds());
    }

    public void remove(String key) {
        store.remove(key);
    }

    /**
     * Drops every expired entry.
     *
     * @return the number of entries evicted
     */
    public int evictExpired() {
        Instant now = clock.instant();
        int removed = 0;
        for (CacheEntry entry : store.values()) {
            if (entry.isExpired(now) && store.remove(entry.key(), entry)) {
                removed++;
            }
        }
        if (removed > 0) {
            evictions.addAndGet(removed);
            log.debug("CACHE_SWEEP owner={} evicted={} remaining={}", owner, removed, store.size());
        }
        return removed;
    }

    public void clear() {
        int size = store.size();
        store.clear();
        log.debug("CACHE_CLEARED owner={} entries={}", owner, size);
    }

    public CacheStats stats() {
        long h = hits.get();
        long m = misses.get();
        double hitRate = (h + m) == 0 ? 0.0 : (double) h / (h + m);
        return new CacheStats(store.size(), h, m, evictions.get(), hitRate);
    }
}
