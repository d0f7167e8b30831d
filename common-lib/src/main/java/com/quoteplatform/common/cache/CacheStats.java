package com.quoteplatform.common.cache;

/**
 * Observability view of a {@link ScopedCache}.
 *
 * @param entryCount entries currently held, expired-but-not-yet-evicted ones included
 * @param hitRate    {@code hits / (hits + misses)}, 0 before the first lookup
 */
public record CacheStats(int entryCount, long hits, long misses, long evictions, double hitRate) {}
