package com.quoteplatform.common.cache;

import java.time.Instant;

/**
 * Immutable cache entry. Eligible for return only while {@code now < expiresAt}.
 */
public record CacheEntry(String key, Object value, Instant expiresAt) {

    public boolean isExpired(Instant now) {
        return !now.isBefore(expiresAt);
    }
}
