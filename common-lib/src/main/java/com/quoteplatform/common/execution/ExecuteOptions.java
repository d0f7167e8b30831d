package com.quoteplatform.common.execution;

import java.time.Duration;

/**
 * Per-call overrides for {@link ServiceExecutor#execute}. A {@code null} field falls back to the
 * executor's {@link com.quoteplatform.common.model.ServiceConfig}.
 *
 * @param useCache     read and populate the cache; {@code null} = instance {@code cacheEnabled}
 * @param ttl          lifetime of a stored result; {@code null} = instance {@code cacheTtl}
 * @param retryOnError retry failed attempts up to {@code retryAttempts} times
 */
public record ExecuteOptions(Boolean useCache, Duration ttl, boolean retryOnError) {

    private static final ExecuteOptions DEFAULTS = new ExecuteOptions(null, null, false);

    public static ExecuteOptions defaults() {
        return DEFAULTS;
    }

    public static ExecuteOptions cached(Duration ttl) {
        return new ExecuteOptions(true, ttl, false);
    }

    public static ExecuteOptions uncached() {
        return new ExecuteOptions(false, null, false);
    }

    public ExecuteOptions withRetry() {
        return new ExecuteOptions(useCache, ttl, true);
    }

    boolean resolveUseCache(boolean instanceDefault) {
        return useCache == null ? instanceDefault : useCache;
    }

    Duration resolveTtl(Duration instanceDefault) {
        return ttl == null ? instanceDefault : ttl;
    }
}
