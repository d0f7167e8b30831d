package com.quoteplatform.common.model;

import java.time.Instant;

/**
 * Point-in-time copy of a service's call statistics.
 *
 * @param averageResponseTime running mean in milliseconds
 * @param cacheHitRate        {@code cacheHits / totalCalls}, 0 when no calls were made
 * @param lastCallTime        completion time of the most recent call, {@code null} before the first one
 */
public record ServiceMetrics(
    long totalCalls,
    long successCalls,
    long errorCalls,
    long cacheHits,
    double averageResponseTime,
    double cacheHitRate,
    Instant lastCallTime
) {

    public static ServiceMetrics empty() {
        return new ServiceMetrics(0, 0, 0, 0, 0.0, 0.0, null);
    }

    /** Fraction of calls that failed; 0 with no calls. */
    public double errorRate() {
        return totalCalls == 0 ? 0.0 : (double) errorCalls / totalCalls;
    }
}
