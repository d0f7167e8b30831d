package com.quoteplatform.common.metrics;

import com.quoteplatform.common.model.ServiceMetrics;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Call statistics for one named service instance.
 *
 * <p>All updates run under a single lock so concurrent callers never lose an increment.
 * A cache hit counts as a successful call, which keeps
 * {@code successCalls + errorCalls == totalCalls} true after every call.
 *
 * <p>Average latency is an incremental running mean,
 * {@code avg' = avg + (elapsed - avg) / totalCalls'}, so no total is accumulated.
 * The cache hit rate is derived at snapshot time from the raw counters.
 */
public class MetricsRecorder {

    private final Clock clock;
    private final Object lock = new Object();

    private long totalCalls;
    private long successCalls;
    private long errorCalls;
    private long cacheHits;
    private double averageResponseTime;
    private Instant lastCallTime;

    public MetricsRecorder(Clock clock) {
        this.clock = clock;
    }

    public void recordSuccess(Duration elapsed) {
        synchronized (lock) {
            successCalls++;
            complete(elapsed);
        }
    }

    public void recordError(Duration elapsed) {
        synchronized (lock) {
            errorCalls++;
            complete(elapsed);
        }
    }

    public void recordCacheHit(Duration elapsed) {
        synchronized (lock) {
            successCalls++;
            cacheHits++;
            complete(elapsed);
        }
    }

    public ServiceMetrics snapshot() {
        synchronized (lock) {
            double hitRate = totalCalls == 0 ? 0.0 : (double) cacheHits / totalCalls;
            return new ServiceMetrics(totalCalls, successCalls, errorCalls, cacheHits,
                                      averageResponseTime, hitRate, lastCallTime);
        }
    }

    public void reset() {
        synchronized (lock) {
            totalCalls = 0;
            successCalls = 0;
            errorCalls = 0;
            cacheHits = 0;
            averageResponseTime = 0.0;
            lastCallTime = null;
        }
    }

    // caller holds lock
    private void complete(Duration elapsed) {
        totalCalls++;
        double elapsedMs = elapsed.toNanos() / 1_000_000.0;
        averageResponseTime += (elapsedMs - averageResponseTime) / totalCalls;
        lastCallTime = clock.instant();
    }
}
