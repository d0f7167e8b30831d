package com.quoteplatform.common.model;

import java.time.Duration;
import java.util.Objects;

/**
 * Immutable per-instance configuration of a {@link com.quoteplatform.common.execution.ServiceExecutor}.
 *
 * <p>Defaults (applied by {@link #defaults()} and for every field left unset on the {@link Builder}):
 * <ul>
 *   <li>{@code cacheEnabled} = true, {@code cacheTtl} = 24h</li>
 *   <li>{@code retryAttempts} = 3, {@code retryBackoff} = 1s doubling per attempt, capped at {@code maxRetryBackoff} = 5s</li>
 *   <li>{@code timeout} = 10s per attempt</li>
 *   <li>{@code monitoringEnabled} = true, ticking every {@code monitoringInterval} = 5 min</li>
 *   <li>{@code highLatencyThreshold} = 5s, used by the health verdict</li>
 * </ul>
 */
public record ServiceConfig(
    boolean cacheEnabled,
    Duration cacheTtl,
    int retryAttempts,
    Duration timeout,
    boolean monitoringEnabled,
    Duration retryBackoff,
    Duration maxRetryBackoff,
    Duration highLatencyThreshold,
    Duration monitoringInterval
) {

    public static final Duration DEFAULT_CACHE_TTL              = Duration.ofHours(24);
    public static final int      DEFAULT_RETRY_ATTEMPTS         = 3;
    public static final Duration DEFAULT_TIMEOUT                = Duration.ofSeconds(10);
    public static final Duration DEFAULT_RETRY_BACKOFF          = Duration.ofSeconds(1);
    public static final Duration DEFAULT_MAX_RETRY_BACKOFF      = Duration.ofSeconds(5);
    public static final Duration DEFAULT_HIGH_LATENCY_THRESHOLD = Duration.ofSeconds(5);
    public static final Duration DEFAULT_MONITORING_INTERVAL    = Duration.ofMinutes(5);

    public ServiceConfig {
        Objects.requireNonNull(cacheTtl, "cacheTtl");
        Objects.requireNonNull(timeout, "timeout");
        Objects.requireNonNull(retryBackoff, "retryBackoff");
        Objects.requireNonNull(maxRetryBackoff, "maxRetryBackoff");
        Objects.requireNonNull(highLatencyThreshold, "highLatencyThreshold");
        Objects.requireNonNull(monitoringInterval, "monitoringInterval");
        if (retryAttempts < 0) {
            throw new IllegalArgumentException("retryAttempts must be >= 0, got " + retryAttempts);
        }
        if (timeout.isZero() || timeout.isNegative()) {
            throw new IllegalArgumentException("timeout must be positive, got " + timeout);
        }
        if (cacheTtl.isNegative()) {
            throw new IllegalArgumentException("cacheTtl must not be negative, got " + cacheTtl);
        }
        if (retryBackoff.isNegative() || maxRetryBackoff.isNegative()) {
            throw new IllegalArgumentException("retry backoff must not be negative");
        }
        if (monitoringInterval.isZero() || monitoringInterval.isNegative()) {
            throw new IllegalArgumentException("monitoringInterval must be positive, got " + monitoringInterval);
        }
    }

    public static ServiceConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
            .cacheEnabled(cacheEnabled)
            .cacheTtl(cacheTtl)
            .retryAttempts(retryAttempts)
            .timeout(timeout)
            .monitoringEnabled(monitoringEnabled)
            .retryBackoff(retryBackoff)
            .maxRetryBackoff(maxRetryBackoff)
            .highLatencyThreshold(highLatencyThreshold)
            .monitoringInterval(monitoringInterval);
    }

    public static final class Builder {
        private boolean  cacheEnabled         = true;
        private Duration cacheTtl             = DEFAULT_CACHE_TTL;
        private int      retryAttempts        = DEFAULT_RETRY_ATTEMPTS;
        private Duration timeout              = DEFAULT_TIMEOUT;
        private boolean  monitoringEnabled    = true;
        private Duration retryBackoff         = DEFAULT_RETRY_BACKOFF;
        private Duration maxRetryBackoff      = DEFAULT_MAX_RETRY_BACKOFF;
        private Duration highLatencyThreshold = DEFAULT_HIGH_LATENCY_THRESHOLD;
        private Duration monitoringInterval   = DEFAULT_MONITORING_INTERVAL;

        private Builder() {}

        public Builder cacheEnabled(boolean cacheEnabled) {
            this.cacheEnabled = cacheEnabled;
            return this;
        }

        public Builder cacheTtl(Duration cacheTtl) {
            this.cacheTtl = cacheTtl;
            return this;
        }

        public Builder retryAttempts(int retryAttempts) {
            this.retryAttempts = retryAttempts;
            return this;
        }

        public Builder timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public Builder monitoringEnabled(boolean monitoringEnabled) {
            this.monitoringEnabled = monitoringEnabled;
            return this;
        }

        public Builder retryBackoff(Duration retryBackoff) {
            this.retryBackoff = retryBackoff;
            return this;
        }

        public Builder maxRetryBackoff(Duration maxRetryBackoff) {
            this.maxRetryBackoff = maxRetryBackoff;
            return this;
        }

        public Builder highLatencyThreshold(Duration highLatencyThreshold) {
            this.highLatencyThreshold = highLatencyThreshold;
            return this;
        }

        public Builder monitoringInterval(Duration monitoringInterval) {
            this.monitoringInterval = monitoringInterval;
            return this;
        }

        public ServiceConfig build() {
            return new ServiceConfig(cacheEnabled, cacheTtl, retryAttempts, timeout, monitoringEnabled,
                                     retryBackoff, maxRetryBackoff, highLatencyThreshold, monitoringInterval);
        }
    }
}
