package com.quoteplatform.quote.resilience;

import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import io.github.resilience4j.ratelimiter.RateLimiterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-provider request budgets on Resilience4j rate limiters. A provider with no registered
 * budget is unlimited. Admission never waits: a provider at capacity is refused at once.
 *
 * <p>A budget of {@code maxRequests} per {@code window} is issued as one permit every
 * {@code window / (maxRequests - 1)}, and unused permits do not accumulate. Any trailing
 * {@code window} then overlaps at most {@code maxRequests} refresh periods, so it never holds
 * more than {@code maxRequests} admissions.
 */
public class ProviderRateLimiter {

    private static final Logger log = LoggerFactory.getLogger(ProviderRateLimiter.class);

    private final RateLimiterRegistry registry;
    private final ConcurrentHashMap<String, RateLimiter> limiters = new ConcurrentHashMap<>();

    public ProviderRateLimiter() {
        this(RateLimiterRegistry.ofDefaults());
    }

    public ProviderRateLimiter(RateLimiterRegistry registry) {
        this.registry = registry;
    }

    public static RateLimiterConfig config(int maxRequests, Duration window) {
        if (maxRequests < 2) {
            throw new IllegalArgumentException("maxRequests must be >= 2, got " + maxRequests);
        }
        if (window == null || window.isZero() || window.isNegative()) {
            throw new IllegalArgumentException("window must be positive");
        }
        return RateLimiterConfig.custom()
            .limitForPeriod(1)
            .limitRefreshPeriod(window.dividedBy(maxRequests - 1))
            .timeoutDuration(Duration.ZERO)
            .build();
    }

    public void register(String provider, int maxRequests, Duration window) {
        RateLimiterConfig config = config(maxRequests, window);
        limiters.put(provider, registry.rateLimiter(provider, config));
        log.debug("RATE_LIMIT_REGISTERED provider={} maxRequests={} windowSeconds={} refreshMs={}",
                  provider, maxRequests, window.toSeconds(), config.getLimitRefreshPeriod().toMillis());
    }

    public boolean tryAcquire(String provider) {
        RateLimiter limiter = limiters.get(provider);
        if (limiter == null) {
            return true;
        }
        boolean admitted = limiter.acquirePermission();
        if (!admitted) {
            log.debug("RATE_LIMITED provider={}", provider);
        }
        return admitted;
    }

    public boolean isRateLimited(String provider) {
        RateLimiter limiter = limiters.get(provider);
        return limiter != null && limiter.getMetrics().getAvailablePermissions() <= 0;
    }
}
