package com.quoteplatform.quote.service;

import com.quoteplatform.common.model.ServiceMetrics;

/**
 * Health tier of a provider, derived from its success rate across live calls and health checks.
 * Declaration order is the order providers are tried in.
 */
public enum ProviderStatus {
    HEALTHY,
    DEGRADED,
    DOWN;

    public static final double HEALTHY_SUCCESS_RATE  = 0.7;
    public static final double DEGRADED_SUCCESS_RATE = 0.3;

    public static ProviderStatus of(ServiceMetrics metrics) {
        double rate = successRate(metrics);
        if (rate >= HEALTHY_SUCCESS_RATE) {
            return HEALTHY;
        }
        return rate >= DEGRADED_SUCCESS_RATE ? DEGRADED : DOWN;
    }

    /** {@code successCalls / totalCalls}; 1.0 before the first call. */
    public static double successRate(ServiceMetrics metrics) {
        return metrics.totalCalls() == 0 ? 1.0 : (double) metrics.successCalls() / metrics.totalCalls();
    }
}
