package com.quoteplatform.quote.service;

import com.quoteplatform.common.model.ServiceMetrics;
import com.quoteplatform.quote.resilience.CircuitState;

import java.time.Instant;

/**
 * Health of one external provider as reported by {@code GET /api/v1/quotes/health}.
 *
 * @param status      tier from {@code successRate}; decides the order providers are tried in
 * @param successRate share of successful live calls and health checks, 1.0 before the first one
 */
public record ProviderHealth(
    String provider,
    ProviderStatus status,
    double successRate,
    CircuitState state,
    int consecutiveFailures,
    Instant openedAt,
    boolean rateLimited,
    double weight,
    ServiceMetrics metrics
) {}
