package com.quoteplatform.quote.resilience;

import io.github.resilience4j.circuitbreaker.CircuitBreaker;

public enum CircuitState {
    CLOSED,
    OPEN,
    HALF_OPEN;

    /** Disabled and metrics-only breakers let every call through, so they report CLOSED. */
    public static CircuitState of(CircuitBreaker.State state) {
        return switch (state) {
            case OPEN, FORCED_OPEN -> OPEN;
            case HALF_OPEN         -> HALF_OPEN;
            default                -> CLOSED;
        };
    }
}
