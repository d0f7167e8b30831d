package com.quoteplatform.quote.resilience;

import java.time.Instant;

/**
 * Point-in-time view of one provider's breaker.
 *
 * @param openedAt when the breaker last opened, {@code null} if it never has since the last reset
 */
public record CircuitSnapshot(CircuitState state, int consecutiveFailures, Instant openedAt) {

    public static CircuitSnapshot closed() {
        return new CircuitSnapshot(CircuitState.CLOSED, 0, null);
    }
}
