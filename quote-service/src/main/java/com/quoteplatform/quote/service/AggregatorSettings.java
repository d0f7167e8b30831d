package com.quoteplatform.quote.service;

import java.time.Duration;
import java.time.ZoneId;

/**
 * Aggregator knobs that are not part of the shared executor config.
 *
 * @param zone zone in which "today" is evaluated for the quote of the day
 */
public record AggregatorSettings(
    Duration categoryTtl,
    Duration todayTtl,
    Duration searchTtl,
    ZoneId zone,
    boolean healthCheckEnabled,
    Duration healthCheckInterval,
    Duration healthCheckTimeout
) {

    public static AggregatorSettings defaults() {
        return new AggregatorSettings(Duration.ofMinutes(5), Duration.ofHours(24), Duration.ofMinutes(10),
                                      ZoneId.of("UTC"), false, Duration.ofMinutes(5), Duration.ofSeconds(5));
    }
}
