package com.quoteplatform.quote.service;

import com.quoteplatform.quote.provider.QuoteProvider;

import java.time.Duration;

/**
 * An external provider as the aggregator sees it: the client plus its per-attempt deadline.
 */
public record ProviderBinding(QuoteProvider provider, Duration timeout) {

    public String name() {
        return provider.name();
    }
}
