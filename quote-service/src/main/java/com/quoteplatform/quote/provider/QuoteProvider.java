package com.quoteplatform.quote.provider;

import com.quoteplatform.common.model.Quote;
import reactor.core.publisher.Mono;

/**
 * A single upstream source of quotes.
 *
 * <p>Implementations signal failure with a
 * {@link com.quoteplatform.common.exception.ProviderException}; they do not retry, cache or
 * fall back. That policy belongs to the aggregator.
 */
public interface QuoteProvider {

    /** Stable display name, also the key for weights, breakers and rate limits. */
    String name();

    /**
     * @param category requested category, or {@code null} for any; providers without
     *                 category support ignore it
     */
    Mono<Quote> fetchQuote(String category);
}
