package com.quoteplatform.quote.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.quoteplatform.common.model.Quote;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.util.UriBuilder;

import java.net.URI;
import java.util.List;

/** ZenQuotes: {@code GET /api/random} answers {@code [{"q": ..., "a": ...}]}. No category support. */
public class ZenQuotesProvider extends HttpQuoteProvider {

    public static final String NAME = "ZenQuotes";

    public ZenQuotesProvider(WebClient webClient, ObjectMapper objectMapper) {
        super(NAME, webClient, objectMapper);
    }

    @Override
    protected URI buildUri(UriBuilder builder, String category) {
        return builder.path("/api/random").build();
    }

    @Override
    protected Quote toQuote(JsonNode root, String category) {
        if (!root.isArray() || root.isEmpty()) {
            return null;
        }
        JsonNode first = root.get(0);
        return new Quote(null, text(first, "q"), text(first, "a"), "inspiration",
                         List.of("inspiration", "wisdom"), NAME);
    }
}
