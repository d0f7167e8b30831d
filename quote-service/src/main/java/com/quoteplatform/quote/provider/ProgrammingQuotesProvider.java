package com.quoteplatform.quote.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.quoteplatform.common.model.Quote;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.util.UriBuilder;

import java.net.URI;
import java.util.List;

/**
 * Programming Quotes: {@code GET /api/random}. The text field is {@code quote} on the current API
 * and {@code en} on older deployments.
 */
public class ProgrammingQuotesProvider extends HttpQuoteProvider {

    public static final String NAME = "Programming Quotes";

    public ProgrammingQuotesProvider(WebClient webClient, ObjectMapper objectMapper) {
        super(NAME, webClient, objectMapper);
    }

    @Override
    protected URI buildUri(UriBuilder builder, String category) {
        return builder.path("/api/random").build();
    }

    @Override
    protected Quote toQuote(JsonNode root, String category) {
        if (!root.isObject()) {
            return null;
        }
        String id = root.hasNonNull("id") ? "programming-" + root.get("id").asText() : null;
        return new Quote(id, text(root, "quote", "en", "text"), text(root, "author"), "programming",
                         List.of("programming", "technology", "development"), NAME);
    }
}
