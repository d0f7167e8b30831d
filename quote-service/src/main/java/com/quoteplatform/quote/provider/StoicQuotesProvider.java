package com.quoteplatform.quote.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.quoteplatform.common.model.Quote;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.util.UriBuilder;

import java.net.URI;
import java.util.List;

/** Stoic Quotes: {@code GET /api/quote} answers {@code {text, author}}. */
public class StoicQuotesProvider extends HttpQuoteProvider {

    public static final String NAME = "Stoic Quotes";

    public StoicQuotesProvider(WebClient webClient, ObjectMapper objectMapper) {
        super(NAME, webClient, objectMapper);
    }

    @Override
    protected URI buildUri(UriBuilder builder, String category) {
        return builder.path("/api/quote").build();
    }

    @Override
    protected Quote toQuote(JsonNode root, String category) {
        if (!root.isObject()) {
            return null;
        }
        String author = text(root, "author");
        return new Quote(null, text(root, "text", "quote"), author == null ? "Unknown Stoic" : author,
                         "philosophy", List.of("stoicism", "philosophy", "wisdom"), NAME);
    }
}
