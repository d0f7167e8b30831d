package com.quoteplatform.quote.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.quoteplatform.common.model.Quote;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.util.UriBuilder;

import java.net.URI;
import java.util.List;

/** FavQs quote of the day: {@code GET /api/qotd} answers {@code {"quote": {id, body, author, tags}}}. */
public class FavQsProvider extends HttpQuoteProvider {

    public static final String NAME = "FavQs";

    public FavQsProvider(WebClient webClient, ObjectMapper objectMapper) {
        super(NAME, webClient, objectMapper);
    }

    @Override
    protected URI buildUri(UriBuilder builder, String category) {
        return builder.path("/api/qotd").build();
    }

    @Override
    protected Quote toQuote(JsonNode root, String category) {
        JsonNode quote = root.path("quote");
        if (!quote.isObject()) {
            return null;
        }
        List<String> tags = tags(quote.path("tags"));
        String id = quote.hasNonNull("id") ? "favqs-" + quote.get("id").asText() : null;
        return new Quote(id, text(quote, "body"), text(quote, "author"),
                         tags.isEmpty() ? null : tags.get(0), tags, NAME);
    }
}
