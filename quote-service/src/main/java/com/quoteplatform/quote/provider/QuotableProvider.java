package com.quoteplatform.quote.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.quoteplatform.common.model.Quote;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.util.UriBuilder;

import java.net.URI;
import java.util.List;
import java.util.Locale;

/** Quotable: {@code GET /random?tags=<category>} answers {@code {_id, content, author, tags}}. */
public class QuotableProvider extends HttpQuoteProvider {

    public static final String NAME = "Quotable";

    public QuotableProvider(WebClient webClient, ObjectMapper objectMapper) {
        super(NAME, webClient, objectMapper);
    }

    @Override
    protected URI buildUri(UriBuilder builder, String category) {
        builder.path("/random");
        if (category != null && !category.isBlank()) {
            builder.queryParam("tags", category.trim().toLowerCase(Locale.ROOT));
        }
        return builder.build();
    }

    @Override
    protected Quote toQuote(JsonNode root, String category) {
        if (!root.isObject()) {
            return null;
        }
        List<String> tags = tags(root.path("tags"));
        String resolved = tags.isEmpty() ? category : tags.get(0);
        return new Quote(text(root, "_id"), text(root, "content"), text(root, "author"), resolved, tags, NAME);
    }
}
