package com.quoteplatform.quote.provider;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.quoteplatform.common.exception.ProviderException;
import com.quoteplatform.common.model.ErrorKind;
import com.quoteplatform.common.model.Quote;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.util.UriBuilder;
import reactor.core.publisher.Mono;

import java.net.URI;
import java.util.ArrayList;
import java.util.List;

/**
 * Base for providers reached with a single JSON GET. Subclasses supply the request path and
 * the mapping from the response tree to a {@link Quote}.
 *
 * <p>Every failure leaves here as a {@link ProviderException} of kind
 * {@link ErrorKind#PROVIDER_ERROR}: non-2xx status, transport error, unparseable body, or a
 * payload without quote text.
 */
public abstract class HttpQuoteProvider implements QuoteProvider {

    private static final Logger log = LoggerFactory.getLogger(HttpQuoteProvider.class);

    private final String name;
    private final WebClient webClient;
    private final ObjectMapper objectMapper;

    protected HttpQuoteProvider(String name, WebClient webClient, ObjectMapper objectMapper) {
        this.name = name;
        this.webClient = webClient;
        this.objectMapper = objectMapper;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public Mono<Quote> fetchQuote(String category) {
        return webClient.get()
            .uri(builder -> buildUri(builder, category))
            .accept(MediaType.APPLICATION_JSON)
            .retrieve()
            .onStatus(HttpStatusCode::isError, response -> Mono.error(new ProviderException(
                name, ErrorKind.PROVIDER_ERROR, "HTTP " + response.statusCode().value())))
            .bodyToMono(String.class)
            .switchIfEmpty(Mono.error(() -> ProviderException.malformed(name, "empty body")))
            .map(body -> parse(body, category))
            .onErrorMap(WebClientRequestException.class, e -> new ProviderException(
                name, ErrorKind.PROVIDER_ERROR, "request failed: " + e.getMessage(), e))
            .doOnNext(q -> log.debug("PROVIDER_FETCHED provider={} id={} author={}", name, q.id(), q.author()));
    }

    /** Request URI relative to the provider's base URL. */
    protected abstract URI buildUri(UriBuilder builder, String category);

    /**
     * Maps the parsed response to a quote. Returning {@code null} or a blank quote marks the
     * payload as malformed.
     */
    protected abstract Quote toQuote(JsonNode root, String category);

    Quote parse(String body, String category) {
        JsonNode root;
        try {
            root = objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new ProviderException(name, ErrorKind.PROVIDER_ERROR, "malformed payload: not JSON", e);
        }
        Quote quote = root == null ? null : toQuote(root, category);
        if (quote == null || quote.isBlank()) {
            throw ProviderException.malformed(name, "no quote text");
        }
        return quote;
    }

    // ── helpers for subclasses ────────────────────────────────────────────────

    protected static String text(JsonNode node, String... fields) {
        for (String field : fields) {
            JsonNode value = node.path(field);
            if (value.isTextual() && !value.asText().isBlank()) {
                return value.asText();
            }
        }
        return null;
    }

    protected static List<String> tags(JsonNode node) {
        List<String> tags = new ArrayList<>();
        if (node.isArray()) {
            node.forEach(t -> {
                if (t.isTextual()) {
                    tags.add(t.asText());
                }
            });
        }
        return tags;
    }
}
