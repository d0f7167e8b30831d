package com.quoteplatform.quote.controller;

import com.quoteplatform.common.trace.TraceContextUtil;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.WebFilter;
import org.springframework.web.server.WebFilterChain;
import reactor.core.publisher.Mono;

import java.util.UUID;

/**
 * Ensures every request has an {@value #HEADER}: reuses the caller's or generates one, echoes it
 * on the response and puts it in the Reactor Context for downstream log lines.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class RequestIdFilter implements WebFilter {

    public static final String HEADER = "X-Request-Id";

    @Override
    public Mono<Void> filter(ServerWebExchange exchange, WebFilterChain chain) {
        String requestId = exchange.getRequest().getHeaders().getFirst(HEADER);
        if (requestId == null || requestId.isBlank()) {
            requestId = UUID.randomUUID().toString();
        }
        exchange.getResponse().getHeaders().set(HEADER, requestId);
        String id = requestId;
        return chain.filter(exchange)
            .contextWrite(ctx -> ctx.put(TraceContextUtil.REQUEST_ID_KEY, id));
    }
}
