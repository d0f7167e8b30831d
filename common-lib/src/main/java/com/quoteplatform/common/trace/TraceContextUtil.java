package com.quoteplatform.common.trace;

import org.slf4j.MDC;
import reactor.core.publisher.Mono;
import reactor.util.context.ContextView;

/**
 * Request-id propagation for reactive pipelines.
 *
 * <p>The Reactor Context carries the request id; MDC is written only for the duration of a
 * single log statement, never left on the thread.
 *
 * <pre>
 *     return TraceContextUtil.withRequestId(aggregator.fetchQuote(category), requestId);
 * </pre>
 */
public final class TraceContextUtil {

    public static final String REQUEST_ID_KEY = "requestId";

    private TraceContextUtil() {}

    public static <T> Mono<T> withRequestId(Mono<T> mono, String requestId) {
        return mono.contextWrite(ctx -> ctx.put(REQUEST_ID_KEY, requestId));
    }

    /** @return the request id, or {@code "none"} outside a request */
    public static String getRequestId(ContextView ctx) {
        return ctx.getOrDefault(REQUEST_ID_KEY, "none");
    }

    public static void withMdc(String requestId, Runnable logAction) {
        MDC.put(REQUEST_ID_KEY, requestId);
        try {
            logAction.run();
        } finally {
            MDC.remove(REQUEST_ID_KEY);
        }
    }
}
