package com.quoteplatform.quote.service;

import com.quoteplatform.common.exception.ProviderException;
import com.quoteplatform.common.execution.ExecuteOptions;
import com.quoteplatform.common.execution.ManagedService;
import com.quoteplatform.common.execution.ServiceExecutor;
import com.quoteplatform.common.metrics.MetricsRecorder;
import com.quoteplatform.common.model.ErrorKind;
import com.quoteplatform.common.model.ExecutionResult;
import com.quoteplatform.common.model.Quote;
import com.quoteplatform.common.model.ServiceMetrics;
import com.quoteplatform.common.trace.TraceContextUtil;
import com.quoteplatform.quote.provider.LocalQuoteProvider;
import com.quoteplatform.quote.resilience.CircuitPermit;
import com.quoteplatform.quote.resilience.CircuitSnapshot;
import com.quoteplatform.quote.resilience.ProviderCircuitBreaker;
import com.quoteplatform.quote.resilience.ProviderRateLimiter;
import com.quoteplatform.quote.selection.SourceWeightStore;
import com.quoteplatform.quote.selection.WeightedProviderSelector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * Serves quotes from several unreliable HTTP providers and never fails.
 *
 * <p>Per request: collect the providers whose breaker permits a call and whose rate limit has
 * room, order them by weighted random draw, move degraded and then down providers to the back
 * (see {@link ProviderStatus}), and try them one at a time until one returns a quote. Provider
 * failures are recorded against that provider and swallowed. If no provider is eligible or all
 * of them fail, the answer comes from {@link LocalQuoteProvider}.
 *
 * <p>Every public operation goes through the {@link ServiceExecutor}, so results are cached,
 * time-bounded and counted there.
 */
public class QuoteAggregatorService implements ManagedService {

    private static final Logger log = LoggerFactory.getLogger(QuoteAggregatorService.class);

    public static final String SERVICE_NAME = "QuoteService";
    public static final int DEFAULT_SEARCH_LIMIT = 10;
    public static final int MAX_SEARCH_LIMIT = 50;
    public static final int DEFAULT_BULK_COUNT = 5;
    public static final int MAX_BULK_COUNT = 10;

    private final ServiceExecutor executor;
    private final Map<String, ProviderBinding> providers = new LinkedHashMap<>();
    private final Map<String, MetricsRecorder> providerMetrics = new LinkedHashMap<>();
    private final LocalQuoteProvider local;
    private final ProviderCircuitBreaker circuitBreaker;
    private final ProviderRateLimiter rateLimiter;
    private final WeightedProviderSelector selector;
    private final SourceWeightStore weights;
    private final AggregatorSettings settings;
    private final Clock clock;
    private final ProviderHealthMonitor healthMonitor;

    public QuoteAggregatorService(ServiceExecutor executor,
                                  List<ProviderBinding> providers,
                                  LocalQuoteProvider local,
                                  ProviderCircuitBreaker circuitBreaker,
                                  ProviderRateLimiter rateLimiter,
                                  WeightedProviderSelector selector,
                                  SourceWeightStore weights,
                                  AggregatorSettings settings,
                                  Clock clock,
                                  Scheduler scheduler) {
        this.executor       = executor;
        this.local          = local;
        this.circuitBreaker = circuitBreaker;
        this.rateLimiter    = rateLimiter;
        this.selector       = selector;
        this.weights        = weights;
        this.settings       = settings;
        this.clock          = clock;
        for (ProviderBinding binding : providers) {
            this.providers.put(binding.name(), binding);
            this.providerMetrics.put(binding.name(), new MetricsRecorder(clock));
        }
        this.healthMonitor = new ProviderHealthMonitor(providers, providerMetrics,
            settings.healthCheckInterval(), settings.healthCheckTimeout(), scheduler);
    }

    @Override
    public String serviceName() {
        return executor.serviceName();
    }

    /** Starts background health checks when enabled. Idempotent. */
    public void start() {
        if (settings.healthCheckEnabled() && !executor.isDestroyed()) {
            healthMonitor.start();
        }
    }

    @Override
    public void destroy() {
        healthMonitor.stop();
        executor.destroy();
    }

    // ── quote operations ──────────────────────────────────────────────────────

    /** One quote for {@code category}; {@code null} or blank means any category. */
    public Mono<ExecutionResult<Quote>> fetchQuote(String category) {
        String normalized = normalizeCategory(category);
        String key = "quote:category:" + (normalized == null ? "any" : normalized);
        return withFallback(
            executor.execute("fetchQuote", key, () -> fetchFromProviders(normalized, () -> local.pick(normalized)),
                             new ExecuteOptions(null, settings.categoryTtl(), false)),
            () -> local.pick(normalized));
    }

    /**
     * Quote of the day, stable for the calendar day in the configured zone while cached. Without a
     * provider it is the bundled quote for the date, so it survives a cache clear.
     */
    public Mono<ExecutionResult<Quote>> getTodayQuote() {
        LocalDate today = LocalDate.now(clock.withZone(settings.zone()));
        return withFallback(
            executor.execute("getTodayQuote", "quote:today:" + today,
                             () -> fetchFromProviders(null, () -> local.quoteOfDay(today)),
                             new ExecuteOptions(null, settings.todayTtl(), false)),
            () -> local.quoteOfDay(today));
    }

    /** Fresh selection every call; bypasses the cache. */
    public Mono<ExecutionResult<Quote>> getRandomQuote() {
        return withFallback(
            executor.execute("getRandomQuote", "quote:random", () -> fetchFromProviders(null, () -> local.pick(null)),
                             ExecuteOptions.uncached()),
            () -> local.pick(null));
    }

    /** Text or author match over the bundled and remembered quotes. */
    public Mono<ExecutionResult<List<Quote>>> searchQuotes(String query, Integer limit) {
        int effectiveLimit = clamp(limit, DEFAULT_SEARCH_LIMIT, MAX_SEARCH_LIMIT);
        String q = query == null ? "" : query.trim().toLowerCase(Locale.ROOT);
        return executor.execute("searchQuotes", "quote:search:" + q + ":" + effectiveLimit,
            () -> Mono.fromSupplier(() -> local.search(q, effectiveLimit)),
            new ExecuteOptions(null, settings.searchTtl(), false));
    }

    /** Author match over the bundled and remembered quotes. */
    public Mono<ExecutionResult<List<Quote>>> getQuotesByAuthor(String author, Integer limit) {
        int effectiveLimit = clamp(limit, DEFAULT_SEARCH_LIMIT, MAX_SEARCH_LIMIT);
        String a = author == null ? "" : author.trim().toLowerCase(Locale.ROOT);
        return executor.execute("getQuotesByAuthor", "quote:author:" + a + ":" + effectiveLimit,
            () -> Mono.fromSupplier(() -> local.byAuthor(a, effectiveLimit)),
            new ExecuteOptions(null, settings.searchTtl(), false));
    }

    /**
     * Up to {@code count} distinct quotes, at most one per external provider, topped up from the
     * local pool. Never cached.
     */
    public Mono<ExecutionResult<List<Quote>>> getBulkQuotes(Integer count, String category) {
        int n = clamp(count, DEFAULT_BULK_COUNT, MAX_BULK_COUNT);
        String normalized = normalizeCategory(category);
        Mono<ExecutionResult<List<Quote>>> result = executor.execute("getBulkQuotes", "quote:bulk",
            () -> bulkFromProviders(n, normalized), ExecuteOptions.uncached());
        return withFallback(result, () -> local.sample(n, normalized, Set.of()));
    }

    // ── health / admin ────────────────────────────────────────────────────────

    /** Per-provider view in configured order. Reading it never changes breaker state. */
    public Map<String, ProviderHealth> getHealthStatus() {
        Map<String, ProviderHealth> out = new LinkedHashMap<>();
        for (String name : providers.keySet()) {
            CircuitSnapshot circuit = circuitBreaker.snapshot(name);
            ServiceMetrics metrics = providerMetrics.get(name).snapshot();
            out.put(name, new ProviderHealth(name, ProviderStatus.of(metrics), ProviderStatus.successRate(metrics),
                circuit.state(), circuit.consecutiveFailures(), circuit.openedAt(),
                rateLimiter.isRateLimited(name), weights.weightOf(name), metrics));
        }
        return out;
    }

    public boolean isHealthy() {
        return executor.isHealthy();
    }

    public ServiceMetrics getPerformanceMetrics() {
        return executor.getMetrics();
    }

    public Map<String, ServiceMetrics> getProviderMetrics() {
        Map<String, ServiceMetrics> out = new LinkedHashMap<>();
        providerMetrics.forEach((name, recorder) -> out.put(name, recorder.snapshot()));
        return out;
    }

    public Map<String, Double> getSourceWeights() {
        return weights.current();
    }

    /** @return a {@code Mono} that errors with {@link IllegalArgumentException} on invalid input */
    public Mono<Void> updateSourceWeights(Map<String, Double> updates) {
        return Mono.defer(() -> weights.update(updates));
    }

    public void clearCache() {
        executor.clearCache();
    }

    /** @throws IllegalArgumentException if {@code provider} is not configured */
    public void resetCircuit(String provider) {
        if (!providers.containsKey(provider)) {
            throw new IllegalArgumentException("Unknown provider: " + provider);
        }
        circuitBreaker.reset(provider);
    }

    /** Runs one health check round now, regardless of the schedule. */
    public Mono<Void> checkProviders() {
        return healthMonitor.checkAll();
    }

    // ── provider selection ────────────────────────────────────────────────────

    Mono<Quote> fetchFromProviders(String category, Supplier<Quote> fallback) {
        return Mono.deferContextual(ctx -> {
            String requestId = TraceContextUtil.getRequestId(ctx);
            List<String> order = providerOrder();
            log.debug("PROVIDER_ORDER requestId={} category={} order={}", requestId, category, order);

            return Flux.fromIterable(order)
                .concatMap(name -> attempt(providers.get(name), category, requestId)
                    .onErrorResume(e -> Mono.empty()))
                .next()
                .switchIfEmpty(Mono.fromSupplier(() -> {
                    Quote quote = fallback.get();
                    TraceContextUtil.withMdc(requestId, () ->
                        log.info("FALLBACK_LOCAL category={} eligible={} quoteId={}",
                                 category, order.size(), quote.id()));
                    return quote;
                }));
        });
    }

    private Mono<List<Quote>> bulkFromProviders(int count, String category) {
        return Mono.deferContextual(ctx -> {
            String requestId = TraceContextUtil.getRequestId(ctx);
            return Flux.fromIterable(providerOrder())
                .concatMap(name -> attempt(providers.get(name), category, requestId)
                    .onErrorResume(e -> Mono.empty()))
                .distinct(Quote::signature)
                .take(count)
                .collectList()
                .map(fetched -> {
                    List<Quote> out = new ArrayList<>(fetched);
                    Set<String> seen = new HashSet<>();
                    fetched.forEach(q -> seen.add(q.signature()));
                    out.addAll(local.sample(count - out.size(), category, seen));
                    log.debug("BULK_QUOTES requestId={} requested={} fromProviders={} total={}",
                              requestId, count, fetched.size(), out.size());
                    return out;
                });
        });
    }

    /** Eligible providers in weighted-random order, then stably grouped HEALTHY, DEGRADED, DOWN. */
    private List<String> providerOrder() {
        List<String> eligible = providers.keySet().stream()
            .filter(name -> circuitBreaker.isCallPermitted(name) && !rateLimiter.isRateLimited(name))
            .toList();
        List<String> order = new ArrayList<>(selector.order(eligible, weights.current()));
        order.sort(Comparator.comparing(this::statusOf));
        return order;
    }

    private ProviderStatus statusOf(String provider) {
        return ProviderStatus.of(providerMetrics.get(provider).snapshot());
    }

    private Mono<Quote> attempt(ProviderBinding binding, String category, String requestId) {
        String name = binding.name();
        return Mono.defer(() -> {
            Optional<CircuitPermit> acquired = circuitBreaker.tryAcquire(name);
            if (acquired.isEmpty()) {
                return Mono.error(new ProviderException(name, ErrorKind.CIRCUIT_OPEN, "circuit open"));
            }
            CircuitPermit permit = acquired.get();
            if (!rateLimiter.tryAcquire(name)) {
                permit.release();
                return Mono.error(new ProviderException(name, ErrorKind.RATE_LIMITED, "rate limit reached"));
            }
            MetricsRecorder metrics = providerMetrics.get(name);
            long start = System.nanoTime();
            long timeoutMs = binding.timeout().toMillis();

            return binding.provider().fetchQuote(category)
                .switchIfEmpty(Mono.error(() -> ProviderException.malformed(name, "no quote")))
                .timeout(binding.timeout(), Mono.error(() -> new ProviderException(
                    name, ErrorKind.TIMEOUT, "timeout after " + timeoutMs + "ms")))
                .flatMap(quote -> quote.isBlank()
                    ? Mono.<Quote>error(ProviderException.malformed(name, "blank quote"))
                    : Mono.just(quote))
                .doOnError(e -> {
                    permit.onError(e);
                    metrics.recordError(elapsedSince(start));
                    TraceContextUtil.withMdc(requestId, () ->
                        log.warn("PROVIDER_FAILED provider={} kind={} reason={}", name, kindOf(e), e.getMessage()));
                })
                .flatMap(quote -> {
                    permit.onSuccess();
                    metrics.recordSuccess(elapsedSince(start));
                    log.debug("PROVIDER_OK provider={} requestId={} quoteId={}", name, requestId, quote.id());
                    return local.remember(quote).thenReturn(quote);
                })
                .doOnCancel(permit::release);
        });
    }

    private <T> Mono<ExecutionResult<T>> withFallback(Mono<ExecutionResult<T>> result, Supplier<T> fallback) {
        return result.map(r -> {
            if (r.success()) {
                return r;
            }
            log.warn("FALLBACK_LOCAL service={} kind={} reason={}", serviceName(), r.errorKind(), r.error());
            return ExecutionResult.success(fallback.get(), false, LocalQuoteProvider.NAME, clock);
        });
    }

    private static ErrorKind kindOf(Throwable e) {
        if (e instanceof ProviderException pe) {
            return pe.getKind();
        }
        return e instanceof TimeoutException ? ErrorKind.TIMEOUT : ErrorKind.UNKNOWN;
    }

    private static int clamp(Integer requested, int defaultValue, int max) {
        return requested == null ? defaultValue : Math.max(1, Math.min(requested, max));
    }

    private static String normalizeCategory(String category) {
        return category == null || category.isBlank() ? null : category.trim().toLowerCase(Locale.ROOT);
    }

    private static Duration elapsedSince(long startNanos) {
        return Duration.ofNanos(System.nanoTime() - startNanos);
    }
}
