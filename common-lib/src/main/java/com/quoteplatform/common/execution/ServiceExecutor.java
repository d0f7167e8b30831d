package com.quoteplatform.common.execution;

import com.quoteplatform.common.cache.CacheStats;
import com.quoteplatform.common.cache.ScopedCache;
import com.quoteplatform.common.exception.ProviderException;
import com.quoteplatform.common.metrics.MetricsRecorder;
import com.quoteplatform.common.model.ErrorKind;
import com.quoteplatform.common.model.ExecutionResult;
import com.quoteplatform.common.model.ServiceConfig;
import com.quoteplatform.common.model.ServiceMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;
import reactor.util.retry.Retry;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

/**
 * Execution wrapper shared by every concrete service: cache lookup, deadline-bounded fetch,
 * bounded retry with exponential backoff, metrics, and a derived health verdict.
 *
 * <p><strong>Flow of {@link #execute}:</strong>
 * <ol>
 *   <li>Caching requested and a live entry exists → cache hit, the fetcher is never invoked.</li>
 *   <li>Otherwise the fetcher runs under a per-attempt deadline of {@code timeout}.</li>
 *   <li>Failed attempts are retried up to {@code retryAttempts} times when {@code retryOnError}
 *       is set, stopping at the first success.</li>
 *   <li>Success is cached (if requested) and counted once; exhausted failure is counted once.</li>
 * </ol>
 *
 * <p>The returned {@code Mono} never signals an error. Every outcome becomes an
 * {@link ExecutionResult}, leaving the failure policy to the caller.
 *
 * <p>Concrete services hold an executor rather than extend one.
 */
public class ServiceExecutor implements ManagedService {

    private static final Logger log = LoggerFactory.getLogger(ServiceExecutor.class);

    /** Error rate at or above which the service reports unhealthy. */
    public static final double UNHEALTHY_ERROR_RATE = 0.10;

    private final String serviceName;
    private final ServiceConfig config;
    private final Clock clock;
    private final ScopedCache cache;
    private final MetricsRecorder metrics;
    private final AtomicBoolean destroyed = new AtomicBoolean(false);
    private final Disposable maintenance;

    public ServiceExecutor(String serviceName, ServiceConfig config) {
        this(serviceName, config, Clock.systemUTC(), Schedulers.parallel());
    }

    public ServiceExecutor(String serviceName, ServiceConfig config, Clock clock) {
        this(serviceName, config, clock, Schedulers.parallel());
    }

    public ServiceExecutor(String serviceName, ServiceConfig config, Clock clock, Scheduler scheduler) {
        this.serviceName = serviceName;
        this.config      = config;
        this.clock       = clock;
        this.cache       = new ScopedCache(serviceName, clock);
        this.metrics     = new MetricsRecorder(clock);
        this.maintenance = config.monitoringEnabled()
            ? Flux.interval(config.monitoringInterval(), scheduler).subscribe(tick -> runMaintenance())
            : null;
        log.info("SERVICE_STARTED service={} cacheEnabled={} cacheTtlSeconds={} retryAttempts={} timeoutMs={} monitoring={}",
                 serviceName, config.cacheEnabled(), config.cacheTtl().toSeconds(), config.retryAttempts(),
                 config.timeout().toMillis(), config.monitoringEnabled());
    }

    @Override
    public String serviceName() {
        return serviceName;
    }

    public ServiceConfig config() {
        return config;
    }

    public <T> Mono<ExecutionResult<T>> execute(String operation, String cacheKey, Supplier<Mono<T>> fetcher) {
        return execute(operation, cacheKey, fetcher, ExecuteOptions.defaults());
    }

    /**
     * Runs {@code fetcher} with caching, deadline, retry and metrics.
     *
     * @param operation logical operation name, used in logs only
     * @param cacheKey  key in this service's scoped cache
     * @param fetcher   produces a fresh {@code Mono} per attempt; it is subscribed once per attempt
     * @param options   per-call overrides
     * @return a {@code Mono} that always emits exactly one {@link ExecutionResult}
     */
    public <T> Mono<ExecutionResult<T>> execute(String operation, String cacheKey,
                                                Supplier<Mono<T>> fetcher, ExecuteOptions options) {
        return Mono.defer(() -> {
            if (destroyed.get()) {
                return Mono.just(ExecutionResult.<T>failure(
                    "service " + serviceName + " destroyed", ErrorKind.UNKNOWN, serviceName, clock));
            }

            long startNanos  = System.nanoTime();
            boolean useCache = options.resolveUseCache(config.cacheEnabled());
            Duration ttl     = options.resolveTtl(config.cacheTtl());

            if (useCache) {
                T cached = cache.get(cacheKey);
                if (cached != null) {
                    metrics.recordCacheHit(elapsedSince(startNanos));
                    log.debug("CACHE_HIT service={} operation={} key={}", serviceName, operation, cacheKey);
                    return Mono.just(ExecutionResult.success(cached, true, serviceName, clock));
                }
                log.debug("CACHE_MISS service={} operation={} key={}", serviceName, operation, cacheKey);
            }

            return withRetry(attempt(operation, fetcher), operation, options.retryOnError())
                .map(data -> {
                    if (useCache) {
                        cache.set(cacheKey, data, ttl);
                    }
                    metrics.recordSuccess(elapsedSince(startNanos));
                    return ExecutionResult.success(data, false, serviceName, clock);
                })
                .onErrorResume(e -> {
                    Duration elapsed = elapsedSince(startNanos);
                    metrics.recordError(elapsed);
                    ErrorKind kind = classify(e);
                    log.warn("EXECUTE_FAILED service={} operation={} key={} kind={} elapsedMs={} reason={}",
                             serviceName, operation, cacheKey, kind, elapsed.toMillis(), messageOf(e));
                    return Mono.just(ExecutionResult.<T>failure(messageOf(e), kind, serviceName, clock));
                });
        });
    }

    // ── attempt / retry ───────────────────────────────────────────────────────

    private <T> Mono<T> attempt(String operation, Supplier<Mono<T>> fetcher) {
        long timeoutMs = config.timeout().toMillis();
        return Mono.defer(fetcher)
            .switchIfEmpty(Mono.error(() -> new ProviderException(
                serviceName, ErrorKind.PROVIDER_ERROR, operation + " returned no data")))
            .timeout(config.timeout(), Mono.error(() -> new TimeoutException(
                "Operation timeout after " + timeoutMs + "ms")));
    }

    private <T> Mono<T> withRetry(Mono<T> attempt, String operation, boolean retryOnError) {
        int attempts = config.retryAttempts();
        if (!retryOnError || attempts == 0) {
            return attempt;
        }
        if (config.retryBackoff().isZero()) {
            return attempt.retryWhen(Retry.max(attempts)
                .doBeforeRetry(signal -> logRetry(operation, signal))
                .onRetryExhaustedThrow((retrySpec, signal) -> signal.failure()));
        }
        // delay = retryBackoff * 2^(n-1), capped at maxRetryBackoff
        return attempt.retryWhen(Retry.backoff(attempts, config.retryBackoff())
            .maxBackoff(config.maxRetryBackoff())
            .jitter(0.0)
            .doBeforeRetry(signal -> logRetry(operation, signal))
            .onRetryExhaustedThrow((retrySpec, signal) -> signal.failure()));
    }

    private void logRetry(String operation, Retry.RetrySignal signal) {
        log.debug("RETRY service={} operation={} attempt={} reason={}",
                  serviceName, operation, signal.totalRetries() + 1, messageOf(signal.failure()));
    }

    // ── health / observability ────────────────────────────────────────────────

    /**
     * Unhealthy when the error rate reaches {@value #UNHEALTHY_ERROR_RATE} or the average latency
     * exceeds {@code highLatencyThreshold}. With no calls there is no evidence of failure.
     */
    public boolean isHealthy() {
        ServiceMetrics snapshot = metrics.snapshot();
        if (snapshot.totalCalls() == 0) {
            return true;
        }
        return snapshot.errorRate() < UNHEALTHY_ERROR_RATE
            && snapshot.averageResponseTime() <= config.highLatencyThreshold().toMillis();
    }

    public ServiceMetrics getMetrics() {
        return metrics.snapshot();
    }

    public CacheStats getCacheStats() {
        return cache.stats();
    }

    public void clearCache() {
        cache.clear();
        log.info("CACHE_CLEARED service={}", serviceName);
    }

    public void invalidate(String cacheKey) {
        cache.remove(cacheKey);
    }

    public boolean isDestroyed() {
        return destroyed.get();
    }

    @Override
    public void destroy() {
        if (!destroyed.compareAndSet(false, true)) {
            return;
        }
        if (maintenance != null) {
            maintenance.dispose();
        }
        cache.clear();
        log.info("SERVICE_DESTROYED service={}", serviceName);
    }

    void runMaintenance() {
        try {
            int evicted = cache.evictExpired();
            ServiceMetrics snapshot = metrics.snapshot();
            log.info("SERVICE_MONITOR service={} healthy={} totalCalls={} errorRate={} avgResponseMs={} cacheHitRate={} evicted={}",
                     serviceName, isHealthy(), snapshot.totalCalls(),
                     String.format("%.3f", snapshot.errorRate()),
                     String.format("%.1f", snapshot.averageResponseTime()),
                     String.format("%.3f", snapshot.cacheHitRate()), evicted);
        } catch (RuntimeException e) {
            log.warn("SERVICE_MONITOR failed service={}", serviceName, e);
        }
    }

    // ── helpers ───────────────────────────────────────────────────────────────

    static ErrorKind classify(Throwable e) {
        if (e instanceof TimeoutException) {
            return ErrorKind.TIMEOUT;
        }
        if (e instanceof ProviderException pe) {
            return pe.getKind();
        }
        return ErrorKind.UNKNOWN;
    }

    private static String messageOf(Throwable e) {
        String message = e.getMessage();
        return message == null || message.isBlank() ? e.getClass().getSimpleName() : message;
    }

    private static Duration elapsedSince(long startNanos) {
        return Duration.ofNanos(System.nanoTime() - startNanos);
    }
}
