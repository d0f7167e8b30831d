package com.quoteplatform.quote.service;

import com.quoteplatform.common.metrics.MetricsRecorder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Periodic liveness check of every external provider.
 *
 * <p>Outcomes go into the provider's metrics only, where they move the provider's
 * {@link ProviderStatus}. Circuit breakers are driven by real traffic, so a health check never opens or
 * closes one, and checks do not spend the provider's rate-limit budget.
 */
public class ProviderHealthMonitor {

    private static final Logger log = LoggerFactory.getLogger(ProviderHealthMonitor.class);

    private final List<ProviderBinding> providers;
    private final Map<String, MetricsRecorder> providerMetrics;
    private final Duration interval;
    private final Duration checkTimeout;
    private final Scheduler scheduler;

    private Disposable task;

    public ProviderHealthMonitor(List<ProviderBinding> providers,
                                 Map<String, MetricsRecorder> providerMetrics,
                                 Duration interval,
                                 Duration checkTimeout,
                                 Scheduler scheduler) {
        this.providers = List.copyOf(providers);
        this.providerMetrics = providerMetrics;
        this.interval = interval;
        this.checkTimeout = checkTimeout;
        this.scheduler = scheduler;
    }

    public synchronized void start() {
        if (task != null && !task.isDisposed()) {
            return;
        }
        task = Flux.interval(interval, interval, scheduler)
            .concatMap(tick -> checkAll())
            .subscribe(
                ignored -> {},
                e -> log.error("HEALTH_MONITOR_STOPPED unexpectedly", e));
        log.info("HEALTH_MONITOR_STARTED providers={} intervalSeconds={}", providers.size(), interval.toSeconds());
    }

    public synchronized void stop() {
        if (task != null) {
            task.dispose();
            task = null;
            log.info("HEALTH_MONITOR_STOPPED");
        }
    }

    public synchronized boolean isRunning() {
        return task != null && !task.isDisposed();
    }

    /** Checks every provider once, sequentially. Completes when all checks are done; never errors. */
    public Mono<Void> checkAll() {
        return Flux.fromIterable(providers)
            .concatMap(this::checkOne)
            .then();
    }

    private Mono<Void> checkOne(ProviderBinding binding) {
        MetricsRecorder metrics = providerMetrics.get(binding.name());
        return Mono.defer(() -> {
            long start = System.nanoTime();
            return binding.provider().fetchQuote(null)
                .timeout(checkTimeout)
                .doOnNext(q -> {
                    Duration elapsed = Duration.ofNanos(System.nanoTime() - start);
                    if (metrics != null) {
                        metrics.recordSuccess(elapsed);
                    }
                    log.debug("HEALTH_CHECK_OK provider={} elapsedMs={}", binding.name(), elapsed.toMillis());
                })
                .switchIfEmpty(Mono.error(() -> new IllegalStateException("no quote returned")))
                .then()
                .onErrorResume(e -> {
                    if (metrics != null) {
                        metrics.recordError(Duration.ofNanos(System.nanoTime() - start));
                    }
                    log.warn("HEALTH_CHECK_FAILED provider={} reason={}", binding.name(), e.getMessage());
                    return Mono.empty();
                });
        });
    }
}
