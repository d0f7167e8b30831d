package com.quoteplatform.common.execution;

import com.quoteplatform.common.MutableClock;
import com.quoteplatform.common.exception.ProviderException;
import com.quoteplatform.common.model.ErrorKind;
import com.quoteplatform.common.model.ExecutionResult;
import com.quoteplatform.common.model.ServiceConfig;
import com.quoteplatform.common.model.ServiceMetrics;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class ServiceExecutorTest {

    private static final Duration VERIFY_TIMEOUT = Duration.ofSeconds(5);

    private final MutableClock clock = MutableClock.startingAt("2024-01-01T00:00:00Z");
    private ServiceExecutor executor;

    @AfterEach
    void tearDown() {
        if (executor != null) {
            executor.destroy();
        }
    }

    private ServiceExecutor newExecutor(ServiceConfig.Builder config) {
        executor = new ServiceExecutor("TestService", config.monitoringEnabled(false).build(), clock);
        return executor;
    }

    private static ServiceConfig.Builder config() {
        return ServiceConfig.builder().retryBackoff(Duration.ofMillis(10));
    }

    @Test
    @DisplayName("results are stamped with the executor's clock")
    void timestampFromClock() {
        ServiceExecutor ex = newExecutor(config().cacheEnabled(true).retryAttempts(0));
        clock.advance(Duration.ofMinutes(7));

        ExecutionResult<String> fresh = ex.execute("get", "k", () -> Mono.just("v")).block(VERIFY_TIMEOUT);
        clock.advance(Duration.ofSeconds(1));
        ExecutionResult<String> cached = ex.execute("get", "k", () -> Mono.just("w")).block(VERIFY_TIMEOUT);
        ExecutionResult<String> failed = ex.execute("get", "other",
            () -> Mono.<String>error(new IllegalStateException("boom"))).block(VERIFY_TIMEOUT);

        assertEquals(java.time.Instant.parse("2024-01-01T00:07:00Z"), fresh.timestamp());
        assertEquals(clock.instant(), cached.timestamp());
        assertTrue(cached.cached());
        assertEquals(clock.instant(), failed.timestamp());
        assertFalse(failed.success());
    }

    // ── caching ───────────────────────────────────────────────────────────────

    @Nested
    @DisplayName("caching")
    class Caching {

        @Test
        @DisplayName("second call within TTL is served from cache without invoking the fetcher")
        void secondCallCached() {
            ServiceExecutor ex = newExecutor(config().cacheEnabled(true).cacheTtl(Duration.ofMinutes(5)));
            AtomicInteger calls = new AtomicInteger();
            Map<String, String> payload = Map.of("text", "Test");

            StepVerifier.create(ex.execute("get", "k", () -> {
                    calls.incrementAndGet();
                    return Mono.just(payload);
                }))
                .assertNext(r -> {
                    assertTrue(r.success());
                    assertFalse(r.cached());
                    assertEquals(payload, r.data());
                })
                .expectComplete()
                .verify(VERIFY_TIMEOUT);

            StepVerifier.create(ex.execute("get", "k", () -> {
                    calls.incrementAndGet();
                    return Mono.just(Map.of("text", "Other"));
                }))
                .assertNext(r -> {
                    assertTrue(r.success());
                    assertTrue(r.cached());
                    assertEquals("Test", r.data().get("text"));
                })
                .expectComplete()
                .verify(VERIFY_TIMEOUT);

            assertEquals(1, calls.get());
            ServiceMetrics m = ex.getMetrics();
            assertEquals(2, m.totalCalls());
            assertEquals(1, m.cacheHits());
            assertEquals(0.5, m.cacheHitRate(), 1e-9);
        }

        @Test
        @DisplayName("caching disabled invokes the fetcher on every call")
        void cachingDisabled() {
            ServiceExecutor ex = newExecutor(config().cacheEnabled(false));
            AtomicInteger calls = new AtomicInteger();

            for (int i = 0; i < 3; i++) {
                StepVerifier.create(ex.execute("get", "k", () -> Mono.just(calls.incrementAndGet())))
                    .assertNext(r -> assertFalse(r.cached()))
                    .expectComplete()
                    .verify(VERIFY_TIMEOUT);
            }
            assertEquals(3, calls.get());
            assertEquals(0, ex.getMetrics().cacheHits());
        }

        @Test
        @DisplayName("per-call uncached option bypasses an enabled cache")
        void uncachedOption() {
            ServiceExecutor ex = newExecutor(config().cacheEnabled(true));
            AtomicInteger calls = new AtomicInteger();

            ex.execute("get", "k", () -> Mono.just(calls.incrementAndGet()), ExecuteOptions.uncached()).block();
            ex.execute("get", "k", () -> Mono.just(calls.incrementAndGet()), ExecuteOptions.uncached()).block();

            assertEquals(2, calls.get());
        }

        @Test
        @DisplayName("entry expires after its TTL and the fetcher runs again")
        void ttlExpiry() {
            ServiceExecutor ex = newExecutor(config().cacheEnabled(true));
            AtomicInteger calls = new AtomicInteger();

            ex.execute("get", "k", () -> Mono.just(calls.incrementAndGet()), ExecuteOptions.cached(Duration.ofSeconds(30))).block();
            clock.advance(Duration.ofSeconds(31));
            ExecutionResult<Integer> second = ex.execute("get", "k", () -> Mono.just(calls.incrementAndGet()),
                                    ExecuteOptions.cached(Duration.ofSeconds(30))).block();

            assertNotNull(second);
            assertFalse(second.cached());
            assertEquals(2, second.data());
        }

        @Test
        @DisplayName("failures are never cached")
        void failureNotCached() {
            ServiceExecutor ex = newExecutor(config().cacheEnabled(true).retryAttempts(0));
            AtomicInteger calls = new AtomicInteger();

            ex.execute("get", "k", () -> {
                calls.incrementAndGet();
                return Mono.<String>error(new IllegalStateException("boom"));
            }).block();
            ExecutionResult<String> second = ex.execute("get", "k", () -> {
                calls.incrementAndGet();
                return Mono.just("ok");
            }).block();

            assertEquals(2, calls.get());
            assertNotNull(second);
            assertTrue(second.success());
            assertFalse(second.cached());
        }
    }

    // ── retry / timeout ───────────────────────────────────────────────────────

    @Nested
    @DisplayName("retry and timeout")
    class RetryAndTimeout {

        @Test
        @DisplayName("three failures then success with retryAttempts=3 yields success")
        void recoversWithinRetryBudget() {
            ServiceExecutor ex = newExecutor(config().retryAttempts(3).cacheEnabled(false));
            AtomicInteger calls = new AtomicInteger();

            StepVerifier.create(ex.execute("flaky", "k", () -> calls.incrementAndGet() <= 3
                        ? Mono.<String>error(new IllegalStateException("fail " + calls.get()))
                        : Mono.just("ok"),
                    ExecuteOptions.defaults().withRetry()))
                .assertNext(r -> {
                    assertTrue(r.success());
                    assertEquals("ok", r.data());
                })
                .expectComplete()
                .verify(VERIFY_TIMEOUT);

            assertEquals(4, calls.get());
            ServiceMetrics m = ex.getMetrics();
            assertEquals(1, m.totalCalls());
            assertEquals(1, m.successCalls());
            assertEquals(0, m.errorCalls());
        }

        @Test
        @DisplayName("always-failing fetcher with N retries is invoked N+1 times and counted once")
        void exhaustsRetries() {
            ServiceExecutor ex = newExecutor(config().retryAttempts(2).retryBackoff(Duration.ZERO).cacheEnabled(false));
            AtomicInteger calls = new AtomicInteger();

            StepVerifier.create(ex.execute("broken", "k", () -> {
                        calls.incrementAndGet();
                        return Mono.<String>error(new IllegalStateException("down"));
                    }, ExecuteOptions.defaults().withRetry()))
                .assertNext(r -> {
                    assertFalse(r.success());
                    assertEquals("down", r.error());
                    assertEquals(ErrorKind.UNKNOWN, r.errorKind());
                    assertNull(r.data());
                })
                .expectComplete()
                .verify(VERIFY_TIMEOUT);

            assertEquals(3, calls.get());
            ServiceMetrics m = ex.getMetrics();
            assertEquals(1, m.totalCalls());
            assertEquals(1, m.errorCalls());
        }

        @Test
        @DisplayName("without retryOnError a failure is returned after one attempt")
        void noRetryByDefault() {
            ServiceExecutor ex = newExecutor(config().retryAttempts(3).cacheEnabled(false));
            AtomicInteger calls = new AtomicInteger();

            ex.execute("once", "k", () -> {
                calls.incrementAndGet();
                return Mono.<String>error(new IllegalStateException("down"));
            }).block();

            assertEquals(1, calls.get());
        }

        @Test
        @DisplayName("2000ms fetcher against 100ms timeout fails with a timeout error")
        void timesOut() {
            ServiceExecutor ex = newExecutor(config().timeout(Duration.ofMillis(100)).retryAttempts(0).cacheEnabled(false));

            StepVerifier.create(ex.execute("slow", "k",
                    () -> Mono.delay(Duration.ofMillis(2000)).thenReturn("late")))
                .assertNext(r -> {
                    assertFalse(r.success());
                    assertEquals(ErrorKind.TIMEOUT, r.errorKind());
                    assertTrue(r.error().toLowerCase(Locale.ROOT).contains("timeout"), r.error());
                })
                .expectComplete()
                .verify(VERIFY_TIMEOUT);
        }

        @Test
        @DisplayName("empty fetcher result is a provider error")
        void emptyIsProviderError() {
            ServiceExecutor ex = newExecutor(config().cacheEnabled(false));

            ExecutionResult<String> result = ex.execute("empty", "k", Mono::<String>empty).block();

            assertNotNull(result);
            assertFalse(result.success());
            assertEquals(ErrorKind.PROVIDER_ERROR, result.errorKind());
        }

        @Test
        @DisplayName("ProviderException keeps its kind")
        void providerExceptionKind() {
            ServiceExecutor ex = newExecutor(config().cacheEnabled(false));

            ExecutionResult<String> result = ex.execute("limited", "k", () -> Mono.<String>error(
                new ProviderException("Quotable", ErrorKind.RATE_LIMITED, "slow down"))).block();

            assertNotNull(result);
            assertEquals(ErrorKind.RATE_LIMITED, result.errorKind());
            assertEquals("[Quotable] slow down", result.error());
        }
    }

    // ── health / lifecycle ────────────────────────────────────────────────────

    @Nested
    @DisplayName("health and lifecycle")
    class HealthAndLifecycle {

        @Test
        @DisplayName("no calls is healthy; an error rate of 10% or more is not")
        void healthVerdict() {
            ServiceExecutor ex = newExecutor(config().cacheEnabled(false).retryAttempts(0));
            assertTrue(ex.isHealthy());

            for (int i = 0; i < 9; i++) {
                ex.execute("ok", "k", () -> Mono.just("ok")).block();
            }
            assertTrue(ex.isHealthy());

            ex.execute("bad", "k", () -> Mono.<String>error(new IllegalStateException("x"))).block();
            assertFalse(ex.isHealthy());
        }

        @Test
        @DisplayName("counter invariant holds after a mixed sequence")
        void counterInvariant() {
            ServiceExecutor ex = newExecutor(config().cacheEnabled(true).retryAttempts(0));
            ex.execute("a", "k1", () -> Mono.just("1")).block();
            ex.execute("a", "k1", () -> Mono.just("1")).block();
            ex.execute("b", "k2", () -> Mono.<String>error(new IllegalStateException("x"))).block();
            ex.execute("c", "k3", Mono::<String>empty).block();

            ServiceMetrics m = ex.getMetrics();
            assertEquals(4, m.totalCalls());
            assertEquals(m.totalCalls(), m.successCalls() + m.errorCalls());
        }

        @Test
        @DisplayName("destroyed executor returns failures and destroy is idempotent")
        void destroyed() {
            ServiceExecutor ex = newExecutor(config());
            ex.destroy();
            ex.destroy();

            ExecutionResult<String> result = ex.execute("after", "k", () -> Mono.just("x")).block();
            assertNotNull(result);
            assertFalse(result.success());
            assertEquals(ErrorKind.UNKNOWN, result.errorKind());
            assertTrue(ex.isDestroyed());
        }

        @Test
        @DisplayName("maintenance evicts expired cache entries")
        void maintenanceSweeps() {
            ServiceExecutor ex = newExecutor(config().cacheEnabled(true));
            ex.execute("a", "k", () -> Mono.just("v"), ExecuteOptions.cached(Duration.ofSeconds(1))).block();
            assertEquals(1, ex.getCacheStats().entryCount());

            clock.advance(Duration.ofSeconds(2));
            ex.runMaintenance();

            assertEquals(0, ex.getCacheStats().entryCount());
        }
    }
}
