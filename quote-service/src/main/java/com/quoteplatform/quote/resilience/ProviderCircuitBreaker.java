package com.quoteplatform.quote.resilience;

import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig.SlidingWindowType;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;

/**
 * One Resilience4j {@link CircuitBreaker} per provider name, taken from a shared registry.
 *
 * <pre>
 * CLOSED    --(failureThreshold consecutive failures)--> OPEN
 * OPEN      --(coolDown elapsed)-----------------------> HALF_OPEN
 * HALF_OPEN --(trial succeeds)-------------------------> CLOSED
 * HALF_OPEN --(trial fails)----------------------------> OPEN (fresh openedAt)
 * </pre>
 *
 * <p>{@link #config} expresses this with a count-based window of {@code failureThreshold} calls at
 * a 100% failure rate, one permitted call in HALF_OPEN, and an automatic OPEN to HALF_OPEN
 * transition once the cool-down has passed.
 *
 * <p>Calls go through a {@link CircuitPermit}. Every observed state change bumps the provider's
 * generation; a permit from an older generation can neither report an outcome nor free the
 * HALF_OPEN trial, so a call that started while CLOSED never interferes with a later trial.
 */
public class ProviderCircuitBreaker {

    private static final Logger log = LoggerFactory.getLogger(ProviderCircuitBreaker.class);

    private final CircuitBreakerRegistry registry;
    private final Clock clock;
    private final ConcurrentHashMap<String, Tracked> breakers = new ConcurrentHashMap<>();

    public ProviderCircuitBreaker(CircuitBreakerRegistry registry, Clock clock) {
        this.registry = registry;
        this.clock = clock;
    }

    public ProviderCircuitBreaker(int failureThreshold, Duration coolDown, Clock clock) {
        this(CircuitBreakerRegistry.of(config(failureThreshold, coolDown)), clock);
    }

    /** Breaker settings for {@code failureThreshold} consecutive failures and a {@code coolDown} pause. */
    public static CircuitBreakerConfig config(int failureThreshold, Duration coolDown) {
        if (failureThreshold < 1) {
            throw new IllegalArgumentException("failureThreshold must be >= 1, got " + failureThreshold);
        }
        if (coolDown == null || coolDown.toMillis() < 1) {
            throw new IllegalArgumentException("coolDown must be at least 1ms");
        }
        return CircuitBreakerConfig.custom()
            .slidingWindowType(SlidingWindowType.COUNT_BASED)
            .slidingWindowSize(failureThreshold)
            .minimumNumberOfCalls(failureThreshold)
            .failureRateThreshold(100.0f)
            .waitDurationInOpenState(coolDown)
            .permittedNumberOfCallsInHalfOpenState(1)
            .automaticTransitionFromOpenToHalfOpenEnabled(true)
            .build();
    }

    /** True when a call would be allowed right now: CLOSED, or HALF_OPEN with the trial still free. */
    public boolean isCallPermitted(String provider) {
        Tracked t = tracked(provider);
        synchronized (t) {
            sync(t);
            return t.state == CircuitState.CLOSED
                || (t.state == CircuitState.HALF_OPEN && !t.trialInFlight);
        }
    }

    /** Permission to make one call; empty while OPEN or while another caller holds the trial. */
    public Optional<CircuitPermit> tryAcquire(String provider) {
        Tracked t = tracked(provider);
        synchronized (t) {
            sync(t);
            if (!t.breaker.tryAcquirePermission()) {
                return Optional.empty();
            }
            sync(t);
            boolean trial = t.state == CircuitState.HALF_OPEN;
            if (trial) {
                t.trialInFlight = true;
                log.info("CIRCUIT_TRIAL provider={}", provider);
            }
            return Optional.of(new CircuitPermit(this, provider, t.generation, trial));
        }
    }

    /**
     * Read-only view. Reports the breaker's own state, consecutive failures since the last
     * success, and when it last opened.
     */
    public CircuitSnapshot snapshot(String provider) {
        Tracked t = breakers.get(provider);
        if (t == null) {
            return CircuitSnapshot.closed();
        }
        synchronized (t) {
            sync(t);
            return new CircuitSnapshot(t.state, t.consecutiveFailures, t.openedAt);
        }
    }

    public void reset(String provider) {
        Tracked t = breakers.get(provider);
        if (t == null) {
            return;
        }
        synchronized (t) {
            t.breaker.reset();
            sync(t);
            t.generation++;
            t.consecutiveFailures = 0;
            t.openedAt = null;
            t.trialInFlight = false;
        }
        log.info("CIRCUIT_RESET provider={}", provider);
    }

    /** The underlying breaker, for callers that drive transitions directly. */
    public CircuitBreaker circuitBreaker(String provider) {
        return tracked(provider).breaker;
    }

    // ── permit callbacks ──────────────────────────────────────────────────────

    void complete(CircuitPermit permit, Throwable error) {
        Tracked t = tracked(permit.provider());
        synchronized (t) {
            sync(t);
            if (permit.generation() != t.generation) {
                log.debug("CIRCUIT_OUTCOME_DROPPED provider={} success={} state={}",
                          permit.provider(), error == null, t.state);
                return;
            }
            if (error == null) {
                t.consecutiveFailures = 0;
                t.breaker.onSuccess(permit.elapsedNanos(), TimeUnit.NANOSECONDS);
            } else {
                t.consecutiveFailures++;
                t.breaker.onError(permit.elapsedNanos(), TimeUnit.NANOSECONDS, error);
            }
            if (permit.isTrial()) {
                t.trialInFlight = false;
            }
            sync(t);
        }
    }

    void release(CircuitPermit permit) {
        if (!permit.isTrial()) {
            return;
        }
        Tracked t = tracked(permit.provider());
        synchronized (t) {
            sync(t);
            if (permit.generation() == t.generation && t.trialInFlight) {
                t.breaker.releasePermission();
                t.trialInFlight = false;
                log.debug("CIRCUIT_TRIAL_RELEASED provider={}", permit.provider());
            }
        }
    }

    // ── internals ─────────────────────────────────────────────────────────────

    private Tracked tracked(String provider) {
        return breakers.computeIfAbsent(provider, name -> {
            Tracked t = new Tracked(name, registry.circuitBreaker(name));
            // automatic OPEN -> HALF_OPEN transitions arrive on Resilience4j's scheduler thread
            t.breaker.getEventPublisher().onStateTransition(event -> {
                synchronized (t) {
                    sync(t);
                }
            });
            return t;
        });
    }

    /** Brings the tracked view in line with the breaker's actual state. Caller holds the lock on {@code t}. */
    private void sync(Tracked t) {
        CircuitState actual = CircuitState.of(t.breaker.getState());
        if (actual == t.state) {
            return;
        }
        CircuitState previous = t.state;
        t.state = actual;
        t.generation++;
        t.trialInFlight = false;
        switch (actual) {
            case OPEN -> {
                t.openedAt = clock.instant();
                log.warn("CIRCUIT_OPENED provider={} failures={} previousState={}",
                         t.provider, t.consecutiveFailures, previous);
            }
            case HALF_OPEN -> log.info("CIRCUIT_HALF_OPEN provider={}", t.provider);
            case CLOSED -> {
                t.consecutiveFailures = 0;
                t.openedAt = null;
                log.info("CIRCUIT_CLOSED provider={} previousState={}", t.provider, previous);
            }
        }
    }

    private static final class Tracked {
        final String provider;
        final CircuitBreaker breaker;
        CircuitState state = CircuitState.CLOSED;
        long generation;
        int consecutiveFailures;
        Instant openedAt;
        boolean trialInFlight;

        Tracked(String provider, CircuitBreaker breaker) {
            this.provider = provider;
            this.breaker = breaker;
        }
    }
}
