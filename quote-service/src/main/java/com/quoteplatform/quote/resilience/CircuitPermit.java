package com.quoteplatform.quote.resilience;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Permission for one provider call, issued by {@link ProviderCircuitBreaker#tryAcquire}.
 *
 * <p>Settles exactly once: the first of {@link #onSuccess}, {@link #onError} or {@link #release}
 * wins and later calls are ignored. The permit carries the breaker generation it was issued in,
 * so an outcome that arrives after the breaker changed state is not counted.
 */
public final class CircuitPermit {

    private final ProviderCircuitBreaker owner;
    private final String provider;
    private final long generation;
    private final boolean trial;
    private final long startNanos;
    private final AtomicBoolean settled = new AtomicBoolean(false);

    CircuitPermit(ProviderCircuitBreaker owner, String provider, long generation, boolean trial) {
        this.owner      = owner;
        this.provider   = provider;
        this.generation = generation;
        this.trial      = trial;
        this.startNanos = System.nanoTime();
    }

    public String provider() {
        return provider;
    }

    /** True when this permit holds the single HALF_OPEN trial. */
    public boolean isTrial() {
        return trial;
    }

    long generation() {
        return generation;
    }

    long elapsedNanos() {
        return System.nanoTime() - startNanos;
    }

    public void onSuccess() {
        if (settled.compareAndSet(false, true)) {
            owner.complete(this, null);
        }
    }

    public void onError(Throwable error) {
        Objects.requireNonNull(error, "error");
        if (settled.compareAndSet(false, true)) {
            owner.complete(this, error);
        }
    }

    /** Hands the permit back unused. Only a trial permit frees anything. */
    public void release() {
        if (settled.compareAndSet(false, true)) {
            owner.release(this);
        }
    }
}
