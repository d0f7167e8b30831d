package com.quoteplatform.common.model;

import java.time.Clock;
import java.time.Instant;
import java.util.Objects;

/**
 * Outcome of one {@code execute} call. Every outcome, including failures, is returned
 * as a value; callers decide what to do with a failure.
 *
 * <p>Invariant: a successful result carries data and no error; a failed result carries an
 * error message and kind and no data.
 */
public record ExecutionResult<T>(
    boolean success,
    T data,
    String error,
    ErrorKind errorKind,
    boolean cached,
    String source,
    Instant timestamp
) {

    public ExecutionResult {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(timestamp, "timestamp");
        if (success) {
            if (data == null || error != null || errorKind != null) {
                throw new IllegalArgumentException("successful result requires data and no error");
            }
        } else {
            if (data != null || error == null || errorKind == null) {
                throw new IllegalArgumentException("failed result requires an error and no data");
            }
            if (cached) {
                throw new IllegalArgumentException("failed result cannot be cached");
            }
        }
    }

    /** Stamped with {@code clock.instant()}. */
    public static <T> ExecutionResult<T> success(T data, boolean cached, String source, Clock clock) {
        return new ExecutionResult<>(true, data, null, null, cached, source, clock.instant());
    }

    public static <T> ExecutionResult<T> failure(String error, ErrorKind kind, String source, Clock clock) {
        return new ExecutionResult<>(false, null, error, kind, false, source, clock.instant());
    }
}
