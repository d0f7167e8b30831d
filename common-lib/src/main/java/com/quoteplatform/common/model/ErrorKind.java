package com.quoteplatform.common.model;

/**
 * Classification of a failed fetch, carried on {@link ExecutionResult#errorKind()}.
 */
public enum ErrorKind {
    /** Deadline exceeded before the fetch completed. */
    TIMEOUT,
    /** Fetch completed but signalled failure: bad status, malformed payload, empty body. */
    PROVIDER_ERROR,
    /** Provider short-circuited by its breaker without a network attempt. */
    CIRCUIT_OPEN,
    /** Provider skipped because its local request window is full. */
    RATE_LIMITED,
    UNKNOWN
}
