package com.quoteplatform.common.storage;

import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Key/value blob store the services persist small state through (provider weights,
 * remembered quotes). Backing technology is the implementation's concern.
 *
 * <p>Asynchronous methods never block the caller; the synchronous variants are for
 * construction-time reads and fire-and-forget writes of small values.
 */
public interface StorageService {

    /** Emits the stored value converted to {@code type}, or completes empty when absent. */
    <T> Mono<T> get(String key, Class<T> type);

    <T> Mono<Void> set(String key, T value);

    Mono<Void> remove(String key);

    Mono<Void> clear();

    Mono<List<String>> keys();

    /** @return the stored value converted to {@code type}, or {@code null} when absent */
    <T> T getSync(String key, Class<T> type);

    <T> void setSync(String key, T value);
}
