package com.quoteplatform.common.storage;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local {@link StorageService}. Values are held as Jackson trees so callers get the same
 * copy-on-read blob semantics a persistent store would give them: mutating a value after
 * {@code set} or after {@code get} never changes what is stored.
 */
public class InMemoryStorageService implements StorageService {

    protected final ObjectMapper objectMapper;
    protected final ConcurrentHashMap<String, JsonNode> store = new ConcurrentHashMap<>();

    public InMemoryStorageService() {
        this(new ObjectMapper().registerModule(new JavaTimeModule()));
    }

    public InMemoryStorageService(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public <T> Mono<T> get(String key, Class<T> type) {
        return Mono.fromCallable(() -> getSync(key, type));
    }

    @Override
    public <T> Mono<Void> set(String key, T value) {
        return Mono.fromRunnable(() -> setSync(key, value));
    }

    @Override
    public Mono<Void> remove(String key) {
        return Mono.fromRunnable(() -> {
            store.remove(key);
            afterWrite();
        });
    }

    @Override
    public Mono<Void> clear() {
        return Mono.fromRunnable(() -> {
            store.clear();
            afterWrite();
        });
    }

    @Override
    public Mono<List<String>> keys() {
        return Mono.fromCallable(() -> new ArrayList<>(store.keySet()));
    }

    @Override
    public <T> T getSync(String key, Class<T> type) {
        JsonNode node = store.get(key);
        if (node == null || node.isNull()) {
            return null;
        }
        try {
            return objectMapper.treeToValue(node, type);
        } catch (com.fasterxml.jackson.core.JsonProcessingException e) {
            throw new IllegalStateException("Stored value for key '" + key + "' is not a " + type.getSimpleName(), e);
        }
    }

    @Override
    public <T> void setSync(String key, T value) {
        if (value == null) {
            store.remove(key);
        } else {
            store.put(key, objectMapper.valueToTree(value));
        }
        afterWrite();
    }

    /** Hook for subclasses that mirror the map somewhere durable. */
    protected void afterWrite() {
    }
}
