package com.quoteplatform.quote.selection;

import com.quoteplatform.common.storage.StorageService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Provider weights: configured defaults overlaid with whatever was persisted under
 * {@value #STORAGE_KEY}. Updates merge into the current map and persist the whole map.
 */
public class SourceWeightStore {

    private static final Logger log = LoggerFactory.getLogger(SourceWeightStore.class);

    public static final String STORAGE_KEY = "sourceWeights";

    private final StorageService storage;
    private volatile Map<String, Double> weights;

    public SourceWeightStore(Map<String, Double> defaults, StorageService storage) {
        this.storage = storage;
        Map<String, Double> initial = new LinkedHashMap<>(defaults);
        try {
            Map<?, ?> persisted = storage.getSync(STORAGE_KEY, Map.class);
            if (persisted != null) {
                persisted.forEach((k, v) -> {
                    String name = String.valueOf(k);
                    if (initial.containsKey(name) && v instanceof Number n && isValid(n.doubleValue())) {
                        initial.put(name, n.doubleValue());
                    }
                });
                log.info("SOURCE_WEIGHTS_LOADED weights={}", initial);
            }
        } catch (IllegalStateException e) {
            log.warn("Stored source weights unreadable, using defaults. key={}", STORAGE_KEY, e);
        }
        this.weights = Collections.unmodifiableMap(initial);
    }

    public Map<String, Double> current() {
        return weights;
    }

    public double weightOf(String provider) {
        return weights.getOrDefault(provider, 0.0);
    }

    /**
     * Merges {@code updates} into the current weights and persists the result. The new weights
     * take effect only once storage has accepted them; a storage error leaves them unchanged.
     *
     * @throws IllegalArgumentException on an unknown provider or a weight that is negative or not finite;
     *                                  nothing is changed in that case
     */
    public synchronized Mono<Void> update(Map<String, Double> updates) {
        Map<String, Double> merged = new LinkedHashMap<>(weights);
        updates.forEach((name, value) -> {
            if (!merged.containsKey(name)) {
                throw new IllegalArgumentException("Unknown provider: " + name);
            }
            if (value == null || !isValid(value)) {
                throw new IllegalArgumentException("Invalid weight for " + name + ": " + value);
            }
            merged.put(name, value);
        });
        Map<String, Double> next = Collections.unmodifiableMap(merged);
        return storage.set(STORAGE_KEY, next)
            .doOnError(e -> log.warn("SOURCE_WEIGHTS_PERSIST_FAILED weights={} reason={}", next, e.getMessage()))
            .then(Mono.fromRunnable(() -> {
                synchronized (this) {
                    this.weights = next;
                }
                log.info("SOURCE_WEIGHTS_UPDATED weights={}", next);
            }));
    }

    private static boolean isValid(double weight) {
        return Double.isFinite(weight) && weight >= 0.0;
    }
}
