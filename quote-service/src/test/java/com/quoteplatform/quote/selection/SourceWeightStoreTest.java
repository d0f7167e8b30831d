package com.quoteplatform.quote.selection;

import com.quoteplatform.common.storage.InMemoryStorageService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SourceWeightStoreTest {

    private static Map<String, Double> defaults() {
        Map<String, Double> d = new LinkedHashMap<>();
        d.put("ZenQuotes", 0.25);
        d.put("Quotable", 0.20);
        d.put("FavQs", 0.15);
        return d;
    }

    @Test
    @DisplayName("starts from configured defaults when nothing is stored")
    void defaultsOnly() {
        SourceWeightStore store = new SourceWeightStore(defaults(), new InMemoryStorageService());
        assertEquals(defaults(), store.current());
        assertEquals(0.0, store.weightOf("Unknown"));
    }

    @Test
    @DisplayName("update merges, persists, and a new store reloads the persisted map")
    void persistsAndReloads() {
        InMemoryStorageService storage = new InMemoryStorageService();
        SourceWeightStore store = new SourceWeightStore(defaults(), storage);

        StepVerifier.create(store.update(Map.of("Quotable", 0.9))).verifyComplete();

        assertEquals(0.9, store.weightOf("Quotable"));
        assertEquals(0.25, store.weightOf("ZenQuotes"));

        SourceWeightStore reloaded = new SourceWeightStore(defaults(), storage);
        assertEquals(0.9, reloaded.weightOf("Quotable"));
        assertEquals(0.15, reloaded.weightOf("FavQs"));
    }

    @Test
    @DisplayName("weights stay unchanged when storage rejects the update")
    void storageFailureKeepsWeights() {
        InMemoryStorageService storage = new InMemoryStorageService() {
            @Override
            public <T> Mono<Void> set(String key, T value) {
                return Mono.error(new IllegalStateException("disk full"));
            }
        };
        SourceWeightStore store = new SourceWeightStore(defaults(), storage);

        StepVerifier.create(store.update(Map.of("Quotable", 0.9)))
            .expectErrorMessage("disk full")
            .verify();

        assertEquals(0.20, store.weightOf("Quotable"));
        assertNull(storage.getSync(SourceWeightStore.STORAGE_KEY, Map.class));
    }

    @Test
    @DisplayName("new weights apply only once the update is subscribed and persisted")
    void appliesAfterPersist() {
        SourceWeightStore store = new SourceWeightStore(defaults(), new InMemoryStorageService());

        Mono<Void> pending = store.update(Map.of("FavQs", 0.5));
        assertEquals(0.15, store.weightOf("FavQs"));

        StepVerifier.create(pending).verifyComplete();
        assertEquals(0.5, store.weightOf("FavQs"));
    }

    @Test
    @DisplayName("unknown providers, negative and non-finite weights are rejected without changes")
    void validation() {
        SourceWeightStore store = new SourceWeightStore(defaults(), new InMemoryStorageService());

        assertThrows(IllegalArgumentException.class, () -> store.update(Map.of("Nope", 0.1)));
        assertThrows(IllegalArgumentException.class, () -> store.update(Map.of("Quotable", -0.1)));
        assertThrows(IllegalArgumentException.class, () -> store.update(Map.of("Quotable", Double.NaN)));
        assertThrows(IllegalArgumentException.class,
            () -> store.update(Map.of("Quotable", Double.POSITIVE_INFINITY)));

        assertEquals(defaults(), store.current());
    }

    @Test
    @DisplayName("stored entries for providers no longer configured are ignored")
    void ignoresStaleEntries() {
        InMemoryStorageService storage = new InMemoryStorageService();
        storage.setSync(SourceWeightStore.STORAGE_KEY, Map.of("Retired", 1.0, "FavQs", 0.5));

        SourceWeightStore store = new SourceWeightStore(defaults(), storage);

        assertFalse(store.current().containsKey("Retired"));
        assertEquals(0.5, store.weightOf("FavQs"));
    }
}
