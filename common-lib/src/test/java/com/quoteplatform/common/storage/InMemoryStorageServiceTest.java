package com.quoteplatform.common.storage;

import com.quoteplatform.common.model.Quote;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryStorageServiceTest {

    private final InMemoryStorageService storage = new InMemoryStorageService();

    @Test
    @DisplayName("get on a missing key completes empty")
    void missingKey() {
        StepVerifier.create(storage.get("nope", String.class)).verifyComplete();
        assertNull(storage.getSync("nope", String.class));
    }

    @Test
    @DisplayName("values round-trip through Jackson")
    void roundTrip() {
        Quote quote = new Quote("q1", "Stay hungry.", "Steve Jobs", "inspiration", List.of("life"), "Quotable");

        StepVerifier.create(storage.set("quote", quote)).verifyComplete();

        StepVerifier.create(storage.get("quote", Quote.class))
            .assertNext(q -> assertEquals(quote, q))
            .verifyComplete();
    }

    @Test
    @DisplayName("mutating a value after set does not change what is stored")
    void copyOnWrite() {
        List<String> list = new ArrayList<>(List.of("a"));
        storage.setSync("list", list);
        list.add("b");

        assertEquals(List.of("a"), storage.getSync("list", List.class));
    }

    @Test
    @DisplayName("wrong target type raises IllegalStateException")
    void wrongType() {
        storage.setSync("weights", Map.of("ZenQuotes", 0.25));
        assertThrows(IllegalStateException.class, () -> storage.getSync("weights", Integer.class));
    }

    @Test
    @DisplayName("setting null removes the key; keys, remove and clear behave")
    void keysRemoveClear() {
        storage.setSync("a", 1);
        storage.setSync("b", 2);
        storage.setSync("c", 3);
        storage.setSync("c", null);

        StepVerifier.create(storage.keys())
            .assertNext(keys -> assertEquals(2, keys.size()))
            .verifyComplete();

        storage.remove("a").block();
        assertNull(storage.getSync("a", Integer.class));
        assertEquals(2, storage.getSync("b", Integer.class));

        storage.clear().block();
        StepVerifier.create(storage.keys())
            .assertNext(keys -> assertTrue(keys.isEmpty()))
            .verifyComplete();
    }
}
