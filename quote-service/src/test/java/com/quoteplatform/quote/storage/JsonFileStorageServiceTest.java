package com.quoteplatform.quote.storage;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.quoteplatform.common.model.Quote;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class JsonFileStorageServiceTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @TempDir
    Path dir;

    @Test
    @DisplayName("writes survive a restart")
    void persistsAcrossInstances() {
        Path file = dir.resolve("state/quote-store.json");
        JsonFileStorageService first = new JsonFileStorageService(file, objectMapper);
        first.setSync("sourceWeights", Map.of("ZenQuotes", 0.4));
        first.set("quotes-cache", List.of(Quote.of("Carpe diem.", "Horace", "life", "Quotable"))).block();

        assertTrue(Files.exists(file));

        JsonFileStorageService second = new JsonFileStorageService(file, objectMapper);
        assertEquals(0.4, ((Number) second.getSync("sourceWeights", Map.class).get("ZenQuotes")).doubleValue());
        Quote[] quotes = second.getSync("quotes-cache", Quote[].class);
        assertEquals("Carpe diem.", quotes[0].text());
    }

    @Test
    @DisplayName("remove and clear are persisted")
    void removeAndClear() {
        Path file = dir.resolve("store.json");
        JsonFileStorageService storage = new JsonFileStorageService(file, objectMapper);
        storage.setSync("a", 1);
        storage.setSync("b", 2);
        storage.remove("a").block();

        assertNull(new JsonFileStorageService(file, objectMapper).getSync("a", Integer.class));

        storage.clear().block();
        assertTrue(new JsonFileStorageService(file, objectMapper).keys().block().isEmpty());
    }

    @Test
    @DisplayName("a file that is not a JSON object is ignored")
    void nonObjectIgnored() throws IOException {
        Path file = dir.resolve("array.json");
        Files.writeString(file, "[1,2,3]");

        JsonFileStorageService storage = new JsonFileStorageService(file, objectMapper);

        assertTrue(storage.keys().block().isEmpty());
    }

    @Test
    @DisplayName("an unreadable file fails construction")
    void corruptFile() throws IOException {
        Path file = dir.resolve("broken.json");
        Files.writeString(file, "{not json");

        assertThrows(UncheckedIOException.class, () -> new JsonFileStorageService(file, objectMapper));
    }

    @Test
    @DisplayName("file writes run off the subscribing thread")
    void writesOffCallerThread() {
        AtomicReference<String> writer = new AtomicReference<>();
        JsonFileStorageService storage = new JsonFileStorageService(dir.resolve("store.json"), objectMapper) {
            @Override
            protected synchronized void afterWrite() {
                writer.set(Thread.currentThread().getName());
                super.afterWrite();
            }
        };

        storage.set("a", 1).block();

        assertNotNull(writer.get());
        assertNotEquals(Thread.currentThread().getName(), writer.get());
        assertTrue(writer.get().startsWith("boundedElastic"), writer.get());
    }
}
