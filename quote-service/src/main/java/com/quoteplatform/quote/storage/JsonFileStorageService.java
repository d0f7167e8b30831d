package com.quoteplatform.quote.storage;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.quoteplatform.common.storage.InMemoryStorageService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;

/**
 * Storage kept as a single JSON object on disk, one property per key. The whole document is
 * rewritten after every change, through a temp file and an atomic move.
 *
 * <p>The reactive operations run on {@link Schedulers#boundedElastic()} so the file write never
 * lands on the subscriber's thread, which is usually a Netty event loop.
 */
public class JsonFileStorageService extends InMemoryStorageService {

    private static final Logger log = LoggerFactory.getLogger(JsonFileStorageService.class);

    private final Path file;

    public JsonFileStorageService(Path file, ObjectMapper objectMapper) {
        super(objectMapper);
        this.file = file;
        load();
    }

    public Path file() {
        return file;
    }

    @Override
    public <T> Mono<T> get(String key, Class<T> type) {
        return super.get(key, type).subscribeOn(Schedulers.boundedElastic());
    }

    @Override
    public <T> Mono<Void> set(String key, T value) {
        return super.set(key, value).subscribeOn(Schedulers.boundedElastic());
    }

    @Override
    public Mono<Void> remove(String key) {
        return super.remove(key).subscribeOn(Schedulers.boundedElastic());
    }

    @Override
    public Mono<Void> clear() {
        return super.clear().subscribeOn(Schedulers.boundedElastic());
    }

    @Override
    public Mono<List<String>> keys() {
        return super.keys().subscribeOn(Schedulers.boundedElastic());
    }

    @Override
    protected synchronized void afterWrite() {
        ObjectNode document = objectMapper.createObjectNode();
        store.forEach(document::set);
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Path tmp = file.resolveSibling(file.getFileName() + ".tmp");
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(tmp.toFile(), document);
            Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot write storage file " + file, e);
        }
    }

    private void load() {
        if (!Files.exists(file)) {
            log.info("STORAGE_FILE_NEW path={}", file);
            return;
        }
        try {
            JsonNode root = objectMapper.readTree(file.toFile());
            if (root == null || !root.isObject()) {
                log.warn("STORAGE_FILE_IGNORED path={} reason=not a JSON object", file);
                return;
            }
            root.fields().forEachRemaining(e -> store.put(e.getKey(), e.getValue()));
            log.info("STORAGE_FILE_LOADED path={} keys={}", file, store.size());
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read storage file " + file, e);
        }
    }
}
