package com.quoteplatform.quote.provider;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.quoteplatform.common.model.Quote;
import com.quoteplatform.common.storage.StorageService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.ClassPathResource;
import reactor.core.publisher.Mono;

import java.io.IOException;
import java.io.InputStream;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Random;
import java.util.Set;

/**
 * Quotes that need no network: the bundled dataset plus every quote previously obtained from an
 * external provider (the remembered pool, persisted under {@value #REMEMBERED_KEY}).
 *
 * <p>Never fails. When nothing matches the requested category the whole pool is used, and when
 * the pool is empty a single built-in quote is returned.
 */
public class LocalQuoteProvider implements QuoteProvider {

    private static final Logger log = LoggerFactory.getLogger(LocalQuoteProvider.class);

    public static final String NAME = "Bundled";
    public static final String REMEMBERED_KEY = "quotes-cache";

    static final Quote LAST_RESORT = new Quote("bundled-0",
        "The only way to do great work is to love what you do.", "Steve Jobs", "inspiration",
        List.of("inspiration", "work"), NAME);

    private final List<Quote> bundled;
    private final List<Quote> remembered = new ArrayList<>();
    private final Set<String> signatures = new LinkedHashSet<>();
    private final StorageService storage;
    private final int rememberedMax;
    private final Random random;

    public LocalQuoteProvider(List<Quote> bundled, StorageService storage, int rememberedMax, Random random) {
        this.bundled = List.copyOf(bundled);
        this.storage = storage;
        this.rememberedMax = rememberedMax;
        this.random = random;
        this.bundled.forEach(q -> signatures.add(q.signature()));
        loadRemembered();
    }

    /** Reads the bundled dataset, a JSON array of quotes, from the classpath. */
    public static List<Quote> loadBundled(String classpathLocation, ObjectMapper objectMapper) {
        ClassPathResource resource = new ClassPathResource(classpathLocation);
        if (!resource.exists()) {
            log.warn("BUNDLED_QUOTES_MISSING location={}", classpathLocation);
            return List.of();
        }
        try (InputStream in = resource.getInputStream()) {
            Quote[] quotes = objectMapper.readValue(in, Quote[].class);
            List<Quote> out = new ArrayList<>(quotes.length);
            for (Quote q : quotes) {
                if (!q.isBlank()) {
                    out.add(new Quote(q.id(), q.text(), q.author(), q.category(), q.tags(), NAME));
                }
            }
            log.info("BUNDLED_QUOTES_LOADED location={} count={}", classpathLocation, out.size());
            return out;
        } catch (IOException e) {
            throw new IllegalStateException("Cannot read bundled quotes from " + classpathLocation, e);
        }
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Mono<Quote> fetchQuote(String category) {
        return Mono.fromSupplier(() -> pick(category));
    }

    /** A random quote, preferring {@code category} when any local quote matches it. */
    public Quote pick(String category) {
        List<Quote> pool = pool();
        if (pool.isEmpty()) {
            return LAST_RESORT;
        }
        List<Quote> matching = pool.stream().filter(q -> q.matchesCategory(category)).toList();
        List<Quote> candidates = matching.isEmpty() ? pool : matching;
        return candidates.get(random.nextInt(candidates.size()));
    }

    /** Same quote for every call on the same date; cycles through the bundled set. */
    public Quote quoteOfDay(LocalDate date) {
        if (bundled.isEmpty()) {
            return pick(null);
        }
        return bundled.get((int) Math.floorMod(date.toEpochDay(), (long) bundled.size()));
    }

    /** Case-insensitive substring match on text or author, bundled quotes first. */
    public List<Quote> search(String query, int limit) {
        if (query == null || query.isBlank() || limit <= 0) {
            return List.of();
        }
        String needle = query.trim().toLowerCase(Locale.ROOT);
        return pool().stream()
            .filter(q -> q.text().toLowerCase(Locale.ROOT).contains(needle)
                      || q.author().toLowerCase(Locale.ROOT).contains(needle))
            .limit(limit)
            .toList();
    }

    /** Case-insensitive substring match on author only, bundled quotes first. */
    public List<Quote> byAuthor(String author, int limit) {
        if (author == null || author.isBlank() || limit <= 0) {
            return List.of();
        }
        String needle = author.trim().toLowerCase(Locale.ROOT);
        return pool().stream()
            .filter(q -> q.author().toLowerCase(Locale.ROOT).contains(needle))
            .limit(limit)
            .toList();
    }

    /**
     * Up to {@code count} distinct quotes, none sharing a signature with {@code exclude}.
     * Quotes matching {@code category} come first; the rest of the pool tops up the result.
     */
    public List<Quote> sample(int count, String category, Set<String> exclude) {
        if (count <= 0) {
            return List.of();
        }
        List<Quote> matching = new ArrayList<>();
        List<Quote> others = new ArrayList<>();
        for (Quote q : pool()) {
            if (!exclude.contains(q.signature())) {
                (q.matchesCategory(category) ? matching : others).add(q);
            }
        }
        synchronized (random) {
            Collections.shuffle(matching, random);
            Collections.shuffle(others, random);
        }
        List<Quote> out = new ArrayList<>(count);
        for (Quote q : matching) {
            if (out.size() == count) {
                return out;
            }
            out.add(q);
        }
        for (Quote q : others) {
            if (out.size() == count) {
                break;
            }
            out.add(q);
        }
        return out;
    }

    /**
     * Adds a quote from an external provider to the remembered pool and persists the pool.
     * Duplicates (same text and author) are ignored; the oldest entries go once the pool is full.
     * A storage failure is logged and does not fail the returned {@code Mono}.
     */
    public Mono<Void> remember(Quote quote) {
        List<Quote> snapshot;
        synchronized (this) {
            if (quote == null || quote.isBlank() || !signatures.add(quote.signature())) {
                return Mono.empty();
            }
            remembered.add(quote);
            while (remembered.size() > rememberedMax) {
                signatures.remove(remembered.remove(0).signature());
            }
            snapshot = List.copyOf(remembered);
        }
        return storage.set(REMEMBERED_KEY, snapshot)
            .onErrorResume(e -> {
                log.warn("REMEMBER_PERSIST_FAILED key={} size={}", REMEMBERED_KEY, snapshot.size(), e);
                return Mono.empty();
            });
    }

    public synchronized int rememberedCount() {
        return remembered.size();
    }

    public int bundledCount() {
        return bundled.size();
    }

    private synchronized List<Quote> pool() {
        List<Quote> all = new ArrayList<>(bundled.size() + remembered.size());
        all.addAll(bundled);
        all.addAll(remembered);
        return all;
    }

    private void loadRemembered() {
        try {
            Quote[] stored = storage.getSync(REMEMBERED_KEY, Quote[].class);
            if (stored == null) {
                return;
            }
            List<Quote> restored = new ArrayList<>(Arrays.asList(stored));
            int start = Math.max(0, restored.size() - rememberedMax);
            synchronized (this) {
                for (Quote q : restored.subList(start, restored.size())) {
                    if (!q.isBlank() && signatures.add(q.signature())) {
                        remembered.add(q);
                    }
                }
            }
            log.info("REMEMBERED_QUOTES_LOADED count={}", remembered.size());
        } catch (IllegalStateException e) {
            log.warn("Remembered quotes unreadable, starting empty. key={}", REMEMBERED_KEY, e);
        }
    }
}
