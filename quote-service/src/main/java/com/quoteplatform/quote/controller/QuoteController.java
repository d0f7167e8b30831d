package com.quoteplatform.quote.controller;

import com.quoteplatform.common.model.ExecutionResult;
import com.quoteplatform.common.model.Quote;
import com.quoteplatform.common.model.ServiceMetrics;
import com.quoteplatform.quote.service.ProviderHealth;
import com.quoteplatform.quote.service.QuoteAggregatorService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/quotes")
public class QuoteController {

    private static final Logger log = LoggerFactory.getLogger(QuoteController.class);

    private final QuoteAggregatorService service;

    public QuoteController(QuoteAggregatorService service) {
        this.service = service;
    }

    @GetMapping("/today")
    public Mono<ExecutionResult<Quote>> today() {
        return service.getTodayQuote();
    }

    @GetMapping("/random")
    public Mono<ExecutionResult<Quote>> random() {
        return service.getRandomQuote();
    }

    @GetMapping("/category/{category}")
    public Mono<ExecutionResult<Quote>> byCategory(@PathVariable String category) {
        return service.fetchQuote(category);
    }

    @GetMapping("/search")
    public Mono<ExecutionResult<List<Quote>>> search(@RequestParam("q") String query,
                                                     @RequestParam(value = "limit", required = false) Integer limit) {
        if (query.isBlank()) {
            throw new IllegalArgumentException("query must not be blank");
        }
        return service.searchQuotes(query, limit);
    }

    @GetMapping("/author/{author}")
    public Mono<ExecutionResult<List<Quote>>> byAuthor(@PathVariable String author,
                                                       @RequestParam(value = "limit", required = false) Integer limit) {
        if (author.isBlank()) {
            throw new IllegalArgumentException("author must not be blank");
        }
        return service.getQuotesByAuthor(author, limit);
    }

    @GetMapping("/bulk")
    public Mono<ExecutionResult<List<Quote>>> bulk(@RequestParam(value = "count", required = false) Integer count,
                                                   @RequestParam(value = "category", required = false) String category) {
        return service.getBulkQuotes(count, category);
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, ProviderHealth> providers = service.getHealthStatus();
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("healthy", service.isHealthy());
        body.put("providers", providers);
        return ResponseEntity.ok(body);
    }

    @GetMapping("/metrics")
    public ResponseEntity<Map<String, Object>> metrics() {
        Map<String, Object> body = new LinkedHashMap<>();
        ServiceMetrics overall = service.getPerformanceMetrics();
        body.put("service", overall);
        body.put("providers", service.getProviderMetrics());
        body.put("weights", service.getSourceWeights());
        return ResponseEntity.ok(body);
    }

    @PutMapping("/weights")
    public Mono<ResponseEntity<Map<String, Double>>> updateWeights(@RequestBody Map<String, Double> weights) {
        return service.updateSourceWeights(weights)
            .then(Mono.fromSupplier(() -> ResponseEntity.ok(service.getSourceWeights())));
    }

    @DeleteMapping("/cache")
    public ResponseEntity<Void> clearCache() {
        service.clearCache();
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/circuits/{provider}/reset")
    public ResponseEntity<Void> resetCircuit(@PathVariable String provider) {
        service.resetCircuit(provider);
        return ResponseEntity.noContent().build();
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, String>> badRequest(IllegalArgumentException e) {
        log.warn("Rejected request: {}", e.getMessage());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(Map.of("error", e.getMessage()));
    }
}
