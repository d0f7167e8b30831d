package com.quoteplatform.quote.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.quoteplatform.common.execution.ServiceExecutor;
import com.quoteplatform.common.model.Quote;
import com.quoteplatform.common.registry.ServiceRegistry;
import com.quoteplatform.common.storage.InMemoryStorageService;
import com.quoteplatform.common.storage.StorageService;
import com.quoteplatform.quote.provider.FavQsProvider;
import com.quoteplatform.quote.provider.HttpQuoteProvider;
import com.quoteplatform.quote.provider.LocalQuoteProvider;
import com.quoteplatform.quote.provider.ProgrammingQuotesProvider;
import com.quoteplatform.quote.provider.QuotableProvider;
import com.quoteplatform.quote.provider.StoicQuotesProvider;
import com.quoteplatform.quote.provider.ZenQuotesProvider;
import com.quoteplatform.quote.resilience.ProviderCircuitBreaker;
import com.quoteplatform.quote.resilience.ProviderRateLimiter;
import com.quoteplatform.quote.selection.SourceWeightStore;
import com.quoteplatform.quote.selection.WeightedProviderSelector;
import com.quoteplatform.quote.service.AggregatorSettings;
import com.quoteplatform.quote.service.ProviderBinding;
import com.quoteplatform.quote.service.QuoteAggregatorService;
import com.quoteplatform.quote.storage.JsonFileStorageService;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.github.resilience4j.ratelimiter.RateLimiterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.scheduler.Schedulers;

import java.nio.file.Path;
import java.time.Clock;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

@Configuration
public class QuoteServiceConfig {

    private static final Logger log = LoggerFactory.getLogger(QuoteServiceConfig.class);

    @Bean
    @Primary
    public ObjectMapper objectMapper() {
        return new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean(destroyMethod = "destroyAll")
    public ServiceRegistry serviceRegistry() {
        return new ServiceRegistry();
    }

    @Bean
    public StorageService storageService(QuoteProperties properties, ObjectMapper objectMapper) {
        String file = properties.getStorage().getFile();
        if (file == null || file.isBlank()) {
            log.info("STORAGE_MODE in-memory");
            return new InMemoryStorageService(objectMapper);
        }
        log.info("STORAGE_MODE file path={}", file);
        return new JsonFileStorageService(Path.of(file), objectMapper);
    }

    /** Every provider's breaker is created from this registry's default config. */
    @Bean
    public CircuitBreakerRegistry circuitBreakerRegistry(QuoteProperties properties) {
        QuoteProperties.CircuitBreaker cb = properties.getCircuitBreaker();
        log.info("CIRCUIT_BREAKER_CONFIG failureThreshold={} coolDownSeconds={}",
                 cb.getFailureThreshold(), cb.getCoolDown().toSeconds());
        return CircuitBreakerRegistry.of(ProviderCircuitBreaker.config(cb.getFailureThreshold(), cb.getCoolDown()));
    }

    @Bean
    public RateLimiterRegistry rateLimiterRegistry() {
        return RateLimiterRegistry.ofDefaults();
    }

    @Bean
    public LocalQuoteProvider localQuoteProvider(QuoteProperties properties, ObjectMapper objectMapper,
                                                 StorageService storageService) {
        List<Quote> bundled = LocalQuoteProvider.loadBundled(properties.getBundledQuotes(), objectMapper);
        return new LocalQuoteProvider(bundled, storageService, properties.getRememberedQuotesMax(), new Random());
    }

    @Bean
    public QuoteAggregatorService quoteAggregatorService(QuoteProperties properties,
                                                         ServiceRegistry registry,
                                                         StorageService storageService,
                                                         LocalQuoteProvider localQuoteProvider,
                                                         WebClient.Builder webClientBuilder,
                                                         ObjectMapper objectMapper,
                                                         CircuitBreakerRegistry circuitBreakerRegistry,
                                                         RateLimiterRegistry rateLimiterRegistry,
                                                         Clock clock) {
        List<ProviderBinding> bindings = new ArrayList<>();
        Map<String, Double> defaultWeights = new LinkedHashMap<>();
        ProviderRateLimiter rateLimiter = new ProviderRateLimiter(rateLimiterRegistry);

        properties.getProviders().forEach((id, p) -> {
            if (!p.isEnabled()) {
                log.info("PROVIDER_DISABLED id={}", id);
                return;
            }
            WebClient client = webClientBuilder.clone().baseUrl(p.getBaseUrl()).build();
            HttpQuoteProvider provider = createProvider(id, client, objectMapper);
            bindings.add(new ProviderBinding(provider, p.getTimeout()));
            defaultWeights.put(provider.name(), p.getWeight());
            rateLimiter.register(provider.name(), p.getRateLimit().getMaxRequests(), p.getRateLimit().getWindow());
            log.info("PROVIDER_CONFIGURED id={} name={} baseUrl={} weight={} timeoutMs={}",
                     id, provider.name(), p.getBaseUrl(), p.getWeight(), p.getTimeout().toMillis());
        });

        QuoteProperties.Cache cache = properties.getCache();
        QuoteProperties.HealthCheck hc = properties.getHealthCheck();
        AggregatorSettings settings = new AggregatorSettings(cache.getCategoryTtl(), cache.getTodayTtl(),
            cache.getSearchTtl(), ZoneId.of(properties.getZone()), hc.isEnabled(), hc.getInterval(), hc.getTimeout());

        QuoteAggregatorService service = registry.create(QuoteAggregatorService.class,
            QuoteAggregatorService.SERVICE_NAME,
            config -> new QuoteAggregatorService(
                new ServiceExecutor(QuoteAggregatorService.SERVICE_NAME, config, clock),
                bindings,
                localQuoteProvider,
                new ProviderCircuitBreaker(circuitBreakerRegistry, clock),
                rateLimiter,
                new WeightedProviderSelector(),
                new SourceWeightStore(defaultWeights, storageService),
                settings,
                clock,
                Schedulers.parallel()),
            properties.getExecutor().toServiceConfig());
        service.start();
        return service;
    }

    static HttpQuoteProvider createProvider(String id, WebClient client, ObjectMapper objectMapper) {
        return switch (id) {
            case "zenquotes"   -> new ZenQuotesProvider(client, objectMapper);
            case "quotable"    -> new QuotableProvider(client, objectMapper);
            case "favqs"       -> new FavQsProvider(client, objectMapper);
            case "stoic"       -> new StoicQuotesProvider(client, objectMapper);
            case "programming" -> new ProgrammingQuotesProvider(client, objectMapper);
            default -> throw new IllegalArgumentException("Unknown quote provider id: " + id);
        };
    }
}
