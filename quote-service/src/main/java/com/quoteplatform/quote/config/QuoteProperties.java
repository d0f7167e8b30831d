package com.quoteplatform.quote.config;

import com.quoteplatform.common.model.ServiceConfig;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Everything under {@code quote.*} in {@code application.yml}.
 *
 * <p>{@link #getProviders()} keeps declaration order; that order is the tie-break and
 * last-resort order for provider selection.
 */
@ConfigurationProperties(prefix = "quote")
public class QuoteProperties {

    private Executor executor = new Executor();
    private Cache cache = new Cache();
    private CircuitBreaker circuitBreaker = new CircuitBreaker();
    private HealthCheck healthCheck = new HealthCheck();
    private Storage storage = new Storage();
    private String zone = "UTC";
    private String bundledQuotes = "quotes/bundled-quotes.json";
    private int rememberedQuotesMax = 1000;
    private Map<String, Provider> providers = new LinkedHashMap<>();

    public Executor getExecutor() {
        return executor;
    }

    public void setExecutor(Executor executor) {
        this.executor = executor;
    }

    public Cache getCache() {
        return cache;
    }

    public void setCache(Cache cache) {
        this.cache = cache;
    }

    public CircuitBreaker getCircuitBreaker() {
        return circuitBreaker;
    }

    public void setCircuitBreaker(CircuitBreaker circuitBreaker) {
        this.circuitBreaker = circuitBreaker;
    }

    public HealthCheck getHealthCheck() {
        return healthCheck;
    }

    public void setHealthCheck(HealthCheck healthCheck) {
        this.healthCheck = healthCheck;
    }

    public Storage getStorage() {
        return storage;
    }

    public void setStorage(Storage storage) {
        this.storage = storage;
    }

    public String getZone() {
        return zone;
    }

    public void setZone(String zone) {
        this.zone = zone;
    }

    public String getBundledQuotes() {
        return bundledQuotes;
    }

    public void setBundledQuotes(String bundledQuotes) {
        this.bundledQuotes = bundledQuotes;
    }

    public int getRememberedQuotesMax() {
        return rememberedQuotesMax;
    }

    public void setRememberedQuotesMax(int rememberedQuotesMax) {
        this.rememberedQuotesMax = rememberedQuotesMax;
    }

    public Map<String, Provider> getProviders() {
        return providers;
    }

    public void setProviders(Map<String, Provider> providers) {
        this.providers = providers;
    }

    public static class Executor {
        private boolean cacheEnabled = true;
        private Duration cacheTtl = ServiceConfig.DEFAULT_CACHE_TTL;
        private int retryAttempts = ServiceConfig.DEFAULT_RETRY_ATTEMPTS;
        private Duration timeout = ServiceConfig.DEFAULT_TIMEOUT;
        private boolean monitoringEnabled = true;
        private Duration retryBackoff = ServiceConfig.DEFAULT_RETRY_BACKOFF;
        private Duration maxRetryBackoff = ServiceConfig.DEFAULT_MAX_RETRY_BACKOFF;
        private Duration highLatencyThreshold = ServiceConfig.DEFAULT_HIGH_LATENCY_THRESHOLD;
        private Duration monitoringInterval = ServiceConfig.DEFAULT_MONITORING_INTERVAL;

        public ServiceConfig toServiceConfig() {
            return ServiceConfig.builder()
                .cacheEnabled(cacheEnabled)
                .cacheTtl(cacheTtl)
                .retryAttempts(retryAttempts)
                .timeout(timeout)
                .monitoringEnabled(monitoringEnabled)
                .retryBackoff(retryBackoff)
                .maxRetryBackoff(maxRetryBackoff)
                .highLatencyThreshold(highLatencyThreshold)
                .monitoringInterval(monitoringInterval)
                .build();
        }

        public boolean isCacheEnabled() {
            return cacheEnabled;
        }

        public void setCacheEnabled(boolean cacheEnabled) {
            this.cacheEnabled = cacheEnabled;
        }

        public Duration getCacheTtl() {
            return cacheTtl;
        }

        public void setCacheTtl(Duration cacheTtl) {
            this.cacheTtl = cacheTtl;
        }

        public int getRetryAttempts() {
            return retryAttempts;
        }

        public void setRetryAttempts(int retryAttempts) {
            this.retryAttempts = retryAttempts;
        }

        public Duration getTimeout() {
            return timeout;
        }

        public void setTimeout(Duration timeout) {
            this.timeout = timeout;
        }

        public boolean isMonitoringEnabled() {
            return monitoringEnabled;
        }

        public void setMonitoringEnabled(boolean monitoringEnabled) {
            this.monitoringEnabled = monitoringEnabled;
        }

        public Duration getRetryBackoff() {
            return retryBackoff;
        }

        public void setRetryBackoff(Duration retryBackoff) {
            this.retryBackoff = retryBackoff;
        }

        public Duration getMaxRetryBackoff() {
            return maxRetryBackoff;
        }

        public void setMaxRetryBackoff(Duration maxRetryBackoff) {
            this.maxRetryBackoff = maxRetryBackoff;
        }

        public Duration getHighLatencyThreshold() {
            return highLatencyThreshold;
        }

        public void setHighLatencyThreshold(Duration highLatencyThreshold) {
            this.highLatencyThreshold = highLatencyThreshold;
        }

        public Duration getMonitoringInterval() {
            return monitoringInterval;
        }

        public void setMonitoringInterval(Duration monitoringInterval) {
            this.monitoringInterval = monitoringInterval;
        }
    }

    public static class Cache {
        private Duration categoryTtl = Duration.ofMinutes(5);
        private Duration todayTtl = Duration.ofHours(24);
        private Duration searchTtl = Duration.ofMinutes(10);

        public Duration getCategoryTtl() {
            return categoryTtl;
        }

        public void setCategoryTtl(Duration categoryTtl) {
            this.categoryTtl = categoryTtl;
        }

        public Duration getTodayTtl() {
            return todayTtl;
        }

        public void setTodayTtl(Duration todayTtl) {
            this.todayTtl = todayTtl;
        }

        public Duration getSearchTtl() {
            return searchTtl;
        }

        public void setSearchTtl(Duration searchTtl) {
            this.searchTtl = searchTtl;
        }
    }

    public static class CircuitBreaker {
        private int failureThreshold = 5;
        private Duration coolDown = Duration.ofSeconds(60);

        public int getFailureThreshold() {
            return failureThreshold;
        }

        public void setFailureThreshold(int failureThreshold) {
            this.failureThreshold = failureThreshold;
        }

        public Duration getCoolDown() {
            return coolDown;
        }

        public void setCoolDown(Duration coolDown) {
            this.coolDown = coolDown;
        }
    }

    public static class HealthCheck {
        private boolean enabled = true;
        private Duration interval = Duration.ofMinutes(5);
        private Duration timeout = Duration.ofSeconds(5);

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public Duration getInterval() {
            return interval;
        }

        public void setInterval(Duration interval) {
            this.interval = interval;
        }

        public Duration getTimeout() {
            return timeout;
        }

        public void setTimeout(Duration timeout) {
            this.timeout = timeout;
        }
    }

    public static class Storage {
        /** JSON file backing the key/value store; blank keeps state in memory only. */
        private String file = "";

        public String getFile() {
            return file;
        }

        public void setFile(String file) {
            this.file = file;
        }
    }

    public static class Provider {
        private String name;
        private boolean enabled = true;
        private String baseUrl;
        private double weight = 0.0;
        private Duration timeout = Duration.ofSeconds(8);
        private RateLimit rateLimit = new RateLimit();

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public double getWeight() {
            return weight;
        }

        public void setWeight(double weight) {
            this.weight = weight;
        }

        public Duration getTimeout() {
            return timeout;
        }

        public void setTimeout(Duration timeout) {
            this.timeout = timeout;
        }

        public RateLimit getRateLimit() {
            return rateLimit;
        }

        public void setRateLimit(RateLimit rateLimit) {
            this.rateLimit = rateLimit;
        }
    }

    public static class RateLimit {
        private int maxRequests = 6;
        private Duration window = Duration.ofSeconds(60);

        public int getMaxRequests() {
            return maxRequests;
        }

        public void setMaxRequests(int maxRequests) {
            this.maxRequests = maxRequests;
        }

        public Duration getWindow() {
            return window;
        }

        public void setWindow(Duration window) {
            this.window = window;
        }
    }
}
