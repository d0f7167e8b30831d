package com.quoteplatform.quote;

import com.quoteplatform.common.registry.ServiceRegistry;
import com.quoteplatform.quote.service.QuoteAggregatorService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest(properties = "quote.health-check.enabled=false")
class QuoteServiceApplicationTest {

    @Autowired
    private QuoteAggregatorService service;

    @Autowired
    private ServiceRegistry registry;

    @Test
    @DisplayName("context wires every configured provider and registers the aggregator")
    void contextLoads() {
        assertEquals(List.of("ZenQuotes", "Quotable", "FavQs", "Stoic Quotes", "Programming Quotes"),
                     List.copyOf(service.getHealthStatus().keySet()));
        assertSame(service, registry.get(QuoteAggregatorService.SERVICE_NAME, QuoteAggregatorService.class).orElseThrow());
        assertEquals(0.25, service.getSourceWeights().get("ZenQuotes"));
    }
}
