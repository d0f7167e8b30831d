package com.quoteplatform.quote.service;

import com.quoteplatform.common.exception.ProviderException;
import com.quoteplatform.common.metrics.MetricsRecorder;
import com.quoteplatform.common.model.ErrorKind;
import com.quoteplatform.quote.MutableClock;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;
import reactor.test.StepVerifier;
import reactor.test.scheduler.VirtualTimeScheduler;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ProviderHealthMonitorTest {

    private final MutableClock clock = MutableClock.startingAt("2024-01-01T00:00:00Z");

    @Test
    @DisplayName("a round records success and failure in provider metrics only")
    void checkAllRecordsMetrics() {
        FakeQuoteProvider ok = FakeQuoteProvider.healthy("Ok");
        FakeQuoteProvider bad = FakeQuoteProvider.failing("Bad",
            new ProviderException("Bad", ErrorKind.PROVIDER_ERROR, "HTTP 503"));
        FakeQuoteProvider hung = new FakeQuoteProvider("Hung", category -> Mono.never());
        Map<String, MetricsRecorder> metrics = new LinkedHashMap<>();
        for (String name : List.of("Ok", "Bad", "Hung")) {
            metrics.put(name, new MetricsRecorder(clock));
        }
        ProviderHealthMonitor monitor = new ProviderHealthMonitor(
            List.of(new ProviderBinding(ok, Duration.ofSeconds(1)),
                    new ProviderBinding(bad, Duration.ofSeconds(1)),
                    new ProviderBinding(hung, Duration.ofSeconds(1))),
            metrics, Duration.ofMinutes(5), Duration.ofMillis(50),
            Schedulers.parallel());

        StepVerifier.create(monitor.checkAll()).expectComplete().verify(Duration.ofSeconds(5));

        assertEquals(1, metrics.get("Ok").snapshot().successCalls());
        assertEquals(1, metrics.get("Bad").snapshot().errorCalls());
        assertEquals(1, metrics.get("Hung").snapshot().errorCalls());
        assertEquals(ProviderStatus.HEALTHY, ProviderStatus.of(metrics.get("Ok").snapshot()));
        assertEquals(ProviderStatus.DOWN, ProviderStatus.of(metrics.get("Bad").snapshot()));
    }

    @Test
    @DisplayName("scheduled rounds run every interval until stopped")
    void scheduled() {
        VirtualTimeScheduler scheduler = VirtualTimeScheduler.create();
        FakeQuoteProvider ok = FakeQuoteProvider.healthy("Ok");
        Map<String, MetricsRecorder> metrics = Map.of("Ok", new MetricsRecorder(clock));
        ProviderHealthMonitor monitor = new ProviderHealthMonitor(
            List.of(new ProviderBinding(ok, Duration.ofSeconds(1))),
            metrics, Duration.ofMinutes(5), Duration.ofSeconds(5), scheduler);

        monitor.start();
        monitor.start();
        assertTrue(monitor.isRunning());
        assertEquals(0, ok.calls());

        scheduler.advanceTimeBy(Duration.ofMinutes(5));
        assertEquals(1, ok.calls());
        scheduler.advanceTimeBy(Duration.ofMinutes(10));
        assertEquals(3, ok.calls());

        monitor.stop();
        assertFalse(monitor.isRunning());
        scheduler.advanceTimeBy(Duration.ofMinutes(10));
        assertEquals(3, ok.calls());
        scheduler.dispose();
    }
}
