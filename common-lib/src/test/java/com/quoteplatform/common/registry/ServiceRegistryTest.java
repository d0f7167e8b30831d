package com.quoteplatform.common.registry;

import com.quoteplatform.common.execution.ManagedService;
import com.quoteplatform.common.model.ServiceConfig;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class ServiceRegistryTest {

    static class FakeService implements ManagedService {
        final String name;
        final ServiceConfig config;
        int destroyCalls;

        FakeService(String name, ServiceConfig config) {
            this.name = name;
            this.config = config;
        }

        @Override
        public String serviceName() {
            return name;
        }

        @Override
        public void destroy() {
            destroyCalls++;
        }
    }

    static class OtherService extends FakeService {
        OtherService(String name, ServiceConfig config) {
            super(name, config);
        }
    }

    private final ServiceRegistry registry = new ServiceRegistry();

    @Test
    @DisplayName("create twice with the same name returns the same instance")
    void createIsIdempotent() {
        AtomicInteger built = new AtomicInteger();
        FakeService a = registry.create(FakeService.class, "svc", c -> {
            built.incrementAndGet();
            return new FakeService("svc", c);
        });
        FakeService b = registry.create(FakeService.class, "svc", c -> {
            built.incrementAndGet();
            return new FakeService("svc", c);
        });

        assertSame(a, b);
        assertEquals(1, built.get());
        assertEquals(ServiceConfig.defaults(), a.config);
    }

    @Test
    @DisplayName("explicit config is passed to the factory")
    void explicitConfig() {
        ServiceConfig config = ServiceConfig.builder().retryAttempts(1).build();
        FakeService svc = registry.create(FakeService.class, "svc", c -> new FakeService("svc", c), config);
        assertEquals(1, svc.config.retryAttempts());
    }

    @Test
    @DisplayName("destroy then get yields absent, and the instance was destroyed once")
    void destroyRemoves() {
        FakeService svc = registry.create(FakeService.class, "svc", c -> new FakeService("svc", c));

        registry.destroy("svc");
        registry.destroy("svc");

        assertTrue(registry.get("svc").isEmpty());
        assertEquals(1, svc.destroyCalls);
        assertEquals(0, registry.size());
    }

    @Test
    @DisplayName("name bound to another type is rejected")
    void typeMismatch() {
        registry.create(FakeService.class, "svc", c -> new FakeService("svc", c));
        assertThrows(IllegalStateException.class,
            () -> registry.create(OtherService.class, "svc", c -> new OtherService("svc", c)));
    }

    @Test
    @DisplayName("typed get filters by type")
    void typedGet() {
        registry.create(FakeService.class, "svc", c -> new FakeService("svc", c));
        assertTrue(registry.get("svc", FakeService.class).isPresent());
        assertTrue(registry.get("svc", OtherService.class).isEmpty());
    }

    @Test
    @DisplayName("destroyAll destroys and unregisters every service")
    void destroyAll() {
        FakeService a = registry.create(FakeService.class, "a", c -> new FakeService("a", c));
        FakeService b = registry.create(FakeService.class, "b", c -> new FakeService("b", c));

        registry.destroyAll();

        assertEquals(1, a.destroyCalls);
        assertEquals(1, b.destroyCalls);
        assertTrue(registry.names().isEmpty());
    }

    @Test
    @DisplayName("racing creators all receive the same instance")
    void concurrentCreate() throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(8);
        CountDownLatch start = new CountDownLatch(1);
        AtomicInteger built = new AtomicInteger();
        List<Future<FakeService>> futures = new ArrayList<>();
        for (int i = 0; i < 16; i++) {
            futures.add(pool.submit(() -> {
                start.await();
                return registry.create(FakeService.class, "shared", c -> {
                    built.incrementAndGet();
                    return new FakeService("shared", c);
                });
            }));
        }
        start.countDown();

        FakeService first = futures.get(0).get(5, TimeUnit.SECONDS);
        for (Future<FakeService> f : futures) {
            assertSame(first, f.get(5, TimeUnit.SECONDS));
        }
        assertEquals(1, built.get());
        pool.shutdown();
    }
}
