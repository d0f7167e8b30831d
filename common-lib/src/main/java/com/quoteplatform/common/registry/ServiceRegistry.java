package com.quoteplatform.common.registry;

import com.quoteplatform.common.execution.ManagedService;
import com.quoteplatform.common.model.ServiceConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * Process-wide map from a service name to its single live instance.
 *
 * <p>Construct one registry at startup and pass it to whoever needs a service. {@link #create} is
 * construct-or-return: racing callers asking for the same name all receive the instance built
 * by whichever call won, so a logical resource never gets two concurrent fetchers.
 *
 * <p>Once created, instances are owned here. Callers release them through {@link #destroy} or
 * {@link #destroyAll}, never by calling {@link ManagedService#destroy()} themselves.
 */
public class ServiceRegistry {

    private static final Logger log = LoggerFactory.getLogger(ServiceRegistry.class);

    private final ConcurrentHashMap<String, ManagedService> services = new ConcurrentHashMap<>();

    public <S extends ManagedService> S create(Class<S> type, String name,
                                               Function<ServiceConfig, ? extends S> factory) {
        return create(type, name, factory, ServiceConfig.defaults());
    }

    /**
     * Returns the instance registered under {@code name}, constructing it with
     * {@code factory.apply(config)} if there is none. The factory runs at most once per name
     * while that name stays registered.
     *
     * @throws IllegalStateException if {@code name} is bound to an instance of another type
     */
    public <S extends ManagedService> S create(Class<S> type, String name,
                                               Function<ServiceConfig, ? extends S> factory,
                                               ServiceConfig config) {
        ManagedService service = services.computeIfAbsent(name, key -> {
            S created = factory.apply(config);
            log.info("SERVICE_REGISTERED name={} type={}", key, type.getSimpleName());
            return created;
        });
        if (!type.isInstance(service)) {
            throw new IllegalStateException("service '" + name + "' is a "
                + service.getClass().getSimpleName() + ", not a " + type.getSimpleName());
        }
        return type.cast(service);
    }

    public Optional<ManagedService> get(String name) {
        return Optional.ofNullable(services.get(name));
    }

    public <S extends ManagedService> Optional<S> get(String name, Class<S> type) {
        return get(name).filter(type::isInstance).map(type::cast);
    }

    /**
     * Destroys and unregisters {@code name}. No-op when absent.
     */
    public void destroy(String name) {
        ManagedService removed = services.remove(name);
        if (removed != null) {
            removed.destroy();
            log.info("SERVICE_UNREGISTERED name={}", name);
        }
    }

    public void destroyAll() {
        for (Map.Entry<String, ManagedService> entry : services.entrySet()) {
            if (services.remove(entry.getKey(), entry.getValue())) {
                try {
                    entry.getValue().destroy();
                } catch (RuntimeException e) {
                    log.error("Service destroy failed. name={}", entry.getKey(), e);
                }
            }
        }
        log.info("SERVICE_REGISTRY_CLEARED");
    }

    public List<String> names() {
        return List.copyOf(services.keySet());
    }

    public int size() {
        return services.size();
    }
}
