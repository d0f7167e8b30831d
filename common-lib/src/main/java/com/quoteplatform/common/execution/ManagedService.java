package com.quoteplatform.common.execution;

/**
 * A named service whose lifecycle is owned by {@link com.quoteplatform.common.registry.ServiceRegistry}.
 */
public interface ManagedService {

    String serviceName();

    /**
     * Stops background work and releases held resources. Must be idempotent.
     */
    void destroy();
}
