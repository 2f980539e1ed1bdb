package com.arbiter.ruleengine.infra.metrics.api;

import com.arbiter.ruleengine.infra.metrics.MetricsRegistry;

/**
 * Service Provider Interface for {@link MetricsRegistry} implementations.
 *
 * <p>Implementations need a public no-arg constructor and are registered in
 * {@code META-INF/services/com.arbiter.ruleengine.infra.metrics.api.MetricsRegistryProvider}.
 * When several are present the highest {@link #priority()} wins.
 */
public interface MetricsRegistryProvider {

    MetricsRegistry create();

    default int priority() {
        return 0;
    }

    default String name() {
        return getClass().getSimpleName();
    }
}
