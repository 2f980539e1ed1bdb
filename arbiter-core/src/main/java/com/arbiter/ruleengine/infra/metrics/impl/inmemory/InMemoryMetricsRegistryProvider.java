package com.arbiter.ruleengine.infra.metrics.impl.inmemory;

import com.arbiter.ruleengine.infra.metrics.MetricsRegistry;
import com.arbiter.ruleengine.infra.metrics.api.MetricsRegistryProvider;

/**
 * In-memory metrics provider, registered from test resources.
 */
public final class InMemoryMetricsRegistryProvider implements MetricsRegistryProvider {

    @Override
    public MetricsRegistry create() {
        return new InMemoryMetricsRegistry();
    }

    @Override
    public int priority() {
        return 1000;
    }

    @Override
    public String name() {
        return "InMemory (Test)";
    }
}
