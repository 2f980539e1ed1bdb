package com.arbiter.ruleengine.infra.metrics.impl.prometheus;

import com.arbiter.ruleengine.infra.metrics.MetricsRegistry;
import com.arbiter.ruleengine.infra.metrics.api.MetricsRegistryProvider;

/**
 * Production provider; registered by the service module.
 */
public final class PrometheusMetricsRegistryProvider implements MetricsRegistryProvider {

    @Override
    public MetricsRegistry create() {
        return new PrometheusMetricsRegistry();
    }

    @Override
    public int priority() {
        return 100;
    }

    @Override
    public String name() {
        return "Prometheus";
    }
}
