/*
 * Copyright (c) 2025 Arbiter Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.arbiter.ruleengine.infra.metrics;

import com.arbiter.ruleengine.infra.metrics.internal.MetricsRegistryHolder;

/**
 * Framework-agnostic metrics registry.
 *
 * <p>Implementations are discovered via {@link java.util.ServiceLoader}; see
 * {@link com.arbiter.ruleengine.infra.metrics.api.MetricsRegistryProvider}.
 *
 * <pre>{@code
 * Counter errors = MetricsRegistry.getInstance()
 *         .counter("arbiter_condition_errors_total", "reason", "incompatible_types");
 * errors.increment();
 * }</pre>
 *
 * <p>Tags are alternating key/value pairs. The same name with different tag values
 * yields distinct series.
 */
public interface MetricsRegistry {

    Counter counter(String name, String... tags);

    Gauge gauge(String name, String... tags);

    Timer timer(String name, String... tags);

    /**
     * Gets the process-wide registry. Falls back to a no-op registry when no provider
     * is on the classpath.
     */
    static MetricsRegistry getInstance() {
        return MetricsRegistryHolder.INSTANCE;
    }
}
