package com.arbiter.ruleengine.infra.metrics.internal;

import com.arbiter.ruleengine.infra.metrics.MetricsRegistry;
import com.arbiter.ruleengine.infra.metrics.api.MetricsRegistryProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Comparator;
import java.util.ServiceLoader;
import java.util.stream.StreamSupport;

/**
 * Lazy holder for the singleton {@link MetricsRegistry}.
 *
 * <p><b>INTERNAL USE ONLY</b>
 */
public final class MetricsRegistryHolder {
    private static final Logger logger = LoggerFactory.getLogger(MetricsRegistryHolder.class);

    public static final MetricsRegistry INSTANCE;

    static {
        MetricsRegistryProvider provider = StreamSupport.stream(
                        ServiceLoader.load(MetricsRegistryProvider.class).spliterator(), false)
                .max(Comparator.comparingInt(MetricsRegistryProvider::priority))
                .orElse(null);

        if (provider != null) {
            INSTANCE = provider.create();
            logger.info("Metrics provider: {} (priority {})", provider.name(), provider.priority());
        } else {
            INSTANCE = new NoOpMetricsRegistry();
            logger.info("No metrics provider found, metrics are disabled");
        }
    }

    private MetricsRegistryHolder() {
        throw new AssertionError("No instances");
    }
}
