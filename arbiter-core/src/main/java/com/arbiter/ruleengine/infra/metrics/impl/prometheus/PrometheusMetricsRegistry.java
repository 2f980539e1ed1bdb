package com.arbiter.ruleengine.infra.metrics.impl.prometheus;

import com.arbiter.ruleengine.infra.metrics.Counter;
import com.arbiter.ruleengine.infra.metrics.Gauge;
import com.arbiter.ruleengine.infra.metrics.MetricsRegistry;
import com.arbiter.ruleengine.infra.metrics.Timer;
import io.prometheus.client.Collector;
import io.prometheus.client.CollectorRegistry;

import java.util.Arrays;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * {@link MetricsRegistry} backed by the Prometheus simple client.
 *
 * <p>One collector is registered per metric name, with label names taken from the
 * first request for that name. Later requests must use the same label keys; each
 * distinct set of label values gets its own adapter.
 */
public final class PrometheusMetricsRegistry implements MetricsRegistry {

    private static final double[] LATENCY_BUCKETS =
            {0.00001, 0.00005, 0.0001, 0.0005, 0.001, 0.005, 0.01, 0.05, 0.1, 0.5, 1.0};

    private final CollectorRegistry registry;
    private final Map<String, Collector> collectors = new ConcurrentHashMap<>();
    private final Map<String, Counter> counters = new ConcurrentHashMap<>();
    private final Map<String, Gauge> gauges = new ConcurrentHashMap<>();
    private final Map<String, Timer> timers = new ConcurrentHashMap<>();

    public PrometheusMetricsRegistry() {
        this(CollectorRegistry.defaultRegistry);
    }

    public PrometheusMetricsRegistry(CollectorRegistry registry) {
        this.registry = registry;
    }

    public CollectorRegistry getCollectorRegistry() {
        return registry;
    }

    @Override
    public Counter counter(String name, String... tags) {
        return counters.computeIfAbsent(seriesKey(name, tags), k -> {
            io.prometheus.client.Counter counter = (io.prometheus.client.Counter) collectors.computeIfAbsent(
                    "counter:" + name,
                    n -> io.prometheus.client.Counter.build()
                            .name(sanitizeName(name))
                            .help("Counter " + name)
                            .labelNames(labelNames(tags))
                            .register(registry));
            return new PrometheusCounterAdapter(counter, labelValues(tags));
        });
    }

    @Override
    public Gauge gauge(String name, String... tags) {
        return gauges.computeIfAbsent(seriesKey(name, tags), k -> {
            io.prometheus.client.Gauge gauge = (io.prometheus.client.Gauge) collectors.computeIfAbsent(
                    "gauge:" + name,
                    n -> io.prometheus.client.Gauge.build()
                            .name(sanitizeName(name))
                            .help("Gauge " + name)
                            .labelNames(labelNames(tags))
                            .register(registry));
            return new PrometheusGaugeAdapter(gauge, labelValues(tags));
        });
    }

    @Override
    public Timer timer(String name, String... tags) {
        return timers.computeIfAbsent(seriesKey(name, tags), k -> {
            io.prometheus.client.Histogram histogram = (io.prometheus.client.Histogram) collectors.computeIfAbsent(
                    "timer:" + name,
                    n -> io.prometheus.client.Histogram.build()
                            .name(sanitizeName(name) + "_seconds")
                            .help("Timer " + name)
                            .buckets(LATENCY_BUCKETS)
                            .labelNames(labelNames(tags))
                            .register(registry));
            return new PrometheusTimerAdapter(histogram, labelValues(tags));
        });
    }

    static String sanitizeName(String name) {
        return name.toLowerCase()
                .replaceAll("[^a-z0-9_:]", "_")
                .replaceAll("_{2,}", "_");
    }

    private static String seriesKey(String name, String[] tags) {
        return name + Arrays.toString(tags);
    }

    private static String[] labelNames(String[] tags) {
        requireEvenTags(tags);
        String[] names = new String[tags.length / 2];
        for (int i = 0; i < names.length; i++) {
            names[i] = tags[i * 2];
        }
        return names;
    }

    private static String[] labelValues(String[] tags) {
        requireEvenTags(tags);
        String[] values = new String[tags.length / 2];
        for (int i = 0; i < values.length; i++) {
            values[i] = tags[i * 2 + 1];
        }
        return values;
    }

    private static void requireEvenTags(String[] tags) {
        if (tags.length % 2 != 0) {
            throw new IllegalArgumentException("Tags must be key/value pairs: " + Arrays.toString(tags));
        }
    }
}
