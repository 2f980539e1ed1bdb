package com.arbiter.ruleengine.infra.metrics.impl.prometheus;

import com.arbiter.ruleengine.infra.metrics.Timer;

import java.time.Duration;
import java.util.concurrent.Callable;

/**
 * Bridges {@link Timer} to a Prometheus histogram. Durations are observed in seconds,
 * the Prometheus base unit; percentiles are left to {@code histogram_quantile()} on the
 * server.
 */
final class PrometheusTimerAdapter implements Timer {

    private final io.prometheus.client.Histogram.Child histogram;

    PrometheusTimerAdapter(io.prometheus.client.Histogram histogram, String[] labelValues) {
        if (histogram == null) {
            throw new IllegalArgumentException("Histogram cannot be null");
        }
        this.histogram = histogram.labels(labelValues);
    }

    @Override
    public <T> T record(Callable<T> callable) throws Exception {
        io.prometheus.client.Histogram.Timer timer = histogram.startTimer();
        try {
            return callable.call();
        } finally {
            timer.observeDuration();
        }
    }

    @Override
    public void record(Duration duration) {
        if (duration == null || duration.isNegative()) {
            throw new IllegalArgumentException("Duration must be non-null and non-negative: " + duration);
        }
        histogram.observe(duration.toNanos() / 1_000_000_000.0);
    }

    /**
     * Reads the {@code +Inf} bucket, which holds the total observation count.
     */
    @Override
    public long count() {
        double[] buckets = histogram.get().buckets;
        return buckets.length == 0 ? 0L : (long) buckets[buckets.length - 1];
    }
}
