package com.arbiter.ruleengine.infra.metrics.impl.prometheus;

import com.arbiter.ruleengine.infra.metrics.Counter;

/**
 * Bridges {@link Counter} to a Prometheus counter child bound to fixed label values.
 */
final class PrometheusCounterAdapter implements Counter {

    private final io.prometheus.client.Counter.Child counter;

    PrometheusCounterAdapter(io.prometheus.client.Counter counter, String[] labelValues) {
        if (counter == null) {
            throw new IllegalArgumentException("Counter cannot be null");
        }
        this.counter = counter.labels(labelValues);
    }

    @Override
    public void increment() {
        counter.inc();
    }

    @Override
    public void increment(long amount) {
        if (amount < 0) {
            throw new IllegalArgumentException("Counter cannot be decremented, got negative amount: " + amount);
        }
        counter.inc(amount);
    }

    @Override
    public long count() {
        return (long) counter.get();
    }
}
