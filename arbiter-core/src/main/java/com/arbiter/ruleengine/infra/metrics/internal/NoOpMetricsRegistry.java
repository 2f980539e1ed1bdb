package com.arbiter.ruleengine.infra.metrics.internal;

import com.arbiter.ruleengine.infra.metrics.Counter;
import com.arbiter.ruleengine.infra.metrics.Gauge;
import com.arbiter.ruleengine.infra.metrics.MetricsRegistry;
import com.arbiter.ruleengine.infra.metrics.Timer;

import java.time.Duration;
import java.util.concurrent.Callable;

/**
 * Registry that records nothing. Used when no provider is configured.
 */
public final class NoOpMetricsRegistry implements MetricsRegistry {

    private static final Counter COUNTER = new Counter() {
        public void increment() {}
        public void increment(long amount) {}
        public long count() { return 0L; }
    };

    private static final Gauge GAUGE = new Gauge() {
        public void set(double value) {}
        public double value() { return 0.0; }
    };

    private static final Timer TIMER = new Timer() {
        public <T> T record(Callable<T> callable) throws Exception {
            return callable.call();
        }
        public void record(Duration duration) {}
        public long count() { return 0L; }
    };

    @Override
    public Counter counter(String name, String... tags) {
        return COUNTER;
    }

    @Override
    public Gauge gauge(String name, String... tags) {
        return GAUGE;
    }

    @Override
    public Timer timer(String name, String... tags) {
        return TIMER;
    }
}
