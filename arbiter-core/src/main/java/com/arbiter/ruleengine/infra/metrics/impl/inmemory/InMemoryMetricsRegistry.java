package com.arbiter.ruleengine.infra.metrics.impl.inmemory;

import com.arbiter.ruleengine.infra.metrics.Counter;
import com.arbiter.ruleengine.infra.metrics.Gauge;
import com.arbiter.ruleengine.infra.metrics.MetricsRegistry;
import com.arbiter.ruleengine.infra.metrics.Timer;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory metrics registry for tests.
 *
 * <pre>{@code
 * InMemoryMetricsRegistry metrics = new InMemoryMetricsRegistry();
 * ConditionEvaluator evaluator = new ConditionEvaluator(OperatorRegistry.standard(), metrics);
 * ...
 * assertThat(metrics.getCounterValue("arbiter_condition_errors_total",
 *         "reason", "incompatible_types")).isEqualTo(1L);
 * }</pre>
 */
public final class InMemoryMetricsRegistry implements MetricsRegistry {

    private final Map<String, InMemoryCounter> counters = new ConcurrentHashMap<>();
    private final Map<String, InMemoryGauge> gauges = new ConcurrentHashMap<>();
    private final Map<String, InMemoryTimer> timers = new ConcurrentHashMap<>();

    @Override
    public Counter counter(String name, String... tags) {
        return counters.computeIfAbsent(key(name, tags), k -> new InMemoryCounter());
    }

    @Override
    public Gauge gauge(String name, String... tags) {
        return gauges.computeIfAbsent(key(name, tags), k -> new InMemoryGauge());
    }

    @Override
    public Timer timer(String name, String... tags) {
        return timers.computeIfAbsent(key(name, tags), k -> new InMemoryTimer());
    }

    // Test helpers

    public long getCounterValue(String name, String... tags) {
        InMemoryCounter counter = counters.get(key(name, tags));
        return counter != null ? counter.count() : 0L;
    }

    public double getGaugeValue(String name, String... tags) {
        InMemoryGauge gauge = gauges.get(key(name, tags));
        return gauge != null ? gauge.value() : 0.0;
    }

    public List<Duration> getTimerRecordings(String name, String... tags) {
        InMemoryTimer timer = timers.get(key(name, tags));
        return timer != null ? timer.recordings() : List.of();
    }

    public void reset() {
        counters.clear();
        gauges.clear();
        timers.clear();
    }

    private static String key(String name, String[] tags) {
        return tags.length == 0 ? name : name + "{" + String.join(",", tags) + "}";
    }
}
