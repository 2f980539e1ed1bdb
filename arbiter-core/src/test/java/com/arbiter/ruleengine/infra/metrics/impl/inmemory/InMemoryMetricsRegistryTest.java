package com.arbiter.ruleengine.infra.metrics.impl.inmemory;

import com.arbiter.ruleengine.infra.metrics.Counter;
import com.arbiter.ruleengine.infra.metrics.MetricsRegistry;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InMemoryMetricsRegistryTest {

    private final InMemoryMetricsRegistry metrics = new InMemoryMetricsRegistry();

    @Test
    void shouldSeparateSeriesByTags() {
        metrics.counter("arbiter_resolutions_total", "outcome", "matched").increment();
        metrics.counter("arbiter_resolutions_total", "outcome", "matched").increment();
        metrics.counter("arbiter_resolutions_total", "outcome", "no_match").increment(5);

        assertThat(metrics.getCounterValue("arbiter_resolutions_total", "outcome", "matched")).isEqualTo(2L);
        assertThat(metrics.getCounterValue("arbiter_resolutions_total", "outcome", "no_match")).isEqualTo(5L);
        assertThat(metrics.getCounterValue("arbiter_resolutions_total")).isZero();
    }

    @Test
    void shouldRejectNegativeIncrements() {
        Counter counter = metrics.counter("c");

        assertThatThrownBy(() -> counter.increment(-1)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void shouldRecordTimersAndGauges() throws Exception {
        String value = metrics.timer("arbiter_resolve").record(() -> "done");
        metrics.timer("arbiter_resolve").record(Duration.ofMillis(3));
        metrics.gauge("arbiter_active_rules").set(6);

        assertThat(value).isEqualTo("done");
        assertThat(metrics.getTimerRecordings("arbiter_resolve")).hasSize(2).contains(Duration.ofMillis(3));
        assertThat(metrics.timer("arbiter_resolve").count()).isEqualTo(2L);
        assertThat(metrics.getGaugeValue("arbiter_active_rules")).isEqualTo(6.0);
    }

    @Test
    void shouldClearOnReset() {
        metrics.counter("c").increment();
        metrics.reset();

        assertThat(metrics.getCounterValue("c")).isZero();
    }

    @Test
    void shouldBeDiscoveredThroughServiceLoader() {
        assertThat(MetricsRegistry.getInstance()).isInstanceOf(InMemoryMetricsRegistry.class);
    }
}
