package com.arbiter.ruleengine.infra.metrics.impl.prometheus;

import io.prometheus.client.CollectorRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PrometheusMetricsRegistryTest {

    private CollectorRegistry collectorRegistry;
    private PrometheusMetricsRegistry metrics;

    @BeforeEach
    void setUp() {
        collectorRegistry = new CollectorRegistry();
        metrics = new PrometheusMetricsRegistry(collectorRegistry);
    }

    @Test
    void shouldExposeLabelledCounters() {
        metrics.counter("arbiter_resolutions_total", "outcome", "matched").increment();
        metrics.counter("arbiter_resolutions_total", "outcome", "matched").increment(2);
        metrics.counter("arbiter_resolutions_total", "outcome", "guarded").increment();

        assertThat(collectorRegistry.getSampleValue("arbiter_resolutions_total",
                new String[]{"outcome"}, new String[]{"matched"})).isEqualTo(3.0);
        assertThat(collectorRegistry.getSampleValue("arbiter_resolutions_total",
                new String[]{"outcome"}, new String[]{"guarded"})).isEqualTo(1.0);
        assertThat(metrics.counter("arbiter_resolutions_total", "outcome", "matched").count()).isEqualTo(3L);
    }

    @Test
    void shouldExposeGauges() {
        metrics.gauge("arbiter_active_rules").set(6);

        assertThat(collectorRegistry.getSampleValue("arbiter_active_rules")).isEqualTo(6.0);
    }

    @Test
    void shouldRecordTimersInSeconds() {
        metrics.timer("arbiter_resolve").record(Duration.ofMillis(2));
        metrics.timer("arbiter_resolve").record(Duration.ofMillis(4));

        assertThat(collectorRegistry.getSampleValue("arbiter_resolve_seconds_count")).isEqualTo(2.0);
        assertThat(collectorRegistry.getSampleValue("arbiter_resolve_seconds_sum")).isCloseTo(0.006,
                org.assertj.core.data.Offset.offset(1e-9));
        assertThat(metrics.timer("arbiter_resolve").count()).isEqualTo(2L);
    }

    @Test
    void shouldRejectOddTags() {
        assertThatThrownBy(() -> metrics.counter("c", "outcome"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void shouldSanitizeNames() {
        assertThat(PrometheusMetricsRegistry.sanitizeName("Arbiter.Resolve-Time")).isEqualTo("arbiter_resolve_time");
    }
}
