package com.arbiter.ruleengine.infra.metrics.impl.prometheus;

import com.arbiter.ruleengine.infra.metrics.Gauge;

final class PrometheusGaugeAdapter implements Gauge {

    private final io.prometheus.client.Gauge.Child gauge;

    PrometheusGaugeAdapter(io.prometheus.client.Gauge gauge, String[] labelValues) {
        if (gauge == null) {
            throw new IllegalArgumentException("Gauge cannot be null");
        }
        this.gauge = gauge.labels(labelValues);
    }

    @Override
    public void set(double value) {
        gauge.set(value);
    }

    @Override
    public double value() {
        return gauge.get();
    }
}
