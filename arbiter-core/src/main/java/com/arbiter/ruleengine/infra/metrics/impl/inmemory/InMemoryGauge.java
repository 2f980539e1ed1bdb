package com.arbiter.ruleengine.infra.metrics.impl.inmemory;

import com.arbiter.ruleengine.infra.metrics.Gauge;

final class InMemoryGauge implements Gauge {
    private volatile double value;

    @Override
    public void set(double value) {
        this.value = value;
    }

    @Override
    public double value() {
        return value;
    }
}
