package com.arbiter.ruleengine.infra.metrics.impl.inmemory;

import com.arbiter.ruleengine.infra.metrics.Counter;

import java.util.concurrent.atomic.LongAdder;

final class InMemoryCounter implements Counter {
    private final LongAdder value = new LongAdder();

    @Override
    public void increment() {
        value.increment();
    }

    @Override
    public void increment(long amount) {
        if (amount < 0) {
            throw new IllegalArgumentException("Counter cannot be decremented: " + amount);
        }
        value.add(amount);
    }

    @Override
    public long count() {
        return value.sum();
    }
}
