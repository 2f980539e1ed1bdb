/*
 * Copyright (c) 2025 Arbiter Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.arbiter.ruleengine.runtime.evaluation;

import com.arbiter.ruleengine.api.model.Condition;
import com.arbiter.ruleengine.api.model.Facts;
import com.arbiter.ruleengine.api.model.Rule;
import com.arbiter.ruleengine.api.model.RuleSet;
import com.arbiter.ruleengine.infra.metrics.impl.inmemory.InMemoryMetricsRegistry;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanBuilder;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;

import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ResolutionEngineTracingTest {

    @Mock
    private Tracer tracer;

    @Mock
    private SpanBuilder spanBuilder;

    @Mock
    private Span span;

    @Mock
    private Scope scope;

    private ResolutionEngine engine;

    private final RuleSet rules = RuleSet.of(List.of(
            Rule.builder("merit").priority(100).when(Condition.of("cgpa", ">=", 3.7)).then("AWARD FULL", "merit").build(),
            Rule.builder("default").priority(1).then("NOT ELIGIBLE", "none").build()));

    @BeforeEach
    void setUp() {
        when(tracer.spanBuilder(anyString())).thenReturn(spanBuilder);
        when(spanBuilder.startSpan()).thenReturn(span);
        when(span.makeCurrent()).thenReturn(scope);
        engine = new ResolutionEngine(new RuleMatcher(), tracer, new InMemoryMetricsRegistry());
    }

    @Test
    void shouldRecordResolutionOnSpan() {
        engine.resolve(Facts.of(Map.of("cgpa", 3.9)), rules);

        verify(tracer).spanBuilder("resolve-rules");
        verify(span).setAttribute("rules.count", 2L);
        verify(span).setAttribute("rules.fired", 2L);
        verify(span).setAttribute("decision", "AWARD FULL");
        verify(scope).close();
        verify(span).end();
    }

    @Test
    void shouldUseSeparateSpanForTracedResolution() {
        engine.resolveWithTrace(Facts.empty(), rules);

        verify(tracer).spanBuilder("resolve-rules-traced");
        verify(span).setAttribute("rules.fired", 1L);
        verify(span).setAttribute("decision", "NOT ELIGIBLE");
        verify(span).end();
    }
}
