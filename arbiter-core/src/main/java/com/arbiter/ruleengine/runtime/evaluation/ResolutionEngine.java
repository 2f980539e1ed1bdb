/*
 * Copyright (c) 2025 Arbiter Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.arbiter.ruleengine.runtime.evaluation;

import com.arbiter.ruleengine.api.IRuleResolver;
import com.arbiter.ruleengine.api.model.Action;
import com.arbiter.ruleengine.api.model.EvaluationResult;
import com.arbiter.ruleengine.api.model.EvaluationTrace;
import com.arbiter.ruleengine.api.model.EvaluationTrace.RuleOutcome;
import com.arbiter.ruleengine.api.model.Facts;
import com.arbiter.ruleengine.api.model.MatchResult;
import com.arbiter.ruleengine.api.model.Rule;
import com.arbiter.ruleengine.api.model.RuleSet;
import com.arbiter.ruleengine.infra.metrics.MetricsRegistry;
import com.arbiter.ruleengine.infra.metrics.Timer;
import com.arbiter.ruleengine.infra.telemetry.TracingService;
import com.arbiter.ruleengine.runtime.policy.DefaultPolicy;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Resolves a fact set against a rule set into a single decision.
 *
 * <h2>Algorithm</h2>
 * <ol>
 *   <li>Keep the rules whose conditions all hold, in rule-set order.</li>
 *   <li>If none fired, answer {@link DefaultPolicy#NO_MATCH} with an empty fired list.</li>
 *   <li>Otherwise sort the fired rules by priority, highest first. The sort is stable:
 *       rules of equal priority keep their rule-set order.</li>
 *   <li>The first rule's action wins, or {@link DefaultPolicy#MISSING_ACTION} if it has
 *       no usable action.</li>
 * </ol>
 *
 * <p>The engine keeps no state between calls and may be shared across threads.
 */
public final class ResolutionEngine implements IRuleResolver {
    private static final Logger logger = LoggerFactory.getLogger(ResolutionEngine.class);

    static final String RESOLUTIONS = "arbiter_resolutions_total";
    static final String RESOLVE_TIMER = "arbiter_resolve";

    private static final Comparator<Rule> BY_PRIORITY_DESCENDING =
            Comparator.comparingInt(Rule::priority).reversed();

    private final RuleMatcher ruleMatcher;
    private final Tracer tracer;
    private final MetricsRegistry metrics;
    private final Timer resolveTimer;

    public ResolutionEngine() {
        this(new RuleMatcher(), TracingService.getInstance().getTracer(), MetricsRegistry.getInstance());
    }

    public ResolutionEngine(Tracer tracer) {
        this(new RuleMatcher(), tracer, MetricsRegistry.getInstance());
    }

    public ResolutionEngine(RuleMatcher ruleMatcher, Tracer tracer, MetricsRegistry metrics) {
        this.ruleMatcher = ruleMatcher;
        this.tracer = tracer;
        this.metrics = metrics;
        this.resolveTimer = metrics.timer(RESOLVE_TIMER);
    }

    @Override
    public MatchResult resolve(Facts facts, RuleSet rules) {
        Span span = tracer.spanBuilder("resolve-rules").startSpan();
        long start = System.nanoTime();
        try (Scope scope = span.makeCurrent()) {
            Facts input = facts != null ? facts : Facts.empty();
            List<Rule> candidates = rules != null ? rules.rules() : List.of();

            List<Rule> fired = new ArrayList<>();
            for (Rule rule : candidates) {
                if (ruleMatcher.matches(input, rule)) {
                    fired.add(rule);
                }
            }

            MatchResult result = select(fired);
            span.setAttribute("rules.count", candidates.size());
            span.setAttribute("rules.fired", fired.size());
            span.setAttribute("decision", result.decision());
            return result;
        } finally {
            resolveTimer.record(Duration.ofNanos(System.nanoTime() - start));
            span.end();
        }
    }

    @Override
    public EvaluationResult resolveWithTrace(Facts facts, RuleSet rules) {
        Span span = tracer.spanBuilder("resolve-rules-traced").startSpan();
        long start = System.nanoTime();
        try (Scope scope = span.makeCurrent()) {
            Facts input = facts != null ? facts : Facts.empty();
            List<Rule> candidates = rules != null ? rules.rules() : List.of();

            List<RuleOutcome> outcomes = new ArrayList<>(candidates.size());
            List<Rule> fired = new ArrayList<>();
            for (Rule rule : candidates) {
                RuleOutcome outcome = ruleMatcher.explain(input, rule);
                outcomes.add(outcome);
                if (outcome.matched()) {
                    fired.add(rule);
                }
            }

            MatchResult result = select(fired);
            long elapsed = System.nanoTime() - start;
            span.setAttribute("rules.count", candidates.size());
            span.setAttribute("rules.fired", fired.size());
            span.setAttribute("decision", result.decision());
            return new EvaluationResult(result, new EvaluationTrace(elapsed, outcomes));
        } finally {
            resolveTimer.record(Duration.ofNanos(System.nanoTime() - start));
            span.end();
        }
    }

    /**
     * Picks the winner from the fired rules. {@code fired} is sorted in place.
     */
    private MatchResult select(List<Rule> fired) {
        if (fired.isEmpty()) {
            metrics.counter(RESOLUTIONS, "outcome", "no_match").increment();
            return new MatchResult(DefaultPolicy.NO_MATCH, List.of());
        }

        // List.sort is stable, so equal priorities keep rule-set order
        fired.sort(BY_PRIORITY_DESCENDING);

        Rule top = fired.get(0);
        Action winning = DefaultPolicy.actionFor(top);
        if (winning == DefaultPolicy.MISSING_ACTION) {
            logger.warn("Rule '{}' won with priority {} but has no usable action", top.name(), top.priority());
            metrics.counter(RESOLUTIONS, "outcome", "guarded").increment();
        } else {
            metrics.counter(RESOLUTIONS, "outcome", "matched").increment();
        }
        return new MatchResult(winning, fired);
    }
}
