/*
 * Copyright (c) 2025 Arbiter Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.arbiter.ruleengine.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;

/**
 * Match result paired with the trace that explains it.
 *
 * <pre>
 * EvaluationResult result = resolver.resolveWithTrace(facts, ruleSet);
 * for (EvaluationTrace.RuleOutcome outcome : result.trace().ruleOutcomes()) {
 *     System.out.println(outcome.describe());
 * }
 * </pre>
 */
public record EvaluationResult(
        @JsonProperty("match_result") MatchResult matchResult,
        @JsonProperty("trace") EvaluationTrace trace) implements Serializable {

    public boolean hasMatches() {
        return matchResult != null && matchResult.hasMatches();
    }
}
