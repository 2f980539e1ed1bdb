/*
 * Copyright (c) 2025 Arbiter Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.arbiter.ruleengine.service.server;

import com.arbiter.ruleengine.api.model.EvaluationTrace;
import com.arbiter.ruleengine.api.model.MatchResult;
import com.arbiter.ruleengine.api.model.Rule;
import com.arbiter.ruleengine.service.presentation.DecisionCategory;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * Body returned by {@code POST /resolve}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ResolveResponse(
        String decision,
        String reason,
        DecisionCategory category,
        String headline,
        List<FiredRule> firedRules,
        boolean rulesFallback,
        EvaluationTrace trace) {

    public static ResolveResponse from(MatchResult result, boolean rulesFallback, EvaluationTrace trace) {
        DecisionCategory category = DecisionCategory.of(result.decision());
        List<FiredRule> fired = result.firedRules().stream().map(FiredRule::of).toList();
        return new ResolveResponse(result.decision(), result.reason(), category, category.headline(),
                fired, rulesFallback, trace);
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record FiredRule(String name, int priority, String decision) {

        static FiredRule of(Rule rule) {
            return new FiredRule(rule.name(), rule.priority(),
                    rule.action() != null ? rule.action().decision() : null);
        }
    }
}
