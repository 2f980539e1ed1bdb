/*
 * Copyright (c) 2025 Arbiter Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.arbiter.ruleengine.runtime.evaluation;

import com.arbiter.ruleengine.api.model.Condition;
import com.arbiter.ruleengine.api.model.EvaluationTrace.ConditionOutcome;
import com.arbiter.ruleengine.api.model.EvaluationTrace.RuleOutcome;
import com.arbiter.ruleengine.api.model.Facts;
import com.arbiter.ruleengine.api.model.Rule;

import java.util.ArrayList;
import java.util.List;

/**
 * Decides whether a rule fires: every condition must hold. A rule without conditions
 * always fires.
 */
public final class RuleMatcher {

    private final ConditionEvaluator conditionEvaluator;

    public RuleMatcher() {
        this(new ConditionEvaluator());
    }

    public RuleMatcher(ConditionEvaluator conditionEvaluator) {
        this.conditionEvaluator = conditionEvaluator;
    }

    /**
     * Stops at the first condition that does not hold.
     */
    public boolean matches(Facts facts, Rule rule) {
        for (Condition condition : rule.conditions()) {
            if (!conditionEvaluator.evaluate(facts, condition)) {
                return false;
            }
        }
        return true;
    }

    /**
     * Evaluates every condition of the rule, without short-circuiting, so the outcome
     * lists all failing conditions.
     */
    public RuleOutcome explain(Facts facts, Rule rule) {
        List<ConditionOutcome> outcomes = new ArrayList<>(rule.conditions().size());
        boolean matched = true;
        for (Condition condition : rule.conditions()) {
            ConditionOutcome outcome = conditionEvaluator.explain(facts, condition);
            matched &= outcome.matched();
            outcomes.add(outcome);
        }
        return new RuleOutcome(rule.name(), rule.priority(), matched, outcomes);
    }
}
