/*
 * Copyright (c) 2025 Arbiter Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.arbiter.ruleengine.api;

import com.arbiter.ruleengine.api.model.EvaluationResult;
import com.arbiter.ruleengine.api.model.Facts;
import com.arbiter.ruleengine.api.model.MatchResult;
import com.arbiter.ruleengine.api.model.Rule;
import com.arbiter.ruleengine.api.model.RuleSet;

import java.util.List;
import java.util.Map;

/**
 * Contract for resolving a fact set against a rule set into one decision.
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * IRuleResolver resolver = new ResolutionEngine();
 *
 * MatchResult result = resolver.resolve(Map.of(
 *     "cgpa", 3.8,
 *     "family_income", 5000
 * ), ruleSet);
 *
 * System.out.println(result.decision() + ": " + result.reason());
 * result.firedRules().forEach(rule -> System.out.println("  fired " + rule.name()));
 * }</pre>
 *
 * <h2>Thread Safety</h2>
 * <p>Implementations hold no state between calls and can be shared freely across
 * threads.
 *
 * <h2>Failure Model</h2>
 * <p>Resolution never throws for badly shaped input. Malformed conditions do not match,
 * an empty match yields the no-match action, and a winning rule without a usable
 * action yields the guard action.
 */
public interface IRuleResolver {

    /**
     * Resolves facts against rules.
     *
     * @param facts the facts (null is treated as no facts)
     * @param rules the rules (null is treated as an empty rule set)
     * @return the winning action and all fired rules, highest priority first
     */
    MatchResult resolve(Facts facts, RuleSet rules);

    default MatchResult resolve(Map<String, ?> facts, RuleSet rules) {
        return resolve(Facts.of(facts), rules);
    }

    default MatchResult resolve(Facts facts, List<Rule> rules) {
        return resolve(facts, rules == null ? null : RuleSet.of(rules));
    }

    default MatchResult resolve(Map<String, ?> facts, List<Rule> rules) {
        return resolve(Facts.of(facts), rules);
    }

    /**
     * Resolves facts against rules and records why each rule did or did not fire.
     *
     * @param facts the facts
     * @param rules the rules
     * @return result with trace
     */
    default EvaluationResult resolveWithTrace(Facts facts, RuleSet rules) {
        return new EvaluationResult(resolve(facts, rules), null);
    }

    /**
     * Resolves several fact sets against the same rules.
     *
     * @return one result per fact set, in input order
     */
    default List<MatchResult> resolveBatch(List<Facts> factSets, RuleSet rules) {
        return factSets.stream()
                .map(facts -> resolve(facts, rules))
                .toList();
    }
}
