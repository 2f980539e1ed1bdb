/*
 * Copyright (c) 2025 Arbiter Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.arbiter.ruleengine.compiler.analysis;

import com.arbiter.ruleengine.api.model.Condition;
import com.arbiter.ruleengine.api.model.Rule;
import com.arbiter.ruleengine.api.model.RuleSet;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Finds priority layouts in a rule set that make resolution depend on something other
 * than priority, or that make a rule pointless.
 *
 * <h2>Findings</h2>
 * <ul>
 *   <li><b>Tie blocks</b>: two or more rules share a priority. If several of them fire,
 *       the one listed first wins.</li>
 *   <li><b>Unreachable winners</b>: a rule ranked below an unconditional rule. The
 *       unconditional rule always fires, so the lower rule may fire but never wins.</li>
 *   <li><b>Dead rules</b>: a rule with a malformed condition can never fire.</li>
 * </ul>
 *
 * <h2>Usage</h2>
 * <pre>
 * PriorityReport report = new PriorityConflictAnalyzer().analyze(ruleSet);
 * report.unreachable().forEach(finding -> System.out.println(finding.describe()));
 * </pre>
 *
 * <p>Analysis is linear in the number of rules and is meant for authoring tools and CI
 * checks rather than the resolution path.
 */
public class PriorityConflictAnalyzer {

    public PriorityReport analyze(RuleSet ruleSet) {
        List<Rule> rules = ruleSet.rules();
        return new PriorityReport(
                ruleSet.source(),
                findTieBlocks(rules),
                findUnreachable(rules),
                findDeadRules(rules));
    }

    private static List<TieBlock> findTieBlocks(List<Rule> rules) {
        Map<Integer, List<String>> byPriority = new LinkedHashMap<>();
        for (Rule rule : rules) {
            byPriority.computeIfAbsent(rule.priority(), p -> new ArrayList<>()).add(rule.name());
        }

        return byPriority.entrySet().stream()
                .filter(e -> e.getValue().size() > 1)
                .map(e -> new TieBlock(e.getKey(), List.copyOf(e.getValue())))
                .sorted(Comparator.comparingInt(TieBlock::priority).reversed())
                .toList();
    }

    private static List<UnreachableRule> findUnreachable(List<Rule> rules) {
        // The highest-ranked unconditional rule: the first one at the top priority
        Rule ceiling = null;
        int ceilingIndex = -1;
        for (int i = 0; i < rules.size(); i++) {
            Rule rule = rules.get(i);
            if (rule.isUnconditional() && (ceiling == null || rule.priority() > ceiling.priority())) {
                ceiling = rule;
                ceilingIndex = i;
            }
        }
        if (ceiling == null) {
            return List.of();
        }

        List<UnreachableRule> unreachable = new ArrayList<>();
        for (int i = 0; i < rules.size(); i++) {
            Rule rule = rules.get(i);
            boolean outranked = rule.priority() < ceiling.priority()
                    || (rule.priority() == ceiling.priority() && i > ceilingIndex);
            if (outranked) {
                unreachable.add(new UnreachableRule(rule.name(), rule.priority(), ceiling.name(), ceiling.priority()));
            }
        }
        return unreachable;
    }

    private static List<String> findDeadRules(List<Rule> rules) {
        List<String> dead = new ArrayList<>();
        for (Rule rule : rules) {
            if (!rule.conditions().stream().allMatch(Condition::isWellFormed)) {
                dead.add(rule.name());
            }
        }
        return dead;
    }

    /**
     * @param source      the analyzed rule set's source
     * @param ties        tie blocks, highest priority first
     * @param unreachable rules that can never win, in rule-set order
     * @param deadRules   names of rules that can never fire
     */
    public record PriorityReport(
            String source,
            List<TieBlock> ties,
            List<UnreachableRule> unreachable,
            List<String> deadRules
    ) implements Serializable {

        public boolean isClean() {
            return ties.isEmpty() && unreachable.isEmpty() && deadRules.isEmpty();
        }

        public int findingCount() {
            return ties.size() + unreachable.size() + deadRules.size();
        }
    }

    /**
     * Rules sharing one priority, in rule-set order (which is also their win order).
     */
    public record TieBlock(int priority, List<String> ruleNames) implements Serializable {

        public String describe() {
            return String.format("Priority %d is shared by %s; list order decides the winner",
                    priority, String.join(", ", ruleNames));
        }
    }

    /**
     * A rule that is always outranked by an unconditional rule.
     */
    public record UnreachableRule(
            String ruleName,
            int priority,
            String shadowedBy,
            int shadowingPriority
    ) implements Serializable {

        public String describe() {
            return String.format("Rule '%s' (pri=%d) can never win: '%s' (pri=%d) always fires",
                    ruleName, priority, shadowedBy, shadowingPriority);
        }
    }
}
