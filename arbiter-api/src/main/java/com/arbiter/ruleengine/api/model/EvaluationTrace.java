/*
 * Copyright (c) 2025 Arbiter Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.arbiter.ruleengine.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.List;

/**
 * Condition-by-condition record of a single resolution, in rule-set order.
 *
 * <p>Unlike {@link MatchResult#firedRules()}, the trace also covers the rules that did
 * not fire and says which condition stopped them.
 */
public record EvaluationTrace(
        @JsonProperty("total_duration_nanos") long totalDurationNanos,
        @JsonProperty("rule_outcomes") List<RuleOutcome> ruleOutcomes) implements Serializable {

    public EvaluationTrace {
        ruleOutcomes = ruleOutcomes == null ? List.of() : List.copyOf(ruleOutcomes);
    }

    /**
     * Why a condition did not hold.
     */
    public enum FailureReason {
        /** Not a field/operator/value triple. */
        MALFORMED,
        MISSING_FIELD,
        UNKNOWN_OPERATOR,
        /** The operator cannot order the two value kinds. */
        INCOMPATIBLE_TYPES,
        /** Comparison ran and returned false. */
        FALSE
    }

    public record ConditionOutcome(
            @JsonProperty("field") String field,
            @JsonProperty("operator") String operator,
            @JsonProperty("expected_value") FactValue expectedValue,
            @JsonProperty("actual_value") FactValue actualValue,
            @JsonProperty("matched") boolean matched,
            @JsonProperty("failure_reason") FailureReason failureReason) implements Serializable {

        public static ConditionOutcome passed(Condition condition, FactValue actual) {
            return new ConditionOutcome(condition.field(), condition.operator(),
                    condition.value(), actual, true, null);
        }

        public static ConditionOutcome failed(Condition condition, FactValue actual, FailureReason reason) {
            return new ConditionOutcome(condition.field(), condition.operator(),
                    condition.value(), actual, false, reason);
        }

        public String describe() {
            if (matched) {
                return String.format("✓ %s %s %s (actual: %s)", field, operator, expectedValue, actualValue);
            }
            return String.format("✗ %s %s %s (actual: %s, %s)",
                    field, operator, expectedValue, actualValue, failureReason);
        }
    }

    public record RuleOutcome(
            @JsonProperty("rule_name") String ruleName,
            @JsonProperty("priority") int priority,
            @JsonProperty("matched") boolean matched,
            @JsonProperty("conditions") List<ConditionOutcome> conditions) implements Serializable {

        public RuleOutcome {
            conditions = conditions == null ? List.of() : List.copyOf(conditions);
        }

        public String describe() {
            long passed = conditions.stream().filter(ConditionOutcome::matched).count();
            return String.format("%s %s (priority %d, %d/%d conditions)",
                    matched ? "✓" : "✗", ruleName, priority, passed, conditions.size());
        }
    }

    public double totalDurationMicros() {
        return totalDurationNanos / 1000.0;
    }
}
