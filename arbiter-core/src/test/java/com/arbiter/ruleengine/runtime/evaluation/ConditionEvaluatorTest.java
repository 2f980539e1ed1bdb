/*
 * Copyright (c) 2025 Arbiter Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.arbiter.ruleengine.runtime.evaluation;

import com.arbiter.ruleengine.api.model.Condition;
import com.arbiter.ruleengine.api.model.EvaluationTrace.ConditionOutcome;
import com.arbiter.ruleengine.api.model.EvaluationTrace.FailureReason;
import com.arbiter.ruleengine.api.model.FactValue;
import com.arbiter.ruleengine.api.model.Facts;
import com.arbiter.ruleengine.infra.metrics.impl.inmemory.InMemoryMetricsRegistry;
import com.arbiter.ruleengine.runtime.operators.OperatorRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;

class ConditionEvaluatorTest {

    private InMemoryMetricsRegistry metrics;
    private ConditionEvaluator evaluator;
    private Facts facts;

    @BeforeEach
    void setUp() {
        metrics = new InMemoryMetricsRegistry();
        evaluator = new ConditionEvaluator(OperatorRegistry.standard(), metrics);
        facts = Facts.of(Map.of(
                "cgpa", 3.8,
                "family_income", 5000,
                "faculty", "ENGINEERING"));
    }

    @Test
    @DisplayName("Should apply the operator to the fact and the expected value")
    void shouldEvaluateComparison() {
        assertThat(evaluator.evaluate(facts, Condition.of("cgpa", ">=", 3.7))).isTrue();
        assertThat(evaluator.evaluate(facts, Condition.of("family_income", "<=", 4000))).isFalse();
        assertThat(evaluator.evaluate(facts, Condition.of("faculty", "==", "ENGINEERING"))).isTrue();
    }

    @Test
    @DisplayName("Should evaluate to false when the field is absent")
    void shouldFailOnMissingField() {
        Condition condition = Condition.of("disciplinary_actions", "==", 0);

        assertThat(evaluator.evaluate(facts, condition)).isFalse();
        assertThat(evaluator.explain(facts, condition).failureReason()).isEqualTo(FailureReason.MISSING_FIELD);
    }

    @Test
    @DisplayName("Should evaluate to false for an unknown operator")
    void shouldFailOnUnknownOperator() {
        Condition condition = Condition.of("cgpa", "~=", 3.8);

        assertThat(evaluator.evaluate(facts, condition)).isFalse();
        assertThat(evaluator.explain(facts, condition).failureReason()).isEqualTo(FailureReason.UNKNOWN_OPERATOR);
    }

    @Test
    @DisplayName("Should evaluate to false for malformed triples")
    void shouldFailOnMalformedCondition() {
        assertThat(evaluator.evaluate(facts, Condition.fromTriple(List.of("cgpa", ">=")))).isFalse();
        assertThat(evaluator.evaluate(facts, Condition.fromTriple(List.of("cgpa", ">=", List.of(1))))).isFalse();
        assertThat(evaluator.evaluate(facts, null)).isFalse();
        assertThat(evaluator.explain(facts, null).failureReason()).isEqualTo(FailureReason.MALFORMED);
    }

    @Test
    @DisplayName("Should swallow incompatible comparisons into false and count them")
    void shouldCountIncompatibleComparisons() {
        Condition condition = Condition.of("faculty", ">", 3);

        assertThatCode(() -> evaluator.evaluate(facts, condition)).doesNotThrowAnyException();
        assertThat(evaluator.evaluate(facts, condition)).isFalse();
        assertThat(metrics.getCounterValue(ConditionEvaluator.CONDITION_ERRORS, "reason", "incompatible_types"))
                .isEqualTo(2L);
    }

    @Test
    @DisplayName("Should report actual and expected values in the outcome")
    void shouldExplainOutcome() {
        ConditionOutcome passed = evaluator.explain(facts, Condition.of("cgpa", ">=", 3.7));
        ConditionOutcome failed = evaluator.explain(facts, Condition.of("cgpa", "<", 2.5));

        assertThat(passed.matched()).isTrue();
        assertThat(passed.actualValue()).isEqualTo(FactValue.number(3.8));
        assertThat(passed.failureReason()).isNull();
        assertThat(passed.describe()).startsWith("✓ cgpa >= 3.7");

        assertThat(failed.matched()).isFalse();
        assertThat(failed.expectedValue()).isEqualTo(FactValue.number(2.5));
        assertThat(failed.failureReason()).isEqualTo(FailureReason.FALSE);
    }
}
