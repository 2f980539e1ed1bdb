/*
 * Copyright (c) 2025 Arbiter Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.arbiter.ruleengine.runtime.evaluation;

import com.arbiter.ruleengine.api.exceptions.IncompatibleComparisonException;
import com.arbiter.ruleengine.api.model.Condition;
import com.arbiter.ruleengine.api.model.EvaluationTrace.ConditionOutcome;
import com.arbiter.ruleengine.api.model.EvaluationTrace.FailureReason;
import com.arbiter.ruleengine.api.model.FactValue;
import com.arbiter.ruleengine.api.model.Facts;
import com.arbiter.ruleengine.infra.metrics.Counter;
import com.arbiter.ruleengine.infra.metrics.MetricsRegistry;
import com.arbiter.ruleengine.runtime.operators.ComparisonPredicate;
import com.arbiter.ruleengine.runtime.operators.OperatorRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Evaluates one condition against a fact set.
 *
 * <p>Fails safe: a malformed condition, an absent field, an unknown operator or an
 * incompatible comparison all evaluate to {@code false}. Nothing is thrown to the
 * caller. Incompatible comparisons are logged and counted under
 * {@code arbiter_condition_errors_total} so that rule authors can find them.
 */
public final class ConditionEvaluator {
    private static final Logger logger = LoggerFactory.getLogger(ConditionEvaluator.class);

    static final String CONDITION_ERRORS = "arbiter_condition_errors_total";

    private final OperatorRegistry operators;
    private final Counter incompatibleComparisons;

    public ConditionEvaluator() {
        this(OperatorRegistry.standard(), MetricsRegistry.getInstance());
    }

    public ConditionEvaluator(OperatorRegistry operators, MetricsRegistry metrics) {
        this.operators = operators;
        this.incompatibleComparisons = metrics.counter(CONDITION_ERRORS, "reason", "incompatible_types");
    }

    /**
     * @return true iff the condition is well formed, its field is present and the
     *         comparison holds
     */
    public boolean evaluate(Facts facts, Condition condition) {
        return check(facts, condition) == null;
    }

    /**
     * Same as {@link #evaluate} but reports the actual value and, on failure, why.
     */
    public ConditionOutcome explain(Facts facts, Condition condition) {
        Condition target = condition != null ? condition : Condition.malformed();
        FactValue actual = facts.get(target.field()).orElse(null);
        FailureReason failure = check(facts, target);
        return failure == null
                ? ConditionOutcome.passed(target, actual)
                : ConditionOutcome.failed(target, actual, failure);
    }

    /**
     * @return null when the condition holds, otherwise the reason it does not
     */
    private FailureReason check(Facts facts, Condition condition) {
        if (condition == null || condition.field() == null
                || condition.operator() == null || condition.value() == null) {
            return FailureReason.MALFORMED;
        }
        Optional<FactValue> actual = facts.get(condition.field());
        if (actual.isEmpty()) {
            return FailureReason.MISSING_FIELD;
        }
        Optional<ComparisonPredicate> predicate = operators.lookup(condition.operator());
        if (predicate.isEmpty()) {
            logger.debug("Unknown operator '{}' in condition [{}]", condition.operator(), condition);
            return FailureReason.UNKNOWN_OPERATOR;
        }
        try {
            return predicate.get().test(actual.get(), condition.value()) ? null : FailureReason.FALSE;
        } catch (IncompatibleComparisonException e) {
            incompatibleComparisons.increment();
            logger.warn("Error evaluating condition [{}] with fact {}: {}",
                    condition, actual.get(), e.getMessage());
            return FailureReason.INCOMPATIBLE_TYPES;
        }
    }
}
