/*
 * Copyright (c) 2025 Arbiter Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.arbiter.ruleengine.runtime.operators;

import com.arbiter.ruleengine.api.exceptions.IncompatibleComparisonException;
import com.arbiter.ruleengine.api.model.FactValue;

/**
 * Pure two-argument comparison: {@code fact <op> expected}.
 */
@FunctionalInterface
public interface ComparisonPredicate {

    /**
     * @param actual   the fact value (left operand)
     * @param expected the condition value (right operand)
     * @return the comparison result
     * @throws IncompatibleComparisonException if the operator cannot compare the two kinds
     */
    boolean test(FactValue actual, FactValue expected);
}
