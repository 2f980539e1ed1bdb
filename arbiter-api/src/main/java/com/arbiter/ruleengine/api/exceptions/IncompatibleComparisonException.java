/*
 * Copyright (c) 2025 Arbiter Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.arbiter.ruleengine.api.exceptions;

import com.arbiter.ruleengine.api.model.ComparisonOperator;
import com.arbiter.ruleengine.api.model.FactValue;

/**
 * Raised by an operator that cannot compare the given pair of value kinds,
 * e.g. {@code "abc" > true}. Condition evaluation turns it into a false result.
 */
public class IncompatibleComparisonException extends RuntimeException {

    private final ComparisonOperator operator;
    private final FactValue left;
    private final FactValue right;

    public IncompatibleComparisonException(ComparisonOperator operator, FactValue left, FactValue right) {
        super(String.format("Cannot apply '%s' to %s and %s",
                operator.symbol(), left.kind(), right.kind()));
        this.operator = operator;
        this.left = left;
        this.right = right;
    }

    public ComparisonOperator getOperator() {
        return operator;
    }

    public FactValue getLeft() {
        return left;
    }

    public FactValue getRight() {
        return right;
    }
}
