/*
 * Copyright (c) 2025 Arbiter Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.arbiter.ruleengine.api.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * An atomic comparison of one fact field against a literal value.
 *
 * <p>Conditions are written externally as {@code [field, operator, value]} triples. The
 * pieces are kept as given so that a badly shaped triple can still be carried through
 * a rule set; such a condition is not {@linkplain #isWellFormed() well formed} and
 * always evaluates to false.
 *
 * @param field    the fact name (null when the triple had no usable field)
 * @param operator the operator symbol as written (may be unknown)
 * @param value    the expected value (null when the triple had no usable scalar)
 */
public record Condition(String field, String operator, FactValue value) {

    private static final Condition MALFORMED = new Condition(null, null, null);

    public static Condition of(String field, String operator, Object value) {
        return new Condition(field, operator, FactValue.ofNullable(value));
    }

    public static Condition of(String field, ComparisonOperator operator, Object value) {
        return of(field, operator.symbol(), value);
    }

    /**
     * Builds a condition from a JSON-style triple. Anything other than a
     * three-element list yields a malformed condition.
     */
    public static Condition fromTriple(List<?> triple) {
        if (triple == null || triple.size() != 3) {
            return MALFORMED;
        }
        Object field = triple.get(0);
        Object operator = triple.get(1);
        return new Condition(
                field instanceof String ? (String) field : null,
                operator instanceof String ? (String) operator : null,
                FactValue.ofNullable(triple.get(2)));
    }

    public static Condition malformed() {
        return MALFORMED;
    }

    @JsonIgnore
    public Optional<ComparisonOperator> comparisonOperator() {
        return ComparisonOperator.fromSymbol(operator);
    }

    /**
     * A condition is well formed when it names a field, carries a scalar value and
     * uses a registered operator.
     */
    @JsonIgnore
    public boolean isWellFormed() {
        return field != null && value != null && comparisonOperator().isPresent();
    }

    @JsonValue
    public List<Object> toTriple() {
        return Arrays.asList(field, operator, value == null ? null : value.toJson());
    }

    @Override
    public String toString() {
        return field + " " + operator + " " + value;
    }
}
