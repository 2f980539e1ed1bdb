/*
 * Copyright (c) 2025 Arbiter Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.arbiter.ruleengine.runtime.operators;

import com.arbiter.ruleengine.api.exceptions.IncompatibleComparisonException;
import com.arbiter.ruleengine.api.model.ComparisonOperator;
import com.arbiter.ruleengine.api.model.FactValue;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import java.util.function.IntPredicate;

/**
 * Fixed mapping from {@link ComparisonOperator} to its comparison.
 *
 * <p>Built once and never mutated, so a single instance is shared by every evaluation.
 * An unknown symbol is not an error here: {@link #lookup(String)} returns empty and the
 * caller decides what that means.
 *
 * <h2>Comparison rules</h2>
 * <ul>
 *   <li>number vs number: numeric comparison for all operators</li>
 *   <li>text vs text: equality, or lexicographic order for relational operators</li>
 *   <li>boolean vs boolean: equality only</li>
 *   <li>mixed kinds: never equal; relational operators are incompatible</li>
 * </ul>
 */
public final class OperatorRegistry {

    private static final OperatorRegistry STANDARD = new OperatorRegistry();

    private final Map<ComparisonOperator, ComparisonPredicate> predicates;

    private OperatorRegistry() {
        Map<ComparisonOperator, ComparisonPredicate> map = new EnumMap<>(ComparisonOperator.class);
        map.put(ComparisonOperator.EQUAL_TO, OperatorRegistry::equalValues);
        map.put(ComparisonOperator.NOT_EQUAL_TO, (actual, expected) -> !equalValues(actual, expected));
        map.put(ComparisonOperator.GREATER_THAN,
                ordering(ComparisonOperator.GREATER_THAN, NumericComparison.GT, c -> c > 0));
        map.put(ComparisonOperator.GREATER_THAN_OR_EQUAL,
                ordering(ComparisonOperator.GREATER_THAN_OR_EQUAL, NumericComparison.GE, c -> c >= 0));
        map.put(ComparisonOperator.LESS_THAN,
                ordering(ComparisonOperator.LESS_THAN, NumericComparison.LT, c -> c < 0));
        map.put(ComparisonOperator.LESS_THAN_OR_EQUAL,
                ordering(ComparisonOperator.LESS_THAN_OR_EQUAL, NumericComparison.LE, c -> c <= 0));
        this.predicates = Collections.unmodifiableMap(map);
    }

    /**
     * The registry with the six standard operators.
     */
    public static OperatorRegistry standard() {
        return STANDARD;
    }

    public Optional<ComparisonPredicate> lookup(String symbol) {
        return ComparisonOperator.fromSymbol(symbol).map(predicates::get);
    }

    public Optional<ComparisonPredicate> lookup(ComparisonOperator operator) {
        return Optional.ofNullable(operator == null ? null : predicates.get(operator));
    }

    public int size() {
        return predicates.size();
    }

    private static boolean equalValues(FactValue actual, FactValue expected) {
        if (actual.kind() != expected.kind()) {
            return false;
        }
        if (actual.isNumber()) {
            // Primitive comparison so that NaN never equals itself
            return actual.asNumber() == expected.asNumber();
        }
        return actual.value().equals(expected.value());
    }

    private static ComparisonPredicate ordering(ComparisonOperator operator,
                                                NumericComparison numeric,
                                                IntPredicate lexical) {
        return (actual, expected) -> {
            if (actual.kind() != expected.kind()) {
                throw new IncompatibleComparisonException(operator, actual, expected);
            }
            return switch (actual.kind()) {
                case NUMBER -> numeric.test(actual.asNumber(), expected.asNumber());
                case TEXT -> lexical.test(actual.asText().compareTo(expected.asText()));
                case BOOLEAN -> throw new IncompatibleComparisonException(operator, actual, expected);
            };
        };
    }

    private enum NumericComparison {
        GT, GE, LT, LE;

        boolean test(double left, double right) {
            return switch (this) {
                case GT -> left > right;
                case GE -> left >= right;
                case LT -> left < right;
                case LE -> left <= right;
            };
        }
    }
}
