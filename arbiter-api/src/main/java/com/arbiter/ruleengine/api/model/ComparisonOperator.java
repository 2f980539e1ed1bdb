/*
 * Copyright (c) 2025 Arbiter Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.arbiter.ruleengine.api.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Optional;

/**
 * The fixed set of comparison operators a condition may use.
 *
 * <p>Rules refer to operators by symbol ({@code ">="}, {@code "=="}, ...). The symbol is
 * resolved to a tag once, so evaluation never dispatches on raw strings.
 */
public enum ComparisonOperator {
    EQUAL_TO("=="),
    NOT_EQUAL_TO("!="),
    GREATER_THAN(">"),
    GREATER_THAN_OR_EQUAL(">="),
    LESS_THAN("<"),
    LESS_THAN_OR_EQUAL("<=");

    private final String symbol;

    ComparisonOperator(String symbol) {
        this.symbol = symbol;
    }

    @JsonValue
    public String symbol() {
        return symbol;
    }

    /**
     * Resolves a symbol to its operator.
     *
     * @param symbol the operator symbol, e.g. {@code "<="}
     * @return the operator, or empty if the symbol is null or not registered
     */
    public static Optional<ComparisonOperator> fromSymbol(String symbol) {
        if (symbol == null) {
            return Optional.empty();
        }
        String trimmed = symbol.trim();
        for (ComparisonOperator operator : values()) {
            if (operator.symbol.equals(trimmed)) {
                return Optional.of(operator);
            }
        }
        return Optional.empty();
    }

    /**
     * Checks if this operator orders its operands rather than testing equality.
     */
    public boolean isRelational() {
        return this != EQUAL_TO && this != NOT_EQUAL_TO;
    }
}
