/*
 * Copyright (c) 2025 Arbiter Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.arbiter.ruleengine.api.exceptions;

/**
 * Thrown when an external rule list does not have the expected structure.
 *
 * <p>Unchecked, like the rest of the engine's domain exceptions. Callers that need a
 * usable rule set regardless substitute the built-in default set on failure.
 */
public class RuleSetValidationException extends RuntimeException {

    private final int ruleIndex;

    public RuleSetValidationException(String message) {
        this(message, -1, null);
    }

    public RuleSetValidationException(String message, Throwable cause) {
        this(message, -1, cause);
    }

    public RuleSetValidationException(String message, int ruleIndex) {
        this(message, ruleIndex, null);
    }

    public RuleSetValidationException(String message, int ruleIndex, Throwable cause) {
        super(ruleIndex >= 0 ? "Rule at index " + ruleIndex + ": " + message : message, cause);
        this.ruleIndex = ruleIndex;
    }

    /**
     * Index of the offending rule, or -1 if the problem is not tied to one rule.
     */
    public int getRuleIndex() {
        return ruleIndex;
    }
}
