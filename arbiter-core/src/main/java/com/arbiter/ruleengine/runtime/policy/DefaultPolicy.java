/*
 * Copyright (c) 2025 Arbiter Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.arbiter.ruleengine.runtime.policy;

import com.arbiter.ruleengine.api.model.Action;
import com.arbiter.ruleengine.api.model.Rule;

/**
 * Fallback outcomes used when resolution cannot take its action from a rule.
 *
 * <p>Downstream consumers branch on these exact decision strings; they must not change.
 */
public final class DefaultPolicy {

    public static final String MANUAL_REVIEW = "MANUAL_REVIEW";
    public static final String REVIEW = "REVIEW";

    /**
     * Returned when no rule fired.
     */
    public static final Action NO_MATCH = new Action(MANUAL_REVIEW, "No specific rule matched");

    /**
     * Returned when the winning rule has no usable action.
     */
    public static final Action MISSING_ACTION = new Action(REVIEW, "Matching rule has no defined action");

    private DefaultPolicy() {
        throw new AssertionError("No instances");
    }

    /**
     * The action to apply for a winning rule: its own action, or {@link #MISSING_ACTION}
     * if that is absent or has no decision.
     */
    public static Action actionFor(Rule rule) {
        return rule != null && rule.hasWellFormedAction() ? rule.action() : MISSING_ACTION;
    }

    public static boolean isFallback(Action action) {
        return NO_MATCH.equals(action) || MISSING_ACTION.equals(action);
    }
}
