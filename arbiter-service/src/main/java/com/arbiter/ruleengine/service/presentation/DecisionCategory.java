/*
 * Copyright (c) 2025 Arbiter Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.arbiter.ruleengine.service.presentation;

/**
 * How a decision is presented to the person reviewing an application.
 *
 * <p>Only the three award and rejection decisions have their own category; every other
 * decision, including the fallbacks and {@code NOT ELIGIBLE}, asks for manual review.
 */
public enum DecisionCategory {
    FULL_AWARD("AWARD FULL", "FULL SCHOLARSHIP RECOMMENDED"),
    PARTIAL_AWARD("AWARD PARTIAL", "PARTIAL SCHOLARSHIP RECOMMENDED"),
    REJECTION("REJECT", "REJECTION RECOMMENDED"),
    MANUAL_REVIEW(null, "MANUAL REVIEW REQUIRED");

    private final String decision;
    private final String headline;

    DecisionCategory(String decision, String headline) {
        this.decision = decision;
        this.headline = headline;
    }

    public String headline() {
        return headline;
    }

    public static DecisionCategory of(String decision) {
        for (DecisionCategory category : values()) {
            if (category.decision != null && category.decision.equals(decision)) {
                return category;
            }
        }
        return MANUAL_REVIEW;
    }
}
