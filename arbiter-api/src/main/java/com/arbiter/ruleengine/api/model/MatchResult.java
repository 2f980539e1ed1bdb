/*
 * Copyright (c) 2025 Arbiter Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.arbiter.ruleengine.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.List;
import java.util.Optional;

/**
 * Outcome of resolving one fact set against a rule set.
 *
 * @param winningAction the selected action (never null)
 * @param firedRules    every matching rule, highest priority first; equal priorities
 *                      keep their rule-set order
 */
public record MatchResult(
        @JsonProperty("winning_action") Action winningAction,
        @JsonProperty("fired_rules") List<Rule> firedRules) implements Serializable {

    public MatchResult {
        firedRules = firedRules == null ? List.of() : List.copyOf(firedRules);
    }

    public boolean hasMatches() {
        return !firedRules.isEmpty();
    }

    /**
     * The rule whose action won, if any rule fired.
     */
    public Optional<Rule> winner() {
        return firedRules.isEmpty() ? Optional.empty() : Optional.of(firedRules.get(0));
    }

    public String decision() {
        return winningAction.decision();
    }

    public String reason() {
        return winningAction.reason();
    }
}
