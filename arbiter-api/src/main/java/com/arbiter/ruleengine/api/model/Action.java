/*
 * Copyright (c) 2025 Arbiter Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.arbiter.ruleengine.api.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Decision payload attached to a rule.
 *
 * @param decision decision label, e.g. {@code AWARD FULL} or {@code REJECT}
 * @param reason   human-readable justification
 */
public record Action(
        @JsonProperty("decision") String decision,
        @JsonProperty("reason") String reason) {

    /**
     * An action is usable only if it names a decision.
     */
    @JsonIgnore
    public boolean isWellFormed() {
        return decision != null && !decision.isBlank();
    }
}
