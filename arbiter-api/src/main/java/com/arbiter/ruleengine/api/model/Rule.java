/*
 * Copyright (c) 2025 Arbiter Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.arbiter.ruleengine.api.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A named, prioritized conjunction of conditions paired with an action.
 *
 * <p>An empty condition list matches every fact set; this is how catch-all rules are
 * written. Priorities need not be unique.
 *
 * @param name       rule name
 * @param priority   higher wins
 * @param conditions conditions, all of which must hold (never null)
 * @param action     the outcome, or null when the rule was authored without one
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Rule(
        @JsonProperty("name") String name,
        @JsonProperty("priority") int priority,
        @JsonProperty("conditions") List<Condition> conditions,
        @JsonProperty("action") Action action) {

    public Rule {
        if (conditions == null || conditions.isEmpty()) {
            conditions = List.of();
        } else {
            List<Condition> copy = new ArrayList<>(conditions.size());
            for (Condition condition : conditions) {
                copy.add(condition != null ? condition : Condition.malformed());
            }
            conditions = Collections.unmodifiableList(copy);
        }
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    @JsonIgnore
    public boolean isUnconditional() {
        return conditions.isEmpty();
    }

    @JsonIgnore
    public boolean hasWellFormedAction() {
        return action != null && action.isWellFormed();
    }

    public static final class Builder {
        private final String name;
        private int priority;
        private final List<Condition> conditions = new ArrayList<>();
        private Action action;

        private Builder(String name) {
            this.name = name;
        }

        public Builder priority(int priority) {
            this.priority = priority;
            return this;
        }

        public Builder when(String field, String operator, Object value) {
            conditions.add(Condition.of(field, operator, value));
            return this;
        }

        public Builder when(Condition condition) {
            conditions.add(condition);
            return this;
        }

        public Builder then(String decision, String reason) {
            this.action = new Action(decision, reason);
            return this;
        }

        public Builder action(Action action) {
            this.action = action;
            return this;
        }

        public Rule build() {
            return new Rule(name, priority, conditions, action);
        }
    }
}
