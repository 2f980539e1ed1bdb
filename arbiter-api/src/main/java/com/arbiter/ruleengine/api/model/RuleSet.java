/*
 * Copyright (c) 2025 Arbiter Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.arbiter.ruleengine.api.model;

import java.util.List;
import java.util.Objects;

/**
 * Immutable, ordered collection of rules. Rule order is significant: it breaks ties
 * between rules of equal priority.
 *
 * @param source where the rules came from, e.g. a file path or {@code "default"}
 * @param rules  the rules in authoring order
 */
public record RuleSet(String source, List<Rule> rules) {

    public RuleSet {
        source = source != null ? source : "inline";
        rules = rules == null ? List.of() : rules.stream().filter(Objects::nonNull).toList();
    }

    public static RuleSet of(List<Rule> rules) {
        return new RuleSet("inline", rules);
    }

    public static RuleSet of(String source, List<Rule> rules) {
        return new RuleSet(source, rules);
    }

    public int size() {
        return rules.size();
    }

    public boolean isEmpty() {
        return rules.isEmpty();
    }
}
