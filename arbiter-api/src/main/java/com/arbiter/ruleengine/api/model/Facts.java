/*
 * Copyright (c) 2025 Arbiter Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.arbiter.ruleengine.api.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable set of named scalar facts describing the subject under evaluation.
 *
 * <p>Entries whose value is not a supported scalar (null, lists, maps) are dropped when
 * building from raw values, so conditions on them behave exactly like conditions on an
 * absent field.
 */
public final class Facts {

    private static final Facts EMPTY = new Facts(Map.of());

    private final Map<String, FactValue> values;

    private Facts(Map<String, FactValue> values) {
        this.values = values;
    }

    public static Facts empty() {
        return EMPTY;
    }

    /**
     * Builds facts from raw values, e.g. {@code Map.of("cgpa", 3.8, "family_income", 5000)}.
     */
    public static Facts of(Map<String, ?> raw) {
        if (raw == null || raw.isEmpty()) {
            return EMPTY;
        }
        Map<String, FactValue> converted = new LinkedHashMap<>();
        raw.forEach((field, value) -> {
            FactValue factValue = FactValue.ofNullable(value);
            if (field != null && factValue != null) {
                converted.put(field, factValue);
            }
        });
        return new Facts(Collections.unmodifiableMap(converted));
    }

    public Optional<FactValue> get(String field) {
        return field == null ? Optional.empty() : Optional.ofNullable(values.get(field));
    }

    public boolean contains(String field) {
        return field != null && values.containsKey(field);
    }

    public int size() {
        return values.size();
    }

    @JsonValue
    public Map<String, FactValue> asMap() {
        return values;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Facts other)) return false;
        return values.equals(other.values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return "Facts" + values;
    }
}
