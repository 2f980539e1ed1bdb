/*
 * Copyright (c) 2025 Arbiter Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.arbiter.ruleengine.api.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Objects;

/**
 * A scalar value carried by a fact or by the right-hand side of a condition.
 *
 * <p>Values are tagged with their {@link Kind}; all numbers are held as {@code double}
 * so that {@code 3} and {@code 3.0} compare equal.
 *
 * @param kind  the value kind (never null)
 * @param value the payload: {@link Double}, {@link String} or {@link Boolean} matching the kind
 */
public record FactValue(Kind kind, Object value) {

    public enum Kind {
        NUMBER, TEXT, BOOLEAN
    }

    public FactValue {
        Objects.requireNonNull(kind, "Kind cannot be null");
        Objects.requireNonNull(value, "Value cannot be null");
        boolean consistent = switch (kind) {
            case NUMBER -> value instanceof Double;
            case TEXT -> value instanceof String;
            case BOOLEAN -> value instanceof Boolean;
        };
        if (!consistent) {
            throw new IllegalArgumentException(
                    "Value of type " + value.getClass().getSimpleName() + " does not match kind " + kind);
        }
    }

    public static FactValue number(double value) {
        return new FactValue(Kind.NUMBER, value);
    }

    public static FactValue text(String value) {
        return new FactValue(Kind.TEXT, value);
    }

    public static FactValue bool(boolean value) {
        return new FactValue(Kind.BOOLEAN, value);
    }

    /**
     * Converts a raw Java value into a fact value.
     *
     * @param raw a {@link Number}, {@link CharSequence} or {@link Boolean}
     * @return the tagged value
     * @throws IllegalArgumentException if the value is null or not a supported scalar
     */
    public static FactValue of(Object raw) {
        FactValue converted = ofNullable(raw);
        if (converted == null) {
            throw new IllegalArgumentException("Unsupported fact value: " + raw);
        }
        return converted;
    }

    /**
     * Lenient variant of {@link #of(Object)}.
     *
     * @return the tagged value, or null if {@code raw} is null or not a scalar
     */
    public static FactValue ofNullable(Object raw) {
        if (raw instanceof FactValue factValue) {
            return factValue;
        }
        if (raw instanceof Number number) {
            return number(number.doubleValue());
        }
        if (raw instanceof CharSequence text) {
            return text(text.toString());
        }
        if (raw instanceof Boolean bool) {
            return bool(bool);
        }
        return null;
    }

    @JsonIgnore
    public boolean isNumber() {
        return kind == Kind.NUMBER;
    }

    public double asNumber() {
        requireKind(Kind.NUMBER);
        return (Double) value;
    }

    public String asText() {
        requireKind(Kind.TEXT);
        return (String) value;
    }

    public boolean asBoolean() {
        requireKind(Kind.BOOLEAN);
        return (Boolean) value;
    }

    /**
     * Returns the plain JSON form: integral numbers are written without a fraction.
     */
    @JsonValue
    public Object toJson() {
        if (kind == Kind.NUMBER) {
            double number = (Double) value;
            if (number == Math.rint(number) && !Double.isInfinite(number)
                    && Math.abs(number) < Long.MAX_VALUE) {
                return (long) number;
            }
        }
        return value;
    }

    private void requireKind(Kind expected) {
        if (kind != expected) {
            throw new IllegalStateException("Value is " + kind + ", not " + expected);
        }
    }

    @Override
    public String toString() {
        return kind == Kind.TEXT ? "\"" + value + "\"" : String.valueOf(toJson());
    }
}
