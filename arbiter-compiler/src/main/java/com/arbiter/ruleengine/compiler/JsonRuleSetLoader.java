/*
 * Copyright (c) 2025 Arbiter Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.arbiter.ruleengine.compiler;

import com.arbiter.ruleengine.api.IRuleSetLoader;
import com.arbiter.ruleengine.api.exceptions.RuleSetValidationException;
import com.arbiter.ruleengine.api.model.Action;
import com.arbiter.ruleengine.api.model.Condition;
import com.arbiter.ruleengine.api.model.Rule;
import com.arbiter.ruleengine.api.model.RuleSet;
import com.arbiter.ruleengine.compiler.defaults.DefaultRuleSets;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads rule sets from their JSON form:
 *
 * <pre>{@code
 * [
 *   {
 *     "name": "Low CGPA not eligible",
 *     "priority": 95,
 *     "conditions": [["cgpa", "<", 2.5]],
 *     "action": {"decision": "REJECT", "reason": "CGPA below minimum scholarship requirement"}
 *   }
 * ]
 * }</pre>
 *
 * <p>Structural problems reject the whole document with a
 * {@link RuleSetValidationException}. Problems inside a single condition triple do not:
 * the triple loads as a malformed condition, which never holds at evaluation time.
 * A missing {@code priority} is 0, missing {@code conditions} is an empty list and a
 * missing {@code action} stays absent.
 */
public class JsonRuleSetLoader implements IRuleSetLoader {
    private static final Logger logger = LoggerFactory.getLogger(JsonRuleSetLoader.class);

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final Tracer tracer;

    public JsonRuleSetLoader() {
        this(OpenTelemetry.noop().getTracer("arbiter-compiler"));
    }

    public JsonRuleSetLoader(Tracer tracer) {
        this.tracer = tracer;
    }

    @Override
    public RuleSet load(Path rulesPath) throws IOException {
        Span span = tracer.spanBuilder("load-rules").startSpan();
        try (Scope scope = span.makeCurrent()) {
            span.setAttribute("ruleFilePath", rulesPath.toString());
            String content = Files.readString(rulesPath);
            RuleSet ruleSet = parse(content, rulesPath.toString());
            logger.info("Loaded {} rules from {}", ruleSet.size(), rulesPath);
            return ruleSet;
        } catch (IOException | RuleSetValidationException e) {
            span.recordException(e);
            throw e;
        } finally {
            span.end();
        }
    }

    @Override
    public RuleSet parse(String content, String source) {
        Span span = tracer.spanBuilder("parse-rules").startSpan();
        try (Scope scope = span.makeCurrent()) {
            JsonNode root = readTree(content);
            if (root == null || !root.isArray()) {
                throw new RuleSetValidationException("Rules must be a JSON array");
            }

            List<Rule> rules = new ArrayList<>(root.size());
            for (int i = 0; i < root.size(); i++) {
                rules.add(toRule(root.get(i), i));
            }
            span.setAttribute("ruleCount", rules.size());
            return RuleSet.of(source, rules);
        } catch (RuleSetValidationException e) {
            span.recordException(e);
            throw e;
        } finally {
            span.end();
        }
    }

    /**
     * Parses the rules, substituting {@link DefaultRuleSets#scholarship()} when they are
     * invalid. The returned set's source tells the two cases apart.
     */
    public RuleSet parseOrDefault(String content, String source) {
        try {
            return parse(content, source);
        } catch (RuleSetValidationException e) {
            logger.warn("Invalid rules from {}, using the default rule set: {}", source, e.getMessage());
            return DefaultRuleSets.scholarship();
        }
    }

    /**
     * Writes the rule set in the same JSON form {@link #parse} reads.
     */
    public String toJson(RuleSet ruleSet) {
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(ruleSet.rules());
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Cannot serialize rule set " + ruleSet.source(), e);
        }
    }

    private JsonNode readTree(String content) {
        if (content == null || content.isBlank()) {
            throw new RuleSetValidationException("Rules content is empty");
        }
        try {
            return objectMapper.readTree(content);
        } catch (JsonProcessingException e) {
            throw new RuleSetValidationException("Invalid rules JSON: " + e.getOriginalMessage(), e);
        }
    }

    private Rule toRule(JsonNode node, int index) {
        if (node == null || !node.isObject()) {
            throw new RuleSetValidationException("rule must be a JSON object", index);
        }

        JsonNode name = node.get("name");
        if (name == null || !name.isTextual() || name.textValue().isBlank()) {
            throw new RuleSetValidationException("missing or empty name", index);
        }

        return new Rule(
                name.textValue(),
                toPriority(node.get("priority"), index),
                toConditions(node.get("conditions"), index),
                toAction(node.get("action"), index));
    }

    private static int toPriority(JsonNode node, int index) {
        if (node == null || node.isNull()) {
            return 0;
        }
        if (node.isIntegralNumber() && node.canConvertToInt()) {
            return node.intValue();
        }
        if (node.isFloatingPointNumber() && node.canConvertToExactIntegral() && node.canConvertToInt()) {
            return node.intValue();
        }
        throw new RuleSetValidationException("priority must be an integer, got " + node, index);
    }

    private List<Condition> toConditions(JsonNode node, int index) {
        if (node == null || node.isNull()) {
            return List.of();
        }
        if (!node.isArray()) {
            throw new RuleSetValidationException("conditions must be a JSON array", index);
        }

        List<Condition> conditions = new ArrayList<>(node.size());
        for (int j = 0; j < node.size(); j++) {
            JsonNode triple = node.get(j);
            if (!triple.isArray()) {
                throw new RuleSetValidationException("condition " + j + " must be a [field, operator, value] array", index);
            }
            Condition condition = Condition.fromTriple(objectMapper.convertValue(triple, List.class));
            if (!condition.isWellFormed()) {
                logger.warn("Rule at index {} has malformed condition {}: it will never hold", index, triple);
            }
            conditions.add(condition);
        }
        return conditions;
    }

    private static Action toAction(JsonNode node, int index) {
        if (node == null || node.isNull()) {
            return null;
        }
        if (!node.isObject()) {
            throw new RuleSetValidationException("action must be a JSON object", index);
        }
        return new Action(textOrNull(node.get("decision")), textOrNull(node.get("reason")));
    }

    private static String textOrNull(JsonNode node) {
        return node != null && node.isValueNode() && !node.isNull() ? node.asText() : null;
    }
}
