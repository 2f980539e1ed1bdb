/*
 * Copyright (c) 2025 Arbiter Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.arbiter.ruleengine.service.server;

import com.arbiter.ruleengine.compiler.JsonRuleSetLoader;
import com.arbiter.ruleengine.compiler.defaults.DefaultRuleSets;
import com.arbiter.ruleengine.infra.metrics.impl.prometheus.PrometheusMetricsRegistry;
import com.arbiter.ruleengine.runtime.evaluation.ConditionEvaluator;
import com.arbiter.ruleengine.runtime.evaluation.ResolutionEngine;
import com.arbiter.ruleengine.runtime.evaluation.RuleMatcher;
import com.arbiter.ruleengine.runtime.operators.OperatorRegistry;
import com.arbiter.ruleengine.service.management.RuleSetManager;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Tracer;
import io.prometheus.client.CollectorRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class HttpServerTest {

    private static final String MERIT_FACTS = """
            {"cgpa": 3.8, "co_curricular_score": 85, "family_income": 5000, "disciplinary_actions": 0}
            """;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final HttpClient client = HttpClient.newBuilder().version(HttpClient.Version.HTTP_1_1).build();

    @TempDir
    Path tempDir;

    private HttpServer server;
    private String baseUrl;

    @BeforeEach
    void setUp() throws IOException {
        Tracer tracer = OpenTelemetry.noop().getTracer("test");
        PrometheusMetricsRegistry metrics = new PrometheusMetricsRegistry(new CollectorRegistry());
        JsonRuleSetLoader loader = new JsonRuleSetLoader(tracer);

        Path rulesPath = tempDir.resolve("rules.json");
        Files.writeString(rulesPath, loader.toJson(DefaultRuleSets.scholarship()));

        RuleSetManager manager = new RuleSetManager(rulesPath, tracer, loader, metrics, Duration.ofSeconds(60));
        ResolutionEngine engine = new ResolutionEngine(
                new RuleMatcher(new ConditionEvaluator(OperatorRegistry.standard(), metrics)), tracer, metrics);

        server = new HttpServer(0, manager, engine, loader, metrics, tracer);
        server.start();
        baseUrl = "http://localhost:" + server.getPort();
    }

    @AfterEach
    void tearDown() {
        server.stop(0);
    }

    private HttpResponse<String> post(String path, String body) throws Exception {
        HttpRequest request = HttpRequest.newBuilder(URI.create(baseUrl + path))
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(body))
                .build();
        return client.send(request, HttpResponse.BodyHandlers.ofString());
    }

    private HttpResponse<String> get(String path) throws Exception {
        HttpRequest request = HttpRequest.newBuilder(URI.create(baseUrl + path)).GET().build();
        return client.send(request, HttpResponse.BodyHandlers.ofString());
    }

    @Test
    @DisplayName("Should resolve facts against the managed rules")
    void shouldResolveWithManagedRules() throws Exception {
        HttpResponse<String> response = post("/resolve", "{\"facts\": " + MERIT_FACTS + "}");

        assertThat(response.statusCode()).isEqualTo(200);
        JsonNode body = objectMapper.readTree(response.body());
        assertThat(body.get("decision").asText()).isEqualTo("AWARD FULL");
        assertThat(body.get("category").asText()).isEqualTo("FULL_AWARD");
        assertThat(body.get("headline").asText()).isEqualTo("FULL SCHOLARSHIP RECOMMENDED");
        assertThat(body.get("rulesFallback").asBoolean()).isFalse();
        assertThat(body.get("firedRules")).hasSize(3);
        assertThat(body.get("firedRules").get(0).get("name").asText()).isEqualTo("Top merit candidate");
        assertThat(body.get("firedRules").get(0).get("priority").asInt()).isEqualTo(100);
        assertThat(body.has("trace")).isFalse();
    }

    @Test
    @DisplayName("Should use rules sent with the request")
    void shouldResolveWithRequestRules() throws Exception {
        String body = """
                {
                  "facts": {"faculty": "LAW"},
                  "rules": [
                    {"name": "Law bursary", "priority": 5, "conditions": [["faculty", "==", "LAW"]],
                     "action": {"decision": "AWARD PARTIAL", "reason": "Faculty bursary"}}
                  ]
                }
                """;

        JsonNode response = objectMapper.readTree(post("/resolve", body).body());

        assertThat(response.get("decision").asText()).isEqualTo("AWARD PARTIAL");
        assertThat(response.get("reason").asText()).isEqualTo("Faculty bursary");
        assertThat(response.get("rulesFallback").asBoolean()).isFalse();
    }

    @Test
    @DisplayName("Should fall back to the default rules when request rules are invalid")
    void shouldFallBackForInvalidRequestRules() throws Exception {
        String body = "{\"facts\": " + MERIT_FACTS + ", \"rules\": {\"name\": \"not a list\"}}";

        JsonNode response = objectMapper.readTree(post("/resolve", body).body());

        assertThat(response.get("decision").asText()).isEqualTo("AWARD FULL");
        assertThat(response.get("rulesFallback").asBoolean()).isTrue();
    }

    @Test
    @DisplayName("Should include the trace on request")
    void shouldIncludeTrace() throws Exception {
        String body = "{\"facts\": {\"cgpa\": 2.0}, \"trace\": true}";

        JsonNode response = objectMapper.readTree(post("/resolve", body).body());

        assertThat(response.get("decision").asText()).isEqualTo("REJECT");
        assertThat(response.get("category").asText()).isEqualTo("REJECTION");
        JsonNode outcomes = response.get("trace").get("rule_outcomes");
        assertThat(outcomes).hasSize(6);
        assertThat(outcomes.get(0).get("rule_name").asText()).isEqualTo("Top merit candidate");
        assertThat(outcomes.get(0).get("matched").asBoolean()).isFalse();
    }

    @Test
    @DisplayName("Should reject bad requests")
    void shouldRejectBadRequests() throws Exception {
        assertThat(get("/resolve").statusCode()).isEqualTo(405);
        assertThat(post("/resolve", "{not json").statusCode()).isEqualTo(400);
        assertThat(post("/resolve", "{\"rules\": []}").statusCode()).isEqualTo(400);
        assertThat(post("/health", "{}").statusCode()).isEqualTo(405);
    }

    @Test
    @DisplayName("Should serve the active rules in rule-file form")
    void shouldServeRules() throws Exception {
        HttpResponse<String> response = get("/rules");

        assertThat(response.statusCode()).isEqualTo(200);
        assertThat(new JsonRuleSetLoader().parse(response.body(), "served").rules())
                .containsExactlyElementsOf(DefaultRuleSets.scholarship().rules());
    }

    @Test
    @DisplayName("Should report health")
    void shouldReportHealth() throws Exception {
        HttpResponse<String> response = get("/health");

        assertThat(response.statusCode()).isEqualTo(200);
        JsonNode body = objectMapper.readTree(response.body());
        assertThat(body.get("status").asText()).isEqualTo("UP");
        assertThat(body.get("ruleCount").asInt()).isEqualTo(6);
        assertThat(body.get("rulesFallback").asBoolean()).isFalse();
    }

    @Test
    @DisplayName("Should expose Prometheus metrics")
    void shouldExposeMetrics() throws Exception {
        post("/resolve", "{\"facts\": " + MERIT_FACTS + "}");

        HttpResponse<String> response = get("/metrics");

        assertThat(response.statusCode()).isEqualTo(200);
        assertThat(response.headers().firstValue("Content-Type")).hasValueSatisfying(
                type -> assertThat(type).startsWith("text/plain"));
        assertThat(response.body())
                .contains("arbiter_resolutions_total{outcome=\"matched\",} 1.0")
                .contains("arbiter_active_rules 6.0")
                .contains("arbiter_resolve_seconds_count");
    }
}
