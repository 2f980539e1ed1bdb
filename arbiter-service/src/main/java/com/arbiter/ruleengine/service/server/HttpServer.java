/*
 * Copyright (c) 2025 Arbiter Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.arbiter.ruleengine.service.server;

import com.arbiter.ruleengine.api.IRuleResolver;
import com.arbiter.ruleengine.api.model.EvaluationResult;
import com.arbiter.ruleengine.api.model.Facts;
import com.arbiter.ruleengine.api.model.RuleSet;
import com.arbiter.ruleengine.compiler.JsonRuleSetLoader;
import com.arbiter.ruleengine.compiler.defaults.DefaultRuleSets;
import com.arbiter.ruleengine.infra.metrics.MetricsRegistry;
import com.arbiter.ruleengine.infra.metrics.impl.prometheus.PrometheusMetricsRegistry;
import com.arbiter.ruleengine.service.management.RuleSetManager;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.exporter.common.TextFormat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.StringWriter;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Lightweight HTTP front end for the rule engine.
 *
 * <h2>Endpoints</h2>
 * <ul>
 *   <li>POST /resolve - Resolve facts against the managed rules, or against rules sent
 *       with the request</li>
 *   <li>GET /rules - The active rule set, in rule-file form</li>
 *   <li>GET /health - Health check</li>
 *   <li>GET /metrics - Prometheus text exposition</li>
 * </ul>
 *
 * <p>Requests are served by a fixed pool of twice as many threads as there are cores.
 * The resolver is stateless and the manager hands out immutable snapshots, so handlers
 * share them without locking.
 */
public class HttpServer {
    private static final Logger logger = LoggerFactory.getLogger(HttpServer.class);

    static final String HTTP_REQUESTS = "arbiter_http_requests_total";
    private static final String REQUEST_RULES_SOURCE = "request";

    private final com.sun.net.httpserver.HttpServer server;
    private final ExecutorService executor;
    private final Tracer tracer;
    private final ObjectMapper objectMapper;
    private final RuleSetManager ruleSetManager;
    private final IRuleResolver resolver;
    private final JsonRuleSetLoader loader;
    private final MetricsRegistry metrics;
    private final CollectorRegistry collectorRegistry;

    /**
     * @param port           the port to listen on, 0 for any free port
     * @param ruleSetManager source of the active rule set
     * @param resolver       the resolution engine
     * @param loader         parses rules sent with a request
     * @param metrics        registry for request counters; a Prometheus registry is also
     *                       what {@code /metrics} exposes
     * @param tracer         OpenTelemetry tracer
     * @throws IOException if the server cannot bind
     */
    public HttpServer(int port, RuleSetManager ruleSetManager, IRuleResolver resolver,
                      JsonRuleSetLoader loader, MetricsRegistry metrics, Tracer tracer) throws IOException {
        this.ruleSetManager = Objects.requireNonNull(ruleSetManager, "RuleSetManager cannot be null");
        this.resolver = Objects.requireNonNull(resolver, "Resolver cannot be null");
        this.loader = Objects.requireNonNull(loader, "Loader cannot be null");
        this.metrics = Objects.requireNonNull(metrics, "MetricsRegistry cannot be null");
        this.tracer = Objects.requireNonNull(tracer, "Tracer cannot be null");
        this.collectorRegistry = metrics instanceof PrometheusMetricsRegistry prometheus
                ? prometheus.getCollectorRegistry()
                : CollectorRegistry.defaultRegistry;
        this.objectMapper = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        this.server = com.sun.net.httpserver.HttpServer.create(new InetSocketAddress(port), 0);

        this.server.createContext("/resolve", new ResolveHandler());
        this.server.createContext("/rules", new RulesHandler());
        this.server.createContext("/health", new HealthHandler());
        this.server.createContext("/metrics", new MetricsHandler());

        int coreCount = Runtime.getRuntime().availableProcessors();
        this.executor = Executors.newFixedThreadPool(coreCount * 2);
        this.server.setExecutor(executor);
    }

    /**
     * Starts the rule file monitor and the server.
     */
    public void start() {
        ruleSetManager.start();
        server.start();
        logger.info("Arbiter rule engine listening on port {}", getPort());
        logger.info("Endpoints: /resolve (POST), /rules (GET), /health (GET), /metrics (GET)");
    }

    public void stop(int delaySeconds) {
        logger.info("Stopping server...");
        ruleSetManager.shutdown();
        server.stop(delaySeconds);
        executor.shutdown();
    }

    public int getPort() {
        return server.getAddress().getPort();
    }

    class ResolveHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            if (!"POST".equals(exchange.getRequestMethod())) {
                sendError(exchange, 405, "Method Not Allowed");
                return;
            }

            Span span = tracer.spanBuilder("http-resolve").startSpan();
            try (Scope scope = span.makeCurrent()) {
                ResolveRequest request;
                try (InputStream is = exchange.getRequestBody()) {
                    request = objectMapper.readValue(is, ResolveRequest.class);
                } catch (JsonProcessingException e) {
                    span.recordException(e);
                    sendError(exchange, 400, "Invalid request body: " + e.getOriginalMessage());
                    return;
                }
                if (request == null || request.facts() == null) {
                    sendError(exchange, 400, "Request must contain a 'facts' object");
                    return;
                }

                RuleSet rules;
                boolean rulesFallback;
                if (request.hasRules()) {
                    rules = loader.parseOrDefault(request.rules().toString(), REQUEST_RULES_SOURCE);
                    rulesFallback = DefaultRuleSets.isDefault(rules);
                } else {
                    rules = ruleSetManager.getRuleSet();
                    rulesFallback = ruleSetManager.isUsingFallback();
                }
                span.setAttribute("rules.source", rules.source());

                Facts facts = Facts.of(request.facts());
                ResolveResponse response;
                if (request.trace()) {
                    EvaluationResult result = resolver.resolveWithTrace(facts, rules);
                    response = ResolveResponse.from(result.matchResult(), rulesFallback, result.trace());
                } else {
                    response = ResolveResponse.from(resolver.resolve(facts, rules), rulesFallback, null);
                }
                span.setAttribute("decision", response.decision());

                sendResponse(exchange, 200, objectMapper.writeValueAsString(response));
            } catch (IOException | RuntimeException e) {
                span.recordException(e);
                logger.error("Error during resolution", e);
                sendError(exchange, 500, "Internal Server Error");
            } finally {
                span.end();
            }
        }
    }

    class RulesHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            if (!"GET".equals(exchange.getRequestMethod())) {
                sendError(exchange, 405, "Method Not Allowed");
                return;
            }
            RuleSet active = ruleSetManager.getRuleSet();
            exchange.getResponseHeaders().set("X-Rules-Source", active.source());
            sendResponse(exchange, 200, loader.toJson(active));
        }
    }

    class HealthHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            if (!"GET".equals(exchange.getRequestMethod())) {
                sendError(exchange, 405, "Method Not Allowed");
                return;
            }
            RuleSet active = ruleSetManager.getRuleSet();
            Map<String, Object> body = new LinkedHashMap<>();
            boolean up = active != null && !active.isEmpty();
            body.put("status", up ? "UP" : "DOWN");
            if (active != null) {
                body.put("rulesSource", active.source());
                body.put("ruleCount", active.size());
                body.put("rulesFallback", ruleSetManager.isUsingFallback());
            }
            sendResponse(exchange, up ? 200 : 503, objectMapper.writeValueAsString(body));
        }
    }

    class MetricsHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            if (!"GET".equals(exchange.getRequestMethod())) {
                sendError(exchange, 405, "Method Not Allowed");
                return;
            }
            StringWriter writer = new StringWriter();
            TextFormat.write004(writer, collectorRegistry.metricFamilySamples());
            send(exchange, 200, TextFormat.CONTENT_TYPE_004, writer.toString());
        }
    }

    private void sendError(HttpExchange exchange, int statusCode, String message) throws IOException {
        sendResponse(exchange, statusCode, objectMapper.writeValueAsString(Map.of("error", message)));
    }

    private void sendResponse(HttpExchange exchange, int statusCode, String body) throws IOException {
        send(exchange, statusCode, "application/json", body);
    }

    private void send(HttpExchange exchange, int statusCode, String contentType, String body) throws IOException {
        metrics.counter(HTTP_REQUESTS,
                "endpoint", exchange.getHttpContext().getPath(),
                "status", String.valueOf(statusCode)).increment();
        exchange.getResponseHeaders().set("Content-Type", contentType);
        byte[] responseBytes = body.getBytes(StandardCharsets.UTF_8);
        exchange.sendResponseHeaders(statusCode, responseBytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(responseBytes);
        }
    }
}
