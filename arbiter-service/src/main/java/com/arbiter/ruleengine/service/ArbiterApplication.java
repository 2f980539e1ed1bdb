/*
 * Copyright (c) 2025 Arbiter Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.arbiter.ruleengine.service;

import com.arbiter.ruleengine.compiler.JsonRuleSetLoader;
import com.arbiter.ruleengine.infra.config.Config;
import com.arbiter.ruleengine.infra.metrics.MetricsRegistry;
import com.arbiter.ruleengine.infra.telemetry.TracingService;
import com.arbiter.ruleengine.runtime.evaluation.ResolutionEngine;
import com.arbiter.ruleengine.service.management.RuleSetManager;
import com.arbiter.ruleengine.service.server.HttpServer;
import io.opentelemetry.api.trace.Tracer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;

/**
 * Entry point. Settings are read from the environment or system properties:
 * <ul>
 *   <li>{@code rules.file} - rule file to serve and watch (default {@code rules.json})</li>
 *   <li>{@code server.port} - HTTP port (default 8080)</li>
 *   <li>{@code rules.reload.seconds} - rule file poll interval (default 10)</li>
 * </ul>
 */
public class ArbiterApplication {
    private static final Logger logger = LoggerFactory.getLogger(ArbiterApplication.class);

    private HttpServer httpServer;

    public static void main(String[] args) {
        try {
            ArbiterApplication app = new ArbiterApplication();
            app.start();
            Runtime.getRuntime().addShutdownHook(new Thread(app::shutdown));
            Thread.currentThread().join();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (IOException | RuntimeException e) {
            logger.error("Application failed to start: {}", e.getMessage(), e);
            System.exit(1);
        }
    }

    private void start() throws IOException {
        logger.info("Starting Arbiter rule engine");
        Tracer tracer = TracingService.getInstance().getTracer();
        MetricsRegistry metrics = MetricsRegistry.getInstance();

        Path rulesPath = Paths.get(Config.get("rules.file", "rules.json"));
        int port = Config.getInt("server.port", 8080);
        int reloadSeconds = Config.getInt("rules.reload.seconds", 10);

        JsonRuleSetLoader loader = new JsonRuleSetLoader(tracer);
        RuleSetManager ruleSetManager = new RuleSetManager(rulesPath, tracer, loader, metrics,
                Duration.ofSeconds(reloadSeconds));

        httpServer = new HttpServer(port, ruleSetManager, new ResolutionEngine(tracer), loader, metrics, tracer);
        httpServer.start();
        logger.info("Serving {} rules from {}", ruleSetManager.getRuleSet().size(), ruleSetManager.getRuleSet().source());
    }

    private void shutdown() {
        if (httpServer != null) {
            httpServer.stop(1);
        }
        logger.info("Arbiter rule engine shutdown complete");
    }
}
