/*
 * Copyright (c) 2025 Arbiter Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.arbiter.ruleengine.service.management;

import com.arbiter.ruleengine.api.IRuleSetLoader;
import com.arbiter.ruleengine.api.model.RuleSet;
import com.arbiter.ruleengine.compiler.defaults.DefaultRuleSets;
import com.arbiter.ruleengine.infra.metrics.Gauge;
import com.arbiter.ruleengine.infra.metrics.MetricsRegistry;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Owns the active rule set and keeps it in step with the rule file.
 *
 * <p>The file is loaded once at construction. If it is missing or invalid the built-in
 * scholarship rules are used instead, so the manager always has a usable set. After
 * {@link #start()} the file's modification time is polled and a changed file is
 * reloaded; a reload that fails leaves the previous set active.
 */
public class RuleSetManager {
    private static final Logger logger = LoggerFactory.getLogger(RuleSetManager.class);

    static final String ACTIVE_RULES_GAUGE = "arbiter_active_rules";
    private static final Duration DEFAULT_RELOAD_INTERVAL = Duration.ofSeconds(10);

    private final Path rulesPath;
    private final IRuleSetLoader loader;
    private final Tracer tracer;
    private final Duration reloadInterval;
    private final Gauge activeRules;

    /**
     * Readers always see a complete rule set; a reload swaps the whole reference.
     */
    private final AtomicReference<RuleSet> activeRuleSet = new AtomicReference<>();
    private final ScheduledExecutorService monitoringExecutor;

    private volatile long lastModifiedTime = -1;

    public RuleSetManager(Path rulesPath, Tracer tracer, IRuleSetLoader loader) {
        this(rulesPath, tracer, loader, MetricsRegistry.getInstance(), DEFAULT_RELOAD_INTERVAL);
    }

    public RuleSetManager(Path rulesPath, Tracer tracer, IRuleSetLoader loader,
                          MetricsRegistry metrics, Duration reloadInterval) {
        this.rulesPath = rulesPath;
        this.tracer = tracer;
        this.loader = loader;
        this.reloadInterval = reloadInterval;
        this.activeRules = metrics.gauge(ACTIVE_RULES_GAUGE);
        this.monitoringExecutor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "Rule-File-Monitor");
            t.setDaemon(true);
            return t;
        });

        loadInitial();
    }

    public RuleSet getRuleSet() {
        return activeRuleSet.get();
    }

    /**
     * @return true when the built-in rules are active because the rule file could not be used
     */
    public boolean isUsingFallback() {
        return DefaultRuleSets.isDefault(activeRuleSet.get());
    }

    public Path getRulesPath() {
        return rulesPath;
    }

    public void start() {
        long seconds = Math.max(1, reloadInterval.toSeconds());
        monitoringExecutor.scheduleAtFixedRate(this::checkForUpdates, seconds, seconds, TimeUnit.SECONDS);
        logger.info("Watching {} for changes every {}s", rulesPath, seconds);
    }

    public void shutdown() {
        monitoringExecutor.shutdown();
    }

    private void loadInitial() {
        if (!Files.exists(rulesPath)) {
            logger.warn("Rule file {} not found, using the default rule set", rulesPath);
            activate(DefaultRuleSets.scholarship());
            return;
        }
        try {
            reloadInternal();
        } catch (IOException | RuntimeException e) {
            logger.warn("Could not load rule file {}, using the default rule set: {}", rulesPath, e.getMessage());
            activate(DefaultRuleSets.scholarship());
        }
    }

    void checkForUpdates() {
        Span span = tracer.spanBuilder("check-for-rule-updates").startSpan();
        try (Scope scope = span.makeCurrent()) {
            span.setAttribute("ruleFile", rulesPath.toString());
            if (!Files.exists(rulesPath)) {
                logger.debug("Rule file {} does not exist, keeping the active rule set", rulesPath);
                return;
            }
            long currentModifiedTime = Files.getLastModifiedTime(rulesPath).toMillis();
            if (currentModifiedTime > lastModifiedTime) {
                span.addEvent("Change detected. Triggering reload.");
                logger.info("Change detected in rule file {}, reloading", rulesPath);
                loadRuleSet();
            }
        } catch (IOException e) {
            span.recordException(e);
            logger.warn("Could not check rule file {} for modifications", rulesPath, e);
        } catch (RuntimeException e) {
            span.recordException(e);
            logger.error("Unexpected error during rule reload check", e);
        } finally {
            span.end();
        }
    }

    private void loadRuleSet() {
        try {
            reloadInternal();
        } catch (IOException | RuntimeException e) {
            logger.error("Failed to load rule file {}. Previous rule set ({}) remains active.",
                    rulesPath, activeRuleSet.get().source(), e);
        }
    }

    private void reloadInternal() throws IOException {
        Span span = tracer.spanBuilder("load-rule-set").startSpan();
        try (Scope scope = span.makeCurrent()) {
            long modifiedTime = Files.getLastModifiedTime(rulesPath).toMillis();
            // Record the attempt so an invalid file is not retried until it changes again
            this.lastModifiedTime = modifiedTime;
            RuleSet ruleSet = loader.load(rulesPath);
            activate(ruleSet);
            span.setAttribute("ruleCount", ruleSet.size());
            logger.info("Activated {} rules from {}", ruleSet.size(), rulesPath);
        } catch (IOException | RuntimeException e) {
            span.recordException(e);
            throw e;
        } finally {
            span.end();
        }
    }

    private void activate(RuleSet ruleSet) {
        activeRuleSet.set(ruleSet);
        activeRules.set(ruleSet.size());
    }
}
