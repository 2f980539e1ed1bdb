/*
 * Copyright (c) 2025 Arbiter Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.arbiter.ruleengine.service.management;

import com.arbiter.ruleengine.api.IRuleSetLoader;
import com.arbiter.ruleengine.api.exceptions.RuleSetValidationException;
import com.arbiter.ruleengine.api.model.Rule;
import com.arbiter.ruleengine.api.model.RuleSet;
import com.arbiter.ruleengine.compiler.defaults.DefaultRuleSets;
import com.arbiter.ruleengine.infra.metrics.impl.inmemory.InMemoryMetricsRegistry;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanBuilder;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class RuleSetManagerTest {

    @Mock
    private IRuleSetLoader loader;

    @Mock
    private Tracer tracer;

    @Mock
    private SpanBuilder spanBuilder;

    @Mock
    private Span span;

    @Mock
    private Scope scope;

    @TempDir
    Path tempDir;

    private Path rulesPath;
    private InMemoryMetricsRegistry metrics;
    private RuleSetManager manager;

    private final RuleSet initialRules = RuleSet.of("file", List.of(
            Rule.builder("first").priority(10).then("A", "a").build()));
    private final RuleSet updatedRules = RuleSet.of("file", List.of(
            Rule.builder("first").priority(10).then("A", "a").build(),
            Rule.builder("second").priority(5).then("B", "b").build()));

    @BeforeEach
    void setUp() throws IOException {
        rulesPath = tempDir.resolve("rules.json");
        Files.writeString(rulesPath, "[]");
        metrics = new InMemoryMetricsRegistry();

        // Not every test reaches a traced code path
        lenient().when(tracer.spanBuilder(anyString())).thenReturn(spanBuilder);
        lenient().when(spanBuilder.startSpan()).thenReturn(span);
        lenient().when(span.makeCurrent()).thenReturn(scope);
    }

    @AfterEach
    void tearDown() {
        if (manager != null) {
            manager.shutdown();
        }
    }

    private RuleSetManager newManager() {
        manager = new RuleSetManager(rulesPath, tracer, loader, metrics, Duration.ofSeconds(10));
        return manager;
    }

    private void touch(String content) throws IOException {
        FileTime previous = Files.getLastModifiedTime(rulesPath);
        Files.writeString(rulesPath, content);
        Files.setLastModifiedTime(rulesPath, FileTime.fromMillis(previous.toMillis() + 5_000));
    }

    @Test
    void shouldLoadRuleSetOnInitialization() throws Exception {
        when(loader.load(any(Path.class))).thenReturn(initialRules);

        RuleSetManager manager = newManager();

        assertThat(manager.getRuleSet()).isEqualTo(initialRules);
        assertThat(manager.isUsingFallback()).isFalse();
        assertThat(metrics.getGaugeValue(RuleSetManager.ACTIVE_RULES_GAUGE)).isEqualTo(1.0);
        verify(loader).load(rulesPath);
    }

    @Test
    void shouldFallBackToDefaultsWhenFileIsMissing() throws Exception {
        Files.delete(rulesPath);

        RuleSetManager manager = newManager();

        assertThat(manager.getRuleSet()).isSameAs(DefaultRuleSets.scholarship());
        assertThat(manager.isUsingFallback()).isTrue();
        verify(loader, never()).load(any(Path.class));
    }

    @Test
    void shouldFallBackToDefaultsWhenInitialLoadFails() throws Exception {
        when(loader.load(any(Path.class))).thenThrow(new RuleSetValidationException("Rules must be a JSON array"));

        RuleSetManager manager = newManager();

        assertThat(manager.getRuleSet()).isSameAs(DefaultRuleSets.scholarship());
        assertThat(metrics.getGaugeValue(RuleSetManager.ACTIVE_RULES_GAUGE)).isEqualTo(6.0);
    }

    @Test
    void shouldReloadRuleSetWhenFileChanges() throws Exception {
        when(loader.load(any(Path.class))).thenReturn(initialRules, updatedRules);
        RuleSetManager manager = newManager();

        touch("[{\"name\": \"second\"}]");
        manager.checkForUpdates();

        assertThat(manager.getRuleSet()).isEqualTo(updatedRules);
        assertThat(metrics.getGaugeValue(RuleSetManager.ACTIVE_RULES_GAUGE)).isEqualTo(2.0);
        verify(loader, times(2)).load(rulesPath);
    }

    @Test
    void shouldNotReloadUnchangedFile() throws Exception {
        when(loader.load(any(Path.class))).thenReturn(initialRules);
        RuleSetManager manager = newManager();

        manager.checkForUpdates();
        manager.checkForUpdates();

        verify(loader, times(1)).load(rulesPath);
    }

    @Test
    void shouldKeepOldRuleSetIfReloadFails() throws Exception {
        when(loader.load(any(Path.class)))
                .thenReturn(initialRules)
                .thenThrow(new RuleSetValidationException("Reload failed"));
        RuleSetManager manager = newManager();

        touch("{broken");
        manager.checkForUpdates();
        manager.checkForUpdates();

        assertThat(manager.getRuleSet()).isEqualTo(initialRules);
        // The broken file is not retried until it changes again
        verify(loader, times(2)).load(rulesPath);
    }

    @Test
    void shouldPickUpFileCreatedAfterStartup() throws Exception {
        Files.delete(rulesPath);
        when(loader.load(any(Path.class))).thenReturn(initialRules);
        RuleSetManager manager = newManager();

        manager.checkForUpdates();
        assertThat(manager.isUsingFallback()).isTrue();

        Files.writeString(rulesPath, "[]");
        manager.checkForUpdates();

        assertThat(manager.getRuleSet()).isEqualTo(initialRules);
        assertThat(manager.isUsingFallback()).isFalse();
    }
}
