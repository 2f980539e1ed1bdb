/*
 * Copyright (c) 2025 Arbiter Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.arbiter.ruleengine.infra.telemetry;

import com.arbiter.ruleengine.infra.config.Config;
import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.api.trace.propagation.W3CTraceContextPropagator;
import io.opentelemetry.context.propagation.ContextPropagators;
import io.opentelemetry.exporter.logging.LoggingSpanExporter;
import io.opentelemetry.exporter.otlp.trace.OtlpGrpcSpanExporter;
import io.opentelemetry.sdk.OpenTelemetrySdk;
import io.opentelemetry.sdk.resources.Resource;
import io.opentelemetry.sdk.trace.SdkTracerProvider;
import io.opentelemetry.sdk.trace.export.BatchSpanProcessor;
import io.opentelemetry.sdk.trace.export.SpanExporter;
import io.opentelemetry.sdk.trace.samplers.Sampler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * OpenTelemetry tracing setup for the engine.
 *
 * <p>Configuration, read from environment variables with system-property fallback:
 * <ul>
 *   <li>{@code OTEL_DISABLED}: disable tracing entirely (default: false)</li>
 *   <li>{@code OTEL_EXPORTER_TYPE}: {@code logging} or {@code otlp} (default: logging)</li>
 *   <li>{@code OTEL_EXPORTER_OTLP_ENDPOINT}: OTLP endpoint (default: http://localhost:4317)</li>
 *   <li>{@code OTEL_TRACE_SAMPLING_RATIO}: 0.0-1.0 (default: 1.0)</li>
 *   <li>{@code SERVICE_NAME}: service identifier (default: arbiter-rule-engine)</li>
 * </ul>
 *
 * <p>Any failure during setup falls back to a no-op tracer; tracing never prevents the
 * engine from running.
 */
public final class TracingService {
    private static final Logger logger = LoggerFactory.getLogger(TracingService.class);

    public static final String INSTRUMENTATION_NAME = "com.arbiter.rule-engine";
    private static final String DEFAULT_SERVICE_NAME = "arbiter-rule-engine";

    private static final AttributeKey<String> SERVICE_NAME = AttributeKey.stringKey("service.name");

    private static volatile TracingService instance;
    private static final Object LOCK = new Object();

    private final OpenTelemetry openTelemetry;
    private final Tracer tracer;
    private final SdkTracerProvider tracerProvider;

    private TracingService(OpenTelemetry openTelemetry, SdkTracerProvider tracerProvider) {
        this.openTelemetry = openTelemetry;
        this.tracer = openTelemetry.getTracer(INSTRUMENTATION_NAME);
        this.tracerProvider = tracerProvider;
    }

    public static TracingService getInstance() {
        TracingService current = instance;
        if (current == null) {
            synchronized (LOCK) {
                current = instance;
                if (current == null) {
                    current = initialize();
                    instance = current;
                }
            }
        }
        return current;
    }

    private static TracingService initialize() {
        if (Boolean.parseBoolean(Config.get("OTEL_DISABLED", "false"))) {
            logger.info("OpenTelemetry tracing is disabled");
            return noop();
        }
        try {
            Resource resource = Resource.getDefault().merge(Resource.create(
                    Attributes.of(SERVICE_NAME, Config.get("SERVICE_NAME", DEFAULT_SERVICE_NAME))));

            SdkTracerProvider tracerProvider = SdkTracerProvider.builder()
                    .setResource(resource)
                    .setSampler(Sampler.parentBased(Sampler.traceIdRatioBased(samplingRatio())))
                    .addSpanProcessor(BatchSpanProcessor.builder(exporter())
                            .setMaxQueueSize(4096)
                            .setScheduleDelay(Duration.ofSeconds(5))
                            .build())
                    .build();

            OpenTelemetrySdk sdk = OpenTelemetrySdk.builder()
                    .setTracerProvider(tracerProvider)
                    .setPropagators(ContextPropagators.create(W3CTraceContextPropagator.getInstance()))
                    .build();

            TracingService service = new TracingService(sdk, tracerProvider);
            Runtime.getRuntime().addShutdownHook(new Thread(service::shutdown, "otel-shutdown-hook"));
            logger.info("OpenTelemetry tracing initialized");
            return service;
        } catch (RuntimeException e) {
            logger.error("Failed to initialize OpenTelemetry, falling back to noop", e);
            return noop();
        }
    }

    private static TracingService noop() {
        return new TracingService(OpenTelemetry.noop(), null);
    }

    private static double samplingRatio() {
        String raw = Config.get("OTEL_TRACE_SAMPLING_RATIO", "1.0");
        try {
            return Math.max(0.0, Math.min(1.0, Double.parseDouble(raw)));
        } catch (NumberFormatException e) {
            logger.warn("Invalid OTEL_TRACE_SAMPLING_RATIO '{}', sampling everything", raw);
            return 1.0;
        }
    }

    private static SpanExporter exporter() {
        String type = Config.get("OTEL_EXPORTER_TYPE", "logging").toLowerCase();
        if ("otlp".equals(type)) {
            String endpoint = Config.get("OTEL_EXPORTER_OTLP_ENDPOINT", "http://localhost:4317");
            logger.info("Using OTLP span exporter: {}", endpoint);
            return OtlpGrpcSpanExporter.builder()
                    .setEndpoint(endpoint)
                    .setTimeout(30, TimeUnit.SECONDS)
                    .build();
        }
        if (!"logging".equals(type)) {
            logger.warn("Unknown exporter type '{}', using logging exporter", type);
        }
        return LoggingSpanExporter.create();
    }

    public void shutdown() {
        if (tracerProvider == null) {
            return;
        }
        tracerProvider.shutdown().join(10, TimeUnit.SECONDS);
        logger.info("OpenTelemetry shutdown complete");
    }

    public Tracer getTracer() {
        return tracer;
    }

    public OpenTelemetry getOpenTelemetry() {
        return openTelemetry;
    }

    public boolean isEnabled() {
        return tracerProvider != null;
    }
}
