/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.tablekernel.metrics;

import io.micrometer.core.instrument.logging.LoggingMeterRegistry;
import io.micrometer.core.instrument.logging.LoggingRegistryConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * Publishes meters through SLF4J every {@code metrics.step.seconds}, and once more on close,
 * which is when a batch run's numbers actually show up.
 */
public final class LoggingMetricsProvider implements MetricsProvider {

    private static final Logger log = LoggerFactory.getLogger(LoggingMetricsProvider.class);
    private static final Logger metricsLog = LoggerFactory.getLogger("tablekernel.metrics");

    @Override
    public String id() {
        return "LOGGING";
    }

    @Override
    public MetricsRuntime create(MetricsSettings s) {
        if (s == null || !matches(s.providerId)) {
            return null;
        }

        final Duration step = s.step;
        final LoggingRegistryConfig cfg = new LoggingRegistryConfig() {
            @Override public String get(String key) { return null; }
            @Override public Duration step() { return step; }
        };

        final LoggingMeterRegistry reg = LoggingMeterRegistry.builder(cfg)
                .loggingSink(metricsLog::info)
                .build();

        final MicrometerMetricsRuntime runtime = new MicrometerMetricsRuntime(s.commonTags);
        runtime.addRegistry(reg);

        log.info("Logging Metrics Active (step={}s, tags={})", step.getSeconds(), s.commonTags);
        return runtime;
    }
}
