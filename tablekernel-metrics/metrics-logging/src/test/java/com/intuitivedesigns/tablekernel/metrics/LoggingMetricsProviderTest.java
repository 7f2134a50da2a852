/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.tablekernel.metrics;

import com.intuitivedesigns.tablekernel.config.PipelineConfig;
import io.micrometer.core.instrument.composite.CompositeMeterRegistry;
import io.micrometer.core.instrument.logging.LoggingMeterRegistry;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class LoggingMetricsProviderTest {

    @Test
    void createsMicrometerRuntimeWithLoggingRegistry() {
        MetricsSettings s = MetricsSettings.from(PipelineConfig.of(Map.of(
                "metrics.provider", "LOGGING",
                "metrics.tag.pipeline", "hospital")));

        try (MicrometerMetricsRuntime rt = (MicrometerMetricsRuntime) new LoggingMetricsProvider().create(s)) {
            CompositeMeterRegistry composite = (CompositeMeterRegistry) rt.registry();

            assertTrue(composite.getRegistries().stream().anyMatch(r -> r instanceof LoggingMeterRegistry));

            rt.counter("source.rows.read", 12);
            assertEquals(12.0, rt.counterValue("source.rows.read"));
            assertEquals("hospital", composite.get("source.rows.read").counter().getId().getTag("pipeline"));
        }
    }

    @Test
    void skipsWhenAnotherProviderIsSelected() {
        MetricsSettings s = MetricsSettings.from(PipelineConfig.of(Map.of("metrics.provider", "NOOP")));

        assertNull(new LoggingMetricsProvider().create(s));
    }
}
