/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.tablekernel.metrics;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.ServiceLoader;

public final class MetricsFactory {

    private static final Logger log = LoggerFactory.getLogger(MetricsFactory.class);

    private MetricsFactory() {}

    public static MetricsRuntime init(MetricsSettings settings) {
        Objects.requireNonNull(settings, "settings");
        if (settings.disabled()) {
            log.info("Metrics disabled (metrics.provider=NONE).");
            return MetricsRuntime.noop();
        }
        return init(settings, ServiceLoader.load(MetricsProvider.class, resolveClassLoader()));
    }

    /**
     * Picks the first provider that accepts {@code settings}, NOOP when none does.
     */
    public static MetricsRuntime init(MetricsSettings settings, Iterable<MetricsProvider> providers) {
        Objects.requireNonNull(settings, "settings");

        for (MetricsProvider p : providers) {
            try {
                // Providers return null when metrics.provider names someone else
                final MetricsRuntime rt = p.create(settings);
                if (rt != null) {
                    log.info("Metrics Runtime initialized: {} ({})", p.id(), p.getClass().getName());
                    return rt;
                }
            } catch (RuntimeException | LinkageError e) {
                // LinkageError: provider jar present but its backend dependencies are not
                log.warn("Failed to initialize metrics provider [{}]: {}", p.getClass().getName(), e.getMessage());
                log.debug("Provider init stack trace:", e);
            }
        }

        log.info("No metrics provider matched '{}' (NOOP active).", settings.providerId);
        return MetricsRuntime.noop();
    }

    private static ClassLoader resolveClassLoader() {
        final ClassLoader threadCl = Thread.currentThread().getContextClassLoader();
        return (threadCl != null) ? threadCl : MetricsFactory.class.getClassLoader();
    }
}
