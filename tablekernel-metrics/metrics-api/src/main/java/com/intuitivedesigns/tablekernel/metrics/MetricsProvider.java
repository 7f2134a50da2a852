/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.tablekernel.metrics;

/**
 * Service Provider Interface (SPI) for Metrics implementations.
 *
 * <p>Implementations are discovered via {@link java.util.ServiceLoader}.
 * To add a new metrics backend, implement this interface and register it in
 * {@code META-INF/services/com.intuitivedesigns.tablekernel.metrics.MetricsProvider}.
 */
public interface MetricsProvider {

    /**
     * The unique identifier for this provider (e.g., "LOGGING", "NOOP").
     * <p>This ID is matched against the {@code metrics.provider} configuration.
     */
    String id();

    /**
     * Creates a runtime instance for this provider if the settings match.
     *
     * @param settings The configuration settings.
     * @return A valid {@link MetricsRuntime} if this provider is selected,
     * or {@code null} if the provider should be skipped.
     */
    MetricsRuntime create(MetricsSettings settings);

    /**
     * @param configuredId The value from {@code metrics.provider}.
     * @return true if the IDs match (case-insensitive).
     */
    default boolean matches(String configuredId) {
        return configuredId != null && id().equalsIgnoreCase(configuredId.trim());
    }
}
