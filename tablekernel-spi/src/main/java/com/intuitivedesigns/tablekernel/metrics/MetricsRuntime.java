/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.tablekernel.metrics;

/**
 * The vendor-agnostic contract for Observability.
 *
 * Design Philosophy:
 * This interface decouples the kernel from specific implementations (Micrometer registries).
 * Everything has a NOOP default so a pipeline runs unchanged with metrics switched off.
 */
public interface MetricsRuntime extends AutoCloseable {

    /**
     * Returns the underlying registry (e.g., MeterRegistry) for advanced usage.
     */
    Object registry();

    /**
     * @return true if metrics are actually being recorded.
     */
    default boolean enabled() { return false; }

    /**
     * @return A string identifier for the implementation (e.g., "MICROMETER", "NOOP").
     */
    default String type() { return "NOOP"; }

    default void counter(String name) {}

    default void counter(String name, double increment) {}

    default void timer(String name, long durationMillis) {}

    default void gauge(String name, double value) {}

    @Override
    default void close() {
        // no-op by default
    }

    /**
     * A runtime that records nothing.
     */
    static MetricsRuntime noop() {
        return NoopHolder.INSTANCE;
    }

    final class NoopHolder {
        private static final MetricsRuntime INSTANCE = () -> NoopHolder.class;

        private NoopHolder() {}
    }
}
