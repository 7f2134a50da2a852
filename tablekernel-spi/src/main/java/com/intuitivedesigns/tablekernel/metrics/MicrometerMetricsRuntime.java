/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.tablekernel.metrics;

import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tag;
import io.micrometer.core.instrument.composite.CompositeMeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Metrics bridge for Micrometer.
 *
 * Features:
 * - Composite registry: an in-memory {@link SimpleMeterRegistry} is always attached so run
 *   statistics can be read back after a batch, other backends are added by providers.
 * - Push-style gauges mapped onto atomic state holders.
 * - Common tags (e.g. {@code pipeline=marketplace}) applied to every meter.
 */
public final class MicrometerMetricsRuntime implements MetricsRuntime {

    private static final Logger log = LoggerFactory.getLogger(MicrometerMetricsRuntime.class);

    private final CompositeMeterRegistry registry;
    private final SimpleMeterRegistry memory;

    // Micrometer gauges poll; keep the last pushed value here
    private final Map<String, AtomicDouble> gaugeState = new ConcurrentHashMap<>();

    public MicrometerMetricsRuntime() {
        this(Map.of());
    }

    public MicrometerMetricsRuntime(Map<String, String> commonTags) {
        this.registry = new CompositeMeterRegistry();
        this.memory = new SimpleMeterRegistry();
        this.registry.add(memory);

        if (commonTags != null && !commonTags.isEmpty()) {
            final List<Tag> tags = new ArrayList<>(commonTags.size());
            commonTags.forEach((k, v) -> tags.add(Tag.of(k, v)));
            this.registry.config().commonTags(tags);
        }
    }

    /**
     * Adds a specific registry (e.g., a logging registry) to the composite.
     */
    public void addRegistry(MeterRegistry specificRegistry) {
        this.registry.add(specificRegistry);
    }

    // --- Interface Implementation ---

    @Override
    public Object registry() {
        return registry;
    }

    @Override
    public boolean enabled() {
        return true;
    }

    @Override
    public String type() {
        return "MICROMETER";
    }

    @Override
    public void counter(String name) {
        registry.counter(name).increment();
    }

    @Override
    public void counter(String name, double increment) {
        if (increment > 0) {
            registry.counter(name).increment(increment);
        }
    }

    @Override
    public void timer(String name, long durationMillis) {
        registry.timer(name).record(durationMillis, TimeUnit.MILLISECONDS);
    }

    @Override
    public void gauge(String name, double value) {
        // computeIfAbsent registers the gauge exactly once
        AtomicDouble state = gaugeState.computeIfAbsent(name, key -> {
            AtomicDouble newState = new AtomicDouble(value);
            Gauge.builder(key, newState, AtomicDouble::get)
                    .register(registry);
            return newState;
        });
        state.set(value);
    }

    /**
     * Current count of a counter in the in-memory registry, 0 when never incremented.
     */
    public double counterValue(String name) {
        final var c = memory.find(name).counter();
        return c == null ? 0.0 : c.count();
    }

    /**
     * Number of recordings of a timer in the in-memory registry.
     */
    public long timerCount(String name) {
        final var t = memory.find(name).timer();
        return t == null ? 0L : t.count();
    }

    /**
     * Last pushed gauge value, or {@code NaN} when the gauge was never set.
     */
    public double gaugeValue(String name) {
        final AtomicDouble state = gaugeState.get(name);
        return state == null ? Double.NaN : state.get();
    }

    @Override
    public void close() {
        registry.close();
        log.info("Metrics Runtime Closed.");
    }

    /**
     * Mutable double for gauge state.
     */
    private static final class AtomicDouble extends Number {
        private final AtomicLong bits;

        AtomicDouble(double initialValue) {
            this.bits = new AtomicLong(Double.doubleToLongBits(initialValue));
        }

        void set(double newValue) {
            bits.set(Double.doubleToLongBits(newValue));
        }

        double get() {
            return Double.longBitsToDouble(bits.get());
        }

        @Override public int intValue() { return (int) get(); }
        @Override public long longValue() { return (long) get(); }
        @Override public float floatValue() { return (float) get(); }
        @Override public double doubleValue() { return get(); }
    }
}
