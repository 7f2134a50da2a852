/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.tablekernel.config;

import com.intuitivedesigns.tablekernel.core.OutputSink;
import com.intuitivedesigns.tablekernel.core.SourceConnector;
import com.intuitivedesigns.tablekernel.core.Transformer;
import com.intuitivedesigns.tablekernel.metrics.MetricsRuntime;
import com.intuitivedesigns.tablekernel.spi.PipelinePlugin;
import com.intuitivedesigns.tablekernel.spi.PluginCatalog;
import com.intuitivedesigns.tablekernel.spi.SinkPlugin;
import com.intuitivedesigns.tablekernel.spi.SourcePlugin;
import com.intuitivedesigns.tablekernel.spi.TransformerPlugin;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

public final class PipelineFactory {

    private static final Logger log = LoggerFactory.getLogger(PipelineFactory.class);

    // Config keys
    public static final String KEY_SOURCE_TYPE = "source.type";
    public static final String KEY_SINK_TYPE = "sink.type";
    public static final String KEY_TRANSFORM_TYPE = "transform.type";

    // Defaults
    private static final String DEFAULT_SINK = "LOG";
    private static final String DEFAULT_TRANSFORM = "NOOP";

    private final PluginCatalog catalog;

    public PipelineFactory() {
        this(new PluginCatalog(resolveClassLoader()));
    }

    public PipelineFactory(PluginCatalog catalog) {
        this.catalog = Objects.requireNonNull(catalog, "catalog");
    }

    // --- FACTORY METHODS ---

    public SourceConnector<?> createSource(PipelineConfig config, MetricsRuntime metrics) {
        Objects.requireNonNull(config, "config");
        Objects.requireNonNull(metrics, "metrics");

        final String id = require(config, KEY_SOURCE_TYPE);
        final SourcePlugin plugin = catalog.sources().require(id, KEY_SOURCE_TYPE);
        return createSafe(plugin, config, metrics, "Source");
    }

    public OutputSink<?> createSink(PipelineConfig config, MetricsRuntime metrics) {
        Objects.requireNonNull(config, "config");
        Objects.requireNonNull(metrics, "metrics");

        final String id = normalizeId(config.getString(KEY_SINK_TYPE, DEFAULT_SINK), DEFAULT_SINK);
        final SinkPlugin plugin = catalog.sinks().require(id, KEY_SINK_TYPE);
        return createSafe(plugin, config, metrics, "Sink");
    }

    public Transformer<?, ?> createTransformer(PipelineConfig config, MetricsRuntime metrics) {
        Objects.requireNonNull(config, "config");
        Objects.requireNonNull(metrics, "metrics");

        final String id = normalizeId(config.getString(KEY_TRANSFORM_TYPE, DEFAULT_TRANSFORM), DEFAULT_TRANSFORM);
        final TransformerPlugin plugin = catalog.transformers().require(id, KEY_TRANSFORM_TYPE);
        return createSafe(plugin, config, metrics, "Transformer");
    }

    // --- UTILITIES ---

    public void logAvailablePlugins() {
        log.info("Plugin Catalog Loaded:");
        log.info("  Sources:      {}", catalog.sources().availableIds());
        log.info("  Transformers: {}", catalog.transformers().availableIds());
        log.info("  Sinks:        {}", catalog.sinks().availableIds());
    }

    private static String require(PipelineConfig config, String key) {
        final String v = config.getString(key, null);
        if (v == null) {
            throw new IllegalArgumentException("Missing required configuration key: " + key);
        }
        final String s = v.trim();
        if (s.isEmpty()) {
            throw new IllegalArgumentException("Blank value for required configuration key: " + key);
        }
        return s;
    }

    private static String normalizeId(String raw, String fallback) {
        if (raw == null) return fallback;
        final String s = raw.trim();
        return s.isEmpty() ? fallback : s;
    }

    private static ClassLoader resolveClassLoader() {
        final ClassLoader ctx = Thread.currentThread().getContextClassLoader();
        return (ctx != null) ? ctx : PipelineFactory.class.getClassLoader();
    }

    private static <T> T createSafe(PipelinePlugin<T> plugin,
                                    PipelineConfig config,
                                    MetricsRuntime metrics,
                                    String typeName) {
        Objects.requireNonNull(plugin, "plugin");
        try {
            return plugin.create(config, metrics);
        } catch (Exception e) {
            throw new RuntimeException("Failed creating " + typeName + " [" + plugin.id() + "]", e);
        }
    }
}
