/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.tablekernel.spi;

/**
 * The central registry for all loaded plugins.
 * Holds typed registries for Sources, Transformers and Sinks.
 */
public final class PluginCatalog {

    private final ServicePluginRegistry<SourcePlugin> sources;
    private final ServicePluginRegistry<TransformerPlugin> transformers;
    private final ServicePluginRegistry<SinkPlugin> sinks;

    public PluginCatalog(ClassLoader cl) {
        this(new ServicePluginRegistry<>(SourcePlugin.class, cl),
                new ServicePluginRegistry<>(TransformerPlugin.class, cl),
                new ServicePluginRegistry<>(SinkPlugin.class, cl));
    }

    public PluginCatalog(ServicePluginRegistry<SourcePlugin> sources,
                         ServicePluginRegistry<TransformerPlugin> transformers,
                         ServicePluginRegistry<SinkPlugin> sinks) {
        this.sources = sources;
        this.transformers = transformers;
        this.sinks = sinks;
    }

    public ServicePluginRegistry<SourcePlugin> sources() {
        return sources;
    }

    public ServicePluginRegistry<TransformerPlugin> transformers() {
        return transformers;
    }

    public ServicePluginRegistry<SinkPlugin> sinks() {
        return sinks;
    }
}
