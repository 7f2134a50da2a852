/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.tablekernel.spi;

import com.intuitivedesigns.tablekernel.config.PipelineConfig;
import com.intuitivedesigns.tablekernel.metrics.MetricsRuntime;

/**
 * Common shape of every plugin discovered through {@link java.util.ServiceLoader}.
 *
 * @param <T> the component the plugin builds
 */
public interface PipelinePlugin<T> {

    /**
     * @return the unique ID of this plugin implementation (e.g. 'FILE', 'VERSIONED').
     */
    String id();

    PluginKind kind();

    T create(PipelineConfig config, MetricsRuntime metrics) throws Exception;
}
