/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.tablekernel.spi;

import com.intuitivedesigns.tablekernel.config.PipelineConfig;
import com.intuitivedesigns.tablekernel.core.OutputSink;
import com.intuitivedesigns.tablekernel.metrics.MetricsRuntime;

/**
 * SPI Definition for Pipeline Sinks (Destinations).
 */
public interface SinkPlugin extends PipelinePlugin<OutputSink<?>> {

    String id(); // e.g. "VERSIONED", "LOG"

    @Override
    default PluginKind kind() {
        return PluginKind.SINK;
    }

    @Override
    OutputSink<?> create(PipelineConfig config, MetricsRuntime metrics) throws Exception;
}
