/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.tablekernel.plugins;

import com.intuitivedesigns.tablekernel.config.PipelineConfig;
import com.intuitivedesigns.tablekernel.core.OutputSink;
import com.intuitivedesigns.tablekernel.metrics.MetricsRuntime;
import com.intuitivedesigns.tablekernel.output.LogSink;
import com.intuitivedesigns.tablekernel.spi.PluginKind;
import com.intuitivedesigns.tablekernel.spi.SinkPlugin;

import java.util.Objects;

/**
 * Dry-run sink: logs the result table instead of writing files.
 */
public final class LogSinkPlugin implements SinkPlugin {

    public static final String ID = "LOG";

    private static final String CFG_MAX_ROWS = "sink.log.max.rows";
    private static final int DEFAULT_MAX_ROWS = 50;

    @Override
    public String id() {
        return ID;
    }

    @Override
    public PluginKind kind() {
        return PluginKind.SINK;
    }

    @Override
    public OutputSink<?> create(PipelineConfig config, MetricsRuntime metrics) {
        Objects.requireNonNull(config, "config");
        final int maxRows = clamp(config.getInt(CFG_MAX_ROWS, DEFAULT_MAX_ROWS), 0, 100_000);
        return new LogSink(maxRows, metrics);
    }

    private static int clamp(int v, int min, int max) {
        return Math.max(min, Math.min(max, v));
    }
}
