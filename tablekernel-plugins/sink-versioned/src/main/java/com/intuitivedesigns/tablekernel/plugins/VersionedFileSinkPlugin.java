/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.tablekernel.plugins;

import com.intuitivedesigns.tablekernel.config.PipelineConfig;
import com.intuitivedesigns.tablekernel.core.OutputSink;
import com.intuitivedesigns.tablekernel.metrics.MetricsRuntime;
import com.intuitivedesigns.tablekernel.output.VersionedFileSink;
import com.intuitivedesigns.tablekernel.spi.PluginKind;
import com.intuitivedesigns.tablekernel.spi.SinkPlugin;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Clock;
import java.util.Objects;

public final class VersionedFileSinkPlugin implements SinkPlugin {

    private static final Logger log = LoggerFactory.getLogger(VersionedFileSinkPlugin.class);

    public static final String ID = "VERSIONED";

    // Config Keys
    public static final String CFG_DIR = "output.dir";
    public static final String CFG_FORMAT = "output.format";

    // Defaults
    private static final String DEFAULT_DIR = "data/output";
    private static final String DEFAULT_FORMAT = "xlsx";

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

        final Path dir = Path.of(config.getString(CFG_DIR, DEFAULT_DIR));
        final String format = config.getString(CFG_FORMAT, DEFAULT_FORMAT);

        final VersionedFileSink sink = new VersionedFileSink(dir, format, Clock.systemDefaultZone(), metrics);
        log.info("Versioned sink: dir={} format={}", dir.toAbsolutePath(), format);
        return sink;
    }
}
