/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.tablekernel.plugins;

import com.intuitivedesigns.tablekernel.config.PipelineConfig;
import com.intuitivedesigns.tablekernel.core.Transformer;
import com.intuitivedesigns.tablekernel.metrics.MetricsRuntime;
import com.intuitivedesigns.tablekernel.plugins.transform.ReportSpec;
import com.intuitivedesigns.tablekernel.plugins.transform.RollupReportTransformer;
import com.intuitivedesigns.tablekernel.spi.PluginKind;
import com.intuitivedesigns.tablekernel.spi.TransformerPlugin;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Config-driven rollup report over a primary and an optional reference table.
 * <p>
 * ID: ROLLUP_REPORT
 */
public final class RollupReportTransformerPlugin implements TransformerPlugin {

    public static final String ID = "ROLLUP_REPORT";
    private static final Logger log = LoggerFactory.getLogger(RollupReportTransformerPlugin.class);

    @Override
    public String id() {
        return ID;
    }

    @Override
    public PluginKind kind() {
        return PluginKind.TRANSFORMER;
    }

    @Override
    public Transformer<?, ?> create(PipelineConfig config, MetricsRuntime metrics) {
        Objects.requireNonNull(config, "config");
        final ReportSpec spec = ReportSpec.fromConfig(config);
        log.info("Rollup report: primary={} join={} pivot={}", spec.primaryRole(), spec.join(), spec.pivot());
        return new RollupReportTransformer(spec, metrics);
    }
}
