/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.tablekernel.plugins;

import com.intuitivedesigns.tablekernel.config.PipelineConfig;
import com.intuitivedesigns.tablekernel.core.PipelinePayload;
import com.intuitivedesigns.tablekernel.core.Transformer;
import com.intuitivedesigns.tablekernel.metrics.MetricsRuntime;
import com.intuitivedesigns.tablekernel.spi.PluginKind;
import com.intuitivedesigns.tablekernel.spi.TransformerPlugin;
import com.intuitivedesigns.tablekernel.table.NamedTables;
import com.intuitivedesigns.tablekernel.table.Table;

/**
 * Pass-through transformer. A single input table is handed on as is, so a source can be
 * wired straight to a sink (format conversion, dry runs).
 * <p>
 * ID: NOOP
 */
public final class NoopTransformerPlugin implements TransformerPlugin {

    public static final String ID = "NOOP";

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
        return new NoopTransformer();
    }

    static final class NoopTransformer implements Transformer<Object, Object> {
        @Override
        public PipelinePayload<Object> transform(PipelinePayload<Object> payload) {
            // A one-table bundle unwraps to its table so table sinks can take it
            if (payload.data() instanceof NamedTables tables && tables.size() == 1) {
                final Table only = tables.asMap().values().iterator().next();
                return payload.withData(only);
            }
            return payload;
        }
    }
}
