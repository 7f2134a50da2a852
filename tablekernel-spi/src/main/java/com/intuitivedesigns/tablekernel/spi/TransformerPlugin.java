/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.tablekernel.spi;

import com.intuitivedesigns.tablekernel.config.PipelineConfig;
import com.intuitivedesigns.tablekernel.core.Transformer;
import com.intuitivedesigns.tablekernel.metrics.MetricsRuntime;

/**
 * SPI Definition for Pipeline Transformers.
 *
 * <p><b>Generics Note:</b> transformers usually change the data type
 * (input tables to a single report table), hence the wildcards.</p>
 */
public interface TransformerPlugin extends PipelinePlugin<Transformer<?, ?>> {

    String id(); // e.g. "ROLLUP_REPORT", "NOOP"

    @Override
    default PluginKind kind() {
        return PluginKind.TRANSFORMER;
    }

    @Override
    Transformer<?, ?> create(PipelineConfig config, MetricsRuntime metrics) throws Exception;
}
