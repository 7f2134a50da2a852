/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.tablekernel.spi;

import com.intuitivedesigns.tablekernel.config.PipelineConfig;
import com.intuitivedesigns.tablekernel.core.SourceConnector;
import com.intuitivedesigns.tablekernel.metrics.MetricsRuntime;

/**
 * SPI Definition for Pipeline Sources.
 *
 * <p><b>Generics Note:</b> {@code SourceConnector<?>} lets a source produce whatever shape
 * its transformer expects. The orchestrator bridges the types at runtime.</p>
 */
public interface SourcePlugin extends PipelinePlugin<SourceConnector<?>> {

    String id(); // e.g. "FILE"

    @Override
    default PluginKind kind() {
        return PluginKind.SOURCE;
    }

    @Override
    SourceConnector<?> create(PipelineConfig config, MetricsRuntime metrics) throws Exception;
}
