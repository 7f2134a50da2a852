/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.tablekernel.output;

import com.intuitivedesigns.tablekernel.core.OutputSink;
import com.intuitivedesigns.tablekernel.core.PipelinePayload;
import com.intuitivedesigns.tablekernel.metrics.MetricsRuntime;
import com.intuitivedesigns.tablekernel.table.Table;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Renders the result table to the log instead of persisting it. Used for dry runs.
 */
public final class LogSink implements OutputSink<Table> {

    private static final Logger log = LoggerFactory.getLogger(LogSink.class);

    private final int maxRows;
    private final MetricsRuntime metrics;

    public LogSink(int maxRows, MetricsRuntime metrics) {
        this.maxRows = maxRows;
        this.metrics = (metrics != null) ? metrics : MetricsRuntime.noop();
    }

    @Override
    public void write(PipelinePayload<Table> payload) {
        if (payload == null || payload.data() == null) return;
        final Table table = payload.data();
        metrics.counter(VersionedFileSink.METRIC_ROWS_WRITTEN, table.rowCount());
        log.info("Run {} result: {} rows x {} columns\n{}",
                payload.id(), table.rowCount(), table.columnCount(), table.render(maxRows));
    }

    int maxRows() {
        return maxRows;
    }
}
