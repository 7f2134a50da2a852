/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.tablekernel.app;

import com.intuitivedesigns.tablekernel.config.PipelineConfig;
import com.intuitivedesigns.tablekernel.config.PipelineFactory;
import com.intuitivedesigns.tablekernel.core.OutputSink;
import com.intuitivedesigns.tablekernel.core.PipelineOrchestrator;
import com.intuitivedesigns.tablekernel.core.SourceConnector;
import com.intuitivedesigns.tablekernel.core.Transformer;
import com.intuitivedesigns.tablekernel.metrics.MetricsFactory;
import com.intuitivedesigns.tablekernel.metrics.MetricsRuntime;
import com.intuitivedesigns.tablekernel.metrics.MetricsSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Command line entry point: one batch run of extract, transform and load.
 *
 * <p>The pipeline is chosen by configuration, e.g.
 * {@code -Dtk.config.resource=marketplace.properties} or {@code -Dtk.config.path=/etc/tk/hospital.properties}.
 * Exits with status 1 when the run fails.</p>
 */
public final class TableKernelApp {

    private static final Logger log = LoggerFactory.getLogger(TableKernelApp.class);

    private TableKernelApp() {}

    public static void main(String[] args) {
        log.info("=== Booting TableKernel ===");
        final int status = run(PipelineConfig.get());
        if (status != 0) {
            System.exit(status);
        }
    }

    /**
     * Runs one pipeline described by {@code config}.
     *
     * @return 0 on success, 1 on any failure (already logged)
     */
    public static int run(PipelineConfig config) {
        MetricsRuntime metrics = null;
        SourceConnector<?> source = null;
        Transformer<?, ?> transformer = null;
        OutputSink<?> sink = null;

        try {
            // 1. Metrics
            metrics = MetricsFactory.init(MetricsSettings.from(config));

            // 2. Components (SPI)
            final PipelineFactory factory = new PipelineFactory();
            factory.logAvailablePlugins();
            source = factory.createSource(config, metrics);
            transformer = factory.createTransformer(config, metrics);
            sink = factory.createSink(config, metrics);

            // 3. Run. Raw types: the plugins agree on payload types by configuration, not at compile time.
            @SuppressWarnings({"rawtypes", "unchecked"})
            final PipelineOrchestrator pipeline = new PipelineOrchestrator(source, transformer, sink, metrics);
            // owned by the orchestrator from here on
            source = null;
            transformer = null;
            sink = null;

            final int written = pipeline.run();
            log.info("Run complete: {} result(s) written", written);
            return 0;
        } catch (Exception e) {
            log.error("Fatal application error", e);
            return 1;
        } finally {
            // components the orchestrator never took ownership of
            closeQuietly(source);
            closeQuietly(transformer);
            closeQuietly(sink);
            closeQuietly(metrics);
        }
    }

    private static void closeQuietly(AutoCloseable resource) {
        if (resource == null) return;
        try {
            resource.close();
        } catch (Exception e) {
            log.warn("Error closing {}", resource.getClass().getSimpleName(), e);
        }
    }
}
