/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.tablekernel.core;

import com.intuitivedesigns.tablekernel.metrics.MetricsRuntime;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Runs one extract, transform, load pass.
 *
 * <p>Sequential by contract: the source is drained, each payload is transformed and only a
 * successful transform reaches the sink. The first failure aborts the run; it is logged,
 * counted and rethrown as a {@link PipelineException}. Components are closed in every case.</p>
 */
public class PipelineOrchestrator<I, O> {

    private static final Logger log = LoggerFactory.getLogger(PipelineOrchestrator.class);

    static final String METRIC_RUNS_OK = "pipeline.runs.succeeded";
    static final String METRIC_RUNS_FAILED = "pipeline.runs.failed";
    static final String METRIC_RUN_LATENCY = "pipeline.run.latency";
    static final String METRIC_PAYLOADS = "pipeline.payloads.processed";

    private final SourceConnector<I> source;
    private final Transformer<I, O> transformer;
    private final OutputSink<O> sink;
    private final MetricsRuntime metrics;

    public PipelineOrchestrator(SourceConnector<I> source,
                                Transformer<I, O> transformer,
                                OutputSink<O> sink,
                                MetricsRuntime metrics) {
        this.source = Objects.requireNonNull(source, "source");
        this.transformer = Objects.requireNonNull(transformer, "transformer");
        this.sink = Objects.requireNonNull(sink, "sink");
        this.metrics = (metrics != null) ? metrics : MetricsRuntime.noop();
    }

    /**
     * @return the number of payloads written to the sink
     * @throws PipelineException if any stage fails
     */
    public int run() {
        final long start = System.nanoTime();
        log.info("Starting pipeline: source={} transformer={} sink={}",
                source.id(), transformer.getClass().getSimpleName(), sink.id());

        String stage = "extract";
        String runId = "-";
        int written = 0;
        try {
            source.connect();
            stage = "init";
            transformer.init();

            while (true) {
                stage = "extract";
                final PipelinePayload<I> payload = source.fetch();
                if (payload == null) break;
                runId = payload.id();

                stage = "transform";
                final PipelinePayload<O> result = transformer.transform(payload);

                stage = "load";
                sink.write(result);
                written++;
            }
            stage = "load";
            sink.flush();
        } catch (Exception e) {
            metrics.counter(METRIC_RUNS_FAILED);
            log.error("Pipeline run {} failed during {}", runId, stage, e);
            throw new PipelineException(stage, runId, e);
        } finally {
            closeQuietly(transformer, "transformer");
            closeQuietly(sink, "sink");
            closeQuietly(source, "source");
        }

        final long tookMs = (System.nanoTime() - start) / 1_000_000L;
        metrics.counter(METRIC_RUNS_OK);
        metrics.counter(METRIC_PAYLOADS, written);
        metrics.timer(METRIC_RUN_LATENCY, tookMs);
        log.info("Pipeline finished: payloads={} took={}ms", written, tookMs);
        return written;
    }

    private static void closeQuietly(AutoCloseable c, String name) {
        try {
            c.close();
        } catch (Exception e) {
            log.warn("Error closing {}", name, e);
        }
    }
}
