/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.tablekernel.core;

/**
 * A pluggable destination for the pipeline result.
 *
 * Examples:
 * - Versioned file writer (timestamped copy + latest copy)
 * - Log renderer for dry runs
 *
 * <p><b>Contract:</b></p>
 * <ul>
 * <li>{@link #write(PipelinePayload)} persists the result.</li>
 * <li>Implementations throw to signal failure; the orchestrator reports it and fails the run.</li>
 * <li>Do NOT swallow exceptions silently. A run that looks successful but wrote nothing is worse than a failed run.</li>
 * </ul>
 *
 * @param <T> The type of the result payload.
 */
public interface OutputSink<T> extends AutoCloseable {

    /**
     * @param payload the result envelope
     * @throws Exception if persistence fails
     */
    void write(PipelinePayload<T> payload) throws Exception;

    /**
     * Forces buffered output to durable storage.
     */
    default void flush() throws Exception {
        // no-op by default for unbuffered sinks
    }

    /**
     * Returns a unique identifier for this sink instance, for logging and metrics tags.
     */
    default String id() {
        return this.getClass().getSimpleName();
    }

    @Override
    default void close() throws Exception {
        flush();
    }
}
