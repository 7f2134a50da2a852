/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.tablekernel.core;

/**
 * A transformation step in the pipeline.
 *
 * @param <I> Input data type
 * @param <O> Output data type
 */
public interface Transformer<I, O> extends AutoCloseable {

    /**
     * Initialize resources (optional).
     * Called once before the first {@link #transform(PipelinePayload)}.
     */
    default void init() throws Exception {
        // no-op by default
    }

    /**
     * Transform the input payload.
     *
     * <p><b>Contract:</b></p>
     * <ul>
     * <li><b>Traceability:</b> Use {@code input.withData(newData)} to keep the run ID and timestamp.</li>
     * <li><b>Failure:</b> Throwing aborts the run. Nothing is written to the sink.</li>
     * </ul>
     *
     * @param input the incoming payload
     * @return the transformed payload
     * @throws Exception if a non-recoverable error occurs.
     */
    PipelinePayload<O> transform(PipelinePayload<I> input) throws Exception;

    @Override
    default void close() throws Exception {
        // no-op by default
    }
}
