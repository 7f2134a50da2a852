/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.tablekernel.core;

/**
 * A pluggable source of input data for one pipeline run.
 *
 * <p>Batch contract: after {@link #connect()}, {@link #fetch()} returns the extracted
 * payload once and {@code null} on every later call.</p>
 *
 * @param <T> Data type produced by this source.
 */
public interface SourceConnector<T> extends AutoCloseable {

    void connect();

    void disconnect();

    /**
     * @return the extracted payload, or {@code null} once the source is exhausted
     */
    PipelinePayload<T> fetch();

    default String id() {
        return this.getClass().getSimpleName();
    }

    @Override
    default void close() {
        disconnect();
    }
}
