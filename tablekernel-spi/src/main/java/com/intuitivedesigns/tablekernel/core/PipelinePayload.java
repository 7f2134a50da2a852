/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.tablekernel.core;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * The envelope handed from stage to stage during one pipeline run.
 *
 * Design Principles:
 * - Immutability: each stage returns a new envelope.
 * - Provenance: the run ID and extraction time survive every transformation.
 * - Extensibility: free-form metadata (source files, row counts) without changing the type.
 *
 * @param id Unique run ID for tracing.
 * @param data The payload content (input tables or the result table).
 * @param timestamp When the data was extracted.
 * @param metadata Context such as the files a table was read from.
 */
public record PipelinePayload<T>(
        String id,
        T data,
        Instant timestamp,
        Map<String, String> metadata
) {

    public PipelinePayload {
        Objects.requireNonNull(id, "PipelinePayload id cannot be null");
        if (timestamp == null) timestamp = Instant.now();

        // Ensure metadata is immutable and never null
        metadata = (metadata == null) ? Map.of() : Map.copyOf(metadata);
    }

    public PipelinePayload(String id, T data, Map<String, String> metadata) {
        this(id, data, Instant.now(), metadata);
    }

    public PipelinePayload(String id, T data) {
        this(id, data, Instant.now(), Map.of());
    }

    public static <T> PipelinePayload<T> of(T data) {
        return new PipelinePayload<>(UUID.randomUUID().toString(), data, Instant.now(), Map.of());
    }

    public <R> PipelinePayload<R> withData(R newData) {
        return new PipelinePayload<>(id, newData, timestamp, metadata);
    }

    public PipelinePayload<T> withHeader(String key, String value) {
        Map<String, String> newMeta = new HashMap<>(this.metadata);
        newMeta.put(key, value);
        return new PipelinePayload<>(id, data, timestamp, newMeta);
    }

    public PipelinePayload<T> withMetadata(Map<String, String> newMetadata) {
        return new PipelinePayload<>(id, data, timestamp, newMetadata);
    }
}
