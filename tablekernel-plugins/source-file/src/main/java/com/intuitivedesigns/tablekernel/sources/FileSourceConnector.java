/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.tablekernel.sources;

import com.intuitivedesigns.tablekernel.core.PipelinePayload;
import com.intuitivedesigns.tablekernel.core.SourceConnector;
import com.intuitivedesigns.tablekernel.io.TableReaders;
import com.intuitivedesigns.tablekernel.metrics.MetricsRuntime;
import com.intuitivedesigns.tablekernel.table.NamedTables;
import com.intuitivedesigns.tablekernel.table.Table;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Batch source that reads one table per configured role from a directory.
 *
 * <p>The first {@link #fetch()} decodes every file and returns them as a single
 * {@link NamedTables} payload; later calls return {@code null}.</p>
 */
public final class FileSourceConnector implements SourceConnector<NamedTables> {

    private static final Logger log = LoggerFactory.getLogger(FileSourceConnector.class);

    public static final String METRIC_ROWS_READ = "source.rows.read";
    public static final String METRIC_READ_LATENCY = "source.read.latency";

    private final Path dir;
    private final Map<String, String> inputs;
    private final MetricsRuntime metrics;

    private boolean exhausted;

    /**
     * @param dir    directory the file names are resolved against
     * @param inputs role to file name, in read order
     */
    public FileSourceConnector(Path dir, Map<String, String> inputs, MetricsRuntime metrics) {
        this.dir = Objects.requireNonNull(dir, "dir");
        this.inputs = new LinkedHashMap<>(Objects.requireNonNull(inputs, "inputs"));
        this.metrics = (metrics != null) ? metrics : MetricsRuntime.noop();
        if (this.inputs.isEmpty()) {
            throw new IllegalArgumentException("FileSourceConnector needs at least one input file");
        }
    }

    @Override
    public void connect() {
        log.info("File source ready. dir={} inputs={}", dir.toAbsolutePath(), inputs);
    }

    @Override
    public void disconnect() {
        log.debug("File source closed. dir={}", dir);
    }

    @Override
    public PipelinePayload<NamedTables> fetch() {
        if (exhausted) return null;
        exhausted = true;

        final NamedTables.Builder tables = NamedTables.builder();
        final Map<String, String> metadata = new LinkedHashMap<>();

        for (Map.Entry<String, String> e : inputs.entrySet()) {
            final String role = e.getKey();
            final Path file = dir.resolve(e.getValue());

            final long start = System.nanoTime();
            final Table table;
            try {
                table = TableReaders.read(file);
            } catch (IOException ex) {
                throw new UncheckedIOException("Failed reading '" + role + "' from " + file, ex);
            }
            metrics.timer(METRIC_READ_LATENCY, (System.nanoTime() - start) / 1_000_000L);
            metrics.counter(METRIC_ROWS_READ, table.rowCount());

            log.info("Loaded '{}' from {}: {} rows, columns={}", role, file.getFileName(), table.rowCount(), table.columns());
            tables.put(role, table);
            metadata.put("source." + role, file.toString());
            metadata.put("rows." + role, Integer.toString(table.rowCount()));
        }

        return new PipelinePayload<>(UUID.randomUUID().toString(), tables.build(), metadata);
    }

    @Override
    public String id() {
        return "FILE:" + dir;
    }
}
