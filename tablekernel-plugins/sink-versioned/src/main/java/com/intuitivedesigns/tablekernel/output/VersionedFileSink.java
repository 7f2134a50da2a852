/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.tablekernel.output;

import com.intuitivedesigns.tablekernel.core.OutputSink;
import com.intuitivedesigns.tablekernel.core.PipelinePayload;
import com.intuitivedesigns.tablekernel.io.TableEncoder;
import com.intuitivedesigns.tablekernel.io.TableFormat;
import com.intuitivedesigns.tablekernel.io.TableWriters;
import com.intuitivedesigns.tablekernel.metrics.MetricsRuntime;
import com.intuitivedesigns.tablekernel.table.Table;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Objects;

/**
 * Persists each result twice: an immutable copy under {@code <dir>/versions/v_<yyyyMMdd_HHmmss>.<ext>}
 * and a {@code <dir>/latest.<ext>} that is overwritten on every run.
 *
 * <p>When a version file for the same second already exists, a {@code _1}, {@code _2}, ...
 * suffix is appended rather than overwriting it. The two writes are not atomic as a pair:
 * a failure after the version write leaves the previous {@code latest} in place.</p>
 */
public final class VersionedFileSink implements OutputSink<Table> {

    private static final Logger log = LoggerFactory.getLogger(VersionedFileSink.class);

    public static final String VERSIONS_DIR = "versions";
    public static final String LATEST_NAME = "latest";
    public static final String METRIC_ROWS_WRITTEN = "sink.rows.written";
    public static final String METRIC_FILES_WRITTEN = "sink.files.written";
    public static final String METRIC_WRITE_LATENCY = "sink.write.latency";
    public static final String METRIC_LAST_COLUMNS = "sink.last.columns";

    private static final DateTimeFormatter VERSION_STAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

    private final Path outputDir;
    private final String extension;
    private final TableEncoder encoder;
    private final Clock clock;
    private final MetricsRuntime metrics;

    private Path lastVersion;

    /**
     * @param extension output format as a file extension ({@code xlsx}, {@code xls}, {@code csv}, {@code parquet})
     * @throws com.intuitivedesigns.tablekernel.table.UnsupportedFormatException for any other extension
     */
    public VersionedFileSink(Path outputDir, String extension, Clock clock, MetricsRuntime metrics) {
        this.outputDir = Objects.requireNonNull(outputDir, "outputDir");
        this.extension = TableFormat.normalizeExtension(extension);
        this.encoder = TableWriters.encoderFor(this.extension);
        this.clock = Objects.requireNonNull(clock, "clock");
        this.metrics = (metrics != null) ? metrics : MetricsRuntime.noop();
    }

    @Override
    public void write(PipelinePayload<Table> payload) throws IOException {
        Objects.requireNonNull(payload, "payload");
        final Table table = Objects.requireNonNull(payload.data(), "payload data");

        final long start = System.nanoTime();
        final Path versionsDir = outputDir.resolve(VERSIONS_DIR);
        Files.createDirectories(versionsDir);

        final Path version = nextVersionPath(versionsDir);
        encoder.encode(table, version);

        final Path latest = latestPath();
        Files.copy(version, latest, StandardCopyOption.REPLACE_EXISTING);
        lastVersion = version;

        metrics.counter(METRIC_ROWS_WRITTEN, table.rowCount());
        metrics.counter(METRIC_FILES_WRITTEN, 2);
        metrics.gauge(METRIC_LAST_COLUMNS, table.columnCount());
        metrics.timer(METRIC_WRITE_LATENCY, (System.nanoTime() - start) / 1_000_000L);

        log.info("Run {}: wrote {} rows to {} and {}", payload.id(), table.rowCount(), version, latest);
    }

    public Path latestPath() {
        return outputDir.resolve(LATEST_NAME + "." + extension);
    }

    /**
     * @return the version file written by the last successful {@link #write}, or {@code null}
     */
    public Path lastVersion() {
        return lastVersion;
    }

    Path nextVersionPath(Path versionsDir) {
        final String stem = "v_" + LocalDateTime.now(clock).format(VERSION_STAMP);
        Path candidate = versionsDir.resolve(stem + "." + extension);
        for (int n = 1; Files.exists(candidate); n++) {
            candidate = versionsDir.resolve(stem + "_" + n + "." + extension);
        }
        return candidate;
    }

    @Override
    public String id() {
        return "VERSIONED:" + outputDir;
    }
}
