/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.tablekernel.sources;

import com.intuitivedesigns.tablekernel.core.PipelinePayload;
import com.intuitivedesigns.tablekernel.metrics.MicrometerMetricsRuntime;
import com.intuitivedesigns.tablekernel.table.NamedTables;
import com.intuitivedesigns.tablekernel.table.UnsupportedFormatException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class FileSourceConnectorTest {

    @TempDir
    Path dir;

    @Test
    void fetchReturnsAllRolesOnceThenNull() throws Exception {
        Files.writeString(dir.resolve("listings.csv"), "id,host\n1,h1\n2,h2\n");
        Files.writeString(dir.resolve("hosts.csv"), "host,city\nh1,Paris\n");

        Map<String, String> inputs = new LinkedHashMap<>();
        inputs.put("primary", "listings.csv");
        inputs.put("reference", "hosts.csv");

        try (MicrometerMetricsRuntime metrics = new MicrometerMetricsRuntime();
             FileSourceConnector source = new FileSourceConnector(dir, inputs, metrics)) {
            source.connect();

            PipelinePayload<NamedTables> payload = source.fetch();

            assertNotNull(payload);
            assertEquals(List.of("primary", "reference"), List.copyOf(payload.data().roles()));
            assertEquals(2, payload.data().require("primary").rowCount());
            assertEquals("2", payload.metadata().get("rows.primary"));
            assertEquals(dir.resolve("hosts.csv").toString(), payload.metadata().get("source.reference"));
            assertEquals(3.0, metrics.counterValue(FileSourceConnector.METRIC_ROWS_READ));

            assertNull(source.fetch());
        }
    }

    @Test
    void missingFileSurfacesAsUncheckedIo() {
        FileSourceConnector source = new FileSourceConnector(dir, Map.of("primary", "absent.csv"), null);

        assertThrows(UncheckedIOException.class, source::fetch);
    }

    @Test
    void unsupportedExtensionPropagates() throws Exception {
        Files.writeString(dir.resolve("data.txt"), "x");
        FileSourceConnector source = new FileSourceConnector(dir, Map.of("primary", "data.txt"), null);

        assertThrows(UnsupportedFormatException.class, source::fetch);
    }

    @Test
    void atLeastOneInputIsRequired() {
        assertThrows(IllegalArgumentException.class, () -> new FileSourceConnector(dir, Map.of(), null));
    }
}
