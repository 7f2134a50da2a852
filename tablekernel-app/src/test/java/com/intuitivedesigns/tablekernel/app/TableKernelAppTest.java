/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.tablekernel.app;

import com.intuitivedesigns.tablekernel.config.PipelineConfig;
import com.intuitivedesigns.tablekernel.io.TableReaders;
import com.intuitivedesigns.tablekernel.table.Table;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Properties;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

class TableKernelAppTest {

    @TempDir
    Path work;

    @Test
    void marketplaceRunWritesVersionAndLatest() throws Exception {
        Path raw = copyFixtures("marketplace", "raw_data.csv", "segments.csv");
        Path out = work.resolve("output");

        int status = TableKernelApp.run(bundled("marketplace.properties", raw, out, "csv"));

        assertEquals(0, status);
        Table latest = TableReaders.read(out.resolve("latest.csv"));
        Table expected = Table.builder("MARKET_PLACE", "Category", "Seg 1-3", "Seg 4-6", "Grand_Total")
                .addRow("M1", "1-2", 1, 1, 2)
                .addRow("M1", "Total", 1, 1, 2)
                .addRow("M2", "1-2", 0, 1, 1)
                .addRow("M2", "3-5", 1, 0, 1)
                .addRow("M2", "Total", 1, 1, 2)
                .addRow("Grand Total", "Total", 2, 2, 4)
                .build();
        assertEquals(expected, latest);
        assertEquals(1, versions(out).size());
    }

    @Test
    void hospitalRunWritesExcel() throws Exception {
        Path raw = copyFixtures("hospital", "hospital_billing_data.csv", "age_ranges.csv");
        Path out = work.resolve("output");

        int status = TableKernelApp.run(bundled("hospital.properties", raw, out, "xlsx"));

        assertEquals(0, status);
        Table latest = TableReaders.read(out.resolve("latest.xlsx"));
        assertEquals(List.of("Province", "Category", "Child", "Adult", "Elderly", "Grand_Total"), latest.columns());
        assertEquals(List.of("ON", "ON", "ON", "ON", "QC", "QC", "Grand Total"), latest.column("Province"));
        assertEquals(List.of(1L, 1L, 1L, 3L, 2L, 2L, 5L), latest.column("Grand_Total"));
    }

    @Test
    void failedTransformWritesNothingAndReturnsOne() throws Exception {
        Path raw = copyFixtures("marketplace", "raw_data.csv", "segments.csv");
        Path out = work.resolve("output");
        Properties p = load("marketplace.properties");
        p.setProperty("source.dir", raw.toString());
        p.setProperty("output.dir", out.toString());
        p.setProperty("report.filter.column", "No_Such_Column");

        int status = TableKernelApp.run(PipelineConfig.of(p));

        assertEquals(1, status);
        assertFalse(Files.exists(out.resolve("latest.xlsx")));
    }

    @Test
    void unknownSourceTypeReturnsOne() {
        Properties p = new Properties();
        p.setProperty("source.type", "KAFKA");

        assertEquals(1, TableKernelApp.run(PipelineConfig.of(p)));
    }

    private PipelineConfig bundled(String resource, Path raw, Path out, String format) throws Exception {
        Properties p = load(resource);
        p.setProperty("source.dir", raw.toString());
        p.setProperty("output.dir", out.toString());
        p.setProperty("output.format", format);
        p.setProperty("metrics.provider", "NONE");
        return PipelineConfig.of(p);
    }

    private static Properties load(String resource) throws Exception {
        Properties p = new Properties();
        try (InputStream in = TableKernelAppTest.class.getClassLoader().getResourceAsStream(resource)) {
            assertNotNull(in, resource);
            p.load(in);
        }
        return p;
    }

    private Path copyFixtures(String dataset, String... files) throws Exception {
        Path dir = Files.createDirectories(work.resolve("raw"));
        for (String f : files) {
            try (InputStream in = getClass().getClassLoader().getResourceAsStream("data/" + dataset + "/" + f)) {
                assertNotNull(in, f);
                Files.copy(in, dir.resolve(f));
            }
        }
        return dir;
    }

    private static List<Path> versions(Path out) throws Exception {
        try (Stream<Path> s = Files.list(out.resolve("versions"))) {
            return s.toList();
        }
    }
}
