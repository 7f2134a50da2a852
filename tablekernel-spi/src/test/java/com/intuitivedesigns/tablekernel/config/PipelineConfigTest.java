/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.tablekernel.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class PipelineConfigTest {

    @Test
    void typedGettersFallBackToDefaults() {
        PipelineConfig cfg = PipelineConfig.of(Map.of(
                "a.int", " 42 ",
                "a.bad", "forty",
                "a.flag", "true"));

        assertEquals(42, cfg.getInt("a.int", 0));
        assertEquals(7, cfg.getInt("a.bad", 7));
        assertEquals(9L, cfg.getLong("a.none", 9L));
        assertTrue(cfg.getBoolean("a.flag", false));
        assertEquals("dflt", cfg.getString("a.none", "dflt"));
        assertFalse(cfg.hasPath("a.none"));
    }

    @Test
    void listsAreTrimmedAndBlankEntriesDropped() {
        PipelineConfig cfg = PipelineConfig.of(Map.of("cols", " MARKET_PLACE, Segment ,,Category "));

        assertEquals(List.of("MARKET_PLACE", "Segment", "Category"), cfg.getList("cols"));
        assertEquals(List.of(), cfg.getList("missing"));
    }

    @Test
    void loadsFromFile(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("pipeline.properties");
        Files.writeString(file, "source.type=FILE\nsink.type=LOG\n");

        PipelineConfig cfg = PipelineConfig.fromFile(file);

        assertEquals("FILE", cfg.getString("source.type", null));
        assertEquals(2, cfg.keys().size());
    }

    @Test
    void missingFileAndResourceFail(@TempDir Path dir) {
        assertThrows(UncheckedIOException.class, () -> PipelineConfig.fromFile(dir.resolve("nope.properties")));
        assertThrows(IllegalArgumentException.class, () -> PipelineConfig.fromResource("does-not-exist.properties"));
    }
}
