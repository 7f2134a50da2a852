/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.tablekernel.io;

import com.intuitivedesigns.tablekernel.table.Table;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CsvTableDecoderTest {

    @TempDir
    Path dir;

    @Test
    void typesEachColumnFromItsValues() throws Exception {
        Path file = write("rentals.csv",
                "Listing ID,Price,Rating,Neighborhood\n"
                        + "1,120.50,4,Downtown\n"
                        + "2,80,,\"Old Town, East\"\n"
                        + "3,95.25,5,Harbor\n");

        Table t = TableReaders.read(file);

        assertEquals(List.of("Listing ID", "Price", "Rating", "Neighborhood"), t.columns());
        assertEquals(3, t.rowCount());
        assertEquals(1L, t.value(0, "Listing ID"));
        assertEquals(120.5, t.value(0, "Price"));
        assertEquals(80.0, t.value(1, "Price"));
        assertEquals(4L, t.value(0, "Rating"));
        assertNull(t.value(1, "Rating"));
        assertEquals("Old Town, East", t.value(1, "Neighborhood"));
    }

    @Test
    void thousandsSeparatorsStayText() throws Exception {
        Path file = write("billing.csv", "Patient,Amount\nA,\"1,250\"\nB,300\n");

        Table t = TableReaders.read(file);

        assertEquals("1,250", t.value(0, "Amount"));
        assertEquals("300", t.value(1, "Amount"));
    }

    @Test
    void leadingByteOrderMarkIsDropped() throws Exception {
        Path file = write("bom.csv", "\uFEFFid,name\n1,a\n");

        Table t = TableReaders.read(file);

        assertEquals(List.of("id", "name"), t.columns());
        assertEquals(1L, t.value(0, "id"));
    }

    @Test
    void shortRowsArePaddedWithMissingCells() throws Exception {
        Path file = write("short.csv", "a,b,c\n1,2\n");

        Table t = TableReaders.read(file);

        assertEquals(1, t.rowCount());
        assertNull(t.value(0, "c"));
    }

    @Test
    void headerOnlyFileIsEmptyTable() throws Exception {
        Path file = write("empty.csv", "a,b\n");

        Table t = TableReaders.read(file);

        assertEquals(List.of("a", "b"), t.columns());
        assertTrue(t.isEmpty());
    }

    private Path write(String name, String content) throws Exception {
        Path file = dir.resolve(name);
        Files.writeString(file, content, StandardCharsets.UTF_8);
        return file;
    }
}
