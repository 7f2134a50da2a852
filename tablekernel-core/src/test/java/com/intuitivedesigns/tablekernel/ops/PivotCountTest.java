/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.tablekernel.ops;

import com.intuitivedesigns.tablekernel.table.Table;
import com.intuitivedesigns.tablekernel.table.ValidationException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PivotCountTest {

    private final Table patients = Table.builder("Province", "Category", "AgeRangeLabel")
            .addRow("ON", "<5000", "Adult")
            .addRow("ON", "<5000", "Child")
            .addRow("ON", "<5000", "Adult")
            .addRow("ON", "<10000", "Elderly")
            .addRow("BC", "<5000", "Adult")
            .addRow("BC", "<5000", "Infant")
            .addRow("QC", "<5000", "Infant")
            .build();

    @Test
    void countsEachValueAndTotalsOnlyListedValues() {
        Table out = Relational.pivotCount(patients, "Province", "Category", "AgeRangeLabel",
                List.of("Child", "Adult", "Elderly"));

        assertEquals(List.of("Province", "Category", "Child", "Adult", "Elderly", "Grand_Total"), out.columns());
        // QC only has unlisted values and disappears entirely
        assertEquals(List.of("BC", "ON", "ON"), out.column("Province"));
        assertEquals(List.of("<5000", "<10000", "<5000"), out.column("Category"));
        assertEquals(List.of(0L, 0L, 1L), out.column("Child"));
        assertEquals(List.of(1L, 0L, 2L), out.column("Adult"));
        assertEquals(List.of(0L, 1L, 0L), out.column("Elderly"));
        assertEquals(List.of(1L, 1L, 3L), out.column("Grand_Total"));
    }

    @Test
    void listedValueWithNoRowsStillGetsAZeroColumn() {
        Table out = Relational.pivotCount(patients, "Province", "Category", "AgeRangeLabel", List.of("Adult", "Senior"));

        assertTrue(out.hasColumn("Senior"));
        for (Object v : out.column("Senior")) assertEquals(0L, v);
    }

    @Test
    void grandTotalIsTheSumOfValueColumns() {
        Table out = Relational.pivotCount(patients, "Province", "Category", "AgeRangeLabel",
                List.of("Child", "Adult", "Elderly", "Infant"));

        for (int r = 0; r < out.rowCount(); r++) {
            long sum = 0;
            for (String v : List.of("Child", "Adult", "Elderly", "Infant")) sum += (Long) out.value(r, v);
            assertEquals(sum, out.value(r, "Grand_Total"));
        }
    }

    @Test
    void noListedValuePresentGivesAnEmptyPivotWithEveryColumn() {
        Table out = Relational.pivotCount(patients, "Province", "Category", "AgeRangeLabel", List.of("Senior", "Teen"));

        assertEquals(0, out.rowCount());
        assertEquals(List.of("Province", "Category", "Senior", "Teen", "Grand_Total"), out.columns());
    }

    @Test
    void emptyOrDuplicateValuesFail() {
        assertThrows(ValidationException.class,
                () -> Relational.pivotCount(patients, "Province", "Category", "AgeRangeLabel", List.of()));
        assertThrows(ValidationException.class,
                () -> Relational.pivotCount(patients, "Province", "Category", "AgeRangeLabel", List.of("Adult", "Adult")));
    }
}
