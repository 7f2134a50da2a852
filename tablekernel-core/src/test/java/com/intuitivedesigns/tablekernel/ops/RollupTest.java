/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.tablekernel.ops;

import com.intuitivedesigns.tablekernel.table.SchemaException;
import com.intuitivedesigns.tablekernel.table.Table;
import com.intuitivedesigns.tablekernel.table.ValidationException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RollupTest {

    private final Table pivot = Table.builder("Market", "Category", "SegA", "SegB", "Grand_Total")
            .addRow("M2", "1-2", 1L, 0L, 1L)
            .addRow("M1", "3-5", 2L, 3L, 5L)
            .addRow("M1", "1-2", 4L, 1L, 5L)
            .build();

    @Test
    void rollupReturnsSubtotalsThenGrandTotal() {
        Table out = Relational.rollup(pivot, "Market", "Category");

        assertEquals(pivot.columns(), out.columns());
        assertEquals(List.of("M1", "M2", "Grand Total"), out.column("Market"));
        assertEquals(List.of("Total", "Total", "Total"), out.column("Category"));
        assertEquals(List.of(6L, 1L, 7L), out.column("SegA"));
        assertEquals(List.of(4L, 0L, 4L), out.column("SegB"));
        assertEquals(List.of(10L, 1L, 11L), out.column("Grand_Total"));
    }

    @Test
    void subtotalsAddUpToTheGrandTotal() {
        Table out = Relational.rollup(pivot, "Market", "Category");
        int grand = out.rowCount() - 1;

        for (String col : List.of("SegA", "SegB", "Grand_Total")) {
            long subtotals = 0;
            for (int r = 0; r < grand; r++) subtotals += (Long) out.value(r, col);
            long base = 0;
            for (Object v : pivot.column(col)) base += (Long) v;

            assertEquals(subtotals, out.value(grand, col));
            assertEquals(base, subtotals);
        }
    }

    @Test
    void customLabelsAreUsed() {
        Table out = Relational.rollup(pivot, "Market", "Category", "Sum", "All");

        assertEquals("All", out.value(2, "Market"));
        assertEquals("Sum", out.value(0, "Category"));
    }

    @Test
    void textMeasureColumnIsRejected() {
        Table t = Table.builder("g1", "g2", "note", "n").addRow("a", "b", "text", 1L).build();

        ValidationException e = assertThrows(ValidationException.class, () -> Relational.rollup(t, "g1", "g2"));
        assertEquals("note", e.getColumn());
    }

    @Test
    void orderingPlacesSubtotalsAfterTheirGroupAndGrandTotalLast() {
        Table report = Relational.rollupReport(pivot, "Market", "Category", "Total", "Grand Total");

        assertEquals(List.of("M1", "M1", "M1", "M2", "M2", "Grand Total"), report.column("Market"));
        assertEquals(List.of("1-2", "3-5", "Total", "1-2", "Total", "Total"), report.column("Category"));
    }

    @Test
    void emptyPivotReportsASingleZeroGrandTotal() {
        Table rentals = Table.builder("Market", "Category", "Segment").addRow("M1", "X", "1-2").build();
        Table empty = Relational.pivotCount(rentals, "Market", "Category", "Segment", List.of("SegA", "SegB"));

        Table report = Relational.rollupReport(empty, "Market", "Category", "Total", "Grand Total");

        Table expected = Table.builder("Market", "Category", "SegA", "SegB", "Grand_Total")
                .addRow("Grand Total", "Total", 0L, 0L, 0L)
                .build();
        assertEquals(expected, report);
    }

    @Test
    void longOverflowIsAValidationErrorOnTheColumn() {
        Table t = Table.builder("g1", "g2", "n")
                .addRow("a", "x", Long.MAX_VALUE)
                .addRow("a", "y", 1L)
                .build();

        ValidationException e = assertThrows(ValidationException.class, () -> Relational.rollup(t, "g1", "g2"));
        assertEquals("n", e.getColumn());
        assertInstanceOf(ArithmeticException.class, e.getCause());
    }

    @Test
    void orderingIsStableForEqualKeys() {
        Table t = Table.builder("g1", "g2", "n").addRow("a", "x", 1L).addRow("a", "x", 2L).build();

        assertEquals(List.of(1L, 2L), Relational.orderRollup(t, "g1", "g2").column("n"));
    }

    @Test
    void orderingNeedsBothGroupingColumns() {
        assertThrows(SchemaException.class, () -> Relational.orderRollup(pivot, "Market", "Segment"));
    }

    @Test
    void concatRequiresTheSameColumns() {
        Table reordered = Relational.select(pivot, "Grand_Total", "SegB", "SegA", "Category", "Market");
        Table both = Relational.concat(pivot, reordered);

        assertEquals(pivot.columns(), both.columns());
        assertEquals(6, both.rowCount());
        assertEquals(pivot.row(0).asMap(), both.row(3).asMap());

        assertThrows(ValidationException.class, () -> Relational.concat(pivot, Relational.select(pivot, "Market")));
    }
}
