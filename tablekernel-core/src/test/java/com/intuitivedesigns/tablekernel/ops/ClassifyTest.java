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

class ClassifyTest {

    private static final List<Range> RANGES = List.of(Range.of(1, 2), Range.of(3, 5));
    private static final List<String> LABELS = List.of("1-2", "3-5");

    private static Table units(Object... counts) {
        Table.Builder b = Table.builder("Market", "UnitCount", "Extra");
        for (Object c : counts) b.addRow("M1", c, "x");
        return b.build();
    }

    @Test
    void everyRowGetsExactlyOneLabel() {
        Table out = Relational.classify(units(2, 5, 0, 7, 3.5, null), List.of("Market", "UnitCount"),
                "UnitCount", RANGES, LABELS, "6 or more");

        assertEquals(List.of("Market", "UnitCount", "Category"), out.columns());
        assertEquals(List.of("1-2", "3-5", "6 or more", "6 or more", "3-5", "6 or more"), out.column("Category"));
    }

    @Test
    void firstMatchingRangeWins() {
        List<Range> overlapping = List.of(Range.of(0, 10), Range.of(1, 2));

        Table out = Relational.classify(units(2), List.of("UnitCount"), "UnitCount",
                overlapping, List.of("wide", "narrow"), "none", "Bucket");

        assertEquals("wide", out.value(0, "Bucket"));
    }

    @Test
    void boundsAreInclusiveForFractionalRanges() {
        Table t = Table.builder("BillAmount").addRow(1000L).addRow(5000.0).addRow(5000.5).addRow(9999L).addRow(12000L).build();

        Table out = Relational.classify(t, List.of("BillAmount"), "BillAmount",
                List.of(Range.parse("1000:5000"), Range.parse("5001:9999")), List.of("<5000", "<10000"), ">10000");

        assertEquals(List.of("<5000", "<5000", ">10000", "<10000", ">10000"), out.column("Category"));
    }

    @Test
    void parameterShapeIsValidated() {
        Table t = units(1);
        List<String> keep = List.of("UnitCount");

        assertThrows(ValidationException.class,
                () -> Relational.classify(t, keep, "UnitCount", RANGES, List.of("only one"), "d"));
        assertThrows(ValidationException.class,
                () -> Relational.classify(t, keep, "UnitCount", List.of(), List.of(), "d"));
        assertThrows(ValidationException.class, () -> Range.of(5, 1));
        assertThrows(ValidationException.class, () -> Range.parse("1-2"));
    }

    @Test
    void valueColumnMustSurviveProjection() {
        assertThrows(SchemaException.class,
                () -> Relational.classify(units(1), List.of("Market"), "UnitCount", RANGES, LABELS, "d"));
    }

    @Test
    void textValuesCannotBeClassified() {
        assertThrows(ValidationException.class,
                () -> Relational.classify(units("many"), List.of("UnitCount"), "UnitCount", RANGES, LABELS, "d"));
    }
}
