/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.tablekernel.ops;

import com.intuitivedesigns.tablekernel.table.SchemaException;
import com.intuitivedesigns.tablekernel.table.Table;
import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;

class NumericCoercionTest {

    @Test
    void thousandsSeparatorsAreStripped() {
        Table t = Table.builder("id", "amount").addRow(1, "1,250").addRow(2, " 30 ").build();

        Table out = Relational.coerceNumeric(t, "amount");

        assertEquals(1250L, out.value(0, "amount"));
        assertEquals(30L, out.value(1, "amount"));
        assertEquals(1L, out.value(0, "id"));
    }

    @Test
    void unparseableValuesBecomeMissing() {
        Table t = Table.builder("amount").addRow("abc").addRow("").addRow((Object) null).addRow("12").build();

        Table out = Relational.coerceNumeric(t, "amount");

        assertEquals(Arrays.asList(null, null, null, 12L), out.column("amount"));
    }

    @Test
    void anyFractionMakesTheWholeColumnDouble() {
        Table t = Table.builder("amount").addRow("1,000.50").addRow("7").addRow(3L).build();

        Table out = Relational.coerceNumeric(t, "amount");

        assertEquals(Arrays.asList(1000.5, 7.0, 3.0), out.column("amount"));
    }

    @Test
    void integralDoublesCollapseToLongs() {
        Table t = Table.builder("amount").addRow(25.0).addRow("3").build();

        assertEquals(Arrays.asList(25L, 3L), Relational.coerceNumeric(t, "amount").column("amount"));
    }

    @Test
    void inputTableIsUntouched() {
        Table t = Table.builder("amount").addRow("1,250").build();

        Relational.coerceNumeric(t, "amount");

        assertEquals("1,250", t.value(0, "amount"));
    }

    @Test
    void missingColumnFails() {
        Table t = Table.builder("amount").addRow("1").build();

        assertThrows(SchemaException.class, () -> Relational.coerceNumeric(t, "Amount"));
    }
}
