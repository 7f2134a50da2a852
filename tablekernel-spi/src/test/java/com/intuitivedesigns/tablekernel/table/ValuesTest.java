/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.tablekernel.table;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ValuesTest {

    @Test
    void orderPutsNumbersBeforeStringsAndNullLast() {
        List<Object> values = new ArrayList<>(Arrays.asList("b", null, 10L, "a", 2.5, 1L));
        values.sort(Values.ORDER);

        assertEquals(Arrays.asList(1L, 2.5, 10L, "a", "b", null), values);
    }

    @Test
    void integralDoublesShareKeysWithLongs() {
        assertEquals(Values.key(1L), Values.key(1.0));
        assertNotEquals(Values.key(1L), Values.key(1.5));
        assertEquals("x", Values.key("x"));
        assertNull(Values.key(null));
    }

    @Test
    void addKeepsLongsAndSkipsMissing() {
        Object sum = null;
        sum = Values.add(sum, 2L);
        sum = Values.add(sum, null);
        sum = Values.add(sum, 3L);
        assertEquals(5L, sum);

        assertEquals(5.5, Values.add(sum, 0.5));
        assertThrows(ValidationException.class, () -> Values.add(1L, "x"));
    }

    @Test
    void addReportsLongOverflowOnTheNamedColumn() {
        ValidationException e = assertThrows(ValidationException.class,
                () -> Values.add("Amount", Long.MAX_VALUE, 1L));

        assertEquals("Amount", e.getColumn());
        assertInstanceOf(ArithmeticException.class, e.getCause());
        assertEquals(Double.valueOf(Long.MAX_VALUE + 1.0), Values.add("Amount", (double) Long.MAX_VALUE, 1L));
    }

    @Test
    void unsupportedTypesAreRejected() {
        assertThrows(ValidationException.class, () -> Values.normalize(new Object()));
    }
}
