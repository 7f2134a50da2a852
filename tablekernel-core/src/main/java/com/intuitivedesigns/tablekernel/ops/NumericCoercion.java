/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.tablekernel.ops;

import com.intuitivedesigns.tablekernel.table.Table;
import com.intuitivedesigns.tablekernel.table.Values;

import java.util.regex.Pattern;

/**
 * Lenient text-to-number conversion for one column.
 *
 * <p>Every cell is rendered as text, thousands separators are removed and the rest is
 * parsed. Cells that do not parse become missing. The resulting column is all
 * {@link Long} when every parsed value is integral, otherwise all {@link Double}.</p>
 */
final class NumericCoercion {

    private static final Pattern DECIMAL = Pattern.compile("[+-]?(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?");
    private static final Pattern INTEGER = Pattern.compile("[+-]?\\d{1,18}");

    private NumericCoercion() {}

    static Table coerce(Table table, String column) {
        final int c = table.indexOf(column);
        final int n = table.rowCount();

        final Object[] parsed = new Object[n];
        boolean integral = true;
        for (int r = 0; r < n; r++) {
            final Object v = parse(table.value(r, c));
            parsed[r] = v;
            if (v instanceof Double d && !isWhole(d)) {
                integral = false;
            }
        }

        final Table.Builder out = Table.builder(table.columns());
        for (int r = 0; r < n; r++) {
            final Object[] row = table.rowValues(r);
            row[c] = integral ? toLong(parsed[r]) : toDouble(parsed[r]);
            out.addRow(row);
        }
        return out.build();
    }

    /**
     * Parses one cell, returning a {@link Long}, a {@link Double} or {@code null}.
     */
    static Object parse(Object value) {
        if (value == null) return null;
        if (Values.isNumeric(value)) return value;

        final String text = value.toString().replace(",", "").trim();
        if (text.isEmpty()) return null;
        if (INTEGER.matcher(text).matches()) {
            return Long.parseLong(text);
        }
        if (DECIMAL.matcher(text).matches()) {
            final double d = Double.parseDouble(text);
            return Double.isInfinite(d) ? null : d;
        }
        return null;
    }

    private static boolean isWhole(double d) {
        return Values.key(d) instanceof Long;
    }

    private static Object toLong(Object v) {
        if (v instanceof Double d) return d.longValue();
        return v;
    }

    private static Object toDouble(Object v) {
        if (v instanceof Long l) return l.doubleValue();
        return v;
    }
}
