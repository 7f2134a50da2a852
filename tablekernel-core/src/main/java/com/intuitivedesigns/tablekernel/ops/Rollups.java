/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.tablekernel.ops;

import com.intuitivedesigns.tablekernel.table.Table;
import com.intuitivedesigns.tablekernel.table.ValidationException;
import com.intuitivedesigns.tablekernel.table.Values;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Subtotal and grand-total rows, and the canonical order that places them.
 */
final class Rollups {

    private Rollups() {}

    /**
     * Builds only the synthetic rows: one subtotal per distinct {@code group1} value (key-sorted)
     * followed by the grand total. Every column besides the two grouping columns is summed.
     */
    static Table rollup(Table table, String group1, String group2, String totalLabel, String grandLabel) {
        final int g1 = table.indexOf(group1);
        final int g2 = table.indexOf(group2);
        if (g1 == g2) {
            throw new ValidationException(group1, "rollup needs two distinct grouping columns");
        }

        final List<Integer> measures = new ArrayList<>();
        for (int c = 0; c < table.columnCount(); c++) {
            if (c == g1 || c == g2) continue;
            final String name = table.columns().get(c);
            if (!table.isNumericColumn(name)) {
                throw new ValidationException(name, "rollup requires numeric columns besides '"
                        + group1 + "' and '" + group2 + "'; project the table first");
            }
            measures.add(c);
        }

        final Map<GroupKey, List<Integer>> groups = GroupKey.index(table, new int[]{g1});
        final Table.Builder out = Table.builder(table.columns());
        for (GroupKey key : GroupKey.sorted(groups)) {
            out.addRow(totalRow(table, groups.get(key), measures, g1, key.values().get(0), g2, totalLabel));
        }

        final List<Integer> all = new ArrayList<>(table.rowCount());
        for (int r = 0; r < table.rowCount(); r++) all.add(r);
        out.addRow(totalRow(table, all, measures, g1, grandLabel, g2, totalLabel));
        return out.build();
    }

    private static Object[] totalRow(Table table, List<Integer> rows, List<Integer> measures,
                                     int g1, Object g1Value, int g2, Object g2Value) {
        final Object[] row = new Object[table.columnCount()];
        row[g1] = g1Value;
        row[g2] = g2Value;
        for (int c : measures) {
            Object sum = 0L;
            for (int r : rows) {
                sum = Values.add(table.columns().get(c), sum, table.value(r, c));
            }
            row[c] = sum;
        }
        return row;
    }

    static Table concat(List<Table> tables) {
        if (tables == null || tables.isEmpty()) {
            throw new ValidationException("Concat requires at least one table");
        }
        final Table first = tables.get(0);
        final Table.Builder out = Table.builder(first.columns());
        for (Table t : tables) {
            if (!t.columns().containsAll(first.columns()) || t.columnCount() != first.columnCount()) {
                throw new ValidationException("Cannot concat tables with different columns: "
                        + first.columns() + " vs " + t.columns());
            }
            final int[] idx = GroupKey.indexes(t, first.columns());
            for (int r = 0; r < t.rowCount(); r++) {
                final Object[] row = new Object[idx.length];
                for (int i = 0; i < idx.length; i++) row[i] = t.value(r, idx[i]);
                out.addRow(row);
            }
        }
        return out.build();
    }

    /**
     * Stable sort by (is grand total, group1, is subtotal, group2).
     */
    static Table order(Table table, String group1, String group2, String totalLabel, String grandLabel) {
        final int g1 = table.indexOf(group1);
        final int g2 = table.indexOf(group2);

        final Comparator<Object[]> cmp = Comparator
                .<Object[], Boolean>comparing(r -> Objects.equals(r[g1], grandLabel))
                .thenComparing(r -> r[g1], Values.ORDER)
                .thenComparing(r -> Objects.equals(r[g2], totalLabel))
                .thenComparing(r -> r[g2], Values.ORDER);

        final List<Object[]> rows = new ArrayList<>(table.rowCount());
        for (int r = 0; r < table.rowCount(); r++) rows.add(table.rowValues(r));
        rows.sort(cmp);

        final Table.Builder out = Table.builder(table.columns());
        for (Object[] row : rows) out.addRow(row);
        return out.build();
    }
}
