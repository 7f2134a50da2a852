/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.tablekernel.ops;

import com.intuitivedesigns.tablekernel.table.Table;
import com.intuitivedesigns.tablekernel.table.ValidationException;
import com.intuitivedesigns.tablekernel.table.Values;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Turns selected values of one column into per-group count columns plus a {@code Grand_Total}.
 */
final class PivotCount {

    static final String GRAND_TOTAL_COLUMN = "Grand_Total";

    private PivotCount() {}

    static Table pivot(Table table, String group1, String group2, String valueColumn, List<?> values) {
        if (values == null || values.isEmpty()) {
            throw new ValidationException("Pivot requires at least one value");
        }
        final int[] groupIdx = GroupKey.indexes(table, List.of(group1, group2));
        final int valueIdx = table.indexOf(valueColumn);

        // canonical value -> output slot
        final Map<Object, Integer> slots = new HashMap<>();
        final Set<String> names = new LinkedHashSet<>(List.of(group1, group2));
        final List<String> valueNames = new ArrayList<>(values.size());
        for (Object v : values) {
            final Object normalized = Values.normalize(v);
            if (slots.putIfAbsent(Values.key(normalized), slots.size()) != null) {
                throw new ValidationException(valueColumn, "duplicate pivot value '" + v + "'");
            }
            final String name = String.valueOf(normalized);
            if (!names.add(name) || GRAND_TOTAL_COLUMN.equals(name)) {
                throw new ValidationException(valueColumn, "pivot value '" + name + "' clashes with another output column");
            }
            valueNames.add(name);
        }

        final Map<GroupKey, long[]> counts = new HashMap<>();
        for (int r = 0; r < table.rowCount(); r++) {
            final Integer slot = slots.get(Values.key(table.value(r, valueIdx)));
            if (slot == null) continue;
            counts.computeIfAbsent(GroupKey.of(table, r, groupIdx), k -> new long[values.size()])[slot]++;
        }

        final List<String> cols = new ArrayList<>(names);
        cols.add(GRAND_TOTAL_COLUMN);
        final Table.Builder out = Table.builder(cols);
        for (GroupKey key : GroupKey.sorted(counts)) {
            final long[] c = counts.get(key);
            final List<Object> row = new ArrayList<>(key.values());
            long total = 0;
            for (long n : c) {
                row.add(n);
                total += n;
            }
            row.add(total);
            out.addRow(row);
        }
        return out.build();
    }
}
