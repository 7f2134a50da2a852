/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.tablekernel.ops;

import com.intuitivedesigns.tablekernel.table.Table;
import com.intuitivedesigns.tablekernel.table.ValidationException;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Group-by with a row counter or a single aggregate. Output rows are key-sorted.
 */
final class Grouping {

    private Grouping() {}

    static Table count(Table table, List<String> keys, String counterName) {
        final int[] idx = validate(table, keys, counterName);
        final Map<GroupKey, List<Integer>> groups = GroupKey.index(table, idx);

        final Table.Builder out = Table.builder(outputColumns(keys, counterName));
        for (GroupKey key : GroupKey.sorted(groups)) {
            final List<Object> row = new ArrayList<>(key.values());
            row.add((long) groups.get(key).size());
            out.addRow(row);
        }
        return out.build();
    }

    static Table aggregate(Table table, List<String> keys, String outputName, String aggColumn, AggregateFunction fn) {
        final int[] idx = validate(table, keys, outputName);
        if (fn == null) {
            throw new ValidationException("Aggregate function must not be null");
        }
        final int aggIdx = table.indexOf(aggColumn);
        final Map<GroupKey, List<Integer>> groups = GroupKey.index(table, idx);

        final Table.Builder out = Table.builder(outputColumns(keys, outputName));
        for (GroupKey key : GroupKey.sorted(groups)) {
            final List<Object> cells = new ArrayList<>();
            for (int r : groups.get(key)) cells.add(table.value(r, aggIdx));

            final List<Object> row = new ArrayList<>(key.values());
            row.add(fn.apply(aggColumn, cells));
            out.addRow(row);
        }
        return out.build();
    }

    private static int[] validate(Table table, List<String> keys, String outputName) {
        if (keys == null || keys.isEmpty()) {
            throw new ValidationException("Group-by requires at least one key column");
        }
        if (outputName == null || outputName.isBlank()) {
            throw new ValidationException("Output column name must not be blank");
        }
        if (keys.contains(outputName)) {
            throw new ValidationException(outputName, "output name clashes with a group key");
        }
        return GroupKey.indexes(table, keys);
    }

    private static List<String> outputColumns(List<String> keys, String outputName) {
        final List<String> cols = new ArrayList<>(keys);
        cols.add(outputName);
        return cols;
    }
}
