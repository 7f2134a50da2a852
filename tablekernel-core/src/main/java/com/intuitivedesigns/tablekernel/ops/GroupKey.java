/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.tablekernel.ops;

import com.intuitivedesigns.tablekernel.table.Table;
import com.intuitivedesigns.tablekernel.table.Values;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Composite grouping key. {@link #values()} are the first-seen cell values,
 * equality uses {@link Values#key(Object)} so {@code 1} and {@code 1.0} share a group.
 */
final class GroupKey {

    static final Comparator<GroupKey> ORDER = (a, b) -> {
        for (int i = 0; i < a.values.size(); i++) {
            final int c = Values.compare(a.values.get(i), b.values.get(i));
            if (c != 0) return c;
        }
        return 0;
    };

    private final List<Object> values;
    private final List<Object> canonical;

    private GroupKey(List<Object> values) {
        this.values = values;
        this.canonical = new ArrayList<>(values.size());
        for (Object v : values) canonical.add(Values.key(v));
    }

    static GroupKey of(Table table, int row, int[] columns) {
        final List<Object> vals = new ArrayList<>(columns.length);
        for (int c : columns) vals.add(table.value(row, c));
        return new GroupKey(vals);
    }

    List<Object> values() {
        return values;
    }

    /**
     * Row numbers per key, keys in first-encountered order.
     */
    static Map<GroupKey, List<Integer>> index(Table table, int[] columns) {
        final Map<GroupKey, List<Integer>> groups = new LinkedHashMap<>();
        for (int r = 0; r < table.rowCount(); r++) {
            groups.computeIfAbsent(of(table, r, columns), k -> new ArrayList<>()).add(r);
        }
        return groups;
    }

    /**
     * Keys sorted by {@link #ORDER}.
     */
    static List<GroupKey> sorted(Map<GroupKey, ?> groups) {
        final List<GroupKey> keys = new ArrayList<>(groups.keySet());
        keys.sort(ORDER);
        return keys;
    }

    static int[] indexes(Table table, List<String> columns) {
        final int[] idx = new int[columns.size()];
        for (int i = 0; i < idx.length; i++) idx[i] = table.indexOf(columns.get(i));
        return idx;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof GroupKey other && canonical.equals(other.canonical);
    }

    @Override
    public int hashCode() {
        return canonical.hashCode();
    }

    @Override
    public String toString() {
        return values.toString();
    }
}
