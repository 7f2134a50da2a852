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
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Hash join over one or more key columns.
 *
 * <p>Output columns are the left columns followed by the right non-key columns. A non-key
 * name present on both sides is emitted as {@code name_x} (left) and {@code name_y} (right).
 * Missing keys compare equal to each other.</p>
 */
final class Joins {

    static final String LEFT_SUFFIX = "_x";
    static final String RIGHT_SUFFIX = "_y";

    private Joins() {}

    static Table join(Table left, Table right, List<String> keys, JoinKind kind) {
        if (keys == null || keys.isEmpty()) {
            throw new ValidationException("Join requires at least one key column");
        }
        if (kind == null) {
            throw new ValidationException("Join kind must not be null");
        }
        left.requireColumns(keys);
        right.requireColumns(keys);

        final Set<String> keySet = new HashSet<>(keys);
        final int[] leftKeyIdx = indexes(left, keys);
        final int[] rightKeyIdx = indexes(right, keys);

        final List<Integer> rightPayload = new ArrayList<>();
        for (int c = 0; c < right.columnCount(); c++) {
            if (!keySet.contains(right.columns().get(c))) rightPayload.add(c);
        }

        final Table.Builder out = Table.builder(outputColumns(left, right, keySet, rightPayload));
        final int width = left.columnCount() + rightPayload.size();

        // right side index: key -> row numbers in right order
        final Map<List<Object>, List<Integer>> rightIndex = new HashMap<>();
        for (int r = 0; r < right.rowCount(); r++) {
            rightIndex.computeIfAbsent(keyOf(right, r, rightKeyIdx), k -> new ArrayList<>()).add(r);
        }

        if (kind == JoinKind.RIGHT) {
            final Map<List<Object>, List<Integer>> leftIndex = new LinkedHashMap<>();
            for (int r = 0; r < left.rowCount(); r++) {
                leftIndex.computeIfAbsent(keyOf(left, r, leftKeyIdx), k -> new ArrayList<>()).add(r);
            }
            for (int rr = 0; rr < right.rowCount(); rr++) {
                final List<Integer> matches = leftIndex.get(keyOf(right, rr, rightKeyIdx));
                if (matches == null) {
                    out.addRow(unmatchedRight(left, right, rr, leftKeyIdx, rightKeyIdx, rightPayload, width));
                    continue;
                }
                for (int lr : matches) {
                    out.addRow(combine(left, lr, right, rr, rightPayload, width));
                }
            }
            return out.build();
        }

        final boolean[] rightMatched = new boolean[right.rowCount()];
        for (int lr = 0; lr < left.rowCount(); lr++) {
            final List<Integer> matches = rightIndex.get(keyOf(left, lr, leftKeyIdx));
            if (matches == null) {
                if (kind.keepsUnmatchedLeft()) {
                    out.addRow(combine(left, lr, right, -1, rightPayload, width));
                }
                continue;
            }
            for (int rr : matches) {
                rightMatched[rr] = true;
                out.addRow(combine(left, lr, right, rr, rightPayload, width));
            }
        }

        if (kind.keepsUnmatchedRight()) {
            for (int rr = 0; rr < right.rowCount(); rr++) {
                if (!rightMatched[rr]) {
                    out.addRow(unmatchedRight(left, right, rr, leftKeyIdx, rightKeyIdx, rightPayload, width));
                }
            }
        }
        return out.build();
    }

    private static List<String> outputColumns(Table left, Table right, Set<String> keys, List<Integer> rightPayload) {
        final Set<String> rightNames = new HashSet<>();
        for (int c : rightPayload) rightNames.add(right.columns().get(c));

        final List<String> cols = new ArrayList<>(left.columnCount() + rightPayload.size());
        for (String c : left.columns()) {
            cols.add(!keys.contains(c) && rightNames.contains(c) ? c + LEFT_SUFFIX : c);
        }
        for (int c : rightPayload) {
            final String name = right.columns().get(c);
            cols.add(left.hasColumn(name) ? name + RIGHT_SUFFIX : name);
        }
        return cols;
    }

    private static Object[] combine(Table left, int lr, Table right, int rr, List<Integer> rightPayload, int width) {
        final Object[] row = new Object[width];
        final int lw = left.columnCount();
        if (lr >= 0) {
            System.arraycopy(left.rowValues(lr), 0, row, 0, lw);
        }
        if (rr >= 0) {
            for (int i = 0; i < rightPayload.size(); i++) {
                row[lw + i] = right.value(rr, rightPayload.get(i));
            }
        }
        return row;
    }

    /**
     * A right row without a left partner: key columns take the right-hand values.
     */
    private static Object[] unmatchedRight(Table left, Table right, int rr, int[] leftKeyIdx, int[] rightKeyIdx,
                                           List<Integer> rightPayload, int width) {
        final Object[] row = combine(left, -1, right, rr, rightPayload, width);
        for (int k = 0; k < leftKeyIdx.length; k++) {
            row[leftKeyIdx[k]] = right.value(rr, rightKeyIdx[k]);
        }
        return row;
    }

    private static int[] indexes(Table t, List<String> cols) {
        final int[] idx = new int[cols.size()];
        for (int i = 0; i < idx.length; i++) idx[i] = t.indexOf(cols.get(i));
        return idx;
    }

    private static List<Object> keyOf(Table t, int row, int[] idx) {
        final List<Object> key = new ArrayList<>(idx.length);
        for (int i : idx) key.add(Values.key(t.value(row, i)));
        return key;
    }
}
