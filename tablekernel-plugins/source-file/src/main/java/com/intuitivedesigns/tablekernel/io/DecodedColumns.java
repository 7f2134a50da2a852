/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.tablekernel.io;

import com.intuitivedesigns.tablekernel.table.Table;

import java.util.ArrayList;
import java.util.List;

/**
 * Column-wise buffer used by the text decoders: cells are collected raw, typed per column
 * by {@link ColumnTypes}, then assembled into a table.
 */
final class DecodedColumns {

    private final List<String> names;
    private final List<List<Object>> cells;

    DecodedColumns(List<String> names) {
        this.names = List.copyOf(names);
        this.cells = new ArrayList<>(names.size());
        for (int i = 0; i < names.size(); i++) cells.add(new ArrayList<>());
    }

    int width() {
        return names.size();
    }

    /**
     * Short rows are padded with missing cells; cells beyond the header are dropped.
     */
    void addRow(List<Object> row) {
        for (int c = 0; c < names.size(); c++) {
            cells.get(c).add(c < row.size() ? row.get(c) : null);
        }
    }

    Table toTable() {
        final List<List<Object>> typed = new ArrayList<>(cells.size());
        for (List<Object> col : cells) typed.add(ColumnTypes.typed(col));

        final int rows = names.isEmpty() ? 0 : typed.get(0).size();
        final Table.Builder b = Table.builder(names);
        for (int r = 0; r < rows; r++) {
            final Object[] row = new Object[names.size()];
            for (int c = 0; c < row.length; c++) row[c] = typed.get(c).get(r);
            b.addRow(row);
        }
        return b.build();
    }
}
