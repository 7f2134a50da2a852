/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.tablekernel.ops;

import com.intuitivedesigns.tablekernel.table.Table;
import com.intuitivedesigns.tablekernel.table.ValidationException;
import com.intuitivedesigns.tablekernel.table.Values;

import java.util.ArrayList;
import java.util.List;

/**
 * CASE WHEN style bucketing of a numeric column into labels.
 * The first range containing the value wins; nothing matching (or a missing value) gets the default label.
 */
final class RangeClassifier {

    private RangeClassifier() {}

    static Table classify(Table table, List<String> keepColumns, String valueColumn, List<Range> ranges,
                          List<String> labels, String defaultLabel, String newColumn) {
        if (ranges == null || labels == null || ranges.size() != labels.size()) {
            throw new ValidationException("Ranges and labels must match: got "
                    + (ranges == null ? 0 : ranges.size()) + " ranges and "
                    + (labels == null ? 0 : labels.size()) + " labels");
        }
        if (ranges.isEmpty()) {
            throw new ValidationException("At least one range is required");
        }
        if (newColumn == null || newColumn.isBlank()) {
            throw new ValidationException("Category column name must not be blank");
        }

        final Table projected = Relational.select(table, keepColumns);
        final int valueIdx = projected.indexOf(valueColumn);
        if (projected.hasColumn(newColumn)) {
            throw new ValidationException(newColumn, "category column already exists");
        }

        final List<String> cols = new ArrayList<>(projected.columns());
        cols.add(newColumn);
        final Table.Builder out = Table.builder(cols);

        final int width = projected.columnCount();
        for (int r = 0; r < projected.rowCount(); r++) {
            final Object[] row = new Object[width + 1];
            System.arraycopy(projected.rowValues(r), 0, row, 0, width);
            row[width] = label(valueColumn, projected.value(r, valueIdx), ranges, labels, defaultLabel);
            out.addRow(row);
        }
        return out.build();
    }

    private static String label(String column, Object value, List<Range> ranges, List<String> labels, String defaultLabel) {
        if (value == null) return defaultLabel;
        if (!Values.isNumeric(value)) {
            throw new ValidationException(column, "cannot classify non-numeric value '" + value + "'");
        }
        final double d = Values.toDouble(value);
        for (int i = 0; i < ranges.size(); i++) {
            if (ranges.get(i).contains(d)) return labels.get(i);
        }
        return defaultLabel;
    }
}
