/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.tablekernel.ops;

import com.intuitivedesigns.tablekernel.table.Columns;
import com.intuitivedesigns.tablekernel.table.InvalidOperatorException;
import com.intuitivedesigns.tablekernel.table.SchemaException;
import com.intuitivedesigns.tablekernel.table.Table;
import com.intuitivedesigns.tablekernel.table.ValidationException;
import com.intuitivedesigns.tablekernel.table.Values;

import java.util.Arrays;
import java.util.List;

/**
 * SQL-style operations over {@link Table}s.
 *
 * <p>Design Principles:</p>
 * <ul>
 * <li>Pure: every operation returns a new table and never touches its inputs.</li>
 * <li>Deterministic: grouped output is key-sorted ({@link Values#ORDER}).</li>
 * <li>Fail fast: a bad column reference raises {@link SchemaException}, a bad operator
 * {@link InvalidOperatorException}, badly shaped parameters {@link ValidationException}.</li>
 * </ul>
 */
public final class Relational {

    public static final String DEFAULT_CATEGORY_COLUMN = "Category";
    public static final String DEFAULT_TOTAL_LABEL = "Total";
    public static final String DEFAULT_GRAND_LABEL = "Grand Total";
    public static final String GRAND_TOTAL_COLUMN = PivotCount.GRAND_TOTAL_COLUMN;

    private Relational() {}

    // -----------------------------------------------------------------------
    // SHAPE
    // -----------------------------------------------------------------------

    public static Table normalizeColumns(Table table) {
        return Columns.normalize(table);
    }

    /**
     * Parses {@code column} as numbers. Thousands separators are ignored and unparseable
     * cells become missing; only an absent column is an error.
     */
    public static Table coerceNumeric(Table table, String column) {
        return NumericCoercion.coerce(table, column);
    }

    public static Table select(Table table, List<String> columns) {
        if (columns == null || columns.isEmpty()) {
            throw new ValidationException("Select requires at least one column");
        }
        final int[] idx = GroupKey.indexes(table, columns);
        final Table.Builder out = Table.builder(columns);
        for (int r = 0; r < table.rowCount(); r++) {
            final Object[] row = new Object[idx.length];
            for (int i = 0; i < idx.length; i++) row[i] = table.value(r, idx[i]);
            out.addRow(row);
        }
        return out.build();
    }

    public static Table select(Table table, String... columns) {
        return select(table, Arrays.asList(columns));
    }

    // -----------------------------------------------------------------------
    // JOIN & FILTER
    // -----------------------------------------------------------------------

    public static Table join(Table left, Table right, List<String> keys, JoinKind kind) {
        return Joins.join(left, right, keys, kind);
    }

    public static Table join(Table left, Table right, String key, JoinKind kind) {
        return Joins.join(left, right, List.of(key), kind);
    }

    /**
     * Keeps the rows where {@code row[column] <op> value}, in their original order.
     */
    public static Table filter(Table table, String column, FilterOperator op, Object value) {
        if (op == null) {
            throw new ValidationException("Filter operator must not be null");
        }
        if (value == null) {
            throw new ValidationException(column, "filter value must not be null");
        }
        final Object operand = Values.normalize(value);
        final int c = table.indexOf(column);

        final Table.Builder out = Table.builder(table.columns());
        for (int r = 0; r < table.rowCount(); r++) {
            if (op.test(table.value(r, c), operand)) {
                out.addRow(table.rowValues(r));
            }
        }
        return out.build();
    }

    /**
     * @throws InvalidOperatorException if {@code symbol} is not one of {@code >= <= > < == !=}
     */
    public static Table filter(Table table, String column, String symbol, Object value) {
        return filter(table, column, FilterOperator.fromSymbol(symbol), value);
    }

    // -----------------------------------------------------------------------
    // GROUPING & CLASSIFICATION
    // -----------------------------------------------------------------------

    public static Table groupCount(Table table, List<String> keys, String counterName) {
        return Grouping.count(table, keys, counterName);
    }

    public static Table groupAggregate(Table table, List<String> keys, String outputName,
                                       String aggColumn, AggregateFunction fn) {
        return Grouping.aggregate(table, keys, outputName, aggColumn, fn);
    }

    /**
     * Projects to {@code keepColumns}, then appends {@code newColumn} holding the label of the
     * first range containing {@code valueColumn}. Bounds are inclusive.
     */
    public static Table classify(Table table, List<String> keepColumns, String valueColumn, List<Range> ranges,
                                 List<String> labels, String defaultLabel, String newColumn) {
        return RangeClassifier.classify(table, keepColumns, valueColumn, ranges, labels, defaultLabel, newColumn);
    }

    public static Table classify(Table table, List<String> keepColumns, String valueColumn, List<Range> ranges,
                                 List<String> labels, String defaultLabel) {
        return classify(table, keepColumns, valueColumn, ranges, labels, defaultLabel, DEFAULT_CATEGORY_COLUMN);
    }

    // -----------------------------------------------------------------------
    // PIVOT & ROLLUP
    // -----------------------------------------------------------------------

    public static Table pivotCount(Table table, String group1, String group2, String valueColumn, List<?> values) {
        return PivotCount.pivot(table, group1, group2, valueColumn, values);
    }

    public static Table rollup(Table table, String group1, String group2, String totalLabel, String grandLabel) {
        return Rollups.rollup(table, group1, group2, totalLabel, grandLabel);
    }

    public static Table rollup(Table table, String group1, String group2) {
        return rollup(table, group1, group2, DEFAULT_TOTAL_LABEL, DEFAULT_GRAND_LABEL);
    }

    public static Table concat(Table... tables) {
        return Rollups.concat(Arrays.asList(tables));
    }

    public static Table concat(List<Table> tables) {
        return Rollups.concat(tables);
    }

    public static Table orderRollup(Table table, String group1, String group2, String totalLabel, String grandLabel) {
        return Rollups.order(table, group1, group2, totalLabel, grandLabel);
    }

    public static Table orderRollup(Table table, String group1, String group2) {
        return orderRollup(table, group1, group2, DEFAULT_TOTAL_LABEL, DEFAULT_GRAND_LABEL);
    }

    /**
     * Appends subtotal and grand-total rows to {@code table} and sorts the result canonically.
     */
    public static Table rollupReport(Table table, String group1, String group2, String totalLabel, String grandLabel) {
        final Table totals = rollup(table, group1, group2, totalLabel, grandLabel);
        return orderRollup(concat(table, totals), group1, group2, totalLabel, grandLabel);
    }
}
