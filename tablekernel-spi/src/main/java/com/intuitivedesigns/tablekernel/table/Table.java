/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.tablekernel.table;

import java.util.AbstractList;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * An immutable, ordered sequence of rows over a shared list of named columns.
 *
 * <p>Design Principles:</p>
 * <ul>
 * <li>Immutability: operations never change a table, they build a new one.</li>
 * <li>Column order is presentation only. {@link #equals(Object)} compares the column
 * set and, row by row, the column to value mapping.</li>
 * <li>Cells are normalized by {@link Values#normalize(Object)} on the way in.</li>
 * </ul>
 */
public final class Table {

    private final List<String> columns;
    private final Map<String, Integer> index;
    private final List<Object[]> rows;

    private Table(List<String> columns, Map<String, Integer> index, List<Object[]> rows) {
        this.columns = columns;
        this.index = index;
        this.rows = rows;
    }

    // -----------------------------------------------------------------------
    // FACTORY METHODS
    // -----------------------------------------------------------------------

    public static Builder builder(String... columns) {
        return new Builder(Arrays.asList(columns));
    }

    public static Builder builder(List<String> columns) {
        return new Builder(columns);
    }

    public static Table empty(List<String> columns) {
        return new Builder(columns).build();
    }

    // -----------------------------------------------------------------------
    // SCHEMA
    // -----------------------------------------------------------------------

    public List<String> columns() {
        return columns;
    }

    public int columnCount() {
        return columns.size();
    }

    public boolean hasColumn(String column) {
        return index.containsKey(column);
    }

    /**
     * @throws SchemaException if the column does not exist
     */
    public int indexOf(String column) {
        final Integer i = index.get(column);
        if (i == null) {
            throw new SchemaException(column, columns);
        }
        return i;
    }

    /**
     * Fails with {@link SchemaException} on the first absent column.
     */
    public void requireColumns(List<String> required) {
        for (String c : required) {
            indexOf(c);
        }
    }

    /**
     * Positional rename. The caller guarantees {@code newNames} has one entry per column.
     */
    public Table renameColumns(List<String> newNames) {
        if (newNames.size() != columns.size()) {
            throw new ValidationException("Expected " + columns.size() + " column names, got " + newNames.size());
        }
        return new Table(List.copyOf(newNames), indexColumns(newNames), rows);
    }

    // -----------------------------------------------------------------------
    // DATA
    // -----------------------------------------------------------------------

    public int rowCount() {
        return rows.size();
    }

    public boolean isEmpty() {
        return rows.isEmpty();
    }

    public Object value(int row, int column) {
        return rows.get(row)[column];
    }

    public Object value(int row, String column) {
        return rows.get(row)[indexOf(column)];
    }

    public Row row(int row) {
        Objects.checkIndex(row, rows.size());
        return new Row(this, row);
    }

    public List<Row> rows() {
        return new AbstractList<>() {
            @Override
            public Row get(int i) {
                return row(i);
            }

            @Override
            public int size() {
                return rows.size();
            }
        };
    }

    public List<Object> column(String column) {
        final int c = indexOf(column);
        final List<Object> out = new ArrayList<>(rows.size());
        for (Object[] r : rows) {
            out.add(r[c]);
        }
        return Collections.unmodifiableList(out);
    }

    /**
     * True when every non-missing cell of the column is a number.
     */
    public boolean isNumericColumn(String column) {
        final int c = indexOf(column);
        for (Object[] r : rows) {
            if (r[c] != null && !Values.isNumeric(r[c])) return false;
        }
        return true;
    }

    /**
     * Copy of one row's cells in column order.
     */
    public Object[] rowValues(int row) {
        return rows.get(row).clone();
    }

    // -----------------------------------------------------------------------
    // EQUALITY & RENDERING
    // -----------------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Table other)) return false;
        if (rows.size() != other.rows.size()) return false;
        if (!index.keySet().equals(other.index.keySet())) return false;

        for (int r = 0; r < rows.size(); r++) {
            final Object[] mine = rows.get(r);
            final Object[] theirs = other.rows.get(r);
            for (Map.Entry<String, Integer> e : index.entrySet()) {
                if (!Objects.equals(mine[e.getValue()], theirs[other.index.get(e.getKey())])) {
                    return false;
                }
            }
        }
        return true;
    }

    @Override
    public int hashCode() {
        int h = index.keySet().hashCode();
        for (int r = 0; r < rows.size(); r++) {
            h = 31 * h + row(r).asMap().hashCode();
        }
        return h;
    }

    @Override
    public String toString() {
        return "Table{columns=" + columns + ", rows=" + rows.size() + '}';
    }

    /**
     * Plain-text grid of the first {@code maxRows} rows, for logs and debugging.
     */
    public String render(int maxRows) {
        final int shown = Math.min(Math.max(maxRows, 0), rows.size());
        final int[] width = new int[columns.size()];
        for (int c = 0; c < columns.size(); c++) {
            width[c] = columns.get(c).length();
            for (int r = 0; r < shown; r++) {
                width[c] = Math.max(width[c], String.valueOf(rows.get(r)[c]).length());
            }
        }

        final StringBuilder sb = new StringBuilder();
        appendLine(sb, columns.toArray(), width);
        for (int r = 0; r < shown; r++) {
            appendLine(sb, rows.get(r), width);
        }
        if (shown < rows.size()) {
            sb.append("... ").append(rows.size() - shown).append(" more rows\n");
        }
        return sb.toString();
    }

    private static void appendLine(StringBuilder sb, Object[] cells, int[] width) {
        for (int c = 0; c < cells.length; c++) {
            if (c > 0) sb.append(" | ");
            final String s = String.valueOf(cells[c]);
            sb.append(s);
            sb.append(" ".repeat(width[c] - s.length()));
        }
        sb.append('\n');
    }

    private static Map<String, Integer> indexColumns(List<String> columns) {
        final Map<String, Integer> idx = new HashMap<>(columns.size() * 2);
        for (int i = 0; i < columns.size(); i++) {
            final String name = Objects.requireNonNull(columns.get(i), "column name");
            if (idx.putIfAbsent(name, i) != null) {
                throw new ValidationException(name, "duplicate column name");
            }
        }
        return Collections.unmodifiableMap(idx);
    }

    // -----------------------------------------------------------------------
    // BUILDER
    // -----------------------------------------------------------------------

    /**
     * Accumulates rows for a new table. Not thread-safe; build once.
     */
    public static final class Builder {
        private final List<String> columns;
        private final Map<String, Integer> index;
        private final List<Object[]> rows = new ArrayList<>();

        private Builder(List<String> columns) {
            this.columns = List.copyOf(columns);
            this.index = indexColumns(this.columns);
        }

        public Builder addRow(Object... values) {
            if (values.length != columns.size()) {
                throw new ValidationException("Row has " + values.length + " values, table has "
                        + columns.size() + " columns " + columns);
            }
            final Object[] copy = new Object[values.length];
            for (int i = 0; i < values.length; i++) {
                copy[i] = Values.normalize(values[i]);
            }
            rows.add(copy);
            return this;
        }

        public Builder addRow(List<?> values) {
            return addRow(values.toArray());
        }

        /**
         * Adds a row by column name. Columns absent from the map are missing (null);
         * keys that are not columns fail with {@link SchemaException}.
         */
        public Builder addRow(Map<String, ?> values) {
            final Object[] row = new Object[columns.size()];
            for (Map.Entry<String, ?> e : values.entrySet()) {
                final Integer i = index.get(e.getKey());
                if (i == null) {
                    throw new SchemaException(e.getKey(), columns);
                }
                row[i] = Values.normalize(e.getValue());
            }
            rows.add(row);
            return this;
        }

        public int rowCount() {
            return rows.size();
        }

        public Table build() {
            return new Table(columns, index, Collections.unmodifiableList(new ArrayList<>(rows)));
        }
    }

    /**
     * Snapshot of a row as an insertion-ordered map (column order).
     */
    static Map<String, Object> asMap(List<String> columns, Object[] values) {
        final Map<String, Object> m = new LinkedHashMap<>(columns.size() * 2);
        for (int i = 0; i < columns.size(); i++) {
            m.put(columns.get(i), values[i]);
        }
        return m;
    }
}
