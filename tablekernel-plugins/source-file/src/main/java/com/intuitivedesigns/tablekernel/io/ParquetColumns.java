/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.tablekernel.io;

import com.intuitivedesigns.tablekernel.table.Table;
import org.apache.avro.Schema;
import org.apache.avro.Schema.Field;
import org.apache.avro.Schema.Type;
import org.apache.avro.util.Utf8;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Mapping between table columns and Avro record fields for Parquet files.
 *
 * <p>Avro field names are restricted to {@code [A-Za-z_][A-Za-z0-9_]*}, while table columns
 * are free text ("Order Value", "Grand_Total"). The writer sanitizes the field name and keeps
 * the original column name in the field property {@value #COLUMN_PROP}; the reader prefers
 * that property when present.</p>
 */
public final class ParquetColumns {

    public static final String COLUMN_PROP = "tk.column";

    private static final String RECORD_NAME = "TableRow";
    private static final String NAMESPACE = "com.intuitivedesigns.tablekernel";

    private ParquetColumns() {}

    /**
     * Builds a record schema for the table. Every field is nullable: all-integer columns
     * map to {@code long}, other numeric columns to {@code double}, anything else to {@code string}.
     */
    public static Schema schemaFor(Table table) {
        final List<Field> fields = new ArrayList<>(table.columnCount());
        final Set<String> used = new HashSet<>();
        for (String column : table.columns()) {
            final Field f = new Field(uniqueName(column, used), nullable(typeOf(table, column)),
                    null, Field.NULL_DEFAULT_VALUE);
            f.addProp(COLUMN_PROP, column);
            fields.add(f);
        }
        final Schema record = Schema.createRecord(RECORD_NAME, null, NAMESPACE, false);
        record.setFields(fields);
        return record;
    }

    /**
     * @return the table column a field stands for
     */
    public static String columnName(Field field) {
        final String original = field.getProp(COLUMN_PROP);
        return (original == null || original.isEmpty()) ? field.name() : original;
    }

    /**
     * Converts a table cell for a field of the given (non-null) type.
     */
    public static Object toAvro(Object cell, Type type) {
        if (cell == null) return null;
        switch (type) {
            case LONG:
                return ((Number) cell).longValue();
            case DOUBLE:
                return ((Number) cell).doubleValue();
            default:
                return cell.toString();
        }
    }

    /**
     * Converts a decoded Avro value to a table cell.
     */
    public static Object fromAvro(Object value) {
        if (value == null) return null;
        if (value instanceof Utf8 || value instanceof CharSequence) return value.toString();
        if (value instanceof Integer i) return i.longValue();
        if (value instanceof Float f) return f.doubleValue();
        if (value instanceof Long || value instanceof Double) return value;
        if (value instanceof Boolean b) return b.toString();
        if (value instanceof ByteBuffer bb) return StandardCharsets.UTF_8.decode(bb.duplicate()).toString();
        return value.toString();
    }

    /**
     * The non-null branch of a {@code ["null", T]} union, or the schema itself.
     */
    public static Schema unwrapNullable(Schema s) {
        if (s.getType() == Type.UNION) {
            for (Schema branch : s.getTypes()) {
                if (branch.getType() != Type.NULL) return branch;
            }
        }
        return s;
    }

    static String sanitize(String column) {
        String s = column.replaceAll("[^A-Za-z0-9_]", "_");
        if (s.isEmpty() || Character.isDigit(s.charAt(0))) s = "_" + s;
        return s;
    }

    private static String uniqueName(String column, Set<String> used) {
        final String base = sanitize(column);
        String name = base;
        for (int n = 2; !used.add(name); n++) {
            name = base + "_" + n;
        }
        return name;
    }

    private static Type typeOf(Table table, String column) {
        boolean sawValue = false;
        boolean allLong = true;
        for (Object v : table.column(column)) {
            if (v == null) continue;
            sawValue = true;
            if (!(v instanceof Number)) return Type.STRING;
            if (!(v instanceof Long)) allLong = false;
        }
        if (!sawValue) return Type.STRING;
        return allLong ? Type.LONG : Type.DOUBLE;
    }

    private static Schema nullable(Type type) {
        return Schema.createUnion(List.of(Schema.create(Type.NULL), Schema.create(type)));
    }
}
