/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.tablekernel.io;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Per-column value typing for decoded files.
 *
 * <p>A column whose non-empty cells are all integers becomes {@link Long}, all numbers
 * becomes {@link Double}, anything else stays {@link String}. Empty cells are missing.
 * Text such as {@code "1,250"} is left as text.</p>
 */
public final class ColumnTypes {

    private static final Pattern INTEGER = Pattern.compile("[+-]?\\d{1,18}");
    private static final Pattern DECIMAL = Pattern.compile("[+-]?(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?");

    enum Kind { INTEGER, DECIMAL, TEXT }

    private ColumnTypes() {}

    /**
     * @param raw decoded cells: {@code String}, {@code Number} or {@code null}
     * @return the same cells converted to the column's inferred type
     */
    public static List<Object> typed(List<Object> raw) {
        final Kind kind = infer(raw);
        final List<Object> out = new ArrayList<>(raw.size());
        for (Object v : raw) {
            out.add(convert(v, kind));
        }
        return out;
    }

    static Kind infer(List<Object> raw) {
        Kind kind = null;
        for (Object v : raw) {
            final Kind k = kindOf(v);
            if (k == null) continue;
            if (k == Kind.TEXT) return Kind.TEXT;
            kind = (k == Kind.DECIMAL || kind == Kind.DECIMAL) ? Kind.DECIMAL : Kind.INTEGER;
        }
        return kind == null ? Kind.TEXT : kind;
    }

    private static Kind kindOf(Object v) {
        if (v == null) return null;
        if (v instanceof Number n) {
            final double d = n.doubleValue();
            if (v instanceof Long || v instanceof Integer || v instanceof Short || v instanceof Byte) return Kind.INTEGER;
            return isWhole(d) ? Kind.INTEGER : Kind.DECIMAL;
        }
        final String s = v.toString().trim();
        if (s.isEmpty()) return null;
        if (INTEGER.matcher(s).matches()) return Kind.INTEGER;
        if (DECIMAL.matcher(s).matches()) return Kind.DECIMAL;
        return Kind.TEXT;
    }

    private static Object convert(Object v, Kind kind) {
        if (v == null) return null;
        if (!(v instanceof Number) && v.toString().trim().isEmpty()) return null;

        switch (kind) {
            case INTEGER:
                return (v instanceof Number n) ? n.longValue() : Long.parseLong(v.toString().trim());
            case DECIMAL:
                return (v instanceof Number n) ? n.doubleValue() : Double.parseDouble(v.toString().trim());
            default:
                return asText(v);
        }
    }

    /**
     * Spreadsheet numbers are doubles; whole ones render without a trailing {@code .0}.
     */
    public static String asText(Object v) {
        if (v instanceof Double d && isWhole(d)) return Long.toString(d.longValue());
        if (v instanceof Float f && isWhole(f)) return Long.toString(f.longValue());
        return v.toString();
    }

    private static boolean isWhole(double d) {
        return !Double.isInfinite(d) && d == Math.rint(d) && Math.abs(d) < 0x1p53;
    }
}
