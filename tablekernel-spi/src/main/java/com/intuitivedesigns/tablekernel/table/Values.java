/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.tablekernel.table;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Comparator;

/**
 * Cell value rules.
 *
 * <p>A cell holds a {@link String}, a {@link Long}, a {@link Double} or {@code null}
 * (missing). Everything entering a {@link Table} goes through {@link #normalize(Object)}.</p>
 */
public final class Values {

    /**
     * Total order used for grouping and sorting: numbers (numerically) before strings
     * (lexicographically), {@code null} last.
     */
    public static final Comparator<Object> ORDER = Values::compare;

    private static final double LONG_MIN_AS_DOUBLE = -0x1p63;
    private static final double LONG_MAX_AS_DOUBLE = 0x1p63;

    private Values() {}

    public static Object normalize(Object value) {
        if (value == null) return null;
        if (value instanceof String || value instanceof Long) return value;
        if (value instanceof Double d) return d.isNaN() ? null : d;
        if (value instanceof Integer || value instanceof Short || value instanceof Byte) {
            return ((Number) value).longValue();
        }
        if (value instanceof Float f) return f.isNaN() ? null : f.doubleValue();
        if (value instanceof BigInteger bi) return bi.longValueExact();
        if (value instanceof BigDecimal bd) return bd.doubleValue();
        if (value instanceof CharSequence || value instanceof Boolean || value instanceof Character) {
            return value.toString();
        }
        throw new ValidationException("Unsupported cell value type: " + value.getClass().getName());
    }

    public static boolean isNumeric(Object value) {
        return value instanceof Long || value instanceof Double;
    }

    public static double toDouble(Object value) {
        if (value instanceof Number n) return n.doubleValue();
        throw new ValidationException("Not a numeric value: " + value);
    }

    /**
     * Canonical form for key equality: integral doubles collapse to longs so that
     * {@code 1} and {@code 1.0} land in the same group.
     */
    public static Object key(Object value) {
        if (value instanceof Double d && isIntegral(d)) {
            return d.longValue();
        }
        return value;
    }

    public static int compare(Object a, Object b) {
        if (a == b) return 0;
        if (a == null) return 1;
        if (b == null) return -1;

        final boolean an = isNumeric(a);
        final boolean bn = isNumeric(b);
        if (an && bn) {
            if (a instanceof Long la && b instanceof Long lb) return Long.compare(la, lb);
            return Double.compare(toDouble(a), toDouble(b));
        }
        if (an) return -1;
        if (bn) return 1;
        return a.toString().compareTo(b.toString());
    }

    /**
     * Adds two numeric cells. {@code null} is skipped; the result stays a {@link Long}
     * while both sides are longs.
     */
    public static Object add(Object sum, Object value) {
        return add(null, sum, value);
    }

    /**
     * Same as {@link #add(Object, Object)}, naming {@code column} in failures.
     *
     * @throws ValidationException on a non-numeric value or when a long sum overflows
     */
    public static Object add(String column, Object sum, Object value) {
        if (value == null) return sum;
        if (!isNumeric(value)) {
            throw new ValidationException(column, "cannot sum non-numeric value: " + value);
        }
        if (sum == null) return value;
        if (sum instanceof Long a && value instanceof Long b) {
            try {
                return Math.addExact(a, b);
            } catch (ArithmeticException e) {
                throw new ValidationException(column, "long overflow adding " + a + " and " + b, e);
            }
        }
        return toDouble(sum) + toDouble(value);
    }

    private static boolean isIntegral(double d) {
        return d == Math.rint(d) && !Double.isInfinite(d)
                && d >= LONG_MIN_AS_DOUBLE && d < LONG_MAX_AS_DOUBLE;
    }
}
