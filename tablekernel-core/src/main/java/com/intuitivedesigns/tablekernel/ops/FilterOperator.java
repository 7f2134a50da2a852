/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.tablekernel.ops;

import com.intuitivedesigns.tablekernel.table.InvalidOperatorException;
import com.intuitivedesigns.tablekernel.table.ValidationException;
import com.intuitivedesigns.tablekernel.table.Values;

import java.util.Arrays;
import java.util.stream.Collectors;

/**
 * The closed set of row filter comparisons.
 */
public enum FilterOperator {
    GREATER_OR_EQUAL(">="),
    LESS_OR_EQUAL("<="),
    GREATER(">"),
    LESS("<"),
    EQUAL("=="),
    NOT_EQUAL("!=");

    private static final String SUPPORTED = Arrays.stream(values())
            .map(FilterOperator::symbol)
            .collect(Collectors.joining(", "));

    private final String symbol;

    FilterOperator(String symbol) {
        this.symbol = symbol;
    }

    public String symbol() {
        return symbol;
    }

    /**
     * @throws InvalidOperatorException for anything but the six supported symbols
     */
    public static FilterOperator fromSymbol(String symbol) {
        if (symbol != null) {
            final String s = symbol.trim();
            for (FilterOperator op : values()) {
                if (op.symbol.equals(s)) return op;
            }
        }
        throw new InvalidOperatorException(symbol, SUPPORTED);
    }

    /**
     * Evaluates {@code cell <op> value}. A missing cell satisfies only {@link #NOT_EQUAL}.
     */
    boolean test(Object cell, Object value) {
        if (cell == null) {
            return this == NOT_EQUAL;
        }
        switch (this) {
            case EQUAL:
                return sameValue(cell, value);
            case NOT_EQUAL:
                return !sameValue(cell, value);
            default:
                break;
        }

        if (Values.isNumeric(cell) != Values.isNumeric(value)) {
            throw new ValidationException("Cannot compare " + describe(cell) + " with " + describe(value)
                    + " using '" + symbol + "'");
        }
        final int c = Values.compare(cell, value);
        switch (this) {
            case GREATER_OR_EQUAL:
                return c >= 0;
            case LESS_OR_EQUAL:
                return c <= 0;
            case GREATER:
                return c > 0;
            case LESS:
                return c < 0;
            default:
                throw new IllegalStateException("Unhandled operator " + this);
        }
    }

    private static boolean sameValue(Object a, Object b) {
        if (Values.isNumeric(a) && Values.isNumeric(b)) {
            return Values.compare(a, b) == 0;
        }
        return a.equals(b);
    }

    private static String describe(Object v) {
        return (Values.isNumeric(v) ? "number " : "text ") + "'" + v + "'";
    }
}
