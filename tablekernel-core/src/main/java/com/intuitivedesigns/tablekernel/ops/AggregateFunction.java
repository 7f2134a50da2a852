/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.tablekernel.ops;

import com.intuitivedesigns.tablekernel.table.ValidationException;
import com.intuitivedesigns.tablekernel.table.Values;

import java.util.List;
import java.util.Locale;

/**
 * Aggregations supported by {@link Relational#groupAggregate}. Missing values are ignored
 * by every function.
 */
public enum AggregateFunction {
    COUNT,
    SUM,
    MEAN,
    MIN,
    MAX;

    public static AggregateFunction parse(String name) {
        if (name == null) {
            throw new ValidationException("Aggregate function must not be null");
        }
        try {
            return valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ValidationException("Unknown aggregate function '" + name + "'. Expected one of count, sum, mean, min, max");
        }
    }

    Object apply(String column, List<Object> values) {
        switch (this) {
            case COUNT: {
                long n = 0;
                for (Object v : values) {
                    if (v != null) n++;
                }
                return n;
            }
            case SUM: {
                Object sum = 0L;
                for (Object v : values) {
                    sum = addNumeric(column, sum, v);
                }
                return sum;
            }
            case MEAN: {
                double total = 0.0;
                long n = 0;
                for (Object v : values) {
                    if (v == null) continue;
                    requireNumeric(column, v);
                    total += Values.toDouble(v);
                    n++;
                }
                return n == 0 ? null : total / n;
            }
            case MIN:
            case MAX: {
                Object best = null;
                for (Object v : values) {
                    if (v == null) continue;
                    if (best == null) {
                        best = v;
                        continue;
                    }
                    final int c = Values.compare(v, best);
                    if (this == MIN ? c < 0 : c > 0) best = v;
                }
                return best;
            }
            default:
                throw new IllegalStateException("Unhandled aggregate " + this);
        }
    }

    private static Object addNumeric(String column, Object sum, Object v) {
        if (v == null) return sum;
        requireNumeric(column, v);
        return Values.add(column, sum, v);
    }

    private static void requireNumeric(String column, Object v) {
        if (!Values.isNumeric(v)) {
            throw new ValidationException(column, "cannot aggregate non-numeric value '" + v + "'");
        }
    }
}
