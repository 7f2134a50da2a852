/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.tablekernel.ops;

import com.intuitivedesigns.tablekernel.table.ValidationException;

/**
 * An inclusive numeric interval {@code [min, max]}.
 */
public record Range(double min, double max) {

    public Range {
        if (Double.isNaN(min) || Double.isNaN(max)) {
            throw new ValidationException("Range bounds must be numbers");
        }
        if (min > max) {
            throw new ValidationException("Range min " + min + " is greater than max " + max);
        }
    }

    public static Range of(double min, double max) {
        return new Range(min, max);
    }

    /**
     * Parses {@code "min:max"}, e.g. {@code "1000:5000"}.
     */
    public static Range parse(String text) {
        final String[] parts = text == null ? new String[0] : text.trim().split(":");
        if (parts.length != 2) {
            throw new ValidationException("Range must be written as min:max, got '" + text + "'");
        }
        try {
            return new Range(Double.parseDouble(parts[0].trim()), Double.parseDouble(parts[1].trim()));
        } catch (NumberFormatException e) {
            throw new ValidationException("Range bounds must be numbers, got '" + text + "'");
        }
    }

    public boolean contains(double value) {
        return value >= min && value <= max;
    }
}
