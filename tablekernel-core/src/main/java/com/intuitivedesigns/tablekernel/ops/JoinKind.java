/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.tablekernel.ops;

import com.intuitivedesigns.tablekernel.table.ValidationException;

import java.util.Locale;

/**
 * The four classic relational join kinds.
 */
public enum JoinKind {
    INNER,
    LEFT,
    RIGHT,
    OUTER;

    /**
     * Parses a kind name case-insensitively. {@code full} is accepted as an alias of {@link #OUTER}.
     */
    public static JoinKind parse(String name) {
        if (name == null || name.isBlank()) {
            throw new ValidationException("Join kind must not be blank");
        }
        final String n = name.trim().toUpperCase(Locale.ROOT);
        if ("FULL".equals(n)) return OUTER;
        try {
            return valueOf(n);
        } catch (IllegalArgumentException e) {
            throw new ValidationException("Unknown join kind '" + name + "'. Expected one of inner, left, right, outer");
        }
    }

    boolean keepsUnmatchedLeft() {
        return this == LEFT || this == OUTER;
    }

    boolean keepsUnmatchedRight() {
        return this == RIGHT || this == OUTER;
    }
}
